package com.mike.contactcardfinder.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class ProcessingStats {
    int totalBatches;
    int totalEmails;
    int successful;
    int notFound;
    int errors;
    int unprocessed;
    boolean stopped;
    Duration duration;

    public static ProcessingStats empty() {
        return ProcessingStats.builder()
                .totalBatches(0)
                .totalEmails(0)
                .successful(0)
                .notFound(0)
                .errors(0)
                .unprocessed(0)
                .stopped(false)
                .duration(Duration.ZERO)
                .build();
    }

    public ProcessingStats plus(BatchResult batch) {
        return toBuilder()
                .totalBatches(totalBatches + 1)
                .totalEmails(totalEmails + batch.total())
                .successful(successful + batch.successful())
                .notFound(notFound + batch.notFound())
                .errors(errors + batch.errors())
                .unprocessed(unprocessed + batch.unprocessed())
                .build();
    }

    public String toLogLine() {
        return "batches=" + totalBatches +
                " emails=" + totalEmails +
                " ok=" + successful + " (" + percent(successful) + ")" +
                " notFound=" + notFound + " (" + percent(notFound) + ")" +
                " errors=" + errors + " (" + percent(errors) + ")" +
                " unprocessed=" + unprocessed +
                " stopped=" + stopped +
                " duration=" + (duration == null ? 0 : duration.toMillis() / 1000.0) + "s";
    }

    private String percent(int part) {
        if (totalEmails == 0) return "0.0%";
        return String.format(java.util.Locale.ROOT, "%.1f%%", part * 100.0 / totalEmails);
    }
}
