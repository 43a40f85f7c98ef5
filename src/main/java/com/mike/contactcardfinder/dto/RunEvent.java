package com.mike.contactcardfinder.dto;

import java.time.LocalDateTime;

/**
 * Message sent from a running lookup to whoever hosts it. Never carries mutable state.
 */
public record RunEvent(
        Type type,
        String message,
        int processed,
        int total,
        ProcessingStats stats,
        LocalDateTime at
) {
    public enum Type {
        PROGRESS, LOG, COMPLETED, FAILED
    }

    /** COMPLETED or FAILED: nothing follows it. */
    public boolean isTerminal() {
        return type == Type.COMPLETED || type == Type.FAILED;
    }

    public static RunEvent progress(String email, Status status, int processed, int total) {
        return new RunEvent(Type.PROGRESS, email + " -> " + status, processed, total, null, LocalDateTime.now());
    }

    public static RunEvent log(String message) {
        return new RunEvent(Type.LOG, message, 0, 0, null, LocalDateTime.now());
    }

    public static RunEvent completed(ProcessingStats stats) {
        return new RunEvent(Type.COMPLETED, stats.toLogLine(), stats.getTotalEmails(), stats.getTotalEmails(),
                stats, LocalDateTime.now());
    }

    public static RunEvent failed(Exception e) {
        return new RunEvent(Type.FAILED, e.getMessage(), 0, 0, null, LocalDateTime.now());
    }
}
