package com.mike.contactcardfinder.service.lookup;

import com.mike.contactcardfinder.config.ContactFinderConfigValidator;
import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.driver.UiDriver;
import com.mike.contactcardfinder.driver.UiDriverException;
import com.mike.contactcardfinder.driver.UiDriverFactory;
import com.mike.contactcardfinder.driver.UiElement;
import com.mike.contactcardfinder.dto.BatchResult;
import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.dto.Status;
import com.mike.contactcardfinder.exception.CardTimeoutException;
import com.mike.contactcardfinder.exception.SessionInvalidException;
import com.mike.contactcardfinder.exception.SurfaceSetupException;
import com.mike.contactcardfinder.exception.TokenNotFoundException;
import com.mike.contactcardfinder.service.behavior.DelayCategory;
import com.mike.contactcardfinder.service.behavior.DelayManager;
import com.mike.contactcardfinder.service.behavior.MouseEmulator;
import com.mike.contactcardfinder.service.behavior.Sleeper;
import com.mike.contactcardfinder.service.behavior.TypingSimulator;
import com.mike.contactcardfinder.service.cardextractor.ContactClassifier;
import com.mike.contactcardfinder.service.cardextractor.ContactExtractionEngine;
import com.mike.contactcardfinder.session.SessionStore;
import com.mike.contactcardfinder.spreadsheet.PendingSource;
import com.mike.contactcardfinder.spreadsheet.ResultSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs pending records through the directory in batches: one compose surface per batch, one card per address.
 * A failing address only fails itself; a failing surface fails the rest of its batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchOrchestrator {

    private static final DateTimeFormatter SHOT_TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ContactFinderProperties props;
    private final ContactFinderConfigValidator configValidator;
    private final SessionStore sessionStore;
    private final UiDriverFactory driverFactory;

    private final DelayManager delays;
    private final MouseEmulator mouse;
    private final TypingSimulator typing;
    private final Sleeper sleeper;

    private final ContactExtractionEngine extractionEngine;
    private final ContactClassifier classifier;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public ProcessingStats run(PendingSource source, ResultSink sink) {
        return run(source, sink, RunListener.NONE);
    }

    public ProcessingStats run(PendingSource source, ResultSink sink, RunListener listener) {
        try {
            ProcessingStats stats = doRun(source, sink, listener);
            listener.onCompleted(stats);
            return stats;
        } catch (RuntimeException e) {
            log.error("Lookup: run failed: {}", e.getMessage());
            listener.onFailed(e);
            throw e;
        }
    }

    /** Cooperative: the current record finishes, nothing after it starts. */
    public void requestStop() {
        log.info("Lookup: stop requested");
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    private ProcessingStats doRun(PendingSource source, ResultSink sink, RunListener listener) {
        configValidator.requireValid();
        stopRequested.set(false);
        long startedNanos = System.nanoTime();

        List<EmailRecord> pending = source.readPending();
        if (pending.isEmpty()) {
            log.info("Lookup: nothing pending");
            listener.onLog("Nothing pending");
            return ProcessingStats.empty();
        }

        Path storageState = sessionStore.requireStorageState();

        int batchSize = props.getProcessing().getBatchSize();
        List<List<EmailRecord>> batches = BatchPartitioner.partition(pending, batchSize);
        log.info("Lookup: {} pending in {} batches of up to {}", pending.size(), batches.size(), batchSize);
        listener.onLog("Processing " + pending.size() + " addresses in " + batches.size() + " batches");

        RunContext ctx = new RunContext(sink, listener, pending.size());
        ProcessingStats stats = ProcessingStats.empty();
        int started = 0;

        try (UiDriver driver = driverFactory.open(storageState)) {
            ensureSignedIn(driver);

            for (int i = 0; i < batches.size(); i++) {
                if (shouldStop()) break;

                List<EmailRecord> batch = batches.get(i);
                log.info("Lookup: batch {}/{} ({} addresses)", i + 1, batches.size(), batch.size());
                listener.onLog("Batch " + (i + 1) + "/" + batches.size());

                BatchResult result = processBatch(driver, i + 1, batch, ctx);
                stats = stats.plus(result);
                started++;

                log.info("Lookup: batch {} done ok={} notFound={} errors={}",
                        i + 1, result.successful(), result.notFound(), result.errors());

                if (i < batches.size() - 1 && !shouldStop()) {
                    delays.pause(DelayCategory.BETWEEN_RECORDS);
                }
            }
        }

        int notStarted = batches.stream().skip(started).mapToInt(List::size).sum();
        stats = stats.toBuilder()
                .totalEmails(stats.getTotalEmails() + notStarted)
                .unprocessed(stats.getUnprocessed() + notStarted)
                .stopped(stopRequested.get())
                .duration(Duration.ofNanos(System.nanoTime() - startedNanos))
                .build();

        log.info("Lookup: finished {}", stats.toLogLine());
        return stats;
    }

    /** An interrupted thread sleeps for nothing, so it is treated as a stop request. */
    private boolean shouldStop() {
        if (!stopRequested.get() && Thread.currentThread().isInterrupted()) {
            log.warn("Lookup: runner thread interrupted, stopping");
            stopRequested.set(true);
        }
        return stopRequested.get();
    }

    private void ensureSignedIn(UiDriver driver) {
        goToDirectory(driver);

        String landed = driver.currentUrl();
        String lower = landed == null ? "" : landed.toLowerCase(Locale.ROOT);
        for (String marker : props.getLoginUrlMarkers()) {
            if (lower.contains(marker.toLowerCase(Locale.ROOT))) {
                throw new SessionInvalidException("session expired, landed on login page " + landed);
            }
        }
    }

    BatchResult processBatch(UiDriver driver, int batchNumber, List<EmailRecord> records, RunContext ctx) {
        try {
            openSurface(driver, records);
        } catch (RuntimeException e) {
            log.warn("Lookup: batch {} setup failed: {}", batchNumber, e.getMessage());
            screenshotOnFailure(driver, batchNumber, "setup");
            failUnresolved(records, ctx);
            return new BatchResult(batchNumber, records);
        }

        for (int i = 0; i < records.size(); i++) {
            if (shouldStop()) {
                log.info("Lookup: stopping inside batch {}, {} left pending", batchNumber, records.size() - i);
                break;
            }

            EmailRecord record = records.get(i);
            lookup(driver, record);
            persist(record, ctx);

            if (i < records.size() - 1) {
                delays.pause(DelayCategory.BETWEEN_ACTIONS);
            }
        }

        try {
            discardSurface(driver);
        } catch (RuntimeException e) {
            log.warn("Lookup: batch {} teardown failed: {}", batchNumber, e.getMessage());
            screenshotOnFailure(driver, batchNumber, "teardown");
            if (!stopRequested.get()) failUnresolved(records, ctx);
        }

        return new BatchResult(batchNumber, records);
    }

    private void openSurface(UiDriver driver, List<EmailRecord> records) {
        var selectors = props.getSelectors();
        var waits = props.getWaitTimes();

        try {
            goToDirectory(driver);

            UiElement newMessage = driver.locate(selectors.getNewMessageButton())
                    .orElseThrow(() -> new SurfaceSetupException("new message button not found"));
            click(driver, newMessage);
            hold(waits.getAfterNewMessageMs());

            UiElement to = driver.locateByRole(selectors.getToFieldRole(), selectors.getToFieldName())
                    .orElseThrow(() -> new SurfaceSetupException("recipient field not found"));

            String recipients = records.stream()
                    .map(EmailRecord::getEmail)
                    .collect(Collectors.joining(";"));

            if (props.getProcessing().isHumanTyping()) {
                typing.fill(to, recipients);
                delays.pause(DelayCategory.AFTER_TYPING);
            } else {
                to.fill(recipients);
            }
            hold(waits.getAfterFillToMs());

            driver.blurActiveElement();
            hold(waits.getAfterBlurMs());
        } catch (SurfaceSetupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SurfaceSetupException("compose surface setup failed: " + e.getMessage(), e);
        }
    }

    private void lookup(UiDriver driver, EmailRecord record) {
        String email = record.getEmail();
        var selectors = props.getSelectors();

        try {
            UiElement token = driver.locateByText(email)
                    .orElseThrow(() -> new TokenNotFoundException("recipient token not found for " + email));

            click(driver, token);
            delays.pause(DelayCategory.AFTER_CLICK);

            int timeoutMs = props.getWaitTimes().getCardVisibleMs();
            if (!driver.waitVisible(selectors.getCard(), timeoutMs)) {
                throw new CardTimeoutException("card for " + email + " not visible after " + timeoutMs + "ms");
            }
            Optional<UiElement> card = driver.locate(selectors.getCard());
            delays.pause(DelayCategory.CARD_LOAD);

            // no element handle: read the text through the page, without the link anchors
            ContactInfo info = card.isPresent()
                    ? extractionEngine.extract(card.get())
                    : extractionEngine.extract(driver.innerText(selectors.getCard()), null);
            Status status = classifier.classify(info);

            closeCard(driver);
            record.resolve(status, info);

            log.info("Lookup: {} -> {}", email, status);
        } catch (TokenNotFoundException e) {
            log.warn("Lookup: {}", e.getMessage());
            record.resolve(Status.ERROR, null);
        } catch (RuntimeException e) {
            log.warn("Lookup: {} failed: {}", email, e.getMessage());
            closeCardQuietly(driver);
            if (!record.isResolved()) record.resolve(Status.ERROR, null);
        }
    }

    private void discardSurface(UiDriver driver) {
        var selectors = props.getSelectors();
        var waits = props.getWaitTimes();

        hold(waits.getBeforeDiscardMs());
        try {
            UiElement discard = driver.locate(selectors.getDiscardButton())
                    .orElseThrow(() -> new SurfaceSetupException("discard button not found"));
            discard.click();
        } catch (UiDriverException e) {
            throw new SurfaceSetupException("discard failed: " + e.getMessage(), e);
        }

        hold(waits.getBetweenDiscardClicksMs());
        try {
            driver.locate(selectors.getDiscardButton()).ifPresent(UiElement::click);
        } catch (UiDriverException e) {
            log.debug("Lookup: second discard click skipped: {}", e.getMessage());
        }
    }

    private void closeCard(UiDriver driver) {
        driver.pressKey("Escape");
        delays.pause(DelayCategory.AFTER_CARD_CLOSE);
    }

    private void closeCardQuietly(UiDriver driver) {
        try {
            driver.pressKey("Escape");
        } catch (UiDriverException e) {
            log.debug("Lookup: escape after failure did not go through: {}", e.getMessage());
        }
    }

    private void click(UiDriver driver, UiElement element) {
        if (props.getProcessing().isMouseEmulation()) {
            mouse.moveAndClick(driver, element, null);
        } else {
            element.click();
        }
    }

    private void goToDirectory(UiDriver driver) {
        String pageUrl = props.getPageUrl();
        int hash = pageUrl.indexOf('#');
        String base = hash >= 0 ? pageUrl.substring(0, hash) : pageUrl;

        String current = driver.currentUrl();
        if (current == null || !current.startsWith(base)) {
            log.info("Lookup: navigating to {}", pageUrl);
            driver.navigate(pageUrl);
        }
    }

    private void failUnresolved(List<EmailRecord> records, RunContext ctx) {
        for (EmailRecord record : records) {
            if (record.isResolved()) continue;
            record.resolve(Status.ERROR, null);
            persist(record, ctx);
        }
    }

    private void persist(EmailRecord record, RunContext ctx) {
        try {
            ctx.sink.write(record);
        } catch (RuntimeException e) {
            log.error("Lookup: cannot save row {} ({}): {}", record.getRow(), record.getEmail(), e.getMessage());
        }
        ctx.processed++;
        ctx.listener.onProgress(record, ctx.processed, ctx.total);
    }

    private void screenshotOnFailure(UiDriver driver, int batchNumber, String phase) {
        var browser = props.getBrowser();
        if (!browser.isScreenshotOnFailure()) return;

        try {
            Path dir = Path.of(browser.getScreenshotDir());
            Files.createDirectories(dir);
            Path shot = dir.resolve("batch-" + batchNumber + "-" + phase + "-"
                    + LocalDateTime.now().format(SHOT_TS) + ".png");
            driver.screenshot(shot);
            log.info("Lookup: screenshot saved {}", shot);
        } catch (IOException | UiDriverException e) {
            log.warn("Lookup: screenshot failed: {}", e.getMessage());
        }
    }

    private void hold(int ms) {
        if (ms > 0) sleeper.sleep(Duration.ofMillis(ms));
    }

    static final class RunContext {
        private final ResultSink sink;
        private final RunListener listener;
        private final int total;
        private int processed;

        RunContext(ResultSink sink, RunListener listener, int total) {
            this.sink = sink;
            this.listener = listener;
            this.total = total;
        }
    }
}
