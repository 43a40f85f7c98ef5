package com.mike.contactcardfinder.service.behavior;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * Produces waits that look like a person pausing: gaussian around the middle of the range, a little jitter,
 * and a nudge whenever the last few waits came out almost the same.
 */
@Slf4j
public class DelayManager {

    private static final int HISTORY_SIZE = 10;
    private static final int PATTERN_WINDOW = 3;
    private static final double PATTERN_TOLERANCE_S = 0.1;
    private static final double JITTER = 0.05;
    private static final double FLOOR_S = 0.1;

    private final DelayConfig config;
    private final Random random;
    private final Sleeper sleeper;

    private final Deque<Double> history = new ArrayDeque<>();

    public DelayManager(DelayConfig config, Random random, Sleeper sleeper) {
        this.config = config;
        this.random = random;
        this.sleeper = sleeper;
    }

    public Duration delay(DelayCategory category) {
        MsRange range = config.rangeFor(category);
        return delay(range.minMs(), range.maxMs());
    }

    public Duration delay(int minMs, int maxMs) {
        double seconds = delaySeconds(minMs / 1000.0, maxMs / 1000.0);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    public synchronized double delaySeconds(double min, double max) {
        double base = sampleGaussian(min, max);
        double proposal = base * (1 + uniform(-JITTER, JITTER));

        if (isRepeating(proposal)) {
            proposal += uniform(-0.2, 0.3);
        }

        double result = Math.max(FLOOR_S, proposal);
        recordDelay(result);
        return result;
    }

    public void pause(DelayCategory category) {
        Duration d = delay(category);
        log.debug("Lookup: pause {} {}ms", category, d.toMillis());
        sleeper.sleep(d);
    }

    public void pause(int minMs, int maxMs) {
        sleeper.sleep(delay(minMs, maxMs));
    }

    double sampleGaussian(double min, double max) {
        if (max <= min) return min;
        double mean = (min + max) / 2;
        double sd = (max - min) / 6;
        double value = mean + random.nextGaussian() * sd;
        return Math.max(min, Math.min(max, value));
    }

    synchronized void recordDelay(double seconds) {
        history.addLast(seconds);
        while (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }
    }

    synchronized List<Double> history() {
        return List.copyOf(history);
    }

    private boolean isRepeating(double proposal) {
        if (history.size() < PATTERN_WINDOW) return false;
        Iterator<Double> recent = history.descendingIterator();
        for (int i = 0; i < PATTERN_WINDOW; i++) {
            if (Math.abs(recent.next() - proposal) >= PATTERN_TOLERANCE_S) return false;
        }
        return true;
    }

    private double uniform(double a, double b) {
        return a + (b - a) * random.nextDouble();
    }
}
