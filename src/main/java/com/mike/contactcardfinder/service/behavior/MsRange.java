package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

import java.util.Random;

/**
 * Inclusive millisecond range.
 */
public record MsRange(int minMs, int maxMs) {

    public MsRange {
        if (minMs < 0) throw new ConfigInvalidException("range min must be >= 0, got " + minMs);
        if (maxMs < minMs) throw new ConfigInvalidException("range max " + maxMs + " < min " + minMs);
    }

    public static MsRange of(int minMs, int maxMs) {
        return new MsRange(minMs, maxMs);
    }

    public double midpoint() {
        return (minMs + maxMs) / 2.0;
    }

    public int width() {
        return maxMs - minMs;
    }

    double uniform(Random random) {
        return minMs + width() * random.nextDouble();
    }
}
