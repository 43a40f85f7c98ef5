package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

public record TypingConfig(
        double minCharsPerSecond,
        double maxCharsPerSecond,
        double mistakeProbability,
        MsRange correctionDelay,
        double betweenWordsFactor,
        double burstChance,
        int burstLength
) {
    public TypingConfig {
        if (minCharsPerSecond <= 0 || maxCharsPerSecond < minCharsPerSecond) {
            throw new ConfigInvalidException("chars per second range invalid: "
                    + minCharsPerSecond + ".." + maxCharsPerSecond);
        }
        if (mistakeProbability < 0 || mistakeProbability > 1) {
            throw new ConfigInvalidException("mistakeProbability must be within [0,1]");
        }
        if (burstChance < 0 || burstChance > 1) {
            throw new ConfigInvalidException("burstChance must be within [0,1]");
        }
        if (burstLength < 0) throw new ConfigInvalidException("burstLength must be >= 0");
        if (correctionDelay == null) throw new ConfigInvalidException("correctionDelay is required");
    }

    public static TypingConfig defaults() {
        return new TypingConfig(2.0, 6.0, 0.02, MsRange.of(100, 300), 1.5, 0.3, 5);
    }

    public TypingConfig withMistakeProbability(double probability) {
        return new TypingConfig(minCharsPerSecond, maxCharsPerSecond, probability, correctionDelay,
                betweenWordsFactor, burstChance, burstLength);
    }
}
