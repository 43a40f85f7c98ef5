package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

public record MouseConfig(
        boolean bezierCurves,
        int randomOffsetPx,
        MsRange moveDuration,
        double overshootChance,
        MsRange pauseBeforeClick
) {
    public MouseConfig {
        if (randomOffsetPx < 0) throw new ConfigInvalidException("randomOffsetPx must be >= 0");
        if (overshootChance < 0 || overshootChance > 1) {
            throw new ConfigInvalidException("overshootChance must be within [0,1], got " + overshootChance);
        }
        if (moveDuration == null || pauseBeforeClick == null) {
            throw new ConfigInvalidException("mouse ranges are required");
        }
    }

    public static MouseConfig defaults() {
        return new MouseConfig(true, 10, MsRange.of(500, 1500), 0.15, MsRange.of(50, 150));
    }

    public MouseConfig withOvershootChance(double chance) {
        return new MouseConfig(bezierCurves, randomOffsetPx, moveDuration, chance, pauseBeforeClick);
    }
}
