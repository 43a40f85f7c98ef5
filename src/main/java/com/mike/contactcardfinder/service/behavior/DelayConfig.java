package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

import java.util.EnumMap;
import java.util.Map;

public record DelayConfig(Map<DelayCategory, MsRange> ranges) {

    public DelayConfig {
        if (ranges == null) throw new ConfigInvalidException("delay ranges are required");
        for (DelayCategory category : DelayCategory.values()) {
            if (!ranges.containsKey(category)) {
                throw new ConfigInvalidException("missing delay range for " + category);
            }
        }
        ranges = Map.copyOf(ranges);
    }

    public MsRange rangeFor(DelayCategory category) {
        return ranges.get(category);
    }

    public static DelayConfig defaults() {
        Map<DelayCategory, MsRange> ranges = new EnumMap<>(DelayCategory.class);
        ranges.put(DelayCategory.BETWEEN_ACTIONS, MsRange.of(500, 2000));
        ranges.put(DelayCategory.BETWEEN_RECORDS, MsRange.of(3000, 8000));
        ranges.put(DelayCategory.AFTER_TYPING, MsRange.of(200, 800));
        ranges.put(DelayCategory.AFTER_CLICK, MsRange.of(800, 1500));
        ranges.put(DelayCategory.AFTER_CARD_CLOSE, MsRange.of(1000, 2000));
        ranges.put(DelayCategory.CARD_LOAD, MsRange.of(1500, 2500));
        return new DelayConfig(ranges);
    }
}
