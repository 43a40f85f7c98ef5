package com.mike.contactcardfinder.dto;

import java.util.Arrays;

/**
 * Outcome of one lookup, together with the literal marker stored in the workbook status column.
 */
public enum Status {
    PENDING(""),
    SUCCESS("OK"),
    NOT_FOUND("NO EXISTE"),
    ERROR("ERROR");

    private final String marker;

    Status(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** Blank means not processed yet; an unknown marker reads as ERROR. */
    public static Status fromMarker(String raw) {
        if (raw == null || raw.isBlank()) return PENDING;
        String m = raw.trim();
        return Arrays.stream(values())
                .filter(s -> s.marker.equalsIgnoreCase(m) || s.name().equalsIgnoreCase(m))
                .findFirst()
                .orElse(ERROR);
    }
}
