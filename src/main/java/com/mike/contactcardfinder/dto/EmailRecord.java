package com.mike.contactcardfinder.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * One source row. Status moves once from PENDING to a terminal value within a run.
 */
@Getter
@ToString
public class EmailRecord {

    private final String email;

    /** 1-based worksheet row the record was read from */
    private final int row;

    private Status status = Status.PENDING;
    private ContactInfo data;

    public EmailRecord(String email, int row) {
        this.email = email;
        this.row = row;
    }

    public boolean isResolved() {
        return status.isTerminal();
    }

    public void resolve(Status outcome, ContactInfo info) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("outcome must be terminal, got " + outcome);
        }
        if (isResolved()) {
            throw new IllegalStateException("record " + email + " (row " + row + ") already resolved as " + status);
        }
        this.status = outcome;
        this.data = outcome == Status.SUCCESS ? info : null;
    }
}
