package com.mike.contactcardfinder.spreadsheet;

import com.mike.contactcardfinder.dto.EmailRecord;

import java.util.List;

@FunctionalInterface
public interface PendingSource {

    /** Records still to process, in source order. */
    List<EmailRecord> readPending();
}
