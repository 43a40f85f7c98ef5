package com.mike.contactcardfinder.spreadsheet;

import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.Status;

import java.util.List;

/**
 * Worksheet of addresses with one status column and the extracted fields next to it.
 * Columns and rows are 1-based.
 */
public interface SpreadsheetStore extends PendingSource, ResultSink {

    List<EmailRecord> readPending(int startRow, int emailColumn, int statusColumn);

    /** SUCCESS writes the contact fields, any other status clears them. */
    void writeResult(int row, Status status, ContactInfo info);

    @Override
    default void write(EmailRecord record) {
        writeResult(record.getRow(), record.getStatus(), record.getData());
    }
}
