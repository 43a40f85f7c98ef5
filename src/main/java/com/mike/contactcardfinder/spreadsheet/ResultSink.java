package com.mike.contactcardfinder.spreadsheet;

import com.mike.contactcardfinder.dto.EmailRecord;

@FunctionalInterface
public interface ResultSink {

    void write(EmailRecord record);
}
