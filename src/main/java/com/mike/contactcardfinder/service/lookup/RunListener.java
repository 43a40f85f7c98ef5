package com.mike.contactcardfinder.service.lookup;

import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.ProcessingStats;

/**
 * Receives notifications from a running lookup. Called on the worker thread.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {
    };

    default void onProgress(EmailRecord record, int processed, int total) {
    }

    default void onLog(String message) {
    }

    default void onCompleted(ProcessingStats stats) {
    }

    default void onFailed(Exception e) {
    }
}
