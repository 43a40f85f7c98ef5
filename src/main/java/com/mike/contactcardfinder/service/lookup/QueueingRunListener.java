package com.mike.contactcardfinder.service.lookup;

import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.dto.RunEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Turns listener callbacks into {@link RunEvent}s that another thread drains.
 */
public class QueueingRunListener implements RunListener {

    private final Queue<RunEvent> events = new ConcurrentLinkedQueue<>();

    @Override
    public void onProgress(EmailRecord record, int processed, int total) {
        events.add(RunEvent.progress(record.getEmail(), record.getStatus(), processed, total));
    }

    @Override
    public void onLog(String message) {
        events.add(RunEvent.log(message));
    }

    @Override
    public void onCompleted(ProcessingStats stats) {
        events.add(RunEvent.completed(stats));
    }

    @Override
    public void onFailed(Exception e) {
        events.add(RunEvent.failed(e));
    }

    /** Removes and returns everything queued so far, oldest first. */
    public List<RunEvent> drain() {
        List<RunEvent> out = new ArrayList<>();
        RunEvent e;
        while ((e = events.poll()) != null) {
            out.add(e);
        }
        return out;
    }
}
