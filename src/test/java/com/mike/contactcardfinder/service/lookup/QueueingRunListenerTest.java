package com.mike.contactcardfinder.service.lookup;

import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.dto.RunEvent;
import com.mike.contactcardfinder.dto.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueingRunListenerTest {

    @Test
    @DisplayName("drain returns events oldest first and empties the queue")
    void drain_in_order() {
        //Arrange
        QueueingRunListener listener = new QueueingRunListener();
        EmailRecord record = new EmailRecord("ana@madrid.org", 2);
        record.resolve(Status.NOT_FOUND, null);
        //Act
        listener.onLog("Batch 1/1");
        listener.onProgress(record, 1, 1);
        listener.onCompleted(ProcessingStats.empty());
        List<RunEvent> first = listener.drain();
        List<RunEvent> second = listener.drain();
        //Assert
        assertEquals(List.of(RunEvent.Type.LOG, RunEvent.Type.PROGRESS, RunEvent.Type.COMPLETED),
                first.stream().map(RunEvent::type).toList());
        assertEquals("ana@madrid.org -> NOT_FOUND", first.get(1).message());
        assertEquals(1, first.get(1).processed());
        assertTrue(second.isEmpty());
    }

    @Test
    @DisplayName("failure carries the exception message")
    void failed_event() {
        //Arrange
        QueueingRunListener listener = new QueueingRunListener();
        //Act
        listener.onFailed(new IllegalStateException("boom"));
        //Assert
        RunEvent event = listener.drain().get(0);
        assertEquals(RunEvent.Type.FAILED, event.type());
        assertEquals("boom", event.message());
    }
}
