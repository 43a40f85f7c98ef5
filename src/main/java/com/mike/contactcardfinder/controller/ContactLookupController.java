package com.mike.contactcardfinder.controller;

import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.dto.RunEvent;
import com.mike.contactcardfinder.service.lookup.BatchOrchestrator;
import com.mike.contactcardfinder.service.lookup.QueueingRunListener;
import com.mike.contactcardfinder.session.SessionStore;
import com.mike.contactcardfinder.spreadsheet.SpreadsheetStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/lookup")
@RequiredArgsConstructor
@Slf4j
public class ContactLookupController {

    private final BatchOrchestrator orchestrator;
    private final SpreadsheetStore spreadsheetStore;
    private final SessionStore sessionStore;

    @Value("${contactfinder.admin-token:}")
    private String adminToken;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ConcurrentMap<String, RunState> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, QueueingRunListener> events = new ConcurrentHashMap<>();

    // one browser session at a time
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "contact-lookup-runner");
        t.setDaemon(true);
        return t;
    });

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> runAsync(
            @RequestHeader(value = "X-Admin-Token", required = false) String token
    ) {
        assertAdmin(token);

        if (!running.compareAndSet(false, true)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "status", "ALREADY_RUNNING"
            ));
        }

        String runId = UUID.randomUUID().toString();
        QueueingRunListener listener = new QueueingRunListener();
        runs.put(runId, RunState.running(runId));
        events.put(runId, listener);

        try {
            executor.submit(() -> {
                try {
                    ProcessingStats stats = orchestrator.run(spreadsheetStore, spreadsheetStore, listener);
                    runs.computeIfPresent(runId, (id, prev) -> prev.done(stats));
                } catch (Exception e) {
                    log.error("Lookup: async run {} failed", runId, e);
                    runs.computeIfPresent(runId, (id, prev) -> prev.failed(e));
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }

        return ResponseEntity.accepted().body(Map.of(
                "runId", runId,
                "status", "STARTED"
        ));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop(
            @RequestHeader(value = "X-Admin-Token", required = false) String token
    ) {
        assertAdmin(token);

        if (!running.get()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "NOT_RUNNING"));
        }
        orchestrator.requestStop();
        return ResponseEntity.accepted().body(Map.of("status", "STOP_REQUESTED"));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunState> getRun(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @PathVariable String runId
    ) {
        assertAdmin(token);
        RunState state = runs.get(runId);
        if (state == null) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(state);
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<RunState> latest(
            @RequestHeader(value = "X-Admin-Token", required = false) String token
    ) {
        assertAdmin(token);
        return runs.values().stream()
                .max((a, b) -> a.startedAt().compareTo(b.startedAt()))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /** Drains the events queued since the previous call. The queue is dropped once the final event is drained. */
    @GetMapping("/runs/{runId}/events")
    public ResponseEntity<List<RunEvent>> drainEvents(
            @RequestHeader(value = "X-Admin-Token", required = false) String token,
            @PathVariable String runId
    ) {
        assertAdmin(token);
        QueueingRunListener listener = events.get(runId);
        if (listener == null) {
            return runs.containsKey(runId) ? ResponseEntity.ok(List.of()) : ResponseEntity.notFound().build();
        }

        List<RunEvent> drained = listener.drain();
        if (drained.stream().anyMatch(RunEvent::isTerminal)) {
            events.remove(runId);
        }
        return ResponseEntity.ok(drained);
    }

    @GetMapping("/session")
    public ResponseEntity<Map<String, Object>> session(
            @RequestHeader(value = "X-Admin-Token", required = false) String token
    ) {
        assertAdmin(token);
        return ResponseEntity.ok(Map.of("valid", sessionStore.isValid()));
    }

    @PreDestroy
    void shutdown() {
        if (running.get()) orchestrator.requestStop();
        executor.shutdown();
    }

    private void assertAdmin(String token) {
        if (adminToken != null && !adminToken.isBlank()) {
            if (token == null || !adminToken.equals(token)) {
                throw new UnauthorizedException();
            }
        }
    }

    @ResponseStatus(code = HttpStatus.UNAUTHORIZED)
    static class UnauthorizedException extends RuntimeException {}

    public record RunState(
            String runId,
            String status,          // RUNNING / DONE / FAILED
            LocalDateTime startedAt,
            LocalDateTime finishedAt,
            String error,
            ProcessingStats stats
    ) {
        static RunState running(String id) {
            return new RunState(id, "RUNNING", LocalDateTime.now(), null, null, null);
        }

        RunState done(ProcessingStats s) {
            return new RunState(runId, "DONE", startedAt, LocalDateTime.now(), null, s);
        }

        RunState failed(Exception e) {
            return new RunState(runId, "FAILED", startedAt, LocalDateTime.now(), e.getMessage(), null);
        }
    }
}
