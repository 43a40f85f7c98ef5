package com.mike.contactcardfinder.service.lookup;

import com.mike.contactcardfinder.config.ContactFinderConfigValidator;
import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.driver.UiDriver;
import com.mike.contactcardfinder.driver.UiDriverFactory;
import com.mike.contactcardfinder.driver.UiElement;
import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.dto.EmailRecord;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.dto.Status;
import com.mike.contactcardfinder.exception.ConfigInvalidException;
import com.mike.contactcardfinder.exception.ExtractionFailureException;
import com.mike.contactcardfinder.exception.SessionInvalidException;
import com.mike.contactcardfinder.service.behavior.DelayConfig;
import com.mike.contactcardfinder.service.behavior.DelayManager;
import com.mike.contactcardfinder.service.behavior.MouseConfig;
import com.mike.contactcardfinder.service.behavior.MouseEmulator;
import com.mike.contactcardfinder.service.behavior.Sleeper;
import com.mike.contactcardfinder.service.behavior.TypingConfig;
import com.mike.contactcardfinder.service.behavior.TypingSimulator;
import com.mike.contactcardfinder.service.cardextractor.ContactClassifier;
import com.mike.contactcardfinder.service.cardextractor.ContactExtractionEngine;
import com.mike.contactcardfinder.service.cardextractor.ExtractionRules;
import com.mike.contactcardfinder.session.SessionStore;
import com.mike.contactcardfinder.spreadsheet.PendingSource;
import com.mike.contactcardfinder.spreadsheet.ResultSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BatchOrchestratorTest {

    private static final ContactInfo SIP_ONLY = ContactInfo.builder().sip("sip:maria.garcia@madrid.org").build();
    private static final ContactInfo GENERIC_ONLY = ContactInfo.builder().personalEmail("ASP164@MADRID.ORG").build();

    private ContactFinderProperties props;
    private ContactFinderProperties.Selectors sel;
    private SessionStore sessionStore;
    private UiDriverFactory driverFactory;
    private UiDriver driver;
    private ContactExtractionEngine engine;

    private UiElement newMessage;
    private UiElement toField;
    private UiElement token;
    private UiElement card;
    private UiElement discard;

    private List<EmailRecord> written;
    private ResultSink sink;

    private BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new ContactFinderProperties();
        props.getProcessing().setMouseEmulation(false);
        props.getProcessing().setHumanTyping(false);
        sel = props.getSelectors();

        Sleeper sleeper = mock(Sleeper.class);
        sessionStore = mock(SessionStore.class);
        when(sessionStore.requireStorageState()).thenReturn(Path.of("state.json"));

        driver = mock(UiDriver.class);
        driverFactory = mock(UiDriverFactory.class);
        when(driverFactory.open(any())).thenReturn(driver);

        newMessage = mock(UiElement.class);
        toField = mock(UiElement.class);
        token = mock(UiElement.class);
        card = mock(UiElement.class);
        discard = mock(UiElement.class);

        when(driver.currentUrl()).thenReturn(props.getPageUrl());
        when(driver.locate(sel.getNewMessageButton())).thenReturn(Optional.of(newMessage));
        when(driver.locateByRole(sel.getToFieldRole(), sel.getToFieldName())).thenReturn(Optional.of(toField));
        when(driver.locateByText(anyString())).thenReturn(Optional.of(token));
        when(driver.waitVisible(eq(sel.getCard()), anyInt())).thenReturn(true);
        when(driver.locate(sel.getCard())).thenReturn(Optional.of(card));
        when(driver.locate(sel.getDiscardButton())).thenReturn(Optional.of(discard));

        engine = mock(ContactExtractionEngine.class);
        when(engine.extract(card)).thenReturn(SIP_ONLY);

        written = new ArrayList<>();
        sink = written::add;

        orchestrator = new BatchOrchestrator(
                props,
                new ContactFinderConfigValidator(props),
                sessionStore,
                driverFactory,
                new DelayManager(DelayConfig.defaults(), new Random(1), sleeper),
                new MouseEmulator(MouseConfig.defaults(), new Random(1), sleeper),
                new TypingSimulator(TypingConfig.defaults(), new Random(1), sleeper),
                sleeper,
                engine,
                new ContactClassifier(ExtractionRules.defaults())
        );
    }

    private static List<EmailRecord> records(int n) {
        return IntStream.range(0, n)
                .mapToObj(i -> new EmailRecord("user" + i + "@madrid.org", i + 2))
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("card with sip -> SUCCESS, written with its data")
        void sip_card_is_success() {
            //Arrange
            List<EmailRecord> pending = records(1);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(Status.SUCCESS, pending.get(0).getStatus());
            assertEquals(SIP_ONLY, pending.get(0).getData());
            assertEquals(1, written.size());
            assertEquals(1, stats.getSuccessful());
        }

        @Test
        @DisplayName("card with only a generic address -> NOT_FOUND")
        void generic_card_is_not_found() {
            //Arrange
            when(engine.extract(card)).thenReturn(GENERIC_ONLY);
            List<EmailRecord> pending = records(1);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(Status.NOT_FOUND, pending.get(0).getStatus());
            assertEquals(1, stats.getNotFound());
        }

        @Test
        @DisplayName("extraction throws -> ERROR for that address only")
        void extraction_failure_is_error() {
            //Arrange
            when(engine.extract(card))
                    .thenReturn(SIP_ONLY)
                    .thenThrow(new ExtractionFailureException("bad card"))
                    .thenReturn(GENERIC_ONLY);
            List<EmailRecord> pending = records(3);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(List.of(Status.SUCCESS, Status.ERROR, Status.NOT_FOUND),
                    pending.stream().map(EmailRecord::getStatus).toList());
            assertEquals(1, stats.getSuccessful());
            assertEquals(1, stats.getNotFound());
            assertEquals(1, stats.getErrors());
            verify(driver, times(3)).pressKey("Escape");
        }

        @Test
        @DisplayName("unreadable card -> ERROR")
        void unreadable_card_is_error() {
            //Arrange
            when(engine.extract(card)).thenReturn(null);
            List<EmailRecord> pending = records(1);
            //Act
            orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(Status.ERROR, pending.get(0).getStatus());
        }

        @Test
        @DisplayName("visible card without an element handle -> text read through the page selector")
        void card_text_through_page() {
            //Arrange
            when(driver.locate(sel.getCard())).thenReturn(Optional.empty());
            when(driver.innerText(sel.getCard())).thenReturn("MI\nsip:maria.garcia@madrid.org");
            when(engine.extract("MI\nsip:maria.garcia@madrid.org", null)).thenReturn(SIP_ONLY);
            List<EmailRecord> pending = records(1);
            //Act
            orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(Status.SUCCESS, pending.get(0).getStatus());
            verify(engine, never()).extract(any(UiElement.class));
        }
    }

    @Nested
    @DisplayName("per-address failures")
    class PerAddress {

        @Test
        @DisplayName("token not found -> ERROR, the rest of the batch goes on")
        void token_missing() {
            //Arrange
            List<EmailRecord> pending = records(3);
            when(driver.locateByText("user1@madrid.org")).thenReturn(Optional.empty());
            //Act
            orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(List.of(Status.SUCCESS, Status.ERROR, Status.SUCCESS),
                    pending.stream().map(EmailRecord::getStatus).toList());
            assertEquals(3, written.size());
        }

        @Test
        @DisplayName("card never shows up -> ERROR, nothing extracted")
        void card_timeout() {
            //Arrange
            when(driver.waitVisible(eq(sel.getCard()), anyInt())).thenReturn(false);
            List<EmailRecord> pending = records(2);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(2, stats.getErrors());
            verify(engine, never()).extract(any(UiElement.class));
        }

        @Test
        @DisplayName("a failing sink is logged and does not stop the run")
        void sink_failure_does_not_abort() {
            //Arrange
            List<EmailRecord> pending = records(2);
            ResultSink broken = r -> { throw new IllegalStateException("disk full"); };
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, broken);
            //Assert
            assertEquals(2, stats.getSuccessful());
        }
    }

    @Nested
    @DisplayName("batches")
    class Batches {

        @Test
        @DisplayName("23 addresses -> batches of 10, 10, 3, written in source order")
        void twenty_three_records() {
            //Arrange
            List<EmailRecord> pending = records(23);
            ArgumentCaptor<String> recipients = ArgumentCaptor.forClass(String.class);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(3, stats.getTotalBatches());
            assertEquals(23, stats.getTotalEmails());
            assertEquals(23, stats.getSuccessful());
            assertEquals(IntStream.rangeClosed(2, 24).boxed().toList(),
                    written.stream().map(EmailRecord::getRow).toList());

            verify(toField, times(3)).fill(recipients.capture());
            assertEquals(List.of(10, 10, 3),
                    recipients.getAllValues().stream().map(s -> s.split(";").length).toList());
            assertEquals(pending.subList(0, 10).stream().map(EmailRecord::getEmail).collect(Collectors.joining(";")),
                    recipients.getAllValues().get(0));
        }

        @Test
        @DisplayName("setup failure -> whole batch ERROR, next batch still runs")
        void setup_failure_fails_batch() {
            //Arrange
            when(driver.locate(sel.getNewMessageButton()))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(newMessage));
            List<EmailRecord> pending = records(12);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(10, stats.getErrors());
            assertEquals(2, stats.getSuccessful());
            assertEquals(12, written.size());
            verify(driver, never()).locateByText("user0@madrid.org");
        }

        @Test
        @DisplayName("discard button missing -> resolved records keep their outcome")
        void teardown_failure_keeps_resolved() {
            //Arrange
            when(driver.locate(sel.getDiscardButton())).thenReturn(Optional.empty());
            List<EmailRecord> pending = records(2);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertEquals(2, stats.getSuccessful());
            assertEquals(2, written.size());
        }

        @Test
        @DisplayName("surface is discarded twice after each batch")
        void discard_clicked_twice() {
            //Arrange
            List<EmailRecord> pending = records(1);
            //Act
            orchestrator.run(() -> pending, sink);
            //Assert
            verify(discard, times(2)).click();
        }
    }

    @Nested
    @DisplayName("run lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("nothing pending -> zero stats, no session or browser")
        void nothing_pending_is_noop() {
            //Act
            ProcessingStats stats = orchestrator.run(() -> List.of(), sink);
            //Assert
            assertEquals(0, stats.getTotalEmails());
            assertEquals(0, stats.getTotalBatches());
            verifyNoInteractions(sessionStore, driverFactory);
            assertTrue(written.isEmpty());
        }

        @Test
        @DisplayName("invalid configuration -> ConfigInvalidException before reading anything")
        void invalid_config_is_fatal() {
            //Arrange
            props.getProcessing().setBatchSize(0);
            PendingSource source = mock(PendingSource.class);
            //Act + Assert
            assertThrows(ConfigInvalidException.class, () -> orchestrator.run(source, sink));
            verifyNoInteractions(source, sessionStore, driverFactory);
        }

        @Test
        @DisplayName("missing session -> SessionInvalidException, browser never opened")
        void missing_session_is_fatal() {
            //Arrange
            when(sessionStore.requireStorageState()).thenThrow(new SessionInvalidException("no file"));
            List<EmailRecord> pending = records(1);
            //Act + Assert
            assertThrows(SessionInvalidException.class, () -> orchestrator.run(() -> pending, sink));
            verifyNoInteractions(driverFactory);
        }

        @Test
        @DisplayName("landing on a login page -> SessionInvalidException, listener notified")
        void login_page_is_fatal() {
            //Arrange
            when(driver.currentUrl()).thenReturn("https://login.microsoftonline.com/common/oauth2/authorize");
            RunListener listener = mock(RunListener.class);
            List<EmailRecord> pending = records(2);
            //Act + Assert
            assertThrows(SessionInvalidException.class, () -> orchestrator.run(() -> pending, sink, listener));
            verify(listener).onFailed(any(SessionInvalidException.class));
            verify(driver).close();
            assertTrue(written.isEmpty());
        }

        @Test
        @DisplayName("stop request -> current address finishes, the rest stays pending and unwritten")
        void stop_leaves_rest_pending() {
            //Arrange
            List<EmailRecord> pending = records(23);
            RunListener stopAfterFirst = new RunListener() {
                @Override
                public void onProgress(EmailRecord record, int processed, int total) {
                    orchestrator.requestStop();
                }
            };
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink, stopAfterFirst);
            //Assert
            assertEquals(1, written.size());
            assertEquals(Status.SUCCESS, pending.get(0).getStatus());
            assertTrue(pending.subList(1, 23).stream().noneMatch(EmailRecord::isResolved));
            assertTrue(stats.isStopped());
            assertEquals(22, stats.getUnprocessed());
            assertEquals(23, stats.getTotalEmails());
        }

        @Test
        @DisplayName("interrupted runner thread -> handled like a stop, no further addresses driven")
        void interrupt_stops_run() {
            //Arrange
            List<EmailRecord> pending = records(12);
            RunListener interruptAfterFirst = new RunListener() {
                @Override
                public void onProgress(EmailRecord record, int processed, int total) {
                    Thread.currentThread().interrupt();
                }
            };
            //Act
            ProcessingStats stats;
            try {
                stats = orchestrator.run(() -> pending, sink, interruptAfterFirst);
            } finally {
                Thread.interrupted();
            }
            //Assert
            assertEquals(1, written.size());
            assertTrue(stats.isStopped());
            assertEquals(11, stats.getUnprocessed());
            verify(driver, times(1)).locateByText(anyString());
            assertTrue(orchestrator.isStopRequested());
        }

        @Test
        @DisplayName("a new run clears an earlier stop request")
        void stop_flag_reset_on_new_run() {
            //Arrange
            orchestrator.requestStop();
            List<EmailRecord> pending = records(2);
            //Act
            ProcessingStats stats = orchestrator.run(() -> pending, sink);
            //Assert
            assertFalse(stats.isStopped());
            assertEquals(2, written.size());
        }

        @Test
        @DisplayName("listener receives progress for every address and one completion")
        void listener_progress_and_completion() {
            //Arrange
            RunListener listener = mock(RunListener.class);
            List<EmailRecord> pending = records(3);
            //Act
            orchestrator.run(() -> pending, sink, listener);
            //Assert
            verify(listener).onProgress(pending.get(0), 1, 3);
            verify(listener).onProgress(pending.get(2), 3, 3);
            verify(listener).onCompleted(any(ProcessingStats.class));
            verify(listener, never()).onFailed(any());
        }
    }
}
