package com.mike.contactcardfinder.bootstrap;

import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.service.lookup.BatchOrchestrator;
import com.mike.contactcardfinder.spreadsheet.SpreadsheetStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LookupStartupRunnerTest {

    private final BatchOrchestrator orchestrator = mock(BatchOrchestrator.class);
    private final SpreadsheetStore store = mock(SpreadsheetStore.class);

    @Test
    @DisplayName("disabled -> orchestrator untouched")
    void disabled() {
        //Arrange
        LookupStartupRunner runner = new LookupStartupRunner(new ContactFinderProperties(), orchestrator, store);
        //Act
        runner.run();
        //Assert
        verifyNoInteractions(orchestrator, store);
    }

    @Test
    @DisplayName("enabled -> one run, failures do not escape")
    void enabled() {
        //Arrange
        ContactFinderProperties props = new ContactFinderProperties();
        props.getProcessing().setRunOnStartup(true);
        when(orchestrator.run(store, store)).thenThrow(new IllegalStateException("no session"));
        LookupStartupRunner runner = new LookupStartupRunner(props, orchestrator, store);
        //Act + Assert
        assertDoesNotThrow(() -> runner.run());
        verify(orchestrator).run(store, store);
    }

    @Test
    @DisplayName("enabled and successful -> stats logged")
    void enabled_success() {
        //Arrange
        ContactFinderProperties props = new ContactFinderProperties();
        props.getProcessing().setRunOnStartup(true);
        when(orchestrator.run(store, store)).thenReturn(ProcessingStats.empty());
        //Act
        new LookupStartupRunner(props, orchestrator, store).run();
        //Assert
        verify(orchestrator).run(store, store);
    }
}
