package com.mike.contactcardfinder.bootstrap;

import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.dto.ProcessingStats;
import com.mike.contactcardfinder.service.lookup.BatchOrchestrator;
import com.mike.contactcardfinder.spreadsheet.SpreadsheetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * One lookup run at boot when {@code contactfinder.processing.run-on-startup} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LookupStartupRunner implements CommandLineRunner {

    private final ContactFinderProperties props;
    private final BatchOrchestrator orchestrator;
    private final SpreadsheetStore spreadsheetStore;

    @Override
    public void run(String... args) {
        if (!props.getProcessing().isRunOnStartup()) {
            log.debug("Lookup: run on startup disabled");
            return;
        }

        log.info("Lookup: startup run on {}", props.getSpreadsheet().getFile());
        try {
            ProcessingStats stats = orchestrator.run(spreadsheetStore, spreadsheetStore);
            log.info("Lookup: startup run done {}", stats.toLogLine());
        } catch (Exception e) {
            log.error("Lookup: startup run failed: {}", e.getMessage(), e);
        }
    }
}
