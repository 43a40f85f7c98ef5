package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.exception.ConfigInvalidException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the run settings that the policy records cannot check on their own.
 */
@Component
@RequiredArgsConstructor
public class ContactFinderConfigValidator {

    private final ContactFinderProperties props;

    public List<String> validate() {
        List<String> problems = new ArrayList<>();

        if (isBlank(props.getPageUrl())) problems.add("contactfinder.page-url must not be blank");

        var processing = props.getProcessing();
        if (processing.getBatchSize() <= 0) {
            problems.add("contactfinder.processing.batch-size must be > 0, got " + processing.getBatchSize());
        }

        var sheet = props.getSpreadsheet();
        if (isBlank(sheet.getFile())) problems.add("contactfinder.spreadsheet.file must not be blank");
        if (sheet.getStartRow() < 1) problems.add("contactfinder.spreadsheet.start-row must be >= 1");
        if (sheet.getEmailColumn() < 1) problems.add("contactfinder.spreadsheet.email-column must be >= 1");
        if (sheet.getStatusColumn() < 1) problems.add("contactfinder.spreadsheet.status-column must be >= 1");
        if (sheet.getEmailColumn() == sheet.getStatusColumn()) {
            problems.add("contactfinder.spreadsheet email and status columns must differ");
        }

        var selectors = props.getSelectors();
        if (isBlank(selectors.getCard())) problems.add("contactfinder.selectors.card must not be blank");
        if (isBlank(selectors.getNewMessageButton())) {
            problems.add("contactfinder.selectors.new-message-button must not be blank");
        }

        var waits = props.getWaitTimes();
        if (waits.getCardVisibleMs() <= 0) problems.add("contactfinder.wait-times.card-visible-ms must be > 0");

        var browser = props.getBrowser();
        if (isBlank(browser.getSessionFile())) problems.add("contactfinder.browser.session-file must not be blank");

        return problems;
    }

    public void requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new ConfigInvalidException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
