package com.mike.contactcardfinder.service.cardextractor;

import com.mike.contactcardfinder.driver.UiDriverException;
import com.mike.contactcardfinder.driver.UiElement;
import com.mike.contactcardfinder.dto.ContactInfo;
import com.mike.contactcardfinder.exception.ExtractionFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Turns the text of an open contact card into a {@link ContactInfo}.
 * Labeled values are taken first; free-text heuristics only fill what is still missing.
 */
@Slf4j
@Component
public class ContactExtractionEngine {

    private final LabeledAnchorProbe anchorProbe;
    private final FreeTextFallback fallback;

    public ContactExtractionEngine(ExtractionRules rules) {
        this.anchorProbe = new LabeledAnchorProbe(rules);
        this.fallback = new FreeTextFallback(rules);
    }

    /**
     * @return null when the card text cannot be read
     */
    public ContactInfo extract(UiElement card) {
        String text;
        try {
            text = card.innerText();
        } catch (UiDriverException e) {
            log.warn("Lookup: cannot read card text: {}", e.getMessage());
            return null;
        }
        return extract(text, card);
    }

    public ContactInfo extract(String cardText, UiElement card) {
        if (cardText == null || cardText.isBlank()) {
            return ContactInfo.empty();
        }

        try {
            List<String> lines = Arrays.stream(cardText.split("\\R"))
                    .map(String::trim)
                    .toList();

            Map<CardField, String> found = anchorProbe.probe(lines);
            probeLinks(card, found);
            fallback.fill(cardText, lines, found);

            ContactInfo info = toContactInfo(found);
            log.debug("Lookup: extracted {}", info);
            return info;
        } catch (ExtractionFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionFailureException("card parsing failed: " + e.getMessage(), e);
        }
    }

    private void probeLinks(UiElement card, Map<CardField, String> found) {
        try {
            anchorProbe.probeLinks(card, found);
        } catch (UiDriverException e) {
            log.debug("Lookup: card links unavailable: {}", e.getMessage());
        }
    }

    private static ContactInfo toContactInfo(Map<CardField, String> found) {
        return ContactInfo.builder()
                .name(found.get(CardField.NAME))
                .personalEmail(found.get(CardField.EMAIL))
                .phone(found.get(CardField.PHONE))
                .sip(found.get(CardField.SIP))
                .address(found.get(CardField.ADDRESS))
                .department(found.get(CardField.DEPARTMENT))
                .company(found.get(CardField.COMPANY))
                .officeLocation(found.get(CardField.OFFICE))
                .build();
    }
}
