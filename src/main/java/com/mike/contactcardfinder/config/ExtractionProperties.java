package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.service.cardextractor.CardField;
import com.mike.contactcardfinder.service.cardextractor.ExtractionRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Card parsing vocabulary. A label list set here replaces the default list of that field only.
 */
@Data
@ConfigurationProperties(prefix = "contactfinder.extraction")
public class ExtractionProperties {

    private static final ExtractionRules DEFAULTS = ExtractionRules.defaults();

    /** Directory placeholders such as ASP164@..., never a person's address */
    private List<String> genericEmailPrefixes = new ArrayList<>(DEFAULTS.genericEmailPrefixes());

    private List<String> sectionHeadings = new ArrayList<>(DEFAULTS.sectionHeadings());

    private String streetMarker = DEFAULTS.streetMarker();

    private String mailtoSelector = DEFAULTS.mailtoSelector();
    private String telSelector = DEFAULTS.telSelector();

    private Map<CardField, List<String>> labels = new EnumMap<>(CardField.class);

    public ExtractionRules toRules() {
        Map<CardField, List<String>> merged = new EnumMap<>(DEFAULTS.labels());
        if (labels != null) {
            labels.forEach((field, values) -> {
                if (values != null && !values.isEmpty()) merged.put(field, values);
            });
        }
        return new ExtractionRules(merged, genericEmailPrefixes, sectionHeadings, streetMarker,
                mailtoSelector, telSelector);
    }
}
