package com.mike.contactcardfinder.service.cardextractor;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Localized labels and filters the extraction engine works with.
 */
public record ExtractionRules(
        Map<CardField, List<String>> labels,
        List<String> genericEmailPrefixes,
        List<String> sectionHeadings,
        String streetMarker,
        String mailtoSelector,
        String telSelector
) {

    public ExtractionRules {
        if (labels == null || labels.isEmpty()) throw new ConfigInvalidException("extraction labels are required");
        if (streetMarker == null || streetMarker.isBlank()) {
            throw new ConfigInvalidException("extraction street marker must not be blank");
        }
        Map<CardField, List<String>> copy = new EnumMap<>(CardField.class);
        labels.forEach((field, values) -> copy.put(field, List.copyOf(values)));
        labels = Map.copyOf(copy);
        genericEmailPrefixes = genericEmailPrefixes == null ? List.of() : List.copyOf(genericEmailPrefixes);
        sectionHeadings = sectionHeadings == null ? List.of() : List.copyOf(sectionHeadings);
    }

    public static ExtractionRules defaults() {
        Map<CardField, List<String>> labels = new EnumMap<>(CardField.class);
        labels.put(CardField.DEPARTMENT, List.of("Department", "Departamento", "Título", "Puesto", "Job title"));
        labels.put(CardField.COMPANY, List.of("Company", "Compañía", "Empresa", "Organización"));
        labels.put(CardField.OFFICE, List.of("Office", "Oficina", "Ubicación", "Localización"));
        labels.put(CardField.PHONE, List.of("Work", "Trabajo", "Teléfono del trabajo"));
        labels.put(CardField.SIP, List.of("IM", "MI"));
        labels.put(CardField.ADDRESS, List.of("Business Address", "Dirección del trabajo", "Dirección"));

        return new ExtractionRules(
                labels,
                List.of("ASP", "AGM", "AEM", "ADM"),
                List.of("CONTACTO", "NOTAS", "ORGANIZACIÓN", "CONTACT", "NOTES", "ORGANIZATION"),
                "C/",
                "a[href^=\"mailto:\"]",
                "a[href^=\"tel:\"]"
        );
    }

    public List<String> labelsFor(CardField field) {
        return labels.getOrDefault(field, List.of());
    }

    /** Labels of every field, longest first so "Dirección del trabajo" wins over "Dirección". */
    public List<Map.Entry<CardField, String>> labelsLongestFirst() {
        List<Map.Entry<CardField, String>> all = new ArrayList<>();
        labels.forEach((field, values) -> values.forEach(v -> all.add(Map.entry(field, v))));
        all.sort((a, b) -> Integer.compare(b.getValue().length(), a.getValue().length()));
        return all;
    }

    public boolean isGenericEmail(String email) {
        if (email == null || genericEmailPrefixes.isEmpty()) return false;
        return genericEmailPattern().matcher(email.trim()).find();
    }

    public boolean isSectionHeading(String line) {
        if (line == null) return false;
        String upper = line.trim().toUpperCase(Locale.ROOT);
        return headingSet().contains(upper);
    }

    public Optional<CardField> labelOf(String line) {
        if (line == null) return Optional.empty();
        String l = line.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<CardField, String> e : labelsLongestFirst()) {
            String label = e.getValue().toLowerCase(Locale.ROOT);
            if (l.equals(label) || l.equals(label + ":") || l.startsWith(label + ":")) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    private Pattern genericEmailPattern() {
        String alternatives = genericEmailPrefixes.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("^(" + alternatives + ")\\d+@", Pattern.CASE_INSENSITIVE);
    }

    private Set<String> headingSet() {
        return sectionHeadings.stream()
                .map(h -> h.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
