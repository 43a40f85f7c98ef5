package com.mike.contactcardfinder.service.cardextractor;

import com.mike.contactcardfinder.driver.UiElement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First extraction pass: values that follow a known label, plus mailto/tel links inside the card.
 */
@Slf4j
@RequiredArgsConstructor
public class LabeledAnchorProbe {

    private static final int ADDRESS_MAX_LINES = 3;
    private static final int PHONE_MIN_DIGITS = 6;

    private static final Pattern PHONE_NOISE = Pattern.compile("[^0-9+\\-() ]");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final ExtractionRules rules;

    public Map<CardField, String> probe(List<String> lines) {
        Map<CardField, String> found = new EnumMap<>(CardField.class);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) continue;

            Optional<Anchor> anchor = anchorOf(line);
            if (anchor.isEmpty()) continue;

            CardField field = anchor.get().field();
            if (found.containsKey(field)) continue;

            String inline = anchor.get().inlineValue();
            String value = field == CardField.ADDRESS
                    ? collectAddress(lines, i, inline)
                    : (inline.isEmpty() ? nextValueLine(lines, i) : inline);

            String accepted = accept(field, value);
            if (accepted != null) {
                found.put(field, accepted);
            }
        }

        return found;
    }

    /** Fills email/phone from link targets when the text labels did not provide them. */
    public void probeLinks(UiElement card, Map<CardField, String> found) {
        if (card == null) return;

        if (!found.containsKey(CardField.EMAIL)) {
            card.attribute(rules.mailtoSelector(), "href")
                    .map(href -> stripScheme(href, "mailto:"))
                    .filter(v -> v.contains("@"))
                    .ifPresent(v -> found.put(CardField.EMAIL, v));
        }
        if (!found.containsKey(CardField.PHONE)) {
            card.attribute(rules.telSelector(), "href")
                    .map(href -> accept(CardField.PHONE, stripScheme(href, "tel:")))
                    .ifPresent(v -> found.put(CardField.PHONE, v));
        }
    }

    Optional<Anchor> anchorOf(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<CardField, String> e : rules.labelsLongestFirst()) {
            String label = e.getValue().toLowerCase(Locale.ROOT);
            if (lower.equals(label) || lower.equals(label + ":")) {
                return Optional.of(new Anchor(e.getKey(), ""));
            }
            if (lower.startsWith(label + ":")) {
                return Optional.of(new Anchor(e.getKey(), line.substring(label.length() + 1).trim()));
            }
        }
        return Optional.empty();
    }

    private String nextValueLine(List<String> lines, int labelIndex) {
        for (int j = labelIndex + 1; j < lines.size(); j++) {
            String candidate = lines.get(j).trim();
            if (candidate.isEmpty()) continue;
            return anchorOf(candidate).isPresent() ? null : candidate;
        }
        return null;
    }

    private String collectAddress(List<String> lines, int labelIndex, String inline) {
        List<String> parts = new ArrayList<>();
        if (!inline.isEmpty()) parts.add(inline);

        int following = 0;
        for (int j = labelIndex + 1; j < lines.size() && following < ADDRESS_MAX_LINES; j++) {
            String candidate = lines.get(j).trim();
            if (candidate.isEmpty() || anchorOf(candidate).isPresent()) break;
            parts.add(candidate);
            following++;
        }
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String accept(CardField field, String raw) {
        if (raw == null || raw.isBlank()) return null;
        String value = raw.trim();

        return switch (field) {
            case PHONE -> {
                String cleaned = PHONE_NOISE.matcher(value).replaceAll("").trim();
                yield countDigits(cleaned) >= PHONE_MIN_DIGITS ? cleaned : null;
            }
            case SIP -> value.toLowerCase(Locale.ROOT).startsWith("sip:") ? value : null;
            default -> value;
        };
    }

    private static int countDigits(String s) {
        int n = 0;
        var m = DIGIT.matcher(s);
        while (m.find()) n++;
        return n;
    }

    private static String stripScheme(String href, String scheme) {
        String h = href.trim();
        if (h.toLowerCase(Locale.ROOT).startsWith(scheme)) h = h.substring(scheme.length());
        int q = h.indexOf('?');
        return (q >= 0 ? h.substring(0, q) : h).trim();
    }

    record Anchor(CardField field, String inlineValue) {}
}
