package com.mike.contactcardfinder.service.cardextractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Second extraction pass over the raw card text. Only fills fields the labeled pass left empty.
 */
public class FreeTextFallback {

    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w.-]+\\.[a-z]{2,}", Pattern.CASE_INSENSITIVE);

    private static final Pattern SIP = Pattern.compile("sip:[\\w.+-]+@[\\w.-]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIP_VALID =
            Pattern.compile("^sip:[\\w.+-]+@[\\w.-]+\\.[a-z]{2,}$", Pattern.CASE_INSENSITIVE);

    private static final Pattern PHONE_9 = Pattern.compile("\\b\\d{9}\\b");
    private static final Pattern PHONE_SHORT = Pattern.compile("\\b\\d{6,8}\\b");
    private static final Pattern POSTCODE_CITY = Pattern.compile("\\d{5}\\s+[A-Z]");
    private static final int PHONE_LABEL_WINDOW = 100;

    private static final Pattern POSTAL = Pattern.compile("\\b\\d{5}\\s+[A-ZÁÉÍÓÚÑ][A-ZÁÉÍÓÚÑ\\- ]*");

    private static final Pattern NAME = Pattern.compile(
            "([A-ZÁÉÍÓÚÑ][A-Za-zÁÉÍÓÚÑáéíóúñ\\-. ]+,\\s*[A-ZÁÉÍÓÚÑ][A-Za-zÁÉÍÓÚÑáéíóúñ\\- ]+)");
    private static final Pattern NAME_CAPS = Pattern.compile(
            "^[A-ZÁÉÍÓÚÑ ]+,\\s*[A-ZÁÉÍÓÚÑ ]+$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final int NAME_SCAN_LINES = 10;

    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private static final List<CardField> CAPS_LINE_ORDER =
            List.of(CardField.DEPARTMENT, CardField.COMPANY, CardField.OFFICE);

    private final ExtractionRules rules;
    private final Pattern street;

    public FreeTextFallback(ExtractionRules rules) {
        this.rules = rules;
        this.street = Pattern.compile(Pattern.quote(rules.streetMarker())
                + "\\s*[A-ZÁÉÍÓÚÑ ,]+\\d+\\s+\\d{5}\\s+[A-ZÁÉÍÓÚÑ\\- ]+");
    }

    public void fill(String text, List<String> lines, Map<CardField, String> found) {
        fillIfAbsent(found, CardField.EMAIL, email(text));
        fillIfAbsent(found, CardField.PHONE, phone(text, lines));
        fillIfAbsent(found, CardField.SIP, sip(text));
        fillIfAbsent(found, CardField.ADDRESS, address(lines));

        int nameLine = -1;
        if (!found.containsKey(CardField.NAME)) {
            NameHit hit = name(lines);
            if (hit != null) {
                found.put(CardField.NAME, hit.name());
                nameLine = hit.line();
            }
        } else {
            nameLine = indexOfLineContaining(lines, found.get(CardField.NAME));
        }

        // no name line: scan from the top
        fillFromCapsLines(lines, nameLine, found);
    }

    String email(String text) {
        List<String> all = new ArrayList<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) all.add(m.group());
        if (all.isEmpty()) return null;

        return all.stream()
                .filter(e -> !rules.isGenericEmail(e))
                .findFirst()
                .orElse(all.get(0));
    }

    String phone(String text, List<String> lines) {
        for (String line : lines) {
            if (!phoneLineAllowed(line)) continue;
            Matcher m = PHONE_9.matcher(line);
            if (m.find()) return m.group();
        }

        Matcher m = PHONE_SHORT.matcher(text);
        while (m.find()) {
            String line = lineAround(text, m.start());
            if (!phoneLineAllowed(line)) continue;
            String window = text.substring(Math.max(0, m.start() - PHONE_LABEL_WINDOW), m.start())
                    .toLowerCase(Locale.ROOT);
            boolean labelled = rules.labelsFor(CardField.PHONE).stream()
                    .anyMatch(label -> window.contains(label.toLowerCase(Locale.ROOT)));
            if (labelled) return m.group();
        }
        return null;
    }

    String sip(String text) {
        Matcher m = SIP.matcher(text);
        while (m.find()) {
            String candidate = m.group();
            if (SIP_VALID.matcher(candidate).matches()) return candidate;
        }
        return null;
    }

    String address(List<String> lines) {
        for (String line : lines) {
            Matcher m = street.matcher(line);
            if (m.find()) return m.group().trim();
        }
        for (String line : lines) {
            Matcher m = POSTAL.matcher(line);
            if (m.find()) return m.group().trim();
        }
        return null;
    }

    NameHit name(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (HAS_DIGIT.matcher(line).find() || line.contains("@") || line.contains(":")) continue;
            if (startsWithStreet(line)) continue;
            Matcher m = NAME.matcher(line);
            if (m.find()) return new NameHit(m.group(1).trim(), i);
        }

        for (int i = 0; i < Math.min(NAME_SCAN_LINES, lines.size()); i++) {
            String line = lines.get(i).trim();
            if (!line.contains(",") || line.length() <= 5) continue;
            if (rules.isSectionHeading(line) || startsWithStreet(line)) continue;
            if (NAME_CAPS.matcher(line).matches()) return new NameHit(line, i);
        }
        return null;
    }

    private void fillFromCapsLines(List<String> lines, int nameLine, Map<CardField, String> found) {
        int slot = 0;
        for (int i = nameLine + 1; i < lines.size() && slot < CAPS_LINE_ORDER.size(); i++) {
            String line = lines.get(i).trim();
            if (!isCapsLine(line) || found.containsValue(line)) continue;
            fillIfAbsent(found, CAPS_LINE_ORDER.get(slot), line);
            slot++;
        }
    }

    private boolean isCapsLine(String line) {
        if (line.length() <= 3) return false;
        if (!line.equals(line.toUpperCase(Locale.ROOT))) return false;
        if (!HAS_LETTER.matcher(line).find()) return false;
        if (HAS_DIGIT.matcher(line).find() || line.contains("@")) return false;
        if (rules.isSectionHeading(line) || startsWithStreet(line)) return false;
        return rules.labelOf(line).isEmpty();
    }

    private boolean phoneLineAllowed(String line) {
        return !line.toLowerCase(Locale.ROOT).contains("sip:") && !POSTCODE_CITY.matcher(line).find();
    }

    private boolean startsWithStreet(String line) {
        return line.toUpperCase(Locale.ROOT).startsWith(rules.streetMarker().toUpperCase(Locale.ROOT));
    }

    private static String lineAround(String text, int index) {
        int start = text.lastIndexOf('\n', index - 1) + 1;
        int end = text.indexOf('\n', index);
        return text.substring(start, end < 0 ? text.length() : end);
    }

    private static int indexOfLineContaining(List<String> lines, String value) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(value)) return i;
        }
        return -1;
    }

    private static void fillIfAbsent(Map<CardField, String> found, CardField field, String value) {
        if (value != null && !value.isBlank() && !found.containsKey(field)) {
            found.put(field, value);
        }
    }

    record NameHit(String name, int line) {}
}
