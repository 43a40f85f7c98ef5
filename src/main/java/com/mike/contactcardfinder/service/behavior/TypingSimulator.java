package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.driver.UiElement;

import java.time.Duration;
import java.util.Map;
import java.util.Random;

/**
 * Types text one character at a time with variable speed, short fast bursts and the odd corrected typo.
 */
public class TypingSimulator {

    private static final String NO_MISTAKE_CHARS = " .,;:!?\n\t";
    private static final String PUNCTUATION = ".,;:!?";
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private static final double PUNCTUATION_FACTOR = 1.8;
    private static final double UPPERCASE_FACTOR = 1.1;
    private static final double BURST_FACTOR = 0.25;
    private static final double VARIATION = 0.2;

    private static final Duration AFTER_BACKSPACE = Duration.ofMillis(50);
    private static final Duration AFTER_CLEAR = Duration.ofMillis(100);

    private static final Map<Character, String> QWERTY_NEIGHBOURS = Map.ofEntries(
            Map.entry('a', "sq"), Map.entry('b', "vn"), Map.entry('c', "xv"), Map.entry('d', "sf"),
            Map.entry('e', "wr"), Map.entry('f', "dg"), Map.entry('g', "fh"), Map.entry('h', "gj"),
            Map.entry('i', "uo"), Map.entry('j', "hk"), Map.entry('k', "jl"), Map.entry('l', "k"),
            Map.entry('m', "n"), Map.entry('n', "bm"), Map.entry('o', "ip"), Map.entry('p', "o"),
            Map.entry('q', "w"), Map.entry('r', "et"), Map.entry('s', "ad"), Map.entry('t', "ry"),
            Map.entry('u', "yi"), Map.entry('v', "cb"), Map.entry('w', "qe"), Map.entry('x', "zc"),
            Map.entry('y', "tu"), Map.entry('z', "x")
    );

    private final TypingConfig config;
    private final Random random;
    private final Sleeper sleeper;

    private int burstRemaining;

    public TypingSimulator(TypingConfig config, Random random, Sleeper sleeper) {
        this.config = config;
        this.random = random;
        this.sleeper = sleeper;
    }

    public void type(UiElement element, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (shouldMakeMistake(c)) {
                element.type(String.valueOf(mistakeFor(c)));
                sleeper.sleep(uniformMs(config.correctionDelay()));
                element.press("Backspace");
                sleeper.sleep(AFTER_BACKSPACE);
            }

            element.type(String.valueOf(c));

            if (i < text.length() - 1) {
                sleeper.sleep(Duration.ofMillis(Math.round(charDelaySeconds(c) * 1000)));
            }
        }
    }

    public void fill(UiElement element, String text) {
        element.fill("");
        sleeper.sleep(AFTER_CLEAR);
        type(element, text);
    }

    double charDelaySeconds(char c) {
        double delay = 1.0 / uniform(config.minCharsPerSecond(), config.maxCharsPerSecond());

        if (burstRemaining > 0) {
            burstRemaining--;
            delay *= BURST_FACTOR;
        } else if (random.nextDouble() < config.burstChance()) {
            burstRemaining = config.burstLength();
            delay *= BURST_FACTOR;
        } else if (c == ' ') {
            delay *= config.betweenWordsFactor();
        } else if (PUNCTUATION.indexOf(c) >= 0) {
            delay *= PUNCTUATION_FACTOR;
        } else if (Character.isUpperCase(c)) {
            delay *= UPPERCASE_FACTOR;
        }

        return delay * (1 + uniform(-VARIATION, VARIATION));
    }

    char mistakeFor(char correct) {
        String neighbours = QWERTY_NEIGHBOURS.get(Character.toLowerCase(correct));
        if (neighbours == null) {
            return ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        char wrong = neighbours.charAt(random.nextInt(neighbours.length()));
        return Character.isUpperCase(correct) ? Character.toUpperCase(wrong) : wrong;
    }

    private boolean shouldMakeMistake(char c) {
        if (NO_MISTAKE_CHARS.indexOf(c) >= 0) return false;
        return random.nextDouble() < config.mistakeProbability();
    }

    private Duration uniformMs(MsRange range) {
        return Duration.ofMillis(Math.round(range.uniform(random)));
    }

    private double uniform(double a, double b) {
        return a + (b - a) * random.nextDouble();
    }
}
