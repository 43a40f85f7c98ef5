package com.mike.contactcardfinder.service.behavior;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Picks the browser user agent for each new browser context.
 */
@Slf4j
public class IdentityRotator {

    static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/130.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 11.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0_0) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 13_6_0) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/130.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36 Edg/131.0.0.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/130.0.0.0 Safari/537.36 Edg/130.0.0.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36 Edg/131.0.0.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:134.0) Gecko/20100101 Firefox/134.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:133.0) Gecko/20100101 Firefox/133.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:134.0) Gecko/20100101 Firefox/134.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14.0; rv:134.0) Gecko/20100101 Firefox/134.0",
            "Mozilla/5.0 (X11; Linux x86_64; rv:134.0) Gecko/20100101 Firefox/134.0",
            "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:134.0) Gecko/20100101 Firefox/134.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.6 Safari/605.1.15",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.6 Safari/605.1.15",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 13_6) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/130.0.0.0 Safari/537.36"
    );

    private static final int RECENT_WINDOW = 3;
    private static final int HISTORY_SIZE = 10;

    private final IdentityConfig config;
    private final Random random;
    private final List<String> pool;
    private final Deque<String> used = new ArrayDeque<>();

    private String current;

    public IdentityRotator(IdentityConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.pool = buildPool(config, random);
        log.info("Identity: pool of {} user agents (platform={}, rotate={})",
                pool.size(), config.preferPlatform(), config.rotate());
    }

    public synchronized String identity() {
        if (!config.rotate()) {
            if (current == null) {
                current = pool.get(random.nextInt(pool.size()));
            }
            return current;
        }

        List<String> recent = recent();
        List<String> available = new ArrayList<>();
        for (String ua : pool) {
            if (!recent.contains(ua)) available.add(ua);
        }
        if (available.isEmpty()) {
            used.clear();
            available = pool;
        }

        String ua = available.get(random.nextInt(available.size()));
        used.addLast(ua);
        while (used.size() > HISTORY_SIZE) {
            used.removeFirst();
        }
        current = ua;
        return ua;
    }

    public synchronized String current() {
        return current;
    }

    List<String> pool() {
        return pool;
    }

    private List<String> recent() {
        List<String> all = new ArrayList<>(used);
        return all.subList(Math.max(0, all.size() - RECENT_WINDOW), all.size());
    }

    private static List<String> buildPool(IdentityConfig config, Random random) {
        List<String> filtered = new ArrayList<>(filterByPlatform(config.preferPlatform()));
        if (filtered.size() > config.poolSize()) {
            Collections.shuffle(filtered, random);
            filtered = new ArrayList<>(filtered.subList(0, config.poolSize()));
        }
        return List.copyOf(filtered);
    }

    static List<String> filterByPlatform(String platform) {
        if (platform == null || platform.isBlank()) return USER_AGENTS;

        String p = platform.trim().toLowerCase(Locale.ROOT);
        return switch (p) {
            case "windows" -> USER_AGENTS.stream().filter(ua -> ua.contains("Windows")).toList();
            case "mac", "macos", "darwin" -> USER_AGENTS.stream().filter(ua -> ua.contains("Macintosh")).toList();
            case "linux" -> USER_AGENTS.stream().filter(ua -> ua.contains("Linux") || ua.contains("X11")).toList();
            default -> USER_AGENTS;
        };
    }
}
