package com.mike.contactcardfinder.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.contactcardfinder.config.ContactFinderProperties;
import com.mike.contactcardfinder.exception.SessionInvalidException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a Playwright storage-state JSON file. The file is usable when it parses and holds at least one cookie.
 */
@Slf4j
@Component
public class FileSessionStore implements SessionStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSessionStore(ContactFinderProperties props, ObjectMapper objectMapper) {
        this(Path.of(props.getBrowser().getSessionFile()), objectMapper);
    }

    public FileSessionStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isValid() {
        try {
            check();
            return true;
        } catch (SessionInvalidException e) {
            log.info("Session: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Path requireStorageState() {
        check();
        return file;
    }

    private void check() {
        if (!Files.isRegularFile(file)) {
            throw new SessionInvalidException("session file not found: " + file.toAbsolutePath());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new SessionInvalidException("session file is not valid JSON: " + file, e);
        }

        JsonNode cookies = root == null ? null : root.get("cookies");
        if (cookies == null || !cookies.isArray() || cookies.isEmpty()) {
            throw new SessionInvalidException("session file holds no cookies: " + file);
        }
    }
}
