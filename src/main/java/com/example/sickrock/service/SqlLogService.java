package com.example.sickrock.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Statement log of the engine. Every entry goes to the {@code sickrock.sql} logger and the most
 * recent ones are kept in memory.
 */
@Service
public class SqlLogService {
    private static final Logger log = LoggerFactory.getLogger("sickrock.sql");
    private static final int MAX_ENTRIES = 500;

    private final Deque<String> entries = new ArrayDeque<>();
    private final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("HH:mm:ss");

    public List<String> recentEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void logOperation(String sql) {
        log.debug("{}", sql);
        append("SQL", sql);
    }

    public void logError(String sql, String message) {
        log.warn("{} :: {}", sql, message);
        append("ERR", sql + " :: " + message);
    }

    public void logWarning(String message) {
        log.warn("{}", message);
        append("WRN", message);
    }

    public void logInfo(String message) {
        log.info("{}", message);
        append("INF", message);
    }

    private void append(String prefix, String message) {
        String timestamp = LocalDateTime.now().format(formatter);
        String entry = String.format("%s %s %s", timestamp, prefix, message);
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > MAX_ENTRIES) {
                entries.removeFirst();
            }
        }
    }
}
