package com.aiv.organizer.logging;

import com.aiv.organizer.config.ConfigService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Persists per-item batch failures to a CSV ledger so a long run can be reviewed
 * afterwards without scrolling through the log stream.
 */
public final class TaskFailureLog {

    static final String HEADER = "timestamp,operation,item,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private final Path ledger;

    public TaskFailureLog(Path ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public static TaskFailureLog fromConfig() {
        return new TaskFailureLog(ConfigService.getInstance().getFailureLogPath());
    }

    /** Appends one failed item; a ledger that cannot be written only produces a warning. */
    public void logFailure(String operation, String item, String message) {
        String line = row(Instant.now(), operation, item, message) + System.lineSeparator();
        // one writer at a time across runners sharing the ledger
        synchronized (TaskFailureLog.class) {
            try {
                Path parent = ledger.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                if (Files.notExists(ledger)) {
                    line = HEADER + System.lineSeparator() + line;
                }
                Files.writeString(ledger, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                AppLogger.get().warning("Failed to write failure ledger " + ledger + ": " + e.getMessage());
            }
        }
    }

    static String row(Instant at, String operation, String item, String message) {
        return Stream.of(TIMESTAMP_FORMAT.format(at), operation, item, message)
            .map(TaskFailureLog::field)
            .collect(Collectors.joining(","));
    }

    /** Item paths and error messages may carry commas, quotes or line breaks. */
    private static String field(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.chars().noneMatch(c -> c == ',' || c == '"' || c == '\n' || c == '\r')) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
