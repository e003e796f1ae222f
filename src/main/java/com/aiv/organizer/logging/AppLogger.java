package com.aiv.organizer.logging;

import com.aiv.organizer.config.ConfigService;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the process-wide logger. Console output gets every record; SEVERE records,
 * stack traces included, are appended to the persistent error log.
 */
public final class AppLogger {
    private static final String LOGGER_NAME = "com.aiv.organizer";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        Formatter consoleFormatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, consoleFormatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        Path errorLog = ConfigService.getInstance().getErrorLogPath();
        try {
            if (errorLog.getParent() != null) {
                Files.createDirectories(errorLog.getParent());
            }
            FileHandler fileHandler = new FileHandler(errorLog.toString(), true);
            fileHandler.setEncoding(UTF_8.name());
            fileHandler.setFormatter(new ErrorLogFormatter());
            fileHandler.setLevel(Level.SEVERE);
            logger.addHandler(fileHandler);
        } catch (IOException | SecurityException ex) {
            logger.warning("Persistent error log disabled (" + errorLog + "): " + ex.getMessage());
        }
        return logger;
    }

    private static final class ErrorLogFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            StringBuilder sb = new StringBuilder()
                .append(TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(record.getMillis())))
                .append(':')
                .append(record.getLevel().getName())
                .append(':')
                .append(formatMessage(record))
                .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                sb.append(trace);
            }
            return sb.toString();
        }
    }
}
