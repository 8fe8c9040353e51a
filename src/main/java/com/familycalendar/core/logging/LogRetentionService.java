package com.familycalendar.core.logging;

import com.familycalendar.core.config.CalendarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes log files older than the configured retention period.
 * <p>
 * Only regular files named {@code log*.log} directly inside the log directory are considered,
 * so anything else an operator keeps there is left alone.
 */
@Service
public class LogRetentionService {

    private static final Logger log = LoggerFactory.getLogger(LogRetentionService.class);

    private final Path logDirectory;
    private final Duration keepFor;
    private final Clock clock;

    @Autowired
    public LogRetentionService(CalendarProperties properties) {
        this(Path.of(properties.getLogs().getPath()), properties.getLogs().getKeepFor(), Clock.systemUTC());
    }

    LogRetentionService(Path logDirectory, Duration keepFor, Clock clock) {
        this.logDirectory = logDirectory;
        this.keepFor = keepFor;
        this.clock = clock;
    }

    /**
     * @return number of files deleted
     * @throws IOException if the log directory cannot be listed
     */
    public int cleanupOldLogs() throws IOException {
        if (!Files.isDirectory(logDirectory)) {
            log.debug("Log directory {} does not exist; nothing to clean", logDirectory);
            return 0;
        }

        Instant cutoff = clock.instant().minus(keepFor);
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(logDirectory, "log*.log")) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    Instant modified = Files.getLastModifiedTime(file).toInstant();
                    if (modified.isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        deleted++;
                        log.debug("Deleted old log file {}", file);
                    }
                } catch (IOException e) {
                    log.warn("Could not remove old log file {}: {}", file, e.getMessage());
                }
            }
        }

        log.info("Log cleanup removed {} file(s) older than {} from {}", deleted, keepFor, logDirectory);
        return deleted;
    }

    public Path getLogDirectory() {
        return logDirectory;
    }
}
