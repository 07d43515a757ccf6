package com.example.waystone.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes old rolled-over log files at startup so ./logs does not grow forever.
 */
public class LogFileCleaner {
    private static final Logger logger = LoggerFactory.getLogger(LogFileCleaner.class);

    public static final Duration DEFAULT_MAX_AGE = Duration.ofDays(14);

    private LogFileCleaner() {
    }

    /**
     * Delete log files in the directory last modified before now minus maxAge.
     *
     * @return number of files deleted
     */
    public static int cleanLogs(File logsDir, Duration maxAge, Instant now) {
        if (!logsDir.isDirectory()) {
            logger.debug("No logs directory found at {}", logsDir.getAbsolutePath());
            return 0;
        }
        File[] files = logsDir.listFiles();
        if (files == null) return 0;
        long cutoff = now.minus(maxAge).toEpochMilli();
        int deleted = 0;
        for (File f : files) {
            if (!f.isFile()) continue;
            String name = f.getName().toLowerCase();
            if (!(name.endsWith(".log") || name.endsWith(".log.gz"))) continue;
            if (f.lastModified() >= cutoff) continue;
            if (f.delete()) {
                deleted++;
            } else {
                logger.debug("Failed to delete {}", f.getAbsolutePath());
            }
        }
        if (deleted > 0) {
            logger.info("Removed {} old log file(s) from {}", deleted, logsDir.getAbsolutePath());
        }
        return deleted;
    }

    public static int cleanLogs() {
        return cleanLogs(new File("./logs"), DEFAULT_MAX_AGE, Instant.now());
    }
}
