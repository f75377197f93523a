package com.company.clientpulse.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public class TimeUtils {

    /**
     * UTC calendar date a snapshot taken at the given instant is filed under
     */
    public static LocalDate snapshotDate(Instant timestamp) {
        return timestamp.atZone(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * Parse the {@code YYYY-MM-DD} stem of an object key such as {@code .../2025-03-12.json}
     */
    public static Optional<LocalDate> dateFromKey(String key) {
        if (key == null || !key.endsWith(".json")) return Optional.empty();

        String fileName = key.substring(key.lastIndexOf('/') + 1, key.length() - ".json".length());
        try {
            return Optional.of(LocalDate.parse(fileName));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Result files are named {@code <unix seconds>-<hash>.json}; recover the timestamp from the prefix
     */
    public static Optional<Instant> timestampFromFileName(String fileName) {
        if (fileName == null || fileName.isEmpty()) return Optional.empty();

        String prefix = fileName.split("-")[0];
        try {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(prefix)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Spring cron expressions carry a seconds field; classic five-field expressions get one prepended
     */
    public static String toSpringCron(String cron) {
        if (cron == null) return null;

        String trimmed = cron.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%ds", seconds);
        } else {
            return String.format("%dms", durationMs);
        }
    }
}
