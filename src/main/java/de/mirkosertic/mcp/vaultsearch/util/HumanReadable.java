package de.mirkosertic.mcp.vaultsearch.util;

import java.time.Duration;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Formatting of durations and byte counts for status output.
 */
public final class HumanReadable {

    private static final String[] SI_UNITS = {"B", "kB", "MB", "GB", "TB", "PB", "EB"};

    private HumanReadable() {
    }

    /**
     * Formats whole days, hours, minutes and seconds, e.g. {@code "1d 2h 3m 4s"}.
     * Zero components are left out; anything below one second is {@code "0s"}.
     */
    public static String duration(final Duration duration) {
        if (duration.isNegative() || duration.getSeconds() == 0) {
            return "0s";
        }
        final long days = duration.toDays();
        final long hours = duration.toHoursPart();
        final long minutes = duration.toMinutesPart();
        final long seconds = duration.toSecondsPart();

        final StringJoiner parts = new StringJoiner(" ");
        if (days > 0) {
            parts.add(days + "d");
        }
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (minutes > 0) {
            parts.add(minutes + "m");
        }
        if (seconds > 0) {
            parts.add(seconds + "s");
        }
        return parts.toString();
    }

    /**
     * Formats a byte count with SI units, e.g. {@code "512 B"}, {@code "1.2 MB"}, {@code "83 MB"}.
     */
    public static String bytes(final long bytes) {
        if (bytes < 10) {
            return bytes + " B";
        }
        final int exponent = Math.min((int) Math.floor(Math.log10(bytes) / 3), SI_UNITS.length - 1);
        final double scaled = Math.floor(bytes / Math.pow(1000, exponent) * 10 + 0.5) / 10;
        final String format = scaled < 10 ? "%.1f %s" : "%.0f %s";
        return String.format(Locale.ROOT, format, scaled, SI_UNITS[exponent]);
    }
}
