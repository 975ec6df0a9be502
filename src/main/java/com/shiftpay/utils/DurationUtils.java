package com.shiftpay.utils;

/**
 * Talk-time durations as they arrive from the phone system ("H:MM:SS" or "MM:SS") and as they are displayed.
 */
public final class DurationUtils {

    private DurationUtils() {
    }

    /**
     * Parses "H:MM:SS", "MM:SS" or a plain number of seconds.
     *
     * @return seconds, or 0 when the value is blank, not a duration, or too long to fit an int
     */
    public static int parse(String duration) {
        if (duration == null || duration.isBlank()) return 0;
        String[] parts = duration.trim().split(":");
        if (parts.length > 3) return 0;
        try {
            int seconds = 0;
            for (String part : parts) {
                int value = Integer.parseInt(part);
                if (value < 0) return 0;
                seconds = Math.addExact(Math.multiplyExact(seconds, 60), value);
            }
            return seconds;
        } catch (NumberFormatException | ArithmeticException e) {
            return 0;
        }
    }

    public static String formatClock(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        return String.format("%02d:%02d:%02d", h, m, s);
    }

    public static String formatHuman(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        if (h == 0) return m + "m";
        return h + "h " + m + "m";
    }
}
