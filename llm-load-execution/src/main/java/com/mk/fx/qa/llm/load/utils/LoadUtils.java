package com.mk.fx.qa.llm.load.utils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

public final class LoadUtils {

    private static final long SLEEP_CHUNK_MILLIS = 100L;

    private LoadUtils() {
        // Utility class, no instantiation
    }

    public static Duration toDuration(Duration duration) {
        return duration != null ? duration : Duration.ZERO;
    }

    /** Returns at most {@code maxChars} leading characters of {@code value}; null stays null. */
    public static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }

    /** Collapses line breaks so a value can be embedded in a single log/console line. */
    public static String singleLine(String value) {
        return value == null ? "" : value.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * Sleeps for the requested duration in chunks, checking for cancellation between chunks.
     *
     * @throws InterruptedException if cancellation is signalled or the thread is interrupted
     */
    public static void sleepWithCancellation(Duration duration, BooleanSupplier cancelled)
            throws InterruptedException {
        long remaining = toDuration(duration).toMillis();
        while (remaining > 0) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Cancelled during sleep");
            }
            var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
            TimeUnit.MILLISECONDS.sleep(chunk);
            remaining -= chunk;
        }
    }
}
