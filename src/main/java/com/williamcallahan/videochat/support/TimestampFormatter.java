package com.williamcallahan.videochat.support;

import java.util.Locale;

/**
 * Formats transcript offsets as {@code MM:SS}.
 */
public final class TimestampFormatter {

    private TimestampFormatter() {}

    /**
     * Formats whole seconds as zero-padded minutes and seconds. Minutes are not wrapped into hours.
     *
     * @param seconds offset in seconds, negative values clamp to zero
     * @return formatted offset such as {@code 05:07} or {@code 72:00}
     */
    public static String minutesSeconds(double seconds) {
        long wholeSeconds = (long) Math.floor(Math.max(0.0, seconds));
        return String.format(Locale.ROOT, "%02d:%02d", wholeSeconds / 60, wholeSeconds % 60);
    }
}
