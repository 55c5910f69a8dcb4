package org.example.shortlinks.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-related helper methods used when pruning unused links.
 *
 * <p>The class is {@code final} and has a private constructor; all members are static.
 */
public final class TimeUtils {
    private TimeUtils() {}

    /**
     * Returns the oldest still-acceptable access time: {@code now - maxAgeDays} days.
     *
     * @param now current time
     * @param maxAgeDays number of days a record is kept after its last access, must be {@code >= 0}
     * @return the pruning cutoff
     * @throws IllegalArgumentException if {@code maxAgeDays} is negative
     */
    public static Instant cutoff(Instant now, int maxAgeDays) {
        if (maxAgeDays < 0) {
            throw new IllegalArgumentException("maxAgeDays must be >= 0: " + maxAgeDays);
        }
        return now.minus(Duration.ofDays(maxAgeDays));
    }

    /**
     * Returns {@code true} if {@code lastAccessedAt} lies strictly before {@code cutoff}.
     *
     * <p>This is an <em>exclusive</em> rule: a record accessed exactly at the cutoff is kept. A
     * record without an access time counts as unused.
     *
     * @param lastAccessedAt last access, may be {@code null}
     * @param cutoff value from {@link #cutoff(Instant, int)}
     * @return {@code true} if the record should be pruned
     */
    public static boolean isUnusedSince(Instant lastAccessedAt, Instant cutoff) {
        return lastAccessedAt == null || lastAccessedAt.isBefore(cutoff);
    }

    /** Returns the later of two instants, treating {@code null} as "no value". */
    public static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
