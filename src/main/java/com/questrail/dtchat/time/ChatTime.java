package com.questrail.dtchat.time;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * ChatTime
 * =============================================================================
 * Absolute UTC instant used for message ordering and wire timestamps.
 *
 * <h2>Precision</h2>
 * <p>Wire timestamps carry milliseconds since the epoch. A {@code ChatTime}
 * built from {@link #fromTimestampMillis(long)} round-trips exactly through
 * {@link #timestampMillis()}. Instants with sub-millisecond precision (e.g. from
 * {@link #now()}) are truncated by {@link #timestampMillis()}.</p>
 *
 * <h2>Accepted range</h2>
 * <p>Only instants between {@code 0001-01-01T00:00:00Z} and
 * {@code 9999-12-31T23:59:59.999Z} are representable, so every value formats
 * with a four-digit year. Wire timestamps outside that range are rejected by
 * {@link #fromTimestampMillis(long)}.</p>
 *
 * <p>This type is an observability and ordering value. It carries no notion of
 * monotonicity; peers' clocks are trusted as received.</p>
 */
public final class ChatTime implements Comparable<ChatTime>
{
    /** 0001-01-01T00:00:00Z */
    public static final long MIN_MILLIS = -62_135_596_800_000L;

    /** 9999-12-31T23:59:59.999Z */
    public static final long MAX_MILLIS = 253_402_300_799_999L;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Instant instant;

    private ChatTime(Instant instant) {
        this.instant = instant;
    }

    public static ChatTime now() {
        return of(SystemWallClock.INSTANCE.now());
    }

    /**
     * Wraps an instant.
     *
     * @throws IllegalArgumentException if the instant is outside the accepted range
     */
    public static ChatTime of(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        long millis = instant.toEpochMilli();
        if (millis < MIN_MILLIS || millis > MAX_MILLIS) {
            throw new IllegalArgumentException("Instant out of range: " + instant);
        }
        return new ChatTime(instant);
    }

    /**
     * Parses a wire timestamp.
     *
     * @return the time, or empty if {@code millis} is outside the accepted range
     */
    public static Optional<ChatTime> fromTimestampMillis(long millis) {
        if (millis < MIN_MILLIS || millis > MAX_MILLIS) {
            return Optional.empty();
        }
        return Optional.of(new ChatTime(Instant.ofEpochMilli(millis)));
    }

    /**
     * Converts fractional seconds since the epoch (contact-plan arithmetic) to a time,
     * rounding to the nearest nanosecond.
     *
     * @throws IllegalArgumentException if the value is not finite or out of range
     */
    public static ChatTime fromSeconds(double seconds) {
        return tryFromSeconds(seconds).orElseThrow(() ->
                new IllegalArgumentException("Seconds not finite or out of range: " + seconds));
    }

    /**
     * As {@link #fromSeconds(double)}, but empty when the value is not finite or
     * lies outside the accepted range.
     */
    public static Optional<ChatTime> tryFromSeconds(double seconds) {
        if (!Double.isFinite(seconds)
                || seconds * 1000d < MIN_MILLIS
                || seconds * 1000d > MAX_MILLIS) {
            return Optional.empty();
        }
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1_000_000_000d);
        Instant instant = Instant.ofEpochSecond(whole, nanos);
        long millis = instant.toEpochMilli();
        if (millis < MIN_MILLIS || millis > MAX_MILLIS) {
            return Optional.empty();
        }
        return Optional.of(new ChatTime(instant));
    }

    public long timestampMillis() {
        return instant.toEpochMilli();
    }

    /**
     * Seconds since the epoch as a double, the unit used by the contact plan.
     */
    public double epochSeconds() {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }

    public Instant toInstant() {
        return instant;
    }

    public boolean isBefore(ChatTime other) {
        return instant.isBefore(other.instant);
    }

    public boolean isAfter(ChatTime other) {
        return instant.isAfter(other.instant);
    }

    /**
     * Returns this instant in the given zone (hour/minute extraction for views).
     */
    public ZonedDateTime atZone(ZoneId zone) {
        return instant.atZone(Objects.requireNonNull(zone, "zone"));
    }

    /**
     * Formats this instant in the given zone.
     *
     * @param date      include {@code yyyy-MM-dd}
     * @param time      include {@code HH:mm:ss}
     * @param separator placed between date and time when both are requested;
     *                  {@code null} means a single space
     * @param zone      display time zone
     * @return the formatted text, empty if neither part is requested
     */
    public String format(boolean date, boolean time, String separator, ZoneId zone) {
        ZonedDateTime zoned = instant.atZone(Objects.requireNonNull(zone, "zone"));
        StringBuilder sb = new StringBuilder();
        if (date) {
            sb.append(DATE.format(zoned));
        }
        if (date && time) {
            sb.append(separator == null ? " " : separator);
        }
        if (time) {
            sb.append(TIME.format(zoned));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(ChatTime other) {
        return instant.compareTo(other.instant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatTime that)) return false;
        return instant.equals(that.instant);
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    @Override
    public String toString() {
        return instant.toString();
    }
}
