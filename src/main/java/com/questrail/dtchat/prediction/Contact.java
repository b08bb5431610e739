package com.questrail.dtchat.prediction;

import java.util.Objects;

/**
 * One scheduled transmission opportunity from {@code from} to {@code to}.
 *
 * <p>Times are seconds relative to the contact plan start. {@code rate} is in
 * bytes per second; {@code owlt} is the one-way light time in seconds.</p>
 */
public record Contact(String from, String to, double start, double end, double rate, double owlt)
{
    public Contact {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (end < start) {
            throw new IllegalArgumentException("Contact ends before it starts: " + start + " > " + end);
        }
        if (rate <= 0) {
            throw new IllegalArgumentException("Contact rate must be positive: " + rate);
        }
        if (owlt < 0) {
            throw new IllegalArgumentException("One-way light time must not be negative: " + owlt);
        }
    }

    /**
     * Arrival time at {@code to} for a bundle of {@code size} bytes ready at
     * {@code readyAt}, or {@code NaN} when transmission cannot start before the
     * contact ends.
     */
    public double arrivalFor(double readyAt, double size) {
        double txStart = Math.max(readyAt, start);
        if (txStart >= end) {
            return Double.NaN;
        }
        return txStart + size / rate + owlt;
    }
}
