package com.questrail.dtchat.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Transport families an {@link Endpoint} can be reached over.
 *
 * <p>Each kind has a short lowercase token used in the canonical textual form
 * of an endpoint ({@code "tcp 127.0.0.1:7000"}, {@code "bp ipn:10.1"}).</p>
 */
public enum TransportKind
{
    TCP("tcp"),
    UDP("udp"),
    BUNDLE_PROTOCOL("bp");

    private final String token;

    TransportKind(String token) {
        this.token = token;
    }

    /**
     * Returns the token used in the canonical endpoint text.
     */
    public String token() {
        return token;
    }

    /**
     * Resolves a kind from its token, ignoring case.
     */
    public static Optional<TransportKind> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (TransportKind kind : values()) {
            if (kind.token.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
