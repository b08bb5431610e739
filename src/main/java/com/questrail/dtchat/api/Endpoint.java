package com.questrail.dtchat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Endpoint
 * -----------------------------------------------------------------------------
 * A transport address at which a peer can be reached: a {@link TransportKind}
 * plus a kind-specific address string.
 *
 * <h2>Canonical form</h2>
 * <pre>
 *   "&lt;kind&gt; &lt;address&gt;"     e.g.  "tcp 127.0.0.1:7000", "udp 10.0.0.2:7001", "bp ipn:10.1"
 * </pre>
 *
 * <p>The canonical form is embedded in every wire envelope so the recipient
 * knows where to send its acknowledgement. {@link #toString()} always renders
 * the canonical form, so {@code parse(e.toString()).equals(e)} holds.</p>
 *
 * <p>Two endpoints are equal iff their kind and address match exactly; no
 * address normalization is performed.</p>
 */
public record Endpoint(TransportKind kind, String address)
{
    public Endpoint {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(address, "address");
        if (address.isBlank() || containsWhitespace(address)) {
            throw new EndpointFormatException("Endpoint address must be non-blank without whitespace: '" + address + "'");
        }
    }

    public static Endpoint tcp(String address) {
        return new Endpoint(TransportKind.TCP, address);
    }

    public static Endpoint udp(String address) {
        return new Endpoint(TransportKind.UDP, address);
    }

    public static Endpoint bundleProtocol(String address) {
        return new Endpoint(TransportKind.BUNDLE_PROTOCOL, address);
    }

    /**
     * Parses the canonical textual form.
     *
     * @throws EndpointFormatException if the kind token is unknown or the address is missing
     */
    public static Endpoint parse(String text) {
        Objects.requireNonNull(text, "text");

        String trimmed = text.trim();
        int split = indexOfWhitespace(trimmed);
        if (split < 0) {
            throw new EndpointFormatException("Endpoint must have the form '<kind> <address>': '" + text + "'");
        }

        String token = trimmed.substring(0, split);
        String address = trimmed.substring(split).trim();

        TransportKind kind = TransportKind.fromToken(token)
                .orElseThrow(() -> new EndpointFormatException("Unknown transport kind '" + token + "' in '" + text + "'"));

        return new Endpoint(kind, address);
    }

    /**
     * Lenient variant of {@link #parse(String)} for untrusted (wire) input.
     */
    public static Optional<Endpoint> tryParse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(text));
        } catch (EndpointFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return kind.token() + " " + address;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean containsWhitespace(String s) {
        return indexOfWhitespace(s) >= 0;
    }
}
