package com.questrail.dtchat.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PendingSendTable
 * -----------------------------------------------------------------------------
 * Token → {@link PendingSend} map for sends awaiting a transport outcome.
 *
 * <p>Each entry is removed exactly once, by whichever of completion or failure
 * arrives first. Not thread-safe; guarded by the engine lock.</p>
 */
final class PendingSendTable
{
    private final Map<String, PendingSend> entries = new LinkedHashMap<>();

    void register(PendingSend send) {
        Objects.requireNonNull(send, "send");
        entries.put(send.token(), send);
    }

    /**
     * Removes and returns the entry for {@code token}, if any.
     */
    Optional<PendingSend> pop(String token) {
        return Optional.ofNullable(entries.remove(token));
    }

    int size() {
        return entries.size();
    }
}
