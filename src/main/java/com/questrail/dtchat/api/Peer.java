package com.questrail.dtchat.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A chat participant and the transport addresses it can be reached at.
 *
 * <p>At most one endpoint per {@link TransportKind} is expected but not
 * enforced; lookups return the first match.</p>
 *
 * @param uuid      stable identity
 * @param name      display name
 * @param color     presentation hint
 * @param endpoints reachable addresses (copied, never null)
 */
public record Peer(String uuid, String name, String color, List<Endpoint> endpoints)
{
    public Peer {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
        endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints"));
    }

    /**
     * Returns the first endpoint of the given kind, if any.
     */
    public Optional<Endpoint> endpointFor(TransportKind kind) {
        Objects.requireNonNull(kind, "kind");
        return endpoints.stream()
                .filter(e -> e.kind() == kind)
                .findFirst();
    }

    public boolean hasEndpoint(Endpoint endpoint) {
        return endpoints.contains(endpoint);
    }
}
