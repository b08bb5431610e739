package com.questrail.dtchat.prediction;

import java.util.OptionalDouble;

/**
 * Route computation over a contact plan. Implementations must be safe for
 * concurrent use.
 */
public interface RoutingEngine
{
    boolean knowsNode(String nodeId);

    /**
     * Earliest arrival at {@code destination}, in seconds since the contact
     * plan start, for a bundle leaving {@code source} at {@code sendOffset}.
     *
     * @return empty if no route exists
     */
    OptionalDouble earliestArrival(String source, String destination, double sendOffset, double sizeBytes);
}
