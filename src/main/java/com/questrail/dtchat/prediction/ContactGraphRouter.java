package com.questrail.dtchat.prediction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * ContactGraphRouter
 * -----------------------------------------------------------------------------
 * Earliest-arrival routing over a {@link ContactPlan}.
 *
 * <p>A Dijkstra search over nodes where the cost of reaching a node is the
 * earliest time a bundle can be there. Leaving a node over a contact is
 * possible only if transmission starts before the contact ends; see
 * {@link Contact#arrivalFor}.</p>
 *
 * <p>Immutable after construction and safe for concurrent use.</p>
 */
public final class ContactGraphRouter implements RoutingEngine
{
    private record Visit(String node, double time) {
    }

    private final Set<String> nodes;
    private final Map<String, List<Contact>> outbound;

    public ContactGraphRouter(ContactPlan plan) {
        Objects.requireNonNull(plan, "plan");
        this.nodes = plan.nodes();

        Map<String, List<Contact>> byNode = new HashMap<>();
        for (Contact c : plan.contacts()) {
            byNode.computeIfAbsent(c.from(), k -> new ArrayList<>()).add(c);
        }
        byNode.replaceAll((k, v) -> List.copyOf(v));
        this.outbound = Map.copyOf(byNode);
    }

    @Override
    public boolean knowsNode(String nodeId) {
        return nodes.contains(nodeId);
    }

    /**
     * A bundle addressed to its own source arrives immediately.
     */
    @Override
    public OptionalDouble earliestArrival(String source, String destination, double sendOffset, double sizeBytes) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        if (!knowsNode(source) || !knowsNode(destination)) {
            return OptionalDouble.empty();
        }

        Map<String, Double> best = new HashMap<>();
        PriorityQueue<Visit> queue = new PriorityQueue<>((a, b) -> Double.compare(a.time(), b.time()));
        best.put(source, sendOffset);
        queue.add(new Visit(source, sendOffset));

        while (!queue.isEmpty()) {
            Visit v = queue.poll();
            if (v.time() > best.getOrDefault(v.node(), Double.POSITIVE_INFINITY)) {
                continue;
            }
            if (v.node().equals(destination)) {
                return OptionalDouble.of(v.time());
            }
            for (Contact c : outbound.getOrDefault(v.node(), List.of())) {
                double arrival = c.arrivalFor(v.time(), sizeBytes);
                if (Double.isNaN(arrival)) {
                    continue;
                }
                if (arrival < best.getOrDefault(c.to(), Double.POSITIVE_INFINITY)) {
                    best.put(c.to(), arrival);
                    queue.add(new Visit(c.to(), arrival));
                }
            }
        }
        return OptionalDouble.empty();
    }
}
