package com.questrail.dtchat.prediction;

import com.questrail.dtchat.time.ChatTime;
import com.questrail.dtchat.time.WallClock;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * ContactPlanOracle
 * -----------------------------------------------------------------------------
 * {@link DeliveryTimeOracle} backed by a {@link RoutingEngine}.
 *
 * <p>Contact plan times are relative to {@code planStart}, the instant the
 * oracle was loaded. A prediction routes a bundle leaving at
 * {@code now - planStart} and maps the arrival offset back to absolute time.</p>
 *
 * <p>BP addresses of the form {@code ipn:NODE.SERVICE} are reduced to the node
 * number, which is how nodes are named in the plan.</p>
 */
public final class ContactPlanOracle implements DeliveryTimeOracle
{
    private final RoutingEngine router;
    private final ChatTime planStart;
    private final WallClock clock;

    public ContactPlanOracle(RoutingEngine router, ChatTime planStart, WallClock clock) {
        this.router = Objects.requireNonNull(router, "router");
        this.planStart = Objects.requireNonNull(planStart, "planStart");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads an ION contact plan and anchors it at the current time.
     */
    public static ContactPlanOracle load(Path contactPlan, WallClock clock) throws IOException {
        ContactPlan plan = ContactPlanParser.parse(contactPlan);
        return new ContactPlanOracle(new ContactGraphRouter(plan), clock.chatNow(), clock);
    }

    @Override
    public ChatTime predict(String sourceAddress, String destinationAddress, double sizeBytes)
            throws PredictionException
    {
        String source = nodeId(sourceAddress);
        String destination = nodeId(destinationAddress);

        if (!router.knowsNode(source)) {
            throw new PredictionException(PredictionException.Reason.INVALID_ENDPOINT,
                    "Source node '" + source + "' not found in contact plan");
        }
        if (!router.knowsNode(destination)) {
            throw new PredictionException(PredictionException.Reason.INVALID_ENDPOINT,
                    "Destination node '" + destination + "' not found in contact plan");
        }

        double sendOffset = clock.chatNow().epochSeconds() - planStart.epochSeconds();
        OptionalDouble arrival = router.earliestArrival(source, destination, sendOffset, sizeBytes);
        if (arrival.isEmpty()) {
            throw new PredictionException(PredictionException.Reason.NO_ROUTE_FOUND,
                    "No route found from node " + source + " to node " + destination);
        }

        double arrivalSeconds = planStart.epochSeconds() + arrival.getAsDouble();
        return ChatTime.tryFromSeconds(arrivalSeconds).orElseThrow(() ->
                new PredictionException(PredictionException.Reason.NO_ROUTE_FOUND,
                        "Arrival at node " + destination + " falls outside the representable time range ("
                                + arrivalSeconds + " s since epoch)"));
    }

    public ChatTime planStart() {
        return planStart;
    }

    /**
     * {@code ipn:10.1} → {@code 10}; anything else is returned unchanged.
     */
    static String nodeId(String bpAddress) {
        Objects.requireNonNull(bpAddress, "bpAddress");
        if (!bpAddress.startsWith("ipn:")) {
            return bpAddress;
        }
        String rest = bpAddress.substring("ipn:".length());
        int dot = rest.indexOf('.');
        return dot >= 0 ? rest.substring(0, dot) : rest;
    }
}
