package com.questrail.dtchat.prediction;

import java.util.Objects;

/**
 * Raised by a {@link DeliveryTimeOracle} when no estimate can be produced.
 */
public final class PredictionException extends Exception
{
    public enum Reason
    {
        /** Both nodes are known but the contact plan offers no path. */
        NO_ROUTE_FOUND,

        /** An address does not map to a node of the contact plan. */
        INVALID_ENDPOINT
    }

    private final Reason reason;

    public PredictionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
