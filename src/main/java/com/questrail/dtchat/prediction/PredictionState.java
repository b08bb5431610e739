package com.questrail.dtchat.prediction;

import java.util.Objects;

/**
 * Availability of delivery-time prediction, fixed when the engine is built.
 */
public sealed interface PredictionState
        permits PredictionState.Enabled, PredictionState.Error, PredictionState.Disabled
{
    static PredictionState disabled() {
        return Disabled.INSTANCE;
    }

    /** A usable oracle is available. */
    record Enabled(DeliveryTimeOracle oracle) implements PredictionState
    {
        public Enabled {
            Objects.requireNonNull(oracle, "oracle");
        }
    }

    /** Prediction was configured but could not be initialised. */
    record Error(String reason) implements PredictionState
    {
        public Error {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** Prediction was not configured. */
    enum Disabled implements PredictionState
    {
        INSTANCE
    }
}
