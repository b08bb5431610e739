package com.questrail.dtchat.prediction;

import com.questrail.dtchat.time.ChatTime;

/**
 * Estimates when a message of a given size, sent now, reaches its destination.
 *
 * <p>Addresses are Bundle Protocol endpoint ids such as {@code ipn:2.0}.
 * Predictions are advisory; callers must never let a failure here affect
 * transmission.</p>
 */
public interface DeliveryTimeOracle
{
    /**
     * @param sourceAddress      BP address of the sender
     * @param destinationAddress BP address of the recipient
     * @param sizeBytes          encoded message size
     * @return predicted absolute arrival time
     * @throws PredictionException if either address is unknown or no route exists
     */
    ChatTime predict(String sourceAddress, String destinationAddress, double sizeBytes)
            throws PredictionException;
}
