package com.questrail.dtchat.message;

import java.util.OptionalLong;

/**
 * Delivery progress of one message in epoch milliseconds, for views that chart
 * send, predicted and actual arrival side by side.
 *
 * @param sendMillis             when the author created the message
 * @param predictedArrivalMillis advisory estimate, if one was computed
 * @param receiveMillis          peer acknowledgement (outbound) or local reception (inbound)
 */
public record DeliveryTimestamps(long sendMillis, OptionalLong predictedArrivalMillis, OptionalLong receiveMillis)
{
    /**
     * Observed minus predicted arrival, when both are known.
     */
    public OptionalLong predictionErrorMillis() {
        if (predictedArrivalMillis.isEmpty() || receiveMillis.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(receiveMillis.getAsLong() - predictedArrivalMillis.getAsLong());
    }
}
