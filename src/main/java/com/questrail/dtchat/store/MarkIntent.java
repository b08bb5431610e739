package com.questrail.dtchat.store;

import com.questrail.dtchat.time.ChatTime;

import java.util.Objects;

/**
 * Requested lifecycle change for a stored message.
 */
public sealed interface MarkIntent
        permits MarkIntent.Acked, MarkIntent.Sent, MarkIntent.Failed
{
    static MarkIntent failed() {
        return Failed.INSTANCE;
    }

    /** The peer acknowledged the message at {@code ackTime}. */
    record Acked(ChatTime ackTime) implements MarkIntent
    {
        public Acked {
            Objects.requireNonNull(ackTime, "ackTime");
        }
    }

    /** The local transport completed transmission at {@code completedAt}. */
    record Sent(ChatTime completedAt) implements MarkIntent
    {
        public Sent {
            Objects.requireNonNull(completedAt, "completedAt");
        }
    }

    enum Failed implements MarkIntent
    {
        INSTANCE
    }
}
