package com.questrail.dtchat.transport;

import com.questrail.dtchat.api.Endpoint;

import java.util.Objects;
import java.util.Optional;

/**
 * TransportEvent
 * -----------------------------------------------------------------------------
 * Closed set of notifications a {@link TransportEngine} delivers.
 *
 * <p>These are transport facts only. They carry no protocol meaning; the chat
 * engine decides what a completion or failure means for a message.</p>
 */
public sealed interface TransportEvent
        permits TransportEvent.Received,
                TransportEvent.Sent,
                TransportEvent.Sending,
                TransportEvent.ListenerStarted,
                TransportEvent.Established,
                TransportEvent.Closed,
                TransportEvent.ConnectionFailed,
                TransportEvent.SendFailed,
                TransportEvent.ReceiveFailed,
                TransportEvent.SocketError
{
    /**
     * True for the failure variants.
     */
    default boolean isError() {
        return false;
    }

    /** One complete payload arrived. */
    record Received(byte[] data, Endpoint from) implements TransportEvent
    {
        public Received {
            data = Objects.requireNonNull(data, "data").clone();
            Objects.requireNonNull(from, "from");
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public String toString() {
            return "Received[from=" + from + ", length=" + data.length + ']';
        }
    }

    /** A payload left the host. */
    record Sent(String token, Endpoint to, int bytesSent) implements TransportEvent
    {
        public Sent {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(to, "to");
        }
    }

    /** A send was accepted and is in progress. */
    record Sending(String token, Endpoint to, int bytes) implements TransportEvent
    {
        public Sending {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(to, "to");
        }
    }

    record ListenerStarted(Endpoint endpoint) implements TransportEvent
    {
        public ListenerStarted {
            Objects.requireNonNull(endpoint, "endpoint");
        }
    }

    record Established(Endpoint remote) implements TransportEvent
    {
        public Established {
            Objects.requireNonNull(remote, "remote");
        }
    }

    record Closed(Endpoint remote) implements TransportEvent
    {
        public Closed {
            Objects.requireNonNull(remote, "remote");
        }
    }

    /** The remote could not be reached. */
    record ConnectionFailed(Endpoint endpoint, String reason, Optional<String> token) implements TransportEvent
    {
        public ConnectionFailed {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(token, "token");
        }

        @Override
        public boolean isError() {
            return true;
        }
    }

    /** A connection existed but the write failed. */
    record SendFailed(Endpoint endpoint, String reason, Optional<String> token) implements TransportEvent
    {
        public SendFailed {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(token, "token");
        }

        @Override
        public boolean isError() {
            return true;
        }
    }

    record ReceiveFailed(Endpoint endpoint, String reason) implements TransportEvent
    {
        public ReceiveFailed {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isError() {
            return true;
        }
    }

    /** A listener could not be opened or failed after opening. */
    record SocketError(Endpoint endpoint, String reason) implements TransportEvent
    {
        public SocketError {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isError() {
            return true;
        }
    }
}
