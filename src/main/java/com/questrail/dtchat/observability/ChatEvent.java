package com.questrail.dtchat.observability;

import com.questrail.dtchat.message.ChatMessage;
import com.questrail.dtchat.transport.TransportEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * ChatEvent
 * -----------------------------------------------------------------------------
 * Everything observable about the chat engine.
 *
 * <p>No event is fatal. Failures are reported as {@link Error} (protocol level)
 * or {@link TransportError} (forwarded transport fact) and processing
 * continues.</p>
 */
public sealed interface ChatEvent
        permits ChatEvent.Info, ChatEvent.Error, ChatEvent.TransportInfo, ChatEvent.TransportError
{
    enum InfoKind
    {
        SENDING,
        SENT,
        RECEIVED,
        ACK_SENT,
        ACK_RECEIVED,
        PREDICTION_STATUS
    }

    enum ErrorKind
    {
        PROTOCOL_DECODE,
        PROTOCOL_ENCODE,
        MESSAGE_NOT_FOUND,
        INTERNAL_ERROR,
        HOST_ERROR
    }

    static ChatEvent info(InfoKind kind, ChatMessage message, String detail) {
        return new Info(kind, Optional.of(message), detail);
    }

    static ChatEvent info(InfoKind kind, String detail) {
        return new Info(kind, Optional.empty(), detail);
    }

    static ChatEvent error(ErrorKind kind, String detail) {
        return new Error(kind, detail);
    }

    /**
     * Message lifecycle progress. {@code message} is the state after the change.
     */
    record Info(InfoKind kind, Optional<ChatMessage> message, String detail) implements ChatEvent
    {
        public Info {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(detail, "detail");
        }
    }

    record Error(ErrorKind kind, String detail) implements ChatEvent
    {
        public Error {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(detail, "detail");
        }
    }

    /** A non-error transport event, forwarded as is. */
    record TransportInfo(TransportEvent event) implements ChatEvent
    {
        public TransportInfo {
            Objects.requireNonNull(event, "event");
        }
    }

    /** A transport failure, forwarded as is. */
    record TransportError(TransportEvent event) implements ChatEvent
    {
        public TransportError {
            Objects.requireNonNull(event, "event");
        }
    }
}
