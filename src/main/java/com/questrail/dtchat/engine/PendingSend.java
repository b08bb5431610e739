package com.questrail.dtchat.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Correlation entry for one in-flight send.
 *
 * @param kind                what is being sent
 * @param token               transport correlation token; the message uuid for
 *                            TEXT, the ack envelope uuid for ACK
 * @param originalMessageUuid for ACK, the message being acknowledged
 */
public record PendingSend(PendingKind kind, String token, Optional<String> originalMessageUuid)
{
    public PendingSend {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(originalMessageUuid, "originalMessageUuid");
    }

    public static PendingSend text(String messageUuid) {
        return new PendingSend(PendingKind.TEXT, messageUuid, Optional.empty());
    }

    public static PendingSend ack(String ackUuid, String originalMessageUuid) {
        return new PendingSend(PendingKind.ACK, ackUuid, Optional.of(originalMessageUuid));
    }
}
