package com.questrail.dtchat.message;

import com.questrail.dtchat.api.TransportKind;
import com.questrail.dtchat.time.ChatTime;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * MessageOrdering
 * -----------------------------------------------------------------------------
 * Comparators and list helpers for presenting messages.
 *
 * <h2>Standard order</h2>
 * <p>By {@code sendTime}, ties broken by {@code receiveTime} (falling back to
 * {@code sendTime} when absent).</p>
 *
 * <h2>Relative order</h2>
 * <p>Order as experienced by one viewer: a message the viewer authored is
 * anchored at its receive time (when the peer acknowledged it), any other
 * message at its send time. A viewer's own message therefore appears where the
 * other side saw it arrive.</p>
 *
 * <p>Both comparators are total preorders over messages; ties are legal and
 * {@link #insertSorted} keeps them in insertion order.</p>
 */
public final class MessageOrdering
{
    private static final Comparator<ChatMessage> STANDARD =
            Comparator.comparing(ChatMessage::sendTime)
                    .thenComparing(MessageOrdering::receiveOrSend);

    private MessageOrdering() {
    }

    public static Comparator<ChatMessage> standard() {
        return STANDARD;
    }

    public static Comparator<ChatMessage> relativeTo(String viewerUuid) {
        Objects.requireNonNull(viewerUuid, "viewerUuid");
        return Comparator.comparing(m -> m.isAuthoredBy(viewerUuid) ? receiveOrSend(m) : m.sendTime());
    }

    /**
     * Inserts {@code message} into an already sorted list, after any element
     * comparing equal to it.
     *
     * @return the index the message was inserted at
     */
    public static int insertSorted(List<ChatMessage> sorted, ChatMessage message, Comparator<ChatMessage> order) {
        Objects.requireNonNull(sorted, "sorted");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(order, "order");

        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (order.compare(sorted.get(mid), message) <= 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        sorted.add(low, message);
        return low;
    }

    /**
     * Stable in-place sort.
     */
    public static void sort(List<ChatMessage> messages, Comparator<ChatMessage> order) {
        Objects.requireNonNull(messages, "messages");
        messages.sort(Objects.requireNonNull(order, "order"));
    }

    /**
     * Messages whose source endpoint uses the given transport, in input order.
     */
    public static List<ChatMessage> filterByTransport(List<ChatMessage> messages, TransportKind kind) {
        Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(kind, "kind");
        return messages.stream()
                .filter(m -> m.sourceEndpoint().kind() == kind)
                .toList();
    }

    private static ChatTime receiveOrSend(ChatMessage m) {
        return m.receiveTime().orElse(m.sendTime());
    }
}
