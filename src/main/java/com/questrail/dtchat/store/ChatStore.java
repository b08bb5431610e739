package com.questrail.dtchat.store;

import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;
import com.questrail.dtchat.message.ChatMessage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ChatStore
 * -----------------------------------------------------------------------------
 * Persistence boundary of the chat engine.
 *
 * <p>The store owns peers, rooms and messages. The engine never deletes a
 * message; it only appends and applies {@link MarkIntent}s. Implementations
 * must be safe to call from the engine lock and from presentation threads
 * concurrently.</p>
 */
public interface ChatStore
{
    Peer localPeer();

    /**
     * Known remote peers keyed by uuid, in configuration order.
     */
    Map<String, Peer> otherPeers();

    /**
     * Rooms keyed by uuid, in configuration order.
     */
    Map<String, Room> rooms();

    /**
     * Appends a message.
     *
     * @return false if a message with the same uuid is already stored
     */
    boolean addMessage(ChatMessage message);

    /**
     * The stored message with the given uuid, if any.
     */
    Optional<ChatMessage> message(String uuid);

    /**
     * Applies a lifecycle change.
     *
     * <p>An intent that is not a legal transition from the current status leaves
     * the message unchanged; the current message is returned in that case.</p>
     *
     * @return the message after the change, or empty if the uuid is unknown
     */
    Optional<ChatMessage> markAs(String uuid, MarkIntent intent);

    /**
     * The most recent {@code count} messages in insertion order.
     */
    List<ChatMessage> lastMessages(int count);

    List<ChatMessage> allMessages();
}
