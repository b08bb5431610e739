package com.questrail.dtchat.observability;

/**
 * Receives chat engine events.
 *
 * <p>Called synchronously while the engine holds its lock. Implementations
 * must return promptly and must not call back into the engine from another
 * thread while blocking this one.</p>
 */
@FunctionalInterface
public interface ChatEventObserver
{
    void onEvent(ChatEvent event);
}
