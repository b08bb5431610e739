package com.questrail.dtchat.transport;

/**
 * Callback sink for {@link TransportEngine}.
 *
 * <p>Events may arrive on transport threads. Listeners are responsible for
 * their own serialization.</p>
 */
@FunctionalInterface
public interface TransportEventListener
{
    void onTransportEvent(TransportEvent event);
}
