package com.questrail.dtchat.transport;

import com.questrail.dtchat.api.Endpoint;

/**
 * TransportEngine
 * -----------------------------------------------------------------------------
 * Port for an asynchronous multi-transport byte carrier (TCP, UDP, BP).
 *
 * <p>Every operation returns immediately. Outcomes are reported later through
 * the registered {@link TransportEventListener}, correlated by the token passed
 * to {@link #send}.</p>
 *
 * <p>Implementations may be backed by Netty, a DTN daemon, or a test harness.</p>
 */
public interface TransportEngine
{
    /**
     * Register the listener that receives all transport events.
     *
     * <p>This must be called before {@link #startListener}.</p>
     */
    void setListener(TransportEventListener listener);

    /**
     * Begin accepting traffic on a local endpoint.
     *
     * <p>Success is reported with {@link TransportEvent.ListenerStarted}, failure
     * with {@link TransportEvent.SocketError}.</p>
     */
    void startListener(Endpoint endpoint);

    /**
     * Send one payload. Completion is reported as {@link TransportEvent.Sent}
     * carrying {@code token}; failure as {@link TransportEvent.ConnectionFailed}
     * or {@link TransportEvent.SendFailed} carrying {@code token}.
     *
     * @param local  local endpoint the payload leaves from
     * @param remote destination endpoint
     * @param data   complete payload; delivered to the remote listener as one unit
     * @param token  caller correlation token
     */
    void send(Endpoint local, Endpoint remote, byte[] data, String token);

    /**
     * Close all listeners and release transport resources.
     */
    void stop();
}
