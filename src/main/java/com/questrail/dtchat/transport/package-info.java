/**
 * DTChat Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP/UDP, a DTN daemon
 * binding, or a test double) and the chat protocol engine.
 *
 * <p>Everything above the adapter sees only:</p>
 * <ul>
 *   <li>Complete payloads as {@code byte[]}</li>
 *   <li>Peers as {@link com.questrail.dtchat.api.Endpoint}</li>
 *   <li>Correlation tokens chosen by the caller of {@code send}</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Deliver each sent payload as one unit to the remote listener</li>
 *   <li>Report every send outcome with the caller's token</li>
 *   <li>Not retry</li>
 * </ul>
 */
package com.questrail.dtchat.transport;
