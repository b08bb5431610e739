/**
 * Protocol buffers implementation of the DTChat codec.
 *
 * <p>The envelope schema lives in {@code src/main/proto/dtchat.proto}; the
 * message classes under {@code com.questrail.dtchat.codec.proto} are generated
 * from it at build time. The classes here only adapt between those messages
 * and {@link com.questrail.dtchat.codec.WireEnvelope}.</p>
 *
 * <ul>
 *   <li>proto3 defaults (empty string, zero) are omitted on encode</li>
 *   <li>the payload submessage is always written, even when empty</li>
 *   <li>unknown fields are skipped on decode</li>
 *   <li>for a repeated oneof the last occurrence wins</li>
 * </ul>
 */
package com.questrail.dtchat.codec.impl;
