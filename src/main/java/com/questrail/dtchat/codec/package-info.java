/**
 * DTChat Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the chat
 * protocol: the flat {@link com.questrail.dtchat.codec.WireEnvelope} and the
 * encoder / decoder boundaries that translate it to and from bytes.</p>
 *
 * <h2>Wire Format</h2>
 * <p>The envelope is encoded in protocol buffers wire format so that peers
 * running other implementations interoperate:</p>
 *
 * <pre>
 *   1  uuid             string
 *   2  sender_uuid      string
 *   3  timestamp        int64   (epoch millis)
 *   4  room_uuid        string
 *   5  source_endpoint  string  ("tcp 127.0.0.1:7001", "bp ipn:2.0", ...)
 *   oneof payload
 *     10 text  { 1 text }
 *     11 ack   { 1 message_uuid }
 *     12 file  { 1 name, 2 data (bytes) }
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] from transport
 *        → WireEnvelopeDecoder
 *            → WireEnvelope
 *                → ChatProtocolEngine (timestamp / endpoint validation, dispatch)
 * </pre>
 *
 * <p>Both directions are pure and stateless. Failures are reported with
 * unchecked {@link com.questrail.dtchat.codec.WireDecodeException} and
 * {@link com.questrail.dtchat.codec.WireEncodeException}; the engine turns
 * them into observable protocol errors.</p>
 */
package com.questrail.dtchat.codec;
