/**
 * Stream Framing
 * =============================================================================
 *
 * <p>Segments the byte stream read from a device's serial bridge into frames
 * and encodes outbound frames. The device actor owns the undecoded remainder
 * and drives the decoder:</p>
 *
 * <pre>
 *   rest ++ chunk
 *        → FrameDecoder.decode
 *            → Complete(frame, rest')  deliver frame, loop on rest'
 *            → NeedMore                keep buffer as rest
 *            → FramingException        drop buffer, report
 * </pre>
 *
 * <p>Bytes between a framing error and the next valid frame boundary are
 * lost.</p>
 */
package com.questrail.devicehub.framing;
