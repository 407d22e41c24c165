/**
 * RSP Codec
 * =============================================================================
 *
 * <p>Wire-level rules of the debug sub-channel:</p>
 *
 * <pre>
 *   packet  = "+"? "$" escaped-payload "#" hex2(checksum)
 *   escape  = "}" followed by the original character, for each of # $ } *
 *   checksum = sum of the escaped payload bytes, modulo 256
 * </pre>
 *
 * <p>Unlike the GDB documentation, the stubs this hub talks to do not XOR the
 * escaped character with 0x20. The escape marker is followed by the reserved
 * character itself. Interoperating with a client that uses the XOR form
 * requires a different escaping implementation.</p>
 *
 * <p>Checksums are produced on {@code wrap} but never verified on
 * {@code unwrap}: the USB link already carries a CRC.</p>
 */
package com.questrail.devicehub.protocol.rsp.codec;
