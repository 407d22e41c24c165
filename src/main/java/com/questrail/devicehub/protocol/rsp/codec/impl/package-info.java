/**
 * Default implementation of the RSP packet codec. Escaping and checksum
 * helpers are package-private; only {@link
 * com.questrail.devicehub.protocol.rsp.codec.impl.DefaultRspPacketCodec} and
 * its exception are exported.
 */
package com.questrail.devicehub.protocol.rsp.codec.impl;
