/**
 * Transport adapters of the hub.
 *
 * <p>The {@code tcp} package holds the transport-neutral debug server ports.
 * Netty is confined to {@code tcp.netty}; no Netty type crosses into the
 * device or hub packages.</p>
 */
package com.questrail.devicehub.transport;
