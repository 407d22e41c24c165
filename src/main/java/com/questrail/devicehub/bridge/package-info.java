/**
 * Port to the external process that gives byte-level access to a device's
 * serial line.
 *
 * <p>Device actors depend on {@link com.questrail.devicehub.bridge.BridgeSpawner}
 * and {@link com.questrail.devicehub.bridge.BridgeChannel} only. The
 * {@code process} subpackage provides the production implementation.</p>
 */
package com.questrail.devicehub.bridge;
