package com.questrail.devicehub.config;

import java.time.Duration;
import java.util.Objects;

/**
 * HubTimingPolicy
 * -----------------------------------------------------------------------------
 * Timeouts for every blocking exchange in the hub.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>metadataTimeout</b>: per-query bound for the uid/protocol queries
 *       issued when a device actor connects.</li>
 *   <li><b>tcpDispatchTimeout</b>: how long a debug TCP connection waits for
 *       its device to answer one request before the connection is dropped.</li>
 *   <li><b>hubQueryTimeout</b>: bound on synchronous administrative queries
 *       against the hub registry.</li>
 *   <li><b>bootloaderCallTimeout</b>: wait for a complete RSP reply to a
 *       pass-through call while the boot loader is resident.</li>
 *   <li><b>applicationCallTimeout</b>: wait for a complete RSP reply carried
 *       on the debug sub-channel while the application is running.</li>
 *   <li><b>correlatedCallTimeout</b>: wait for a token-correlated reply;
 *       on expiry the correlation entry is released.</li>
 * </ul>
 */
public record HubTimingPolicy(
        Duration metadataTimeout,
        Duration tcpDispatchTimeout,
        Duration hubQueryTimeout,
        Duration bootloaderCallTimeout,
        Duration applicationCallTimeout,
        Duration correlatedCallTimeout
) {
    public HubTimingPolicy {
        requirePositive(metadataTimeout, "metadataTimeout");
        requirePositive(tcpDispatchTimeout, "tcpDispatchTimeout");
        requirePositive(hubQueryTimeout, "hubQueryTimeout");
        requirePositive(bootloaderCallTimeout, "bootloaderCallTimeout");
        requirePositive(applicationCallTimeout, "applicationCallTimeout");
        requirePositive(correlatedCallTimeout, "correlatedCallTimeout");
    }

    /**
     * Defaults matching the deployed hubs:
     * <ul>
     *   <li>metadataTimeout: 6001ms</li>
     *   <li>tcpDispatchTimeout: 6002ms</li>
     *   <li>hubQueryTimeout: 6003ms</li>
     *   <li>bootloaderCallTimeout: 6004ms</li>
     *   <li>applicationCallTimeout: 6005ms</li>
     *   <li>correlatedCallTimeout: 6006ms</li>
     * </ul>
     * The values differ by one millisecond so a timeout in a log can be traced
     * back to the exchange that produced it.
     */
    public static HubTimingPolicy defaults() {
        return new HubTimingPolicy(
                Duration.ofMillis(6001),
                Duration.ofMillis(6002),
                Duration.ofMillis(6003),
                Duration.ofMillis(6004),
                Duration.ofMillis(6005),
                Duration.ofMillis(6006)
        );
    }

    /**
     * Uses the same timeout for every exchange. Handy in tests.
     */
    public static HubTimingPolicy uniform(Duration timeout) {
        return new HubTimingPolicy(timeout, timeout, timeout, timeout, timeout, timeout);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
