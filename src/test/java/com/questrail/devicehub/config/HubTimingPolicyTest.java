package com.questrail.devicehub.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HubTimingPolicyTest {

    /**
     * Verifies that the defaults are distinct so a timeout in a log can be
     * traced to its exchange.
     */
    @Test
    void defaultsAreDistinct() {
        HubTimingPolicy policy = HubTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(6001), policy.metadataTimeout());
        assertEquals(Duration.ofMillis(6002), policy.tcpDispatchTimeout());
        assertEquals(Duration.ofMillis(6003), policy.hubQueryTimeout());
        assertEquals(Duration.ofMillis(6004), policy.bootloaderCallTimeout());
        assertEquals(Duration.ofMillis(6005), policy.applicationCallTimeout());
        assertEquals(Duration.ofMillis(6006), policy.correlatedCallTimeout());
    }

    @Test
    void uniformUsesOneTimeoutEverywhere() {
        HubTimingPolicy policy = HubTimingPolicy.uniform(Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), policy.metadataTimeout());
        assertEquals(Duration.ofMillis(250), policy.correlatedCallTimeout());
    }

    @Test
    void zeroTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> HubTimingPolicy.uniform(Duration.ZERO));
    }

    @Test
    void nullTimeoutIsRejected() {
        Duration d = Duration.ofSeconds(1);
        assertThrows(NullPointerException.class, () -> new HubTimingPolicy(d, d, null, d, d, d));
    }
}
