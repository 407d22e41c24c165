package com.questrail.devicehub.config;

import java.util.Objects;

/**
 * Aggregated configuration for the device hub runtime.
 *
 * @param bindHost      address the per-device debug TCP listeners bind to
 * @param basePort      lowest port handed out by the deterministic port hash
 * @param bridgeCommand command spawned (locally or on the device's host) to
 *                      gain byte-level access to a serial device
 * @param timingPolicy  call timeouts
 */
public record HubConfig(
    String bindHost,
    int basePort,
    String bridgeCommand,
    HubTimingPolicy timingPolicy
) {
    public static final int DEFAULT_BASE_PORT = 10000;
    public static final String DEFAULT_BRIDGE_COMMAND = "gdbstub_connect";

    public HubConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(bridgeCommand, "bridgeCommand");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        // The hash adds at most 16383 to the base port.
        if (basePort < 0 || basePort + 16383 > 65535) {
            throw new IllegalArgumentException("basePort out of range: " + basePort);
        }
    }

    public static HubConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bindHost = "0.0.0.0";
        private int basePort = DEFAULT_BASE_PORT;
        private String bridgeCommand = DEFAULT_BRIDGE_COMMAND;
        private HubTimingPolicy timingPolicy = HubTimingPolicy.defaults();

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withBasePort(int basePort) {
            this.basePort = basePort;
            return this;
        }

        public Builder withBridgeCommand(String bridgeCommand) {
            this.bridgeCommand = bridgeCommand;
            return this;
        }

        public Builder withTimingPolicy(HubTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public HubConfig build() {
            return new HubConfig(bindHost, basePort, bridgeCommand, timingPolicy);
        }
    }
}
