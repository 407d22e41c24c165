package com.questrail.devicehub.bridge;

import java.util.List;
import java.util.Objects;

/**
 * What to run, and where, to reach a device's serial line.
 *
 * @param host    host the device is attached to
 * @param command bridging command
 * @param args    command arguments, typically the device file path
 */
public record BridgeSpawnRequest(String host, String command, List<String> args)
{
    public BridgeSpawnRequest {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(command, "command");
        args = List.copyOf(args);
    }
}
