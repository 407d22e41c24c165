package com.questrail.devicehub.bridge.process;

import com.questrail.devicehub.bridge.BridgeChannel;
import com.questrail.devicehub.bridge.BridgeSpawnException;
import com.questrail.devicehub.bridge.BridgeSpawnRequest;
import com.questrail.devicehub.bridge.BridgeSpawner;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ProcessBridgeSpawner
 * =============================================================================
 * Runs the bridging command as an operating system process.
 *
 * <p>Devices attached to this machine are bridged by running the command
 * directly. Devices attached to another host are reached through
 * {@code ssh <host> <command> <args...>}; key-based login is assumed.</p>
 *
 * <p>The child's stderr is inherited so its diagnostics end up next to the
 * hub's own log.</p>
 */
public final class ProcessBridgeSpawner implements BridgeSpawner
{
    private final Set<String> localHosts;

    public ProcessBridgeSpawner(Set<String> localHosts)
    {
        this.localHosts = Set.copyOf(Objects.requireNonNull(localHosts, "localHosts"));
    }

    /**
     * Treats {@code localhost} and this machine's host name as local.
     */
    public static ProcessBridgeSpawner forLocalMachine()
    {
        Set<String> hosts = new HashSet<>();
        hosts.add("localhost");
        try {
            hosts.add(InetAddress.getLocalHost().getHostName());
        } catch (UnknownHostException e) {
            hosts.add(InetAddress.getLoopbackAddress().getHostName());
        }
        return new ProcessBridgeSpawner(hosts);
    }

    List<String> commandLine(BridgeSpawnRequest request)
    {
        List<String> cmd = new ArrayList<>();
        if (!localHosts.contains(request.host())) {
            cmd.add("ssh");
            cmd.add(request.host());
        }
        cmd.add(request.command());
        cmd.addAll(request.args());
        return cmd;
    }

    @Override
    public BridgeChannel spawn(BridgeSpawnRequest request)
    {
        Objects.requireNonNull(request, "request");
        List<String> cmd = commandLine(request);
        try {
            Process process = new ProcessBuilder(cmd)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
            return new ProcessBridgeChannel(process, String.join(" ", cmd));
        } catch (IOException e) {
            throw new BridgeSpawnException("cannot start " + String.join(" ", cmd), e);
        }
    }
}
