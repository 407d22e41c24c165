package com.questrail.devicehub.device;

import com.questrail.devicehub.protocol.rsp.RspMonitorCommands;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link MetadataProbe} that asks the resident debug stub through the
 * {@code uid}, {@code protocol} and {@code protocol2} monitor commands.
 */
public final class RspMetadataProbe implements MetadataProbe
{
    private final Duration timeout;

    public RspMetadataProbe(Duration timeout)
    {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public DeviceMetadata probe(RspCaller device)
    {
        String uid = monitor(device, "uid");
        String protocol = monitor(device, "protocol");
        String protocol2 = monitor(device, "protocol2");
        return new DeviceMetadata(uid, protocol, protocol2);
    }

    private String monitor(RspCaller device, String command)
    {
        try {
            byte[] reply = device.rspCall(RspMonitorCommands.request(command))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return RspMonitorCommands.replyText(reply);
        } catch (TimeoutException e) {
            throw new CallTimeoutException("monitor command " + command, timeout);
        } catch (ExecutionException e) {
            throw new CompletionException("monitor command " + command + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("interrupted during monitor command " + command, e);
        }
    }
}
