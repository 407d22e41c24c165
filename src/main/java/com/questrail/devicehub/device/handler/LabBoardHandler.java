package com.questrail.devicehub.device.handler;

import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceContext;
import com.questrail.devicehub.device.PacketHandler;
import com.questrail.devicehub.device.Tag;

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Companion handler for the lab board firmware.
 *
 * <p>The board talks SLIP and periodically reports its pin state in
 * {@link #TAG_STATUS} frames. Status frames are counted; everything else is
 * left to the built-in tag dispatch.</p>
 */
public final class LabBoardHandler implements PacketHandler
{
    public static final int TAG_STATUS = 0x0001;

    private final AtomicLong statusCount = new AtomicLong();

    /**
     * Installs a new handler as the forward handler of {@code device}.
     */
    public static LabBoardHandler install(DeviceActor device)
    {
        LabBoardHandler handler = new LabBoardHandler();
        device.setForward(handler);
        return handler;
    }

    @Override
    public void onPacket(DeviceContext device, byte[] frame)
    {
        OptionalInt tag = Tag.of(frame);
        if (tag.isPresent() && tag.getAsInt() == TAG_STATUS) {
            statusCount.incrementAndGet();
            return;
        }
        device.dispatchDefault(frame);
    }

    /** Status frames seen so far. */
    public long statusCount()
    {
        return statusCount.get();
    }
}
