package com.questrail.devicehub.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used only to timestamp observability events.
 *
 * <p>This clock may jump due to NTP adjustments or explicit time setting.
 * Timeouts use {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
