package com.questrail.devicehub.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for call deadlines.
 *
 * <p>Every blocking exchange in the hub (boot-loader calls, application-mode
 * calls, correlated calls, metadata queries) is bounded by a timeout that is
 * computed against this clock. Wall-clock time is only used for the
 * timestamps carried by observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful relative to one another.
     */
    long nowNanos();
}
