package com.questrail.devicehub.internal.time;

/**
 * Cancellation handle for a scheduled call timeout.
 *
 * <p>A device actor cancels the handle when the reply it guards arrives
 * before the deadline.</p>
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will no longer run; {@code false} if it
     *         already ran or was cancelled before
     */
    boolean cancel();
}
