package com.questrail.devicehub.framing;

import java.util.Objects;

/**
 * Outcome of one decode step over a device's buffered bytes.
 */
public sealed interface DecodeResult permits DecodeResult.Complete, DecodeResult.NeedMore
{
    DecodeResult NEED_MORE = new NeedMore();

    /**
     * One complete frame and the bytes following it.
     */
    record Complete(byte[] frame, byte[] rest) implements DecodeResult {
        public Complete {
            Objects.requireNonNull(frame, "frame");
            Objects.requireNonNull(rest, "rest");
        }
    }

    /**
     * The buffer holds no complete frame yet; keep it and wait for more.
     */
    record NeedMore() implements DecodeResult {}
}
