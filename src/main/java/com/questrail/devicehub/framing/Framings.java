package com.questrail.devicehub.framing;

import com.questrail.devicehub.framing.impl.LengthPrefixedFraming;
import com.questrail.devicehub.framing.impl.RawFraming;
import com.questrail.devicehub.framing.impl.SlipFraming;

import java.util.Objects;

/**
 * Resolves a {@link FramingFamily} into its decode and encode strategies.
 */
public final class Framings
{
    private Framings() {}

    public static FrameDecoder decoderFor(FramingFamily family)
    {
        FramingFamily base = Objects.requireNonNull(family, "family").base();
        if (base instanceof FramingFamily.LengthPrefixed lp) {
            return new LengthPrefixedFraming(lp.headerBytes());
        }
        if (base instanceof FramingFamily.Slip) {
            return SlipFraming.INSTANCE;
        }
        return RawFraming.INSTANCE;
    }

    public static FrameEncoder encoderFor(FramingFamily family)
    {
        FramingFamily base = Objects.requireNonNull(family, "family").base();
        if (base instanceof FramingFamily.LengthPrefixed lp) {
            return new LengthPrefixedFraming(lp.headerBytes());
        }
        if (base instanceof FramingFamily.Slip) {
            return SlipFraming.INSTANCE;
        }
        return RawFraming.INSTANCE;
    }
}
