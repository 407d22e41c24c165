package com.questrail.devicehub.framing;

import java.util.Objects;
import java.util.Optional;

/**
 * FramingFamily
 * -----------------------------------------------------------------------------
 * How a device segments the byte stream on its serial line into frames.
 *
 * <p>Devices announce their framing by name during metadata negotiation. The
 * vocabulary is:</p>
 * <pre>
 *   raw            no framing; every chunk read is one frame
 *   {packet,N}     N-byte big-endian length header (N = 1, 2 or 4)
 *   slip           SLIP (RFC 1055) with 192 as terminator
 *   {driver,M,P}   framing P used by an external driver M
 * </pre>
 *
 * <p>Inbound and outbound framing of one device are negotiated independently
 * and may differ.</p>
 */
public sealed interface FramingFamily
        permits FramingFamily.Raw, FramingFamily.LengthPrefixed, FramingFamily.Slip, FramingFamily.Driver
{
    FramingFamily RAW = new Raw();
    FramingFamily SLIP = new Slip();

    /**
     * Resolves driver wrappers down to the family that actually frames bytes.
     * The driver name only matters to the external collaborator implementing
     * that driver.
     */
    FramingFamily base();

    /** No framing: the caller segments. */
    record Raw() implements FramingFamily {
        @Override
        public FramingFamily base() {
            return this;
        }

        @Override
        public String toString() {
            return "raw";
        }
    }

    /** Length-prefixed frames with a {@code headerBytes}-byte big-endian length. */
    record LengthPrefixed(int headerBytes) implements FramingFamily {
        public LengthPrefixed {
            if (headerBytes != 1 && headerBytes != 2 && headerBytes != 4) {
                throw new IllegalArgumentException("length header must be 1, 2 or 4 bytes: " + headerBytes);
            }
        }

        @Override
        public FramingFamily base() {
            return this;
        }

        @Override
        public String toString() {
            return "{packet," + headerBytes + "}";
        }
    }

    /** SLIP framing. */
    record Slip() implements FramingFamily {
        @Override
        public FramingFamily base() {
            return this;
        }

        @Override
        public String toString() {
            return "slip";
        }
    }

    /** A framing family handled by an external driver module. */
    record Driver(String module, FramingFamily inner) implements FramingFamily {
        public Driver {
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public FramingFamily base() {
            return inner.base();
        }

        @Override
        public String toString() {
            return "{driver," + module + "," + inner + "}";
        }
    }

    /**
     * Parses a family name in the negotiation vocabulary.
     *
     * @return the family, or empty if the name is not recognized (including
     *         the placeholder {@code unknown})
     */
    static Optional<FramingFamily> parse(String name)
    {
        Objects.requireNonNull(name, "name");
        return FramingFamilyParser.parse(name);
    }
}
