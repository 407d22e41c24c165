package com.questrail.devicehub.protocol.rsp;

import com.questrail.devicehub.protocol.rsp.codec.RspPacketCodec;
import com.questrail.devicehub.protocol.rsp.codec.impl.DefaultRspPacketCodec;
import com.questrail.devicehub.protocol.rsp.codec.impl.RspFramingException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builders and parsers for the monitor ({@code qRcmd}) packets and the
 * comma-separated hex argument packets understood by the device stubs.
 */
public final class RspMonitorCommands
{
    private static final String QRCMD = "qRcmd,";

    private static final RspPacketCodec CODEC = DefaultRspPacketCodec.INSTANCE;

    private RspMonitorCommands() {}

    /**
     * Builds the wrapped {@code qRcmd,<hex(command)>} packet.
     */
    public static byte[] request(String command)
    {
        Objects.requireNonNull(command, "command");
        String body = QRCMD + Hex.encode(command.getBytes(StandardCharsets.ISO_8859_1));
        return CODEC.wrap(body.getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Recognizes a monitor command in a raw packet.
     *
     * @return the hex-decoded command text, or empty if the packet is an ack,
     *         malformed, or not a monitor command
     */
    public static Optional<byte[]> parse(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (RspPacketAssembler.isAck(packet)) {
            return Optional.empty();
        }

        final byte[] payload;
        try {
            payload = CODEC.unwrap(packet);
        } catch (RspFramingException e) {
            return Optional.empty();
        }

        String text = new String(payload, StandardCharsets.ISO_8859_1);
        if (!text.startsWith(QRCMD)) {
            return Optional.empty();
        }
        return Hex.decode(text.substring(QRCMD.length()));
    }

    /**
     * Builds a wrapped command with comma-separated hex arguments followed by
     * a raw payload, e.g. {@code hexCsv("m", List.of(0x8000000L, 4L), "")}
     * yields the wrapped form of {@code m8000000,4,}.
     *
     * <p>This is looser than GDB's own argument syntax; the stubs accept any
     * non-hex character as a separator.</p>
     */
    public static byte[] hexCsv(String code, List<Long> args, String payload)
    {
        StringBuilder sb = new StringBuilder(code);
        for (long arg : args) {
            sb.append(Long.toHexString(arg).toUpperCase()).append(',');
        }
        sb.append(payload);
        return CODEC.wrap(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Interprets the reply to a monitor command as text. Stubs answer with a
     * hex-encoded string; anything that is not hex is returned verbatim.
     */
    public static String replyText(byte[] reply)
    {
        byte[] payload = CODEC.unwrap(reply);
        String text = new String(payload, StandardCharsets.ISO_8859_1);
        return Hex.decode(text)
                .map(bytes -> new String(bytes, StandardCharsets.ISO_8859_1))
                .orElse(text)
                .trim();
    }
}
