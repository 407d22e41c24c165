package com.questrail.devicehub.protocol.rsp;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * RspPacketAssembler
 * -----------------------------------------------------------------------------
 * Concatenates chunks read from a byte stream until they form a complete RSP
 * exchange unit, then hands the whole accumulation out and starts over.
 *
 * <p>Completion is judged on the accumulated buffer only (see
 * {@link #isComplete(byte[])}). The assembler relies on the peer not running
 * two packets together in one read, which holds for both GDB clients and the
 * device stubs: each side waits for the other before sending again.</p>
 *
 * <p>Instances are not thread-safe; each connection or pending call owns its
 * own assembler.</p>
 */
public final class RspPacketAssembler
{
    private final ByteArrayOutputStream accu = new ByteArrayOutputStream();

    /**
     * Returns true if {@code buffer} is a bare ack ({@code +}) or ends in
     * {@code #} followed by exactly two characters.
     */
    public static boolean isComplete(byte[] buffer)
    {
        Objects.requireNonNull(buffer, "buffer");
        if (buffer.length == 1 && buffer[0] == '+') {
            return true;
        }
        return buffer.length >= 3 && buffer[buffer.length - 3] == '#';
    }

    /**
     * Returns true if {@code request} is a bare ack, which needs no reply.
     */
    public static boolean isAck(byte[] request)
    {
        return request.length == 1 && request[0] == '+';
    }

    /**
     * Appends a chunk.
     *
     * @return the accumulated unit if it is now complete; the assembler is
     *         then empty again
     */
    public Optional<byte[]> append(byte[] chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        accu.writeBytes(chunk);

        byte[] current = accu.toByteArray();
        if (!isComplete(current)) {
            return Optional.empty();
        }
        accu.reset();
        return Optional.of(current);
    }
}
