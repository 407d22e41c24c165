package com.questrail.devicehub.device;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles log lines from info sub-channel chunks. Chunk boundaries are
 * arbitrary; an unterminated tail is kept for the next chunk.
 */
final class InfoLineBuffer
{
    private final ByteArrayOutputStream tail = new ByteArrayOutputStream();

    /**
     * @return the lines completed by {@code chunk}, without line terminators
     */
    List<String> append(byte[] chunk)
    {
        List<String> lines = new ArrayList<>();
        for (byte b : chunk) {
            if (b == '\n') {
                lines.add(stripCr(tail.toString(StandardCharsets.UTF_8)));
                tail.reset();
            } else {
                tail.write(b);
            }
        }
        return lines;
    }

    int pending()
    {
        return tail.size();
    }

    private static String stripCr(String line)
    {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
