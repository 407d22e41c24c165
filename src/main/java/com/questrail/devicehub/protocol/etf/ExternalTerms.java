package com.questrail.devicehub.protocol.etf;

import java.nio.ByteBuffer;
import java.nio.BufferUnderflowException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ExternalTerms
 * -----------------------------------------------------------------------------
 * Minimal reader/writer for the Erlang external term format.
 *
 * <p>Device firmware emits log records and correlation acks in this format
 * (version byte 131). Only the shapes the firmware produces are supported:</p>
 * <ul>
 *   <li>integers ({@code SMALL_INTEGER_EXT}, {@code INTEGER_EXT}) as {@link Long}</li>
 *   <li>atoms ({@code ATOM_EXT}, {@code SMALL_ATOM_EXT} and the UTF-8 forms) as {@link Atom}</li>
 *   <li>tuples ({@code SMALL_TUPLE_EXT}, {@code LARGE_TUPLE_EXT}) as {@link Tuple}</li>
 *   <li>lists ({@code NIL_EXT}, {@code STRING_EXT}, proper {@code LIST_EXT}) as {@link List}</li>
 *   <li>binaries ({@code BINARY_EXT}) as {@code byte[]}</li>
 * </ul>
 *
 * <p>Trailing bytes after the first term are ignored. Nesting deeper than
 * {@link #MAX_DEPTH} is rejected.</p>
 */
public final class ExternalTerms
{
    public static final int VERSION = 131;
    public static final int MAX_DEPTH = 64;

    private static final int SMALL_INTEGER_EXT = 97;
    private static final int INTEGER_EXT = 98;
    private static final int ATOM_EXT = 100;
    private static final int SMALL_TUPLE_EXT = 104;
    private static final int LARGE_TUPLE_EXT = 105;
    private static final int NIL_EXT = 106;
    private static final int STRING_EXT = 107;
    private static final int LIST_EXT = 108;
    private static final int BINARY_EXT = 109;
    private static final int SMALL_ATOM_EXT = 115;
    private static final int ATOM_UTF8_EXT = 118;
    private static final int SMALL_ATOM_UTF8_EXT = 119;

    private ExternalTerms() {}

    /**
     * Decodes the term at the start of {@code bytes}.
     *
     * @throws TermDecodeException if the version byte is missing, the term is
     *         truncated, nested too deeply or uses an unsupported tag
     */
    public static Object decode(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        ByteBuffer in = ByteBuffer.wrap(bytes);
        try {
            int version = in.get() & 0xFF;
            if (version != VERSION) {
                throw new TermDecodeException("bad version byte " + version);
            }
            return term(in, 0);
        } catch (BufferUnderflowException e) {
            throw new TermDecodeException("truncated term");
        }
    }

    /**
     * Encodes a non-negative integer in the smallest integer form.
     */
    public static byte[] encodeInteger(int value)
    {
        if (value >= 0 && value < 256) {
            return new byte[] { (byte) VERSION, (byte) SMALL_INTEGER_EXT, (byte) value };
        }
        return ByteBuffer.allocate(6)
                .put((byte) VERSION)
                .put((byte) INTEGER_EXT)
                .putInt(value)
                .array();
    }

    /**
     * Renders a decoded term in Erlang-like syntax for logs.
     */
    public static String render(Object term)
    {
        if (term instanceof byte[] bin) {
            return "<<\"" + new String(bin, StandardCharsets.ISO_8859_1) + "\">>";
        }
        if (term instanceof List<?> list) {
            return list.stream().map(ExternalTerms::render).collect(Collectors.joining(",", "[", "]"));
        }
        return String.valueOf(term);
    }

    private static Object term(ByteBuffer in, int depth)
    {
        if (depth > MAX_DEPTH) {
            throw new TermDecodeException("term nested deeper than " + MAX_DEPTH);
        }
        int tag = in.get() & 0xFF;
        switch (tag) {
            case SMALL_INTEGER_EXT:
                return (long) (in.get() & 0xFF);
            case INTEGER_EXT:
                return (long) in.getInt();
            case ATOM_EXT:
            case ATOM_UTF8_EXT:
                return new Atom(text(in, in.getShort() & 0xFFFF));
            case SMALL_ATOM_EXT:
            case SMALL_ATOM_UTF8_EXT:
                return new Atom(text(in, in.get() & 0xFF));
            case SMALL_TUPLE_EXT:
                return new Tuple(elements(in, in.get() & 0xFF, depth));
            case LARGE_TUPLE_EXT:
                return new Tuple(elements(in, in.getInt(), depth));
            case NIL_EXT:
                return List.of();
            case STRING_EXT: {
                byte[] chars = bytes(in, in.getShort() & 0xFFFF);
                List<Object> list = new ArrayList<>(chars.length);
                for (byte c : chars) {
                    list.add((long) (c & 0xFF));
                }
                return list;
            }
            case LIST_EXT: {
                List<Object> list = elements(in, in.getInt(), depth);
                Object tail = term(in, depth + 1);
                if (!(tail instanceof List<?> t) || !t.isEmpty()) {
                    throw new TermDecodeException("improper lists are not supported");
                }
                return list;
            }
            case BINARY_EXT:
                return bytes(in, in.getInt());
            default:
                throw new TermDecodeException("unsupported term tag " + tag);
        }
    }

    private static List<Object> elements(ByteBuffer in, int count, int depth)
    {
        if (count < 0 || count > in.remaining()) {
            throw new TermDecodeException("bad element count " + count);
        }
        List<Object> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(term(in, depth + 1));
        }
        return out;
    }

    private static byte[] bytes(ByteBuffer in, int length)
    {
        if (length < 0 || length > in.remaining()) {
            throw new TermDecodeException("bad length " + length);
        }
        byte[] out = new byte[length];
        in.get(out);
        return out;
    }

    private static String text(ByteBuffer in, int length)
    {
        return new String(bytes(in, length), StandardCharsets.UTF_8);
    }
}
