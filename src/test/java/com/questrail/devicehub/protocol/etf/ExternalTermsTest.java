package com.questrail.devicehub.protocol.etf;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExternalTermsTest
{
    // ---------------------------------------------------------------------
    // Integers
    // ---------------------------------------------------------------------

    @Test
    void smallIntegerEncoding() {
        assertArrayEquals(bytes(131, 97, 5), ExternalTerms.encodeInteger(5));
        assertArrayEquals(bytes(131, 97, 255), ExternalTerms.encodeInteger(255));
    }

    @Test
    void largeIntegerEncodingIsBigEndian() {
        assertArrayEquals(bytes(131, 98, 0, 0, 1, 0), ExternalTerms.encodeInteger(256));
    }

    @Test
    void integersDecodeToLong() {
        assertEquals(7L, ExternalTerms.decode(bytes(131, 97, 7)));
        assertEquals(-1L, ExternalTerms.decode(bytes(131, 98, 0xFF, 0xFF, 0xFF, 0xFF)));
    }

    // ---------------------------------------------------------------------
    // Compound terms
    // ---------------------------------------------------------------------

    /**
     * Verifies decoding of [{123, &lt;&lt;"hi"&gt;&gt;}], the log record shape
     * sent by application firmware.
     */
    @Test
    void listOfTupleWithBinary() {
        byte[] term = bytes(131, 108, 0, 0, 0, 1,
                104, 2, 97, 123, 109, 0, 0, 0, 2, 'h', 'i',
                106);

        Object decoded = ExternalTerms.decode(term);

        List<?> list = assertInstanceOf(List.class, decoded);
        assertEquals(1, list.size());
        Tuple tuple = assertInstanceOf(Tuple.class, list.get(0));
        assertEquals(2, tuple.arity());
        assertEquals(123L, tuple.get(0));
        assertArrayEquals("hi".getBytes(StandardCharsets.US_ASCII), (byte[]) tuple.get(1));
    }

    @Test
    void atomsDecodeToAtom() {
        assertEquals(new Atom("ok"), ExternalTerms.decode(bytes(131, 100, 0, 2, 'o', 'k')));
        assertEquals(new Atom("ok"), ExternalTerms.decode(bytes(131, 119, 2, 'o', 'k')));
    }

    @Test
    void stringExtDecodesToListOfIntegers() {
        assertEquals(List.of(104L, 105L), ExternalTerms.decode(bytes(131, 107, 0, 2, 'h', 'i')));
    }

    @Test
    void nilDecodesToEmptyList() {
        assertEquals(List.of(), ExternalTerms.decode(bytes(131, 106)));
    }

    @Test
    void renderShowsErlangLikeText() {
        Tuple tuple = new Tuple(List.of(new Atom("error"), "x".getBytes(StandardCharsets.US_ASCII), 3L));
        assertEquals("{error,<<\"x\">>,3}", ExternalTerms.render(tuple));
        assertEquals("[1,2]", ExternalTerms.render(List.of(1L, 2L)));
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void wrongVersionIsRejected() {
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(bytes(130, 97, 1)));
    }

    @Test
    void truncatedTermIsRejected() {
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(bytes(131, 98, 0, 0)));
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(new byte[0]));
    }

    @Test
    void oversizedBinaryLengthIsRejected() {
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(bytes(131, 109, 0, 0, 0, 9, 'a')));
    }

    @Test
    void improperListIsRejected() {
        assertThrows(TermDecodeException.class,
                () -> ExternalTerms.decode(bytes(131, 108, 0, 0, 0, 1, 97, 1, 97, 2)));
    }

    @Test
    void unsupportedTagIsRejected() {
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(bytes(131, 70, 0, 0, 0, 0, 0, 0, 0, 0)));
    }

    @Test
    void nestingUpToLimitDecodes() {
        Object term = ExternalTerms.decode(nestedTuples(ExternalTerms.MAX_DEPTH));
        for (int i = 0; i < ExternalTerms.MAX_DEPTH; i++) {
            term = assertInstanceOf(Tuple.class, term).get(0);
        }
        assertEquals(List.of(), term);
    }

    /**
     * Verifies that nesting past the limit, however deep, is a decode error
     * and not a stack overflow.
     */
    @Test
    void excessiveNestingIsRejected() {
        assertThrows(TermDecodeException.class,
                () -> ExternalTerms.decode(nestedTuples(ExternalTerms.MAX_DEPTH + 1)));
        assertThrows(TermDecodeException.class,
                () -> ExternalTerms.decode(nestedTuples(200_000)));
    }

    @Test
    void nestedListsCountTowardsDepth() {
        int depth = ExternalTerms.MAX_DEPTH + 1;
        byte[] term = new byte[1 + depth * 5 + 1 + depth];
        int i = 0;
        term[i++] = (byte) 131;
        for (int d = 0; d < depth; d++) {
            term[i++] = 108;
            term[i++] = 0;
            term[i++] = 0;
            term[i++] = 0;
            term[i++] = 1;
        }
        term[i++] = 106;
        for (int d = 0; d < depth; d++) {
            term[i++] = 106;
        }
        assertThrows(TermDecodeException.class, () -> ExternalTerms.decode(term));
    }

    /**
     * {@code depth} one-element tuples around an empty list.
     */
    static byte[] nestedTuples(int depth) {
        byte[] out = new byte[1 + 2 * depth + 1];
        out[0] = (byte) 131;
        for (int d = 0; d < depth; d++) {
            out[1 + 2 * d] = 104;
            out[2 + 2 * d] = 1;
        }
        out[out.length - 1] = 106;
        return out;
    }

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }
}
