package com.questrail.devicehub.framing;

import java.util.Optional;

/**
 * Recursive-descent parser for framing family names. Accepts the term-like
 * syntax the device stubs print: {@code raw}, {@code slip}, {@code {packet,4}},
 * {@code {driver,sm_etf,{packet,4}}}. Whitespace is ignored.
 */
final class FramingFamilyParser
{
    private final String text;
    private int pos;

    private FramingFamilyParser(String text) {
        this.text = text.replaceAll("\\s+", "");
    }

    static Optional<FramingFamily> parse(String name)
    {
        FramingFamilyParser p = new FramingFamilyParser(name);
        try {
            FramingFamily family = p.family();
            return p.pos == p.text.length() ? Optional.of(family) : Optional.empty();
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            return Optional.empty();
        }
    }

    private FramingFamily family()
    {
        if (peek() != '{') {
            String word = word();
            switch (word) {
                case "raw":
                    return FramingFamily.RAW;
                case "slip":
                    return FramingFamily.SLIP;
                default:
                    throw new IllegalArgumentException("unknown framing: " + word);
            }
        }

        expect('{');
        String kind = word();
        expect(',');
        final FramingFamily family;
        if (kind.equals("packet")) {
            family = new FramingFamily.LengthPrefixed(Integer.parseInt(word()));
        } else if (kind.equals("driver")) {
            String module = word();
            expect(',');
            family = new FramingFamily.Driver(module, family());
        } else {
            throw new IllegalArgumentException("unknown framing: " + kind);
        }
        expect('}');
        return family;
    }

    private String word()
    {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        if (start == pos) {
            throw new IllegalArgumentException("expected a name at " + pos);
        }
        return text.substring(start, pos);
    }

    private char peek()
    {
        return text.charAt(pos);
    }

    private void expect(char c)
    {
        if (peek() != c) {
            throw new IllegalArgumentException("expected '" + c + "' at " + pos);
        }
        pos++;
    }
}
