//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.mushcore.text;

import java.util.Objects;

/**
 * <p>Case mapping of UTF-8 strings through the Unicode tables of a {@link UnicodeContext}.</p>
 * <p>The in place operations cannot change the length of a string, so they use the
 * simple, one codepoint to one codepoint, mappings and leave unchanged any codepoint
 * whose mapping encodes to a different number of bytes. They report how many
 * codepoints they left unchanged that way. Dotless {@code 'ı'} is such a codepoint
 * for uppercasing, the Kelvin sign for lowercasing.</p>
 * <p>The other operations use the full, locale aware, mappings, so {@code "thiß"}
 * uppercases to {@code "THISS"}. The allocating ones size their result in one pass
 * and fill it in a second; {@link #mapInPlaceOrCopy(UnicodeContext, byte[], Mapping)}
 * writes in place when the full mapping keeps the length and allocates otherwise.</p>
 */
public class UnicodeCaseMapper
{
    public enum Mapping
    {
        UPPER, LOWER;

        int map(UnicodeContext context, int codePoint)
        {
            return this == UPPER ? context.toUpperCase(codePoint) : context.toLowerCase(codePoint);
        }

        String map(UnicodeContext context, String s)
        {
            return this == UPPER ? context.toUpperCase(s) : context.toLowerCase(s);
        }
    }

    private UnicodeCaseMapper()
    {
    }

    /**
     * @param context the Unicode context
     * @param s the string, uppercased in place up to its terminator
     * @return the number of codepoints left unchanged because their uppercase
     * form has a different encoded length
     */
    public static int upperCaseInPlace(UnicodeContext context, byte[] s)
    {
        return mapInPlace(context, s, Mapping.UPPER);
    }

    /**
     * @param context the Unicode context
     * @param s the string, lowercased in place up to its terminator
     * @return the number of codepoints left unchanged because their lowercase
     * form has a different encoded length
     */
    public static int lowerCaseInPlace(UnicodeContext context, byte[] s)
    {
        return mapInPlace(context, s, Mapping.LOWER);
    }

    private static int mapInPlace(UnicodeContext context, byte[] s, Mapping mapping)
    {
        Objects.requireNonNull(context);
        int skipped = 0;
        int offset = 0;
        while (offset < s.length && s[offset] != 0)
        {
            long decoded = Utf8Walker.decode(s, offset);
            int codePoint = Utf8Walker.valueOf(decoded);
            int length = Utf8Walker.lengthOf(decoded);
            int mapped = mapping.map(context, codePoint);
            if (mapped != codePoint)
            {
                if (Utf8Walker.encodedLength(mapped) == length)
                    Utf8Walker.encode(mapped, s, offset, offset + length);
                else
                    skipped++;
            }
            offset += length;
        }
        return skipped;
    }

    /**
     * Uppercases into a caller supplied array with the full mapping. Only whole
     * codepoints are written, at most {@code dst.length - 1} bytes, and the result
     * is always terminated.
     *
     * @param context the Unicode context
     * @param s the string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toUpperCase(UnicodeContext context, byte[] s, byte[] dst)
    {
        return mapInto(Mapping.UPPER.map(context, StringUtil.toString(s)), dst);
    }

    /**
     * Lowercases into a caller supplied array with the full mapping. Only whole
     * codepoints are written, at most {@code dst.length - 1} bytes, and the result
     * is always terminated.
     *
     * @param context the Unicode context
     * @param s the string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toLowerCase(UnicodeContext context, byte[] s, byte[] dst)
    {
        return mapInto(Mapping.LOWER.map(context, StringUtil.toString(s)), dst);
    }

    /**
     * @param context the Unicode context
     * @param s the string
     * @return a new array holding the full uppercase mapping of the string
     */
    public static byte[] toUpperCase(UnicodeContext context, byte[] s)
    {
        return encode(Mapping.UPPER.map(context, StringUtil.toString(s)));
    }

    /**
     * @param context the Unicode context
     * @param s the string
     * @return a new array holding the full lowercase mapping of the string
     */
    public static byte[] toLowerCase(UnicodeContext context, byte[] s)
    {
        return encode(Mapping.LOWER.map(context, StringUtil.toString(s)));
    }

    /**
     * Applies the full mapping in place when it keeps the encoded length of the
     * string, otherwise into a new array.
     *
     * @param context the Unicode context
     * @param s the string
     * @param mapping the mapping
     * @return {@code s} if it was mapped in place, otherwise the new array
     */
    public static byte[] mapInPlaceOrCopy(UnicodeContext context, byte[] s, Mapping mapping)
    {
        String mapped = mapping.map(context, StringUtil.toString(s));
        int length = StringUtil.length(s);
        if (encodedLength(mapped) != length)
            return encode(mapped);
        encode(mapped, s, 0, length);
        return s;
    }

    /**
     * @param context the Unicode context
     * @param s the string
     * @return a new array holding the string with its first codepoint uppercased
     * and the rest lowercased, with the full mappings
     */
    public static byte[] toInitialCase(UnicodeContext context, byte[] s)
    {
        return encode(initial(context, StringUtil.toString(s)));
    }

    /**
     * Initial cases into a caller supplied array, writing whole codepoints only,
     * at most {@code dst.length - 1} bytes, and always terminating the result.
     *
     * @param context the Unicode context
     * @param s the string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toInitialCase(UnicodeContext context, byte[] s, byte[] dst)
    {
        return mapInto(initial(context, StringUtil.toString(s)), dst);
    }

    private static String initial(UnicodeContext context, String s)
    {
        if (s.isEmpty())
            return s;
        int first = Character.charCount(s.codePointAt(0));
        return context.toUpperCase(s.substring(0, first)) + context.toLowerCase(s.substring(first));
    }

    /**
     * Compares two strings by codepoint once both are case folded.
     *
     * @param context the Unicode context
     * @param a a string
     * @param b another string
     * @return a negative, zero or positive value as {@code a} sorts before, with or after {@code b}
     */
    public static int compareIgnoreCase(UnicodeContext context, byte[] a, byte[] b)
    {
        String fa = context.foldCase(StringUtil.toString(a));
        String fb = context.foldCase(StringUtil.toString(b));
        int i = 0;
        int j = 0;
        while (i < fa.length() && j < fb.length())
        {
            int ca = fa.codePointAt(i);
            int cb = fb.codePointAt(j);
            if (ca != cb)
                return ca - cb;
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return (fa.length() - i) - (fb.length() - j);
    }

    /**
     * Compares at most the first {@code n} codepoints of two strings, case folded.
     *
     * @param context the Unicode context
     * @param a a string
     * @param b another string
     * @param n the number of codepoints of each string to compare
     * @return a negative, zero or positive value as the prefix of {@code a} sorts
     * before, with or after the prefix of {@code b}
     */
    public static int compareIgnoreCase(UnicodeContext context, byte[] a, byte[] b, int n)
    {
        if (n <= 0)
            return 0;
        return compareIgnoreCase(context, Utf8Walker.copyOf(a, n), Utf8Walker.copyOf(b, n));
    }

    private static int encodedLength(String s)
    {
        int length = 0;
        for (int i = 0; i < s.length(); )
        {
            int codePoint = s.codePointAt(i);
            length += Utf8Walker.encodedLength(codePoint);
            i += Character.charCount(codePoint);
        }
        return length;
    }

    private static byte[] encode(String s)
    {
        byte[] bytes = new byte[encodedLength(s)];
        encode(s, bytes, 0, bytes.length);
        return bytes;
    }

    /**
     * Encodes whole codepoints while they fit before the limit.
     *
     * @return the offset after the last byte written
     */
    private static int encode(String s, byte[] dst, int offset, int limit)
    {
        for (int i = 0; i < s.length(); )
        {
            int codePoint = s.codePointAt(i);
            int written = Utf8Walker.encode(codePoint, dst, offset, limit);
            if (written == 0 && Utf8Walker.encodedLength(codePoint) > 0)
                break;
            offset += written;
            i += Character.charCount(codePoint);
        }
        return offset;
    }

    private static byte[] mapInto(String mapped, byte[] dst)
    {
        if (dst.length == 0)
            return dst;
        int end = encode(mapped, dst, 0, dst.length - 1);
        dst[end] = 0;
        return dst;
    }
}
