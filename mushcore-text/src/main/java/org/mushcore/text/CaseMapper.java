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

import java.util.Arrays;

/**
 * <p>Case mapping of ASCII and Latin-1 strings, one byte in for one byte out.</p>
 * <p>Mappings come from two fixed 256 entry tables. A Latin-1 character whose
 * case partner lies outside Latin-1, such as {@code 'ÿ'} or {@code 'µ'}, maps to
 * itself, as does {@code 'ß'}.</p>
 * <p>Each direction has three shapes: in place, into a caller supplied array that
 * is always terminated and never overrun, and newly allocated.</p>
 */
public class CaseMapper
{
    private static final byte[] UPPERCASES = new byte[256];
    private static final byte[] LOWERCASES = new byte[256];

    static
    {
        for (int i = 0; i < 256; i++)
        {
            int upper = Character.toUpperCase(i);
            int lower = Character.toLowerCase(i);
            UPPERCASES[i] = (byte)(upper <= 0xFF ? upper : i);
            LOWERCASES[i] = (byte)(lower <= 0xFF ? lower : i);
        }
    }

    private CaseMapper()
    {
    }

    public static byte toUpperCase(byte b)
    {
        return UPPERCASES[b & 0xFF];
    }

    public static byte toLowerCase(byte b)
    {
        return LOWERCASES[b & 0xFF];
    }

    /**
     * @param s the string, uppercased in place up to its terminator
     * @return {@code s}
     */
    public static byte[] upperCaseInPlace(byte[] s)
    {
        return map(UPPERCASES, s);
    }

    /**
     * @param s the string, lowercased in place up to its terminator
     * @return {@code s}
     */
    public static byte[] lowerCaseInPlace(byte[] s)
    {
        return map(LOWERCASES, s);
    }

    /**
     * Uppercases into a caller supplied array, copying at most {@code dst.length - 1}
     * bytes and terminating the copy.
     *
     * @param s the string, null is copied as the empty string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toUpperCase(byte[] s, byte[] dst)
    {
        return map(UPPERCASES, s, dst, 0);
    }

    /**
     * Lowercases into a caller supplied array, copying at most {@code dst.length - 1}
     * bytes and terminating the copy.
     *
     * @param s the string, null is copied as the empty string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toLowerCase(byte[] s, byte[] dst)
    {
        return map(LOWERCASES, s, dst, 0);
    }

    /**
     * @param s the string
     * @return a new array holding the uppercased string
     */
    public static byte[] toUpperCase(byte[] s)
    {
        return map(UPPERCASES, Arrays.copyOf(s, StringUtil.length(s)));
    }

    /**
     * @param s the string
     * @return a new array holding the lowercased string
     */
    public static byte[] toLowerCase(byte[] s)
    {
        return map(LOWERCASES, Arrays.copyOf(s, StringUtil.length(s)));
    }

    /**
     * Writes the string with its first character uppercased and the rest lowercased,
     * copying at most {@code dst.length - 1} bytes and terminating the copy.
     *
     * @param s the string
     * @param dst the destination
     * @return {@code dst}
     */
    public static byte[] toInitialCase(byte[] s, byte[] dst)
    {
        if (dst.length == 0)
            return dst;
        if (dst.length == 1 || s == null || StringUtil.length(s) == 0)
        {
            dst[0] = 0;
            return dst;
        }
        dst[0] = toUpperCase(s[0]);
        return map(LOWERCASES, s, dst, 1);
    }

    /**
     * @param s the string
     * @return a new array holding the string with its first character uppercased
     * and the rest lowercased
     */
    public static byte[] toInitialCase(byte[] s)
    {
        byte[] initial = toLowerCase(s);
        if (initial.length > 0)
            initial[0] = toUpperCase(initial[0]);
        return initial;
    }

    /**
     * @param a a string
     * @param b another string
     * @return a negative, zero or positive value as {@code a} sorts before, with or
     * after {@code b} once both are lowercased
     */
    public static int compareIgnoreCase(byte[] a, byte[] b)
    {
        int i = 0;
        while (true)
        {
            int ca = i < a.length ? LOWERCASES[a[i] & 0xFF] & 0xFF : 0;
            int cb = i < b.length ? LOWERCASES[b[i] & 0xFF] & 0xFF : 0;
            if (ca != cb || ca == 0)
                return ca - cb;
            i++;
        }
    }

    public static boolean equalsIgnoreCase(byte[] a, byte[] b)
    {
        if (a == null || b == null)
            return a == b;
        return compareIgnoreCase(a, b) == 0;
    }

    /**
     * @param s the string
     * @param prefix the prefix, the empty prefix matches every string
     * @return true if {@code s} starts with {@code prefix}, ignoring case
     */
    public static boolean startsWithIgnoreCase(byte[] s, byte[] prefix)
    {
        if (s == null || prefix == null)
            return false;
        return startsWithIgnoreCase(s, 0, prefix);
    }

    private static boolean startsWithIgnoreCase(byte[] s, int offset, byte[] prefix)
    {
        int i = 0;
        while (offset + i < s.length && s[offset + i] != 0 && i < prefix.length && prefix[i] != 0 &&
            LOWERCASES[s[offset + i] & 0xFF] == LOWERCASES[prefix[i] & 0xFF])
        {
            i++;
        }
        return i >= prefix.length || prefix[i] == 0;
    }

    /**
     * @param s the string
     * @param prefix the prefix, the empty prefix matches no string
     * @return true if {@code s} starts with the non empty {@code prefix}, ignoring case
     */
    public static boolean startsWithIgnoreCaseNonEmpty(byte[] s, byte[] prefix)
    {
        if (prefix == null || StringUtil.length(prefix) == 0)
            return false;
        return startsWithIgnoreCase(s, prefix);
    }

    /**
     * Finds the first word of {@code s} that starts with {@code prefix}, ignoring case.
     * Words are runs of Latin-1 letters and digits.
     *
     * @param s the string of words
     * @param prefix the prefix
     * @return the offset of the matching word, or -1 if there is none or the prefix is empty
     */
    public static int matchWordPrefix(byte[] s, byte[] prefix)
    {
        if (s == null || prefix == null || StringUtil.length(prefix) == 0)
            return -1;
        int end = StringUtil.length(s);
        int i = 0;
        while (i < end)
        {
            if (startsWithIgnoreCase(s, i, prefix))
                return i;
            while (i < end && isWordByte(s[i]))
            {
                i++;
            }
            while (i < end && !isWordByte(s[i]))
            {
                i++;
            }
        }
        return -1;
    }

    private static boolean isWordByte(byte b)
    {
        return Character.isLetterOrDigit(b & 0xFF);
    }

    private static byte[] map(byte[] table, byte[] s)
    {
        for (int i = 0; s != null && i < s.length && s[i] != 0; i++)
        {
            s[i] = table[s[i] & 0xFF];
        }
        return s;
    }

    private static byte[] map(byte[] table, byte[] s, byte[] dst, int from)
    {
        if (dst.length == 0)
            return dst;
        int limit = dst.length - 1;
        int i = from;
        while (s != null && i < limit && i < s.length && s[i] != 0)
        {
            dst[i] = table[s[i] & 0xFF];
            i++;
        }
        dst[Math.min(i, limit)] = 0;
        return dst;
    }
}
