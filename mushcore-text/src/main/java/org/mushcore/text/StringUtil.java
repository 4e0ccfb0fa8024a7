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

import java.nio.charset.StandardCharsets;

/**
 * Fast NUL terminated byte string utilities.
 *
 * A string handled by this package ends at its first NUL byte or at the end
 * of its array, whichever comes first. These utilities avoid object creation
 * unless absolutely required.
 */
public class StringUtil
{
    public static final byte[] EMPTY = new byte[0];

    /**
     * The token {@link #replaceTokens(byte[], byte[], byte[])} replaces with the current text.
     */
    public static final String TEXT_TOKEN = "##";

    /**
     * The token {@link #replaceTokens(byte[], byte[], byte[])} replaces with the current position.
     */
    public static final String POSITION_TOKEN = "#@";

    private static final byte[] TEXT_TOKEN_BYTES = TEXT_TOKEN.getBytes(StandardCharsets.US_ASCII);
    private static final byte[] POSITION_TOKEN_BYTES = POSITION_TOKEN.getBytes(StandardCharsets.US_ASCII);

    private StringUtil()
    {
    }

    /**
     * @param s the string
     * @return the number of bytes before the terminator
     */
    public static int length(byte[] s)
    {
        return end(s, 0);
    }

    /**
     * @param s the string
     * @param offset where to start looking
     * @return the offset of the first NUL at or after {@code offset}, or the array length
     */
    public static int end(byte[] s, int offset)
    {
        int i = offset;
        while (i < s.length && s[i] != 0)
        {
            i++;
        }
        return i;
    }

    /**
     * @param s a Java string
     * @return its UTF-8 encoding, or {@link #EMPTY} for null
     */
    public static byte[] toBytes(String s)
    {
        if (s == null)
            return EMPTY;
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param s the UTF-8 string
     * @return the string up to its terminator, decoded
     */
    public static String toString(byte[] s)
    {
        return toString(s, 0);
    }

    /**
     * @param s the UTF-8 string
     * @param offset where the string starts
     * @return the string from {@code offset} up to its terminator, decoded
     */
    public static String toString(byte[] s, int offset)
    {
        return new String(s, offset, end(s, offset) - offset, StandardCharsets.UTF_8);
    }

    public static boolean isSpace(byte b)
    {
        switch (b)
        {
            case ' ':
            case '\t':
            case '\n':
            case 0x0B:
            case '\f':
            case '\r':
                return true;
            default:
                return false;
        }
    }

    /**
     * @param s the string
     * @param offset where to start
     * @return the offset of the first non whitespace byte at or after {@code offset}
     */
    public static int skipSpace(byte[] s, int offset)
    {
        int i = offset;
        while (i < s.length && s[i] != 0 && isSpace(s[i]))
        {
            i++;
        }
        return i;
    }

    /**
     * @param s the string
     * @param offset where to start
     * @param b the byte to look for
     * @return the offset of the next {@code b}, or of the terminator if there is none
     */
    public static int indexOf(byte[] s, int offset, byte b)
    {
        int i = offset;
        while (i < s.length && s[i] != 0 && s[i] != b)
        {
            i++;
        }
        return i;
    }

    /**
     * Finds the first {@code b} that is not escaped by a backslash. A backslash
     * escapes whatever byte follows it, including another backslash.
     *
     * @param s the string
     * @param b the byte to look for
     * @return the offset of the unescaped {@code b}, or -1 if there is none
     */
    public static int indexOfUnescaped(byte[] s, byte b)
    {
        if (s == null)
            return -1;
        int end = length(s);
        int i = 0;
        while (i < end && s[i] != b)
        {
            if (s[i] == '\\' && i + 1 < end)
                i++;
            i++;
        }
        return i < end ? i : -1;
    }

    /**
     * Copies {@code src} into {@code dst} up to, not including, the first {@code stop}
     * byte, then terminates {@code dst}. At most {@code dst.length - 1} bytes are copied.
     *
     * @param dst the destination
     * @param src the source string
     * @param stop the byte to stop at
     * @return {@code dst}
     */
    public static byte[] copyUpTo(byte[] dst, byte[] src, byte stop)
    {
        int limit = dst.length - 1;
        int i = 0;
        while (i < limit && i < src.length && src[i] != 0 && src[i] != stop)
        {
            dst[i] = src[i];
            i++;
        }
        if (dst.length > 0)
            dst[i] = 0;
        return dst;
    }

    /**
     * Copies at most {@code length - 1} bytes of {@code src} into {@code dst} and
     * always terminates the copy.
     *
     * @param dst the destination
     * @param src the source string
     * @param length the size of the destination region
     * @return {@code dst}
     */
    public static byte[] truncatedCopy(byte[] dst, byte[] src, int length)
    {
        if (src == null || dst == null || length <= 0)
            return dst;
        int limit = Math.min(length, dst.length) - 1;
        int i = 0;
        while (i < limit && i < src.length && src[i] != 0)
        {
            dst[i] = src[i];
            i++;
        }
        dst[i] = 0;
        return dst;
    }

    /**
     * Terminates the string in place at the start of its trailing whitespace.
     *
     * @param s the string
     * @param length the length of the string
     * @return the new length of the string
     */
    public static int removeTrailingWhitespace(byte[] s, int length)
    {
        int i = length - 1;
        while (i >= 0 && isSpace(s[i]))
        {
            s[i--] = 0;
            length--;
        }
        return length;
    }

    /**
     * <p>Returns the next name of a space separated list of names, where a name
     * is either a single word or a double quoted string that may hold spaces.</p>
     * <p>The cursor is moved past the name and past its closing quote, if any.</p>
     *
     * @param list the list
     * @param cursor where the next name starts, advanced past it
     * @return the name, at most one long buffer in length
     */
    public static byte[] nextInList(byte[] list, Cursor cursor)
    {
        int i = cursor.position();
        while (i < list.length && list[i] == ' ')
        {
            i++;
        }

        boolean quoted = false;
        if (i < list.length && list[i] == '"')
        {
            i++;
            quoted = true;
        }

        TextBuffer buffer = TextBuffer.newBuffer();
        Cursor out = new Cursor();
        while (i < list.length && list[i] != 0 && (quoted || list[i] != ' ') && list[i] != '"')
        {
            BoundedAppender.appendChar(buffer, out, list[i]);
            i++;
        }

        if (quoted && i < list.length && list[i] != 0)
            i++;

        cursor.position(i);
        return buffer.toByteArray(out);
    }

    /**
     * Replaces every occurrence of a substring. Occurrences are found left to right
     * and do not overlap; replacement text is not searched again.
     *
     * @param s the string
     * @param sub the substring to find, an empty one matches nothing
     * @param with the replacement, null for none
     * @return the new string, at most one long buffer in length, or null if {@code s} is null
     */
    public static byte[] replace(byte[] s, byte[] sub, byte[] with)
    {
        if (s == null)
            return null;

        int end = length(s);
        int subLength = sub == null ? 0 : length(sub);
        int withLength = with == null ? 0 : length(with);
        TextBuffer buffer = TextBuffer.newBuffer();
        Cursor cursor = new Cursor();

        int c = 0;
        if (subLength > 0)
        {
            int i;
            while ((i = indexOf(s, c, end, sub, subLength)) != -1)
            {
                BoundedAppender.appendBytes(buffer, cursor, s, c, i - c);
                BoundedAppender.appendBytes(buffer, cursor, with, 0, withLength);
                c = i + subLength;
            }
        }
        BoundedAppender.appendBytes(buffer, cursor, s, c, end - c);
        return buffer.toByteArray(cursor);
    }

    /**
     * <p>Replaces every occurrence of two substrings in a single pass.</p>
     * <p>At each position {@code sub1} is tried before {@code sub2}, so when one is a
     * prefix of the other the first wins. Replacement text is not searched again.</p>
     *
     * @param s the string
     * @param sub1 the first substring, not empty
     * @param with1 the replacement of the first substring, null for none
     * @param sub2 the second substring, not empty
     * @param with2 the replacement of the second substring, null for none
     * @return the new string, at most one long buffer in length, or null if {@code s} is null
     */
    public static byte[] replace2(byte[] s, byte[] sub1, byte[] with1, byte[] sub2, byte[] with2)
    {
        int subLength1 = length(sub1);
        int subLength2 = length(sub2);
        if (subLength1 == 0 || subLength2 == 0)
            throw new IllegalArgumentException("Empty substring");
        if (s == null)
            return null;

        int end = length(s);
        int withLength1 = with1 == null ? 0 : length(with1);
        int withLength2 = with2 == null ? 0 : length(with2);
        TextBuffer buffer = TextBuffer.newBuffer();
        Cursor cursor = new Cursor();

        int i = 0;
        while (i < end)
        {
            if (regionMatches(s, i, end, sub1, subLength1))
            {
                BoundedAppender.appendBytes(buffer, cursor, with1, 0, withLength1);
                i += subLength1;
            }
            else if (regionMatches(s, i, end, sub2, subLength2))
            {
                BoundedAppender.appendBytes(buffer, cursor, with2, 0, withLength2);
                i += subLength2;
            }
            else
            {
                int j = i + 1;
                while (j < end && s[j] != sub1[0] && s[j] != sub2[0])
                {
                    j++;
                }
                BoundedAppender.appendBytes(buffer, cursor, s, i, j - i);
                i = j;
            }
        }
        return buffer.toByteArray(cursor);
    }

    /**
     * Replaces {@value #TEXT_TOKEN} with {@code text} and {@value #POSITION_TOKEN}
     * with {@code position}, as list iterating functions do for each element.
     *
     * @param s the string
     * @param text the current text
     * @param position the current position
     * @return the new string, at most one long buffer in length, or null if {@code s} is null
     */
    public static byte[] replaceTokens(byte[] s, byte[] text, byte[] position)
    {
        return replace2(s, TEXT_TOKEN_BYTES, text, POSITION_TOKEN_BYTES, position);
    }

    private static int indexOf(byte[] s, int offset, int end, byte[] sub, int subLength)
    {
        for (int i = offset; i <= end - subLength; i++)
        {
            if (regionMatches(s, i, end, sub, subLength))
                return i;
        }
        return -1;
    }

    private static boolean regionMatches(byte[] s, int offset, int end, byte[] sub, int subLength)
    {
        if (end - offset < subLength)
            return false;
        for (int i = 0; i < subLength; i++)
        {
            if (s[offset + i] != sub[i])
                return false;
        }
        return true;
    }
}
