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
import java.util.Arrays;

/**
 * <p>Bounded append primitives over a {@link TextBuffer} and its {@link Cursor}.</p>
 * <p>No append ever writes at or beyond {@link TextBuffer#limit()}, and none of
 * them writes the terminating NUL: the build is finished by
 * {@link TextBuffer#terminate(Cursor)}. An exhausted cursor, or one at or past
 * the limit, makes every append fail without touching the buffer.</p>
 * <p>Multi-byte appends return a residual: 0 when all the input was written,
 * otherwise the number of input bytes that were not. Single unit appends and
 * the all or nothing appends return 0 on success and 1 on failure.</p>
 */
public class BoundedAppender
{
    private static final byte[] HEX_DIGITS = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    private BoundedAppender()
    {
    }

    /**
     * Appends a single byte.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced on success
     * @param c the byte to append, only its low 8 bits are used
     * @return 0 on success, 1 if the buffer is full
     */
    public static int appendChar(TextBuffer buffer, Cursor cursor, int c)
    {
        if (cursor.isExhausted() || cursor.position() >= buffer.limit())
            return 1;
        buffer.array()[cursor.position()] = (byte)c;
        cursor.advance(1);
        return 0;
    }

    /**
     * Appends the UTF-8 encoding of a codepoint, all of it or none of it.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced on success
     * @param codePoint the codepoint
     * @return 0 on success, 1 if the encoding does not fit or the codepoint is not encodable
     */
    public static int appendCodePoint(TextBuffer buffer, Cursor cursor, int codePoint)
    {
        if (cursor.isExhausted())
            return 1;
        int written = Utf8Walker.encode(codePoint, buffer.array(), cursor.position(), buffer.limit());
        if (written == 0)
            return 1;
        cursor.advance(written);
        return 0;
    }

    /**
     * Appends a string up to its terminator, as much of it as fits.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @param s the string, null is appended as nothing
     * @return the number of bytes that did not fit
     */
    public static int append(TextBuffer buffer, Cursor cursor, byte[] s)
    {
        if (s == null)
            return 0;
        return appendBytes(buffer, cursor, s, 0, StringUtil.length(s));
    }

    /**
     * Appends the UTF-8 encoding of a string, as much of it as fits.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @param s the string, null is appended as nothing
     * @return the number of bytes that did not fit
     */
    public static int append(TextBuffer buffer, Cursor cursor, String s)
    {
        if (s == null || s.isEmpty())
            return 0;
        return append(buffer, cursor, StringUtil.toBytes(s));
    }

    /**
     * Appends a slice of known length, as much of it as fits.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @param s the source array
     * @param offset where the slice starts
     * @param length the length of the slice
     * @return the number of bytes that did not fit
     */
    public static int appendBytes(TextBuffer buffer, Cursor cursor, byte[] s, int offset, int length)
    {
        if (s == null || length <= 0)
            return 0;
        if (length == 1)
            return appendChar(buffer, cursor, s[offset]);

        if (cursor.isExhausted() || cursor.position() > buffer.limit())
            return length;
        int copy = Math.min(length, buffer.limit() - cursor.position());
        System.arraycopy(s, offset, buffer.array(), cursor.position(), copy);
        cursor.advance(copy);
        return length - copy;
    }

    /**
     * Appends a whole UTF-8 string or nothing at all.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, untouched on failure
     * @param s the string, null is appended as nothing
     * @return 0 on success, 1 if the string does not fit
     */
    public static int appendUtf8(TextBuffer buffer, Cursor cursor, byte[] s)
    {
        if (s == null)
            return 0;
        int length = StringUtil.length(s);
        if (length == 0)
            return 0;
        if (length > buffer.remaining(cursor))
            return 1;
        System.arraycopy(s, 0, buffer.array(), cursor.position(), length);
        cursor.advance(length);
        return 0;
    }

    /**
     * Appends {@code n} copies of a byte, as many as fit.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @param c the byte
     * @param n the number of copies
     * @return 0 on success, 1 if fewer than {@code n} copies fit
     */
    public static int fill(TextBuffer buffer, Cursor cursor, int c, int n)
    {
        if (n < 1)
            return 0;
        if (n == 1)
            return appendChar(buffer, cursor, c);

        int room = buffer.remaining(cursor);
        int result = 0;
        if (n > room)
        {
            n = room;
            result = 1;
            if (n == 0)
                return result;
        }
        int position = cursor.position();
        Arrays.fill(buffer.array(), position, position + n, (byte)c);
        cursor.advance(n);
        return result;
    }

    /**
     * Pads the content before the cursor until it holds at least {@code width}
     * visible characters. Bytes of control spans are not visible.
     *
     * @param buffer the buffer
     * @param cursor the end of the content, advanced by the padding written
     * @param c the padding byte
     * @param width the wanted number of visible characters
     * @return 0 on success, 1 if the padding was cut short
     */
    public static int padTo(TextBuffer buffer, Cursor cursor, int c, int width)
    {
        if (cursor.isExhausted())
            return 1;
        width = Math.min(width, buffer.limit());
        int visible = ControlSpan.visibleLength(buffer.array(), cursor.position());
        if (visible >= width)
            return 0;
        return fill(buffer, cursor, c, width - visible);
    }

    /**
     * Appends the lowercase hexadecimal form of each byte, two digits per byte.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the digits written
     * @param bytes the bytes
     * @param length how many bytes to render
     * @return 0 on success, 1 if a digit did not fit
     */
    public static int appendHex(TextBuffer buffer, Cursor cursor, byte[] bytes, int length)
    {
        for (int i = 0; i < length; i++)
        {
            int b = bytes[i] & 0xFF;
            if (appendChar(buffer, cursor, HEX_DIGITS[b >> 4]) != 0)
                return 1;
            if (appendChar(buffer, cursor, HEX_DIGITS[b & 0x0F]) != 0)
                return 1;
        }
        return 0;
    }

    /**
     * Appends a string, wrapped in double quotes if it holds a space. A quoted
     * string is appended whole or not at all.
     *
     * @param buffer the buffer
     * @param cursor the insertion point
     * @param s the string
     * @return for a quoted string 0 on success and 1 on failure, otherwise the residual
     */
    public static int appendQuotedIfSpace(TextBuffer buffer, Cursor cursor, byte[] s)
    {
        if (s == null)
            return 0;
        int length = StringUtil.length(s);
        if (length == 0)
            return 0;
        if (StringUtil.indexOf(s, 0, (byte)' ') == length)
            return appendBytes(buffer, cursor, s, 0, length);

        if (cursor.isExhausted())
            return 1;
        int saved = cursor.position();
        if (appendChar(buffer, cursor, '"') != 0 ||
            appendBytes(buffer, cursor, s, 0, length) != 0 ||
            appendChar(buffer, cursor, '"') != 0)
        {
            cursor.position(saved);
            return 1;
        }
        return 0;
    }

    /**
     * <p>Appends what goes before the {@code item}th element of a written out list,
     * giving {@code "a, b, and c"} or {@code "a and b"} with delimiter {@code ","},
     * conjunction {@code "and"} and space {@code " "}.</p>
     * <p>Nothing is written before the first item. Before the last item the
     * conjunction is written, preceded by the delimiter when the list has three
     * or more items. Before any other item only the delimiter is written. The
     * space always follows.</p>
     *
     * @param buffer the buffer
     * @param cursor the insertion point
     * @param item the 1 based number of the item about to be appended
     * @param last whether it is the final item
     * @param delimiter the delimiter, usually a comma
     * @param conjunction the conjunction, usually "and"
     * @param space the output separator
     */
    public static void appendItemSeparator(TextBuffer buffer, Cursor cursor, int item, boolean last, String delimiter, String conjunction, String space)
    {
        if (item == 1)
            return;
        if (last)
        {
            if (item >= 3)
                append(buffer, cursor, delimiter);
            append(buffer, cursor, space);
            append(buffer, cursor, conjunction);
        }
        else
        {
            append(buffer, cursor, delimiter);
        }
        append(buffer, cursor, space);
    }

    /**
     * Formats with {@link String#format(String, Object...)} and appends the result.
     *
     * @param buffer the buffer
     * @param cursor the insertion point
     * @param format the format string
     * @param args the format arguments
     * @return the number of bytes that did not fit
     */
    public static int appendFormat(TextBuffer buffer, Cursor cursor, String format, Object... args)
    {
        return append(buffer, cursor, String.format(format, args));
    }

    /**
     * @param buffer the buffer
     * @param cursor the insertion point
     * @param value the value, rendered in decimal
     * @return 0 on success, 1 if the digits were cut short
     */
    public static int appendInteger(TextBuffer buffer, Cursor cursor, long value)
    {
        return IntegerFormatter.format(value, 10, buffer, cursor) ? 0 : 1;
    }

    /**
     * @param buffer the buffer
     * @param cursor the insertion point
     * @param value the value, treated as unsigned and rendered in decimal
     * @return 0 on success, 1 if the digits were cut short
     */
    public static int appendUnsigned(TextBuffer buffer, Cursor cursor, long value)
    {
        return IntegerFormatter.formatUnsigned(value, 10, buffer, cursor) ? 0 : 1;
    }

    /**
     * Appends an object reference as {@code #} followed by its number, whole or not at all.
     *
     * @param buffer the buffer
     * @param cursor the insertion point, untouched on failure
     * @param ref the object number
     * @return 0 on success, 1 on failure
     */
    public static int appendObjectRef(TextBuffer buffer, Cursor cursor, long ref)
    {
        if (cursor.isExhausted())
            return 1;
        int saved = cursor.position();
        if (appendChar(buffer, cursor, '#') != 0 || !IntegerFormatter.format(ref, 10, buffer, cursor))
        {
            cursor.position(saved);
            return 1;
        }
        return 0;
    }
}
