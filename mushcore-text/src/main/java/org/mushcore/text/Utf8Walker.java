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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <p>Walks a NUL terminated UTF-8 string one codepoint at a time.</p>
 * <p>A string ends at its first NUL byte or at the end of its array. The walker
 * is lazy, finite and single use; the static methods offer the same decoding
 * without allocating.</p>
 * <p>Decoding does not validate: a malformed sequence decodes as
 * {@link #REPLACEMENT} and covers the lead byte plus any continuation bytes
 * that followed it. Use {@link CharsetBridge#validateUtf8(byte[])} to check input.</p>
 */
public class Utf8Walker implements Iterator<CodePoint>
{
    public static final int REPLACEMENT = 0xFFFD;

    /**
     * Receives each codepoint of a {@link #forEach(byte[], Callback)} traversal.
     */
    @FunctionalInterface
    public interface Callback
    {
        /**
         * @param codePoint the decoded codepoint
         * @param source the string being walked
         * @param offset the byte offset of the codepoint
         * @param length the encoded length of the codepoint
         * @return true to continue, false to stop the traversal
         */
        boolean onCodePoint(int codePoint, byte[] source, int offset, int length);
    }

    private final byte[] _source;
    private int _offset;

    public Utf8Walker(byte[] source)
    {
        this(source, 0);
    }

    public Utf8Walker(byte[] source, int offset)
    {
        _source = Objects.requireNonNull(source);
        _offset = offset;
    }

    @Override
    public boolean hasNext()
    {
        return _offset < _source.length && _source[_offset] != 0;
    }

    @Override
    public CodePoint next()
    {
        if (!hasNext())
            throw new NoSuchElementException();
        long decoded = decode(_source, _offset);
        CodePoint codePoint = new CodePoint(valueOf(decoded), _offset, lengthOf(decoded));
        _offset += codePoint.length();
        return codePoint;
    }

    /**
     * @return the byte offset of the next codepoint
     */
    public int offset()
    {
        return _offset;
    }

    /**
     * Calls the callback for each codepoint of the string.
     *
     * @param s the UTF-8 string
     * @param callback the callback
     * @return true if the whole string was walked, false if the callback stopped early
     */
    public static boolean forEach(byte[] s, Callback callback)
    {
        int offset = 0;
        while (offset < s.length && s[offset] != 0)
        {
            long decoded = decode(s, offset);
            int length = lengthOf(decoded);
            if (!callback.onCodePoint(valueOf(decoded), s, offset, length))
                return false;
            offset += length;
        }
        return true;
    }

    /**
     * @param s the UTF-8 string
     * @param offset a byte offset at the start of a codepoint
     * @return the codepoint at the offset, or 0 at the end of the string
     */
    public static int codePointAt(byte[] s, int offset)
    {
        if (offset >= s.length || s[offset] == 0)
            return 0;
        return valueOf(decode(s, offset));
    }

    /**
     * Advances by one codepoint.
     *
     * @param s the UTF-8 string
     * @param offset a byte offset at the start of a codepoint
     * @return the offset of the following codepoint, or {@code offset} at the end of the string
     */
    public static int next(byte[] s, int offset)
    {
        if (offset >= s.length || s[offset] == 0)
            return offset;
        return offset + lengthOf(decode(s, offset));
    }

    /**
     * Retreats by one codepoint.
     *
     * @param s the UTF-8 string
     * @param offset a byte offset at the start of a codepoint, or at the end of the string
     * @return the offset of the preceding codepoint, or 0 at the start of the string
     */
    public static int previous(byte[] s, int offset)
    {
        if (offset <= 0)
            return 0;
        int i = offset - 1;
        if ((s[i] & 0x80) == 0)
            return i;

        int lead = i;
        int trail = 0;
        while (lead > 0 && (s[lead] & 0xC0) == 0x80 && trail < 3)
        {
            lead--;
            trail++;
        }
        if (lengthOf(decode(s, lead)) == offset - lead)
            return lead;
        return i;
    }

    /**
     * @param s the UTF-8 string
     * @return the number of codepoints in the string
     */
    public static int codePointCount(byte[] s)
    {
        int n = 0;
        int offset = 0;
        while (offset < s.length && s[offset] != 0)
        {
            offset += lengthOf(decode(s, offset));
            n++;
        }
        return n;
    }

    /**
     * @param s the UTF-8 string
     * @param codePoints the number of codepoints to measure
     * @return the number of bytes taken by the first {@code codePoints} codepoints,
     * or by the whole string if it is shorter
     */
    public static int byteLengthOf(byte[] s, int codePoints)
    {
        int offset = 0;
        while (codePoints-- > 0 && offset < s.length && s[offset] != 0)
        {
            offset += lengthOf(decode(s, offset));
        }
        return offset;
    }

    /**
     * @param s the UTF-8 string
     * @param codePoints the number of codepoints to copy
     * @return a new array holding the first {@code codePoints} codepoints
     */
    public static byte[] copyOf(byte[] s, int codePoints)
    {
        return Arrays.copyOf(s, byteLengthOf(s, codePoints));
    }

    /**
     * @param codePoint a codepoint
     * @return the number of bytes needed to encode the codepoint, or 0 if it is
     * a surrogate or beyond U+10FFFF
     */
    public static int encodedLength(int codePoint)
    {
        if (codePoint < 0)
            return 0;
        if (codePoint <= 0x7F)
            return 1;
        if (codePoint <= 0x7FF)
            return 2;
        if (codePoint <= 0xD7FF)
            return 3;
        if (codePoint <= 0xDFFF || codePoint > 0x10FFFF)
            return 0;
        if (codePoint <= 0xFFFF)
            return 3;
        return 4;
    }

    /**
     * Encodes a codepoint, but only if all of its bytes fit before the limit.
     *
     * @param codePoint the codepoint to encode
     * @param dst the destination array
     * @param offset where to write the first byte
     * @param limit the offset no byte may be written at or beyond
     * @return the number of bytes written, 0 if nothing was written
     */
    public static int encode(int codePoint, byte[] dst, int offset, int limit)
    {
        int length = encodedLength(codePoint);
        if (length == 0 || offset < 0 || offset + length > Math.min(limit, dst.length))
            return 0;
        switch (length)
        {
            case 1:
                dst[offset] = (byte)codePoint;
                break;
            case 2:
                dst[offset] = (byte)(0xC0 | (codePoint >> 6));
                dst[offset + 1] = (byte)(0x80 | (codePoint & 0x3F));
                break;
            case 3:
                dst[offset] = (byte)(0xE0 | (codePoint >> 12));
                dst[offset + 1] = (byte)(0x80 | ((codePoint >> 6) & 0x3F));
                dst[offset + 2] = (byte)(0x80 | (codePoint & 0x3F));
                break;
            default:
                dst[offset] = (byte)(0xF0 | (codePoint >> 18));
                dst[offset + 1] = (byte)(0x80 | ((codePoint >> 12) & 0x3F));
                dst[offset + 2] = (byte)(0x80 | ((codePoint >> 6) & 0x3F));
                dst[offset + 3] = (byte)(0x80 | (codePoint & 0x3F));
                break;
        }
        return length;
    }

    static int valueOf(long decoded)
    {
        return (int)decoded;
    }

    static int lengthOf(long decoded)
    {
        return (int)(decoded >>> 32);
    }

    /**
     * Decodes the sequence at the offset, which must be before the end of the array.
     *
     * @return the encoded length in the high word and the codepoint in the low word
     */
    static long decode(byte[] s, int offset)
    {
        int b = s[offset] & 0xFF;

        // Is it plain ASCII?
        if (b < 0x80)
            return pack(b, 1);

        int expectedContinuationBytes;
        int codePoint;
        int minCodePoint;
        if ((b & 0xE0) == 0xC0)
        {
            //110xxxxx
            expectedContinuationBytes = 1;
            codePoint = b & 0x1F;
            minCodePoint = 0x80;
        }
        else if ((b & 0xF0) == 0xE0)
        {
            //1110xxxx
            expectedContinuationBytes = 2;
            codePoint = b & 0x0F;
            minCodePoint = 0x800;
        }
        else if ((b & 0xF8) == 0xF0)
        {
            //11110xxx
            expectedContinuationBytes = 3;
            codePoint = b & 0x07;
            minCodePoint = 0x10000;
        }
        else
        {
            // A continuation byte or an invalid lead byte
            return pack(REPLACEMENT, 1);
        }

        int i = offset + 1;
        while (expectedContinuationBytes > 0)
        {
            // 10xxxxxx
            if (i >= s.length || (s[i] & 0xC0) != 0x80)
                return pack(REPLACEMENT, i - offset);
            codePoint = (codePoint << 6) | (s[i] & 0x3F);
            expectedContinuationBytes--;
            i++;
        }

        if (codePoint < minCodePoint || (codePoint >= 0xD800 && codePoint <= 0xDFFF) || codePoint > 0x10FFFF)
            return pack(REPLACEMENT, i - offset);
        return pack(codePoint, i - offset);
    }

    private static long pack(int codePoint, int length)
    {
        return ((long)length << 32) | (codePoint & 0xFFFFFFFFL);
    }
}
