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
 * <p>The unit a string is measured and scanned in: bytes, codepoints or grapheme clusters.</p>
 * <p>Counting, measuring the first N units and seeking are written once against
 * this interface. A unit starts at a byte offset and its value is the byte value,
 * the codepoint, or for a grapheme cluster the codepoint of a single codepoint
 * cluster and -1 for any longer cluster.</p>
 */
public interface TextUnit
{
    TextUnit BYTE = new Bytes();
    TextUnit CODEPOINT = new CodePoints();

    /**
     * @param context the Unicode context whose break rules define the clusters
     * @return the grapheme cluster unit
     */
    static TextUnit grapheme(UnicodeContext context)
    {
        return new Graphemes(context);
    }

    /**
     * @param s the string
     * @param offset the byte offset of a unit
     * @return the byte offset of the following unit, or {@code offset} at the end of the string
     */
    int next(byte[] s, int offset);

    /**
     * @param s the string
     * @param offset the byte offset of a unit
     * @return the value of the unit, 0 at the end of the string
     */
    int valueAt(byte[] s, int offset);

    default boolean isEnd(byte[] s, int offset)
    {
        return offset >= s.length || s[offset] == 0;
    }

    /**
     * @param s the string
     * @return the number of units in the string
     */
    default int count(byte[] s)
    {
        int n = 0;
        int offset = 0;
        while (!isEnd(s, offset))
        {
            offset = next(s, offset);
            n++;
        }
        return n;
    }

    /**
     * @param s the string
     * @param units the number of units to measure
     * @return the number of bytes taken by the first {@code units} units
     */
    default int byteLength(byte[] s, int units)
    {
        int offset = 0;
        while (units-- > 0 && !isEnd(s, offset))
        {
            offset = next(s, offset);
        }
        return offset;
    }

    /**
     * @param s the string
     * @param offset where to start
     * @param value the unit value to look for
     * @return the byte offset of the first unit at or after {@code offset} with
     * the value, or -1 if there is none
     */
    default int indexOf(byte[] s, int offset, int value)
    {
        while (!isEnd(s, offset))
        {
            if (valueAt(s, offset) == value)
                return offset;
            offset = next(s, offset);
        }
        return -1;
    }

    class Bytes implements TextUnit
    {
        private Bytes()
        {
        }

        @Override
        public int next(byte[] s, int offset)
        {
            return isEnd(s, offset) ? offset : offset + 1;
        }

        @Override
        public int valueAt(byte[] s, int offset)
        {
            return isEnd(s, offset) ? 0 : s[offset] & 0xFF;
        }

        @Override
        public int count(byte[] s)
        {
            return StringUtil.length(s);
        }

        @Override
        public String toString()
        {
            return "BYTE";
        }
    }

    class CodePoints implements TextUnit
    {
        private CodePoints()
        {
        }

        @Override
        public int next(byte[] s, int offset)
        {
            return Utf8Walker.next(s, offset);
        }

        @Override
        public int valueAt(byte[] s, int offset)
        {
            return Utf8Walker.codePointAt(s, offset);
        }

        @Override
        public int count(byte[] s)
        {
            return Utf8Walker.codePointCount(s);
        }

        @Override
        public String toString()
        {
            return "CODEPOINT";
        }
    }

    class Graphemes implements TextUnit
    {
        private final UnicodeContext _context;

        private Graphemes(UnicodeContext context)
        {
            _context = Objects.requireNonNull(context);
        }

        @Override
        public int next(byte[] s, int offset)
        {
            return offset + GraphemeWalker.clusterLength(_context, s, offset);
        }

        @Override
        public int valueAt(byte[] s, int offset)
        {
            int length = GraphemeWalker.clusterLength(_context, s, offset);
            if (length == 0)
                return 0;
            long decoded = Utf8Walker.decode(s, offset);
            return Utf8Walker.lengthOf(decoded) == length ? Utf8Walker.valueOf(decoded) : -1;
        }

        @Override
        public int count(byte[] s)
        {
            return GraphemeWalker.clusterCount(_context, s);
        }

        @Override
        public String toString()
        {
            return "GRAPHEME@" + _context.getLocale();
        }
    }
}
