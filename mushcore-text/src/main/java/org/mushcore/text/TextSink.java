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

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A growable UTF-8 string builder with a fixed maximum length.</p>
 * <p>Unlike a {@link TextBuffer} a sink does not truncate: the first append that
 * would bring its length to the maximum puts it in the overflowed state, in which
 * its content is discarded and every further append is ignored. {@link #finish()}
 * then returns the empty string. The maximum defaults to
 * {@link TextLimits#sinkMaxLength()}.</p>
 */
public class TextSink extends ByteArrayOutputStream
{
    private static final Logger LOG = LoggerFactory.getLogger(TextSink.class);

    private final int _maxLength;
    private boolean _overflowed;

    public TextSink()
    {
        this(TextLimits.sinkMaxLength());
    }

    public TextSink(int maxLength)
    {
        super(Math.min(maxLength, 256));
        if (maxLength < 1)
            throw new IllegalArgumentException("Invalid max length: " + maxLength);
        _maxLength = maxLength;
    }

    public int getMaxLength()
    {
        return _maxLength;
    }

    /**
     * @return true if an append exceeded the maximum length and the content was discarded
     */
    public boolean isOverflowed()
    {
        return _overflowed;
    }

    private boolean accept(int length)
    {
        if (_overflowed)
            return false;
        if (count + length >= _maxLength)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Discarding {} bytes of {}, {} more exceed the maximum", count, this, length);
            _overflowed = true;
            super.reset();
            return false;
        }
        return true;
    }

    @Override
    public synchronized void write(int b)
    {
        if (accept(1))
            super.write(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len)
    {
        if (accept(len))
            super.write(b, off, len);
    }

    /**
     * Empties the sink and clears the overflowed state.
     */
    @Override
    public synchronized void reset()
    {
        super.reset();
        _overflowed = false;
    }

    /**
     * @param s a string, appended up to its terminator
     * @return this sink
     */
    public TextSink append(byte[] s)
    {
        if (s != null)
            write(s, 0, StringUtil.length(s));
        return this;
    }

    public TextSink append(byte[] s, int offset, int length)
    {
        write(s, offset, length);
        return this;
    }

    public TextSink append(String s)
    {
        if (s != null && !s.isEmpty())
            append(StringUtil.toBytes(s));
        return this;
    }

    /**
     * @param codePoint a codepoint, appended as UTF-8
     * @return this sink
     */
    public TextSink appendCodePoint(int codePoint)
    {
        byte[] encoded = new byte[4];
        int length = Utf8Walker.encode(codePoint, encoded, 0, encoded.length);
        if (length == 0)
            throw new IllegalArgumentException("Invalid codepoint: " + codePoint);
        write(encoded, 0, length);
        return this;
    }

    public TextSink appendFormat(String format, Object... args)
    {
        return append(String.format(format, args));
    }

    /**
     * @param s a UTF-8 string
     * @param n the number of codepoints to append
     * @return this sink
     */
    public TextSink appendCodePoints(byte[] s, int n)
    {
        if (n > 0)
            write(s, 0, Utf8Walker.byteLengthOf(s, n));
        return this;
    }

    /**
     * @param context the Unicode context
     * @param s a UTF-8 string
     * @param n the number of grapheme clusters to append
     * @return this sink
     */
    public TextSink appendClusters(UnicodeContext context, byte[] s, int n)
    {
        if (n > 0)
            write(s, 0, GraphemeWalker.byteLengthOf(context, s, n));
        return this;
    }

    /**
     * Appends a string, wrapped in double quotes if it holds a space.
     *
     * @param s the string
     * @return this sink
     */
    public TextSink appendQuotedIfSpace(byte[] s)
    {
        if (s == null)
            return this;
        int length = StringUtil.length(s);
        if (length == 0)
            return this;
        if (StringUtil.indexOf(s, 0, (byte)' ') == length)
            return append(s, 0, length);
        byte[] quoted = new byte[length + 2];
        quoted[0] = '"';
        System.arraycopy(s, 0, quoted, 1, length);
        quoted[length + 1] = '"';
        return append(quoted, 0, quoted.length);
    }

    /**
     * Appends what goes before the {@code item}th element of a written out list,
     * as {@link BoundedAppender#appendItemSeparator} does.
     *
     * @return this sink
     */
    public TextSink appendItemSeparator(int item, boolean last, String delimiter, String conjunction, String space)
    {
        if (item == 1)
            return this;
        if (last)
        {
            if (item >= 3)
                append(delimiter);
            append(space);
            append(conjunction);
        }
        else
        {
            append(delimiter);
        }
        return append(space);
    }

    /**
     * @return the number of bytes held
     */
    public synchronized int length()
    {
        return count;
    }

    /**
     * @return a copy of the content, empty if the sink overflowed
     */
    public synchronized byte[] finish()
    {
        if (_overflowed)
            return StringUtil.EMPTY;
        return Arrays.copyOf(buf, count);
    }

    @Override
    public synchronized String toString()
    {
        return String.format("%s@%x[len=%d,max=%d,overflowed=%b]", getClass().getSimpleName(), hashCode(), count, _maxLength, _overflowed);
    }
}
