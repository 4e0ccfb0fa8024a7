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
import java.util.Objects;

/**
 * <p>A fixed capacity byte region that text is accumulated into.</p>
 * <p>At most {@code capacity() - 1} bytes of content are ever written, leaving room
 * for the terminating NUL. Appends do not write the terminator: callers finish a
 * build with {@link #terminate(Cursor)}.</p>
 * <p>Buffers are usually reused across many builds with a fresh {@link Cursor} for each.</p>
 *
 * @see BoundedAppender
 */
public class TextBuffer
{
    private final byte[] _bytes;

    public TextBuffer(int capacity)
    {
        if (capacity < 1)
            throw new IllegalArgumentException("Invalid capacity: " + capacity);
        _bytes = new byte[capacity];
    }

    /**
     * @return a new buffer of the long capacity from {@link TextLimits#bufferLength()}
     */
    public static TextBuffer newBuffer()
    {
        return new TextBuffer(TextLimits.bufferLength());
    }

    /**
     * @return a new buffer of the short capacity from {@link TextLimits#shortBufferLength()}
     */
    public static TextBuffer newShortBuffer()
    {
        return new TextBuffer(TextLimits.shortBufferLength());
    }

    public int capacity()
    {
        return _bytes.length;
    }

    /**
     * @return the offset one past the last byte content may occupy
     */
    public int limit()
    {
        return _bytes.length - 1;
    }

    /**
     * @return the backing array, not a copy
     */
    public byte[] array()
    {
        return _bytes;
    }

    /**
     * @param cursor the cursor of the current build
     * @return the number of bytes that can still be appended at the cursor
     */
    public int remaining(Cursor cursor)
    {
        if (cursor.isExhausted())
            return 0;
        return Math.max(0, limit() - cursor.position());
    }

    /**
     * Writes the terminating NUL at the cursor, or at the last byte if the cursor is beyond it.
     *
     * @param cursor the cursor of the current build
     */
    public void terminate(Cursor cursor)
    {
        Objects.requireNonNull(cursor);
        _bytes[end(cursor)] = 0;
    }

    /**
     * @param cursor the cursor of the current build
     * @return a copy of the content before the cursor
     */
    public byte[] toByteArray(Cursor cursor)
    {
        return Arrays.copyOf(_bytes, end(cursor));
    }

    /**
     * @param cursor the cursor of the current build
     * @return the content before the cursor decoded as UTF-8
     */
    public String toString(Cursor cursor)
    {
        return new String(_bytes, 0, end(cursor), StandardCharsets.UTF_8);
    }

    private int end(Cursor cursor)
    {
        if (cursor.isExhausted())
            return 0;
        return Math.min(cursor.position(), limit());
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[c=%d]", getClass().getSimpleName(), hashCode(), capacity());
    }
}
