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

/**
 * <p>A position within a string or {@link TextBuffer}.</p>
 * <p>Appenders advance the cursor by the number of bytes they wrote. Scanners
 * move it to the start of the remaining input, or mark it exhausted once
 * no input remains. An exhausted cursor refuses every append.</p>
 * <p>A cursor is owned by a single caller and is not thread safe.</p>
 */
public class Cursor
{
    private static final int EXHAUSTED = -1;

    private int _position;

    public Cursor()
    {
        this(0);
    }

    public Cursor(int position)
    {
        if (position < 0)
            throw new IllegalArgumentException("Invalid position: " + position);
        _position = position;
    }

    public int position()
    {
        return _position;
    }

    public void position(int position)
    {
        if (position < 0)
            throw new IllegalArgumentException("Invalid position: " + position);
        _position = position;
    }

    void advance(int bytes)
    {
        _position += bytes;
    }

    /**
     * Marks this cursor as having no more input.
     */
    public void exhaust()
    {
        _position = EXHAUSTED;
    }

    public boolean isExhausted()
    {
        return _position == EXHAUSTED;
    }

    /**
     * Moves the cursor back to the start, clearing any exhausted state.
     */
    public void reset()
    {
        _position = 0;
    }

    @Override
    public String toString()
    {
        return isExhausted() ? "Cursor@exhausted" : "Cursor@" + _position;
    }
}
