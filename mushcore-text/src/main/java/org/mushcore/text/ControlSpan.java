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
 * <p>Recognizes the embedded control spans that scanning must treat as atomic.</p>
 * <p>A markup tag span runs from {@link #TAG_START} to {@link #TAG_END}; an escape
 * span runs from {@link #ESCAPE} to the next {@code 'm'}, the terminator of an
 * ANSI SGR sequence. Spans are recognized, never interpreted. A span without its
 * terminator runs to the end of the string.</p>
 * <p>Instances track the state of a byte by byte scan and are not thread safe.</p>
 */
public class ControlSpan
{
    public static final byte TAG_START = 0x02;
    public static final byte TAG_END = 0x03;
    public static final byte ESCAPE = 0x1B;
    public static final byte ESCAPE_END = 'm';

    public enum State
    {
        NORMAL, IN_MARKUP_TAG, IN_ESCAPE_SEQUENCE
    }

    private State _state = State.NORMAL;

    /**
     * @param b the next byte of the scan
     * @return true if the byte opens, continues or closes a control span
     */
    public boolean accept(byte b)
    {
        State state = _state;
        _state = next(state, b);
        return state != State.NORMAL || _state != State.NORMAL;
    }

    public State getState()
    {
        return _state;
    }

    /**
     * @return true if the scan is inside an unterminated span
     */
    public boolean isInSpan()
    {
        return _state != State.NORMAL;
    }

    public void reset()
    {
        _state = State.NORMAL;
    }

    /**
     * @param value a byte or codepoint value
     * @return true if the value opens a control span
     */
    public static boolean isSpanStart(int value)
    {
        return value == TAG_START || value == ESCAPE;
    }

    static State next(State state, byte b)
    {
        switch (state)
        {
            case NORMAL:
                if (b == TAG_START)
                    return State.IN_MARKUP_TAG;
                if (b == ESCAPE)
                    return State.IN_ESCAPE_SEQUENCE;
                return State.NORMAL;
            case IN_MARKUP_TAG:
                return b == TAG_END ? State.NORMAL : state;
            case IN_ESCAPE_SEQUENCE:
                return b == ESCAPE_END ? State.NORMAL : state;
            default:
                throw new IllegalStateException(state.toString());
        }
    }

    /**
     * @param s the string
     * @param offset the offset of a span start byte
     * @return the offset just past the span terminator, or the end of the string
     * if the span is not terminated
     */
    public static int skip(byte[] s, int offset)
    {
        State state = State.NORMAL;
        int i = offset;
        while (i < s.length && s[i] != 0)
        {
            state = next(state, s[i++]);
            if (state == State.NORMAL)
                return i;
        }
        return i;
    }

    /**
     * @param s the UTF-8 string
     * @param end the offset to stop counting at
     * @return the number of codepoints before {@code end} that are outside control spans
     */
    public static int visibleLength(byte[] s, int end)
    {
        int n = 0;
        int i = 0;
        end = Math.min(end, s.length);
        while (i < end && s[i] != 0)
        {
            if (isSpanStart(s[i]))
            {
                i = skip(s, i);
            }
            else
            {
                i = Utf8Walker.next(s, i);
                n++;
            }
        }
        return n;
    }
}
