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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Renders integers in bases 2 to 36 straight into a {@link TextBuffer}.</p>
 * <p>Digits are produced least significant first onto a local stack, then copied
 * to the buffer while there is room. A base outside [2, 36] is clamped into it.
 * Digits above 9 are lowercase letters.</p>
 */
public class IntegerFormatter
{
    private static final Logger LOG = LoggerFactory.getLogger(IntegerFormatter.class);

    public static final int MIN_BASE = 2;
    public static final int MAX_BASE = 36;

    private static final byte[] DIGITS = "0123456789abcdefghijklmnopqrstuvwxyz".getBytes(StandardCharsets.US_ASCII);

    // 64 binary digits and a sign
    private static final int STACK_SIZE = 65;

    private IntegerFormatter()
    {
    }

    /**
     * @param value the value
     * @param base the base, clamped to [2, 36]
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @return true if the whole number was written, false if it was cut short or
     * the buffer was already full
     */
    public static boolean format(long value, int base, TextBuffer buffer, Cursor cursor)
    {
        if (cursor.isExhausted() || cursor.position() >= buffer.limit())
            return false;
        base = clamp(base);

        boolean negative = value < 0;
        if (negative)
        {
            if (value == Long.MIN_VALUE)
                return formatMinValue(base, buffer, cursor);
            value = -value;
        }

        byte[] stack = new byte[STACK_SIZE];
        int current = stack.length;
        long quotient = value;
        do
        {
            long dividend = quotient;
            quotient = dividend / base;
            long remainder = dividend - quotient * base;
            // Division truncates toward zero, keep the remainder of a non negative dividend non negative
            if (dividend >= 0 && remainder < 0)
            {
                quotient--;
                remainder += base;
            }
            stack[--current] = DIGITS[(int)remainder];
        }
        while (quotient != 0);

        if (negative)
            stack[--current] = '-';

        return copy(stack, current, buffer, cursor);
    }

    /**
     * @param value the value, treated as an unsigned 64 bit integer
     * @param base the base, clamped to [2, 36]
     * @param buffer the buffer
     * @param cursor the insertion point, advanced by the bytes written
     * @return true if the whole number was written
     */
    public static boolean formatUnsigned(long value, int base, TextBuffer buffer, Cursor cursor)
    {
        if (cursor.isExhausted() || cursor.position() >= buffer.limit())
            return false;
        base = clamp(base);

        byte[] stack = new byte[STACK_SIZE];
        int current = stack.length;
        long quotient = value;
        do
        {
            stack[--current] = DIGITS[(int)Long.remainderUnsigned(quotient, base)];
            quotient = Long.divideUnsigned(quotient, base);
        }
        while (quotient != 0);

        return copy(stack, current, buffer, cursor);
    }

    private static int clamp(int base)
    {
        if (base < MIN_BASE)
            return MIN_BASE;
        if (base > MAX_BASE)
            return MAX_BASE;
        return base;
    }

    private static boolean copy(byte[] stack, int current, TextBuffer buffer, Cursor cursor)
    {
        byte[] array = buffer.array();
        int limit = buffer.limit();
        int position = cursor.position();
        int start = position;
        while (current < stack.length && position < limit)
        {
            array[position++] = stack[current++];
        }
        cursor.advance(position - start);
        return current == stack.length;
    }

    /**
     * The magnitude of {@link Long#MIN_VALUE} has no positive long, so it is
     * rendered by the general purpose formatters instead.
     */
    private static boolean formatMinValue(int base, TextBuffer buffer, Cursor cursor)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Formatting Long.MIN_VALUE in base {}", base);
        String digits;
        switch (base)
        {
            case 10:
                digits = String.format("%d", Long.MIN_VALUE);
                break;
            case 16:
                digits = String.format("%x", Long.MIN_VALUE);
                break;
            case 8:
                digits = String.format("%o", Long.MIN_VALUE);
                break;
            default:
                digits = Long.toString(Long.MIN_VALUE, base);
                break;
        }
        return BoundedAppender.append(buffer, cursor, digits) == 0;
    }
}
