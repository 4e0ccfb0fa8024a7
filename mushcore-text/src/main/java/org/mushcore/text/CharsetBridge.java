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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Conversion between Latin-1 and UTF-8, and UTF-8 validation.</p>
 * <p>Conversions never fail. Latin-1 to UTF-8 is lossless; UTF-8 to Latin-1 maps
 * every character outside Latin-1, and every malformed sequence, to {@code '?'}.
 * Both size their result exactly in a first pass and fill it in a second.</p>
 * <p>Latin-1 read from a telnet connection may carry telnet commands, whose bytes
 * are not characters. In protocol aware mode those commands are copied through
 * untranslated: an escaped {@code IAC IAC} is the character 0xFF, option
 * negotiations ({@code IAC DO/DONT/WILL/WONT option}) and {@code IAC NOP} are copied
 * as they are, and a sub-negotiation is copied from {@code IAC SB} up to and
 * including the next {@code SE}, or to the end of the input if there is none. Any
 * other byte following {@code IAC} is logged and dropped with the {@code IAC}.</p>
 */
public class CharsetBridge
{
    private static final Logger LOG = LoggerFactory.getLogger(CharsetBridge.class);

    public static final int IAC = 255;
    public static final int DONT = 254;
    public static final int DO = 253;
    public static final int WONT = 252;
    public static final int WILL = 251;
    public static final int SB = 250;
    public static final int NOP = 241;
    public static final int SE = 240;

    public static final byte PLACEHOLDER = '?';

    private CharsetBridge()
    {
    }

    /**
     * @param latin1 the Latin-1 bytes, NUL bytes included
     * @param length the number of bytes to convert
     * @param protocolAware true to copy telnet commands through untranslated
     * @return a new array of exactly the converted length
     */
    public static byte[] latin1ToUtf8(byte[] latin1, int length, boolean protocolAware)
    {
        if (length < 0 || length > latin1.length)
            throw new IllegalArgumentException("Invalid length: " + length);
        byte[] utf8 = new byte[latin1ToUtf8(latin1, length, protocolAware, null)];
        latin1ToUtf8(latin1, length, protocolAware, utf8);
        return utf8;
    }

    /**
     * @param latin1 the Latin-1 bytes
     * @return a new array holding the UTF-8 encoding of all the bytes
     */
    public static byte[] latin1ToUtf8(byte[] latin1)
    {
        return latin1ToUtf8(latin1, latin1.length, false);
    }

    /**
     * Converts, or with a null {@code utf8} only measures.
     *
     * @return the number of UTF-8 bytes
     */
    private static int latin1ToUtf8(byte[] latin1, int length, boolean protocolAware, byte[] utf8)
    {
        int o = 0;
        int n = 0;
        while (n < length)
        {
            int c = latin1[n] & 0xFF;
            if (protocolAware && c == IAC)
            {
                if (n + 1 == length)
                {
                    if (utf8 != null)
                        LOG.warn("Dropping telnet IAC at end of input");
                    n++;
                    continue;
                }
                int command = latin1[n + 1] & 0xFF;
                switch (command)
                {
                    case IAC:
                        o = encode(IAC, utf8, o);
                        n += 2;
                        break;
                    case SB:
                    {
                        int end = n + 2;
                        while (end < length && (latin1[end] & 0xFF) != SE)
                        {
                            end++;
                        }
                        if (end < length)
                            end++;
                        o = copy(latin1, n, end, utf8, o);
                        n = end;
                        break;
                    }
                    case DO:
                    case DONT:
                    case WILL:
                    case WONT:
                    {
                        int end = Math.min(n + 3, length);
                        o = copy(latin1, n, end, utf8, o);
                        n = end;
                        break;
                    }
                    case NOP:
                        o = copy(latin1, n, n + 2, utf8, o);
                        n += 2;
                        break;
                    default:
                        // Logged on the fill pass only
                        if (utf8 != null)
                            LOG.warn("Dropping invalid telnet command {}", Integer.toHexString(command));
                        n += 2;
                        break;
                }
            }
            else if (c < 0x80)
            {
                if (utf8 != null)
                    utf8[o] = (byte)c;
                o++;
                n++;
            }
            else
            {
                o = encode(c, utf8, o);
                n++;
            }
        }
        return o;
    }

    private static int encode(int c, byte[] utf8, int o)
    {
        if (utf8 != null)
        {
            utf8[o] = (byte)(0xC0 | (c >> 6));
            utf8[o + 1] = (byte)(0x80 | (c & 0x3F));
        }
        return o + 2;
    }

    private static int copy(byte[] src, int from, int to, byte[] dst, int o)
    {
        if (dst != null)
            System.arraycopy(src, from, dst, o, to - from);
        return o + to - from;
    }

    /**
     * @param utf8 the UTF-8 string, up to its terminator
     * @return a new array of exactly the converted length, with {@code '?'} in place
     * of each character outside Latin-1 and each malformed sequence
     */
    public static byte[] utf8ToLatin1(byte[] utf8)
    {
        int length = StringUtil.length(utf8);
        byte[] latin1 = new byte[utf8ToLatin1(utf8, length, null)];
        utf8ToLatin1(utf8, length, latin1);
        return latin1;
    }

    /**
     * Converts, or with a null {@code latin1} only measures.
     *
     * @return the number of Latin-1 bytes
     */
    private static int utf8ToLatin1(byte[] utf8, int length, byte[] latin1)
    {
        int o = 0;
        int n = 0;
        while (n < length)
        {
            int b = utf8[n] & 0xFF;
            int c;
            if (b < 0x80)
            {
                c = b;
                n++;
            }
            else if ((b & 0xE0) == 0xC0)
            {
                if (n + 1 < length && isContinuation(utf8[n + 1]))
                {
                    c = (b & 0x1F) <= 0x03 ? ((b & 0x03) << 6) | (utf8[n + 1] & 0x3F) : PLACEHOLDER;
                    n += 2;
                }
                else
                {
                    c = PLACEHOLDER;
                    n++;
                }
            }
            else if ((b & 0xF0) == 0xE0)
            {
                c = PLACEHOLDER;
                n = skipContinuations(utf8, n + 1, length, 2);
            }
            else if ((b & 0xF8) == 0xF0)
            {
                c = PLACEHOLDER;
                n = skipContinuations(utf8, n + 1, length, 3);
            }
            else
            {
                // A stray continuation byte or a byte that never appears in UTF-8
                c = PLACEHOLDER;
                n++;
            }
            if (latin1 != null)
                latin1[o] = (byte)c;
            o++;
        }
        return o;
    }

    private static boolean isContinuation(byte b)
    {
        return (b & 0xC0) == 0x80;
    }

    private static int skipContinuations(byte[] utf8, int n, int length, int max)
    {
        while (max-- > 0 && n < length && isContinuation(utf8[n]))
        {
            n++;
        }
        return n;
    }

    /**
     * Checks the lead and continuation byte structure of a string. Overlong forms
     * and surrogates are not detected.
     *
     * @param s the string, up to its terminator
     * @return true if every lead byte is followed by exactly the continuation bytes it announces
     */
    public static boolean validateUtf8(byte[] s)
    {
        int continuations = 0;
        for (int i = 0; i < s.length && s[i] != 0; i++)
        {
            int b = s[i] & 0xFF;
            if (b < 0x80)
            {
                if (continuations > 0)
                    return false;
            }
            else if ((b & 0xF8) == 0xF0)
            {
                if (continuations > 0)
                    return false;
                continuations = 3;
            }
            else if ((b & 0xF0) == 0xE0)
            {
                if (continuations > 0)
                    return false;
                continuations = 2;
            }
            else if ((b & 0xE0) == 0xC0)
            {
                if (continuations > 0)
                    return false;
                continuations = 1;
            }
            else if ((b & 0xC0) == 0x80)
            {
                if (continuations == 0)
                    return false;
                continuations--;
            }
            else
            {
                return false;
            }
        }
        return continuations == 0;
    }
}
