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
import java.util.Objects;

/**
 * <p>Splits strings into tokens at a separator, treating control spans as atomic.</p>
 * <p>A separator inside a markup tag or escape span never ends a token; see
 * {@link ControlSpan}. When the separator is a space, a run of spaces counts as one
 * boundary. Any other separator is significant at each occurrence, so that
 * {@code "a||b"} holds an empty token between its two bars.</p>
 * <p>The scanner works in a {@link TextUnit}: matching by byte, by codepoint (for
 * separators outside ASCII) or by grapheme cluster (where a separator followed by a
 * combining mark is not a separator). Results for ASCII input are the same in every
 * unit.</p>
 * <p>Splitting is destructive: it writes a NUL over the first byte of the separator
 * that ends a token. Scanners hold no state between calls and are thread safe.</p>
 */
public class MarkupAwareScanner
{
    private final TextUnit _unit;
    private final int _separator;

    public MarkupAwareScanner(TextUnit unit, int separator)
    {
        _unit = Objects.requireNonNull(unit);
        if (separator <= 0)
            throw new IllegalArgumentException("Invalid separator: " + separator);
        _separator = separator;
    }

    public static MarkupAwareScanner forBytes(byte separator)
    {
        return new MarkupAwareScanner(TextUnit.BYTE, separator & 0xFF);
    }

    public static MarkupAwareScanner forCodePoints(int separator)
    {
        return new MarkupAwareScanner(TextUnit.CODEPOINT, separator);
    }

    public static MarkupAwareScanner forGraphemes(UnicodeContext context, int separator)
    {
        return new MarkupAwareScanner(TextUnit.grapheme(context), separator);
    }

    public TextUnit getUnit()
    {
        return _unit;
    }

    public int getSeparator()
    {
        return _separator;
    }

    private boolean collapsesRuns()
    {
        return _separator == ' ';
    }

    /**
     * @param s the string
     * @param offset where to start
     * @return the offset past any run of spaces at {@code offset} when the separator
     * is a space, otherwise {@code offset}
     */
    public int skipSeparatorRuns(byte[] s, int offset)
    {
        if (!collapsesRuns())
            return offset;
        while (offset < s.length && s[offset] == ' ')
        {
            offset++;
        }
        return offset;
    }

    /**
     * @param s the string
     * @param offset where the token starts
     * @return the offset of the separator ending the token, or of the end of the
     * string if no separator follows
     */
    public int findTokenEnd(byte[] s, int offset)
    {
        int i = offset;
        while (!_unit.isEnd(s, i))
        {
            if (_unit.valueAt(s, i) == _separator)
                return i;
            if (ControlSpan.isSpanStart(s[i]))
                i = ControlSpan.skip(s, i);
            else
                i = _unit.next(s, i);
        }
        return i;
    }

    /**
     * @param s the string
     * @param offset where the current token starts
     * @return the offset where the following token starts, or -1 if the current
     * token is the last one
     */
    public int findNextTokenStart(byte[] s, int offset)
    {
        int end = findTokenEnd(s, offset);
        if (_unit.isEnd(s, end))
            return -1;
        return skipSeparatorRuns(s, _unit.next(s, end));
    }

    /**
     * <p>Splits the token at the cursor off the string.</p>
     * <p>The separator ending the token is overwritten by a NUL and the cursor moves
     * to the start of the following token, past a run of spaces when the separator
     * is a space. When the token is the last one the cursor becomes exhausted.</p>
     *
     * @param s the string, modified in place
     * @param cursor where the token starts
     * @return the token, possibly empty, or null if the cursor was already exhausted
     */
    public Token splitOneToken(byte[] s, Cursor cursor)
    {
        if (cursor.isExhausted())
            return null;
        int start = cursor.position();
        int end = findTokenEnd(s, start);
        if (_unit.isEnd(s, end))
        {
            cursor.exhaust();
        }
        else
        {
            int next = _unit.next(s, end);
            s[end] = 0;
            cursor.position(skipSeparatorRuns(s, next));
        }
        return new Token(s, start, end - start);
    }

    /**
     * @param s the string
     * @return the number of tokens in the string, 0 for the empty string
     */
    public int countTokens(byte[] s)
    {
        if (_unit.isEnd(s, 0))
            return 0;
        int n = 0;
        for (int offset = 0; offset >= 0; offset = findNextTokenStart(s, offset))
        {
            n++;
        }
        return n;
    }

    /**
     * Trims leading and trailing spaces when the separator is a space, writing a NUL
     * after the last non space byte.
     *
     * @param s the string, modified in place
     * @return the offset of the first non space byte, or 0 when the separator is not a space
     */
    public int trimSeparatorRuns(byte[] s)
    {
        if (!collapsesRuns())
            return 0;
        int start = skipSeparatorRuns(s, 0);
        int end = StringUtil.end(s, start);
        while (end > start && s[end - 1] == ' ')
        {
            end--;
        }
        if (end < s.length)
            s[end] = 0;
        return start;
    }

    /**
     * Rebuilds a list without the first token equal to {@code word}. Tokens are
     * joined again with a single separator.
     *
     * @param list the separated list, left unmodified
     * @param word the word to remove
     * @return the new list, at most one long buffer in length
     */
    public byte[] removeWord(byte[] list, byte[] word)
    {
        byte[] s = Arrays.copyOf(list, StringUtil.length(list));
        TextBuffer buffer = TextBuffer.newBuffer();
        Cursor out = new Cursor();
        Cursor in = new Cursor();

        Token token = splitOneToken(s, in);
        if (token.matches(word))
        {
            token = splitOneToken(s, in);
            if (token != null)
                append(buffer, out, token);
        }
        else
        {
            append(buffer, out, token);
            while (!in.isExhausted())
            {
                token = splitOneToken(s, in);
                if (token.matches(word))
                    break;
                appendSeparator(buffer, out);
                append(buffer, out, token);
            }
        }
        while (!in.isExhausted())
        {
            token = splitOneToken(s, in);
            appendSeparator(buffer, out);
            append(buffer, out, token);
        }
        return buffer.toByteArray(out);
    }

    private void append(TextBuffer buffer, Cursor out, Token token)
    {
        BoundedAppender.appendBytes(buffer, out, token.source(), token.offset(), token.length());
    }

    private void appendSeparator(TextBuffer buffer, Cursor out)
    {
        if (_unit == TextUnit.BYTE)
            BoundedAppender.appendChar(buffer, out, _separator);
        else
            BoundedAppender.appendCodePoint(buffer, out, _separator);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[unit=%s,sep=U+%04X]", getClass().getSimpleName(), hashCode(), _unit, _separator);
    }
}
