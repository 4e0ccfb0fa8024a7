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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

// @checkstyle-disable-check : AvoidEscapedUnicodeCharactersCheck
public class TextSinkTest
{
    private static String finish(TextSink sink)
    {
        return StringUtil.toString(sink.finish());
    }

    @Test
    public void testAppend()
    {
        TextSink sink = new TextSink();
        assertThat(sink.getMaxLength(), is(TextLimits.sinkMaxLength()));
        sink.append("foo").append(StringUtil.toBytes("bar")).appendCodePoint('!').appendFormat("%d", 42);
        sink.append((String)null).append((byte[])null).append("");
        assertThat(sink.length(), is(9));
        assertThat(finish(sink), is("foobar!42"));
        assertFalse(sink.isOverflowed());
    }

    @Test
    public void testAppendStopsAtTerminator()
    {
        TextSink sink = new TextSink();
        sink.append(new byte[]{'a', 'b', 0, 'c'});
        assertThat(finish(sink), is("ab"));
    }

    @Test
    public void testOverflowDiscardsContent()
    {
        TextSink sink = new TextSink(10);
        sink.append("12345").append("6789");
        assertFalse(sink.isOverflowed());
        assertThat(finish(sink), is("123456789"));

        sink.append("0");
        assertTrue(sink.isOverflowed());
        assertThat(sink.length(), is(0));
        assertThat(sink.finish().length, is(0));

        sink.append("x").write('y');
        assertThat(sink.length(), is(0));
        assertThat(sink.finish().length, is(0));

        sink.reset();
        assertFalse(sink.isOverflowed());
        sink.append("again");
        assertThat(finish(sink), is("again"));
    }

    @Test
    public void testInvalidMaxLength()
    {
        assertThrows(IllegalArgumentException.class, () -> new TextSink(0));
    }

    @Test
    public void testAppendCodePoint()
    {
        TextSink sink = new TextSink();
        sink.appendCodePoint(0xE9).appendCodePoint(0x1F600);
        assertThat(finish(sink), is("\u00E9\uD83D\uDE00"));
        assertThrows(IllegalArgumentException.class, () -> sink.appendCodePoint(0x110000));
    }

    @Test
    public void testAppendCodePointsAndClusters()
    {
        byte[] s = StringUtil.toBytes("e\u0301xy");

        TextSink codePoints = new TextSink();
        codePoints.appendCodePoints(s, 1).append("|").appendCodePoints(s, 0).appendCodePoints(s, 10);
        assertThat(finish(codePoints), is("e|e\u0301xy"));

        TextSink clusters = new TextSink();
        clusters.appendClusters(new UnicodeContext(), s, 1).append("|").appendClusters(new UnicodeContext(), s, 2);
        assertThat(finish(clusters), is("e\u0301|e\u0301x"));
    }

    @Test
    public void testAppendQuotedIfSpace()
    {
        TextSink sink = new TextSink();
        sink.appendQuotedIfSpace(StringUtil.toBytes("plain"))
            .append(" ")
            .appendQuotedIfSpace(StringUtil.toBytes("two words"))
            .appendQuotedIfSpace(StringUtil.EMPTY)
            .appendQuotedIfSpace(null);
        assertThat(finish(sink), is("plain \"two words\""));
    }

    @Test
    public void testItemSeparators()
    {
        String[] items = {"a", "b", "c"};
        TextSink three = new TextSink();
        for (int i = 0; i < items.length; i++)
        {
            three.appendItemSeparator(i + 1, i == items.length - 1, ",", "and", " ").append(items[i]);
        }
        assertThat(finish(three), is("a, b, and c"));

        TextSink two = new TextSink();
        two.appendItemSeparator(1, false, ",", "or", " ").append("x");
        two.appendItemSeparator(2, true, ",", "or", " ").append("y");
        assertThat(finish(two), is("x or y"));
    }
}
