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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

// @checkstyle-disable-check : AvoidEscapedUnicodeCharactersCheck
public class MarkupAwareScannerTest
{
    public static Stream<Arguments> scanners()
    {
        return Stream.of(
            Arguments.of(TextUnit.BYTE),
            Arguments.of(TextUnit.CODEPOINT),
            Arguments.of(TextUnit.grapheme(new UnicodeContext()))
        );
    }

    private static String remainder(byte[] s, Cursor cursor)
    {
        return cursor.isExhausted() ? null : StringUtil.toString(s, cursor.position());
    }

    @ParameterizedTest
    @MethodSource("scanners")
    public void testFindNextTokenStart(TextUnit unit)
    {
        MarkupAwareScanner space = new MarkupAwareScanner(unit, ' ');
        MarkupAwareScanner bar = new MarkupAwareScanner(unit, '|');

        byte[] s = StringUtil.toBytes("  a b");
        assertThat(s[space.findNextTokenStart(s, 0)], is((byte)'a'));

        s = StringUtil.toBytes("a|b");
        assertThat(s[bar.findNextTokenStart(s, 0)], is((byte)'b'));

        s = StringUtil.toBytes("\u001B[0ma b");
        assertThat(s[space.findNextTokenStart(s, 0)], is((byte)'b'));

        s = StringUtil.toBytes("   ");
        assertThat(space.findNextTokenStart(s, 0), is(3));

        assertThat(bar.findNextTokenStart(StringUtil.EMPTY, 0), is(-1));
    }

    @ParameterizedTest
    @MethodSource("scanners")
    public void testSeparatorInsideSpanIsNotABoundary(TextUnit unit)
    {
        MarkupAwareScanner bar = new MarkupAwareScanner(unit, '|');
        byte[] s = StringUtil.toBytes("a\u0002x|y\u0003b|c");
        assertThat(bar.findTokenEnd(s, 0), is(7));
        assertThat(bar.countTokens(s), is(2));

        MarkupAwareScanner space = new MarkupAwareScanner(unit, ' ');
        s = StringUtil.toBytes("\u001B[1 mx y");
        assertThat(space.countTokens(s), is(2));
    }

    @ParameterizedTest
    @MethodSource("scanners")
    public void testSplitOneToken(TextUnit unit)
    {
        MarkupAwareScanner space = new MarkupAwareScanner(unit, ' ');
        MarkupAwareScanner bar = new MarkupAwareScanner(unit, '|');

        Cursor cursor = new Cursor();
        cursor.exhaust();
        assertThat(space.splitOneToken(StringUtil.toBytes("a"), cursor), nullValue());
        assertThat(cursor.isExhausted(), is(true));

        byte[] s = StringUtil.toBytes("  a b");
        cursor = new Cursor();
        assertThat(space.splitOneToken(s, cursor).asString(), is(""));
        assertThat(remainder(s, cursor), is("a b"));

        s = StringUtil.toBytes("a|b");
        cursor = new Cursor();
        assertThat(bar.splitOneToken(s, cursor).asString(), is("a"));
        assertThat(remainder(s, cursor), is("b"));
        assertThat(s[1], is((byte)0));

        s = StringUtil.toBytes("\u001B[0ma b");
        cursor = new Cursor();
        assertThat(space.splitOneToken(s, cursor).asString(), is("\u001B[0ma"));
        assertThat(remainder(s, cursor), is("b"));

        s = StringUtil.toBytes("   ");
        cursor = new Cursor();
        assertThat(space.splitOneToken(s, cursor).asString(), is(""));
        assertThat(remainder(s, cursor), is(""));

        s = StringUtil.toBytes("");
        cursor = new Cursor();
        Token last = bar.splitOneToken(s, cursor);
        assertThat(last.isEmpty(), is(true));
        assertThat(cursor.isExhausted(), is(true));
        assertThat(bar.splitOneToken(s, cursor), nullValue());
    }

    @Test
    public void testSplitAll()
    {
        MarkupAwareScanner bar = MarkupAwareScanner.forBytes((byte)'|');
        byte[] s = StringUtil.toBytes("a||b|");
        Cursor cursor = new Cursor();
        List<String> tokens = new ArrayList<>();
        Token token;
        while ((token = bar.splitOneToken(s, cursor)) != null)
        {
            tokens.add(token.asString());
        }
        assertThat(tokens, contains("a", "", "b", ""));
    }

    @ParameterizedTest
    @MethodSource("scanners")
    public void testCountTokens(TextUnit unit)
    {
        MarkupAwareScanner space = new MarkupAwareScanner(unit, ' ');
        MarkupAwareScanner bar = new MarkupAwareScanner(unit, '|');
        assertThat(space.countTokens(StringUtil.toBytes("A B C D")), is(4));
        assertThat(bar.countTokens(StringUtil.toBytes("A|B|C|D")), is(4));
        assertThat(space.countTokens(StringUtil.toBytes("A  B  C  D")), is(4));
        assertThat(bar.countTokens(StringUtil.toBytes("A  B  C  D")), is(1));
        assertThat(space.countTokens(StringUtil.toBytes("")), is(0));
        assertThat(bar.countTokens(StringUtil.toBytes("|")), is(2));
        assertThat(space.countTokens(StringUtil.toBytes("   ")), is(2));
    }

    @Test
    public void testMultiByteSeparator()
    {
        MarkupAwareScanner nbsp = MarkupAwareScanner.forCodePoints(0xA0);
        byte[] s = StringUtil.toBytes("a\u00A0q");
        assertThat(s[nbsp.findNextTokenStart(s, 0)], is((byte)'q'));

        Cursor cursor = new Cursor();
        assertThat(nbsp.splitOneToken(s, cursor).asString(), is("a"));
        assertThat(cursor.position(), is(3));
        assertThat(remainder(s, cursor), is("q"));
        assertThat(nbsp.countTokens(StringUtil.toBytes("é\u00A0ü\u00A0")), is(3));
    }

    @Test
    public void testGraphemeSeparatorIgnoresCombinedBase()
    {
        UnicodeContext context = new UnicodeContext();
        byte[] s = StringUtil.toBytes("ab|\u0301c|d");
        assertThat(MarkupAwareScanner.forGraphemes(context, '|').countTokens(s), is(2));
        assertThat(MarkupAwareScanner.forCodePoints('|').countTokens(s), is(3));
    }

    @Test
    public void testTrimSeparatorRuns()
    {
        MarkupAwareScanner space = MarkupAwareScanner.forBytes((byte)' ');
        byte[] s = StringUtil.toBytes("  foo  ");
        assertThat(StringUtil.toString(s, space.trimSeparatorRuns(s)), is("foo"));

        s = StringUtil.toBytes("  foo  ");
        assertThat(StringUtil.toString(s, MarkupAwareScanner.forBytes((byte)'x').trimSeparatorRuns(s)), is("  foo  "));

        for (String text : new String[]{"foo", "  foo", "foo  "})
        {
            s = StringUtil.toBytes(text);
            assertThat(StringUtil.toString(s, space.trimSeparatorRuns(s)), is("foo"));
        }
    }

    @Test
    public void testRemoveWord()
    {
        byte[] list = StringUtil.toBytes("adam boy charles");
        byte[] removed = MarkupAwareScanner.forBytes((byte)' ').removeWord(list, StringUtil.toBytes("boy"));
        assertThat(StringUtil.toString(removed), is("adam charles"));
        assertThat(StringUtil.toString(list), is("adam boy charles"));

        removed = MarkupAwareScanner.forBytes((byte)'|').removeWord(StringUtil.toBytes("adam|boy|charles"), StringUtil.toBytes("charles"));
        assertThat(StringUtil.toString(removed), is("adam|boy"));

        removed = MarkupAwareScanner.forBytes((byte)'|').removeWord(StringUtil.toBytes("adam|boy|adam"), StringUtil.toBytes("adam"));
        assertThat(StringUtil.toString(removed), is("boy|adam"));

        removed = MarkupAwareScanner.forCodePoints(0xB7).removeWord(StringUtil.toBytes("un\u00B7deux\u00B7trois"), StringUtil.toBytes("deux"));
        assertThat(StringUtil.toString(removed), is("un\u00B7trois"));

        removed = MarkupAwareScanner.forBytes((byte)' ').removeWord(StringUtil.toBytes("solo"), StringUtil.toBytes("missing"));
        assertThat(StringUtil.toString(removed), is("solo"));
    }

    @Test
    public void testInvalidSeparator()
    {
        assertThrows(IllegalArgumentException.class, () -> MarkupAwareScanner.forCodePoints(0));
        assertThrows(NullPointerException.class, () -> new MarkupAwareScanner(null, ' '));
    }
}
