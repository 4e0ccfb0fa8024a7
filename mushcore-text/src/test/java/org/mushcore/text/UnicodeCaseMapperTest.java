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

import com.ibm.icu.util.ULocale;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

// @checkstyle-disable-check : AvoidEscapedUnicodeCharactersCheck
public class UnicodeCaseMapperTest
{
    private final UnicodeContext _context = new UnicodeContext();

    private static byte[] utf8(String s)
    {
        return StringUtil.toBytes(s);
    }

    @Test
    public void testUpperCaseInPlace()
    {
        byte[] s = utf8("aaaA");
        assertThat(UnicodeCaseMapper.upperCaseInPlace(_context, s), is(0));
        assertThat(StringUtil.toString(s), is("AAAA"));

        s = utf8("áâ");
        UnicodeCaseMapper.upperCaseInPlace(_context, s);
        assertThat(StringUtil.toString(s), is("ÁÂ"));

        s = utf8("thiß");
        assertThat(UnicodeCaseMapper.upperCaseInPlace(_context, s), is(0));
        assertThat(StringUtil.toString(s), is("THIß"));
    }

    @Test
    public void testLowerCaseInPlace()
    {
        byte[] s = utf8("AAAa");
        UnicodeCaseMapper.lowerCaseInPlace(_context, s);
        assertThat(StringUtil.toString(s), is("aaaa"));

        s = utf8("ÁÂ");
        UnicodeCaseMapper.lowerCaseInPlace(_context, s);
        assertThat(StringUtil.toString(s), is("áâ"));

        s = utf8("THIß");
        UnicodeCaseMapper.lowerCaseInPlace(_context, s);
        assertThat(StringUtil.toString(s), is("thiß"));
    }

    @Test
    public void testInPlaceSkipsLengthChangingCodePoints()
    {
        // dotless i is two bytes, its uppercase I is one
        byte[] s = utf8("\u0131x");
        assertThat(UnicodeCaseMapper.upperCaseInPlace(_context, s), is(1));
        assertThat(StringUtil.toString(s), is("\u0131X"));

        // the Kelvin sign is three bytes, its lowercase k is one
        s = utf8("\u212AB");
        assertThat(UnicodeCaseMapper.lowerCaseInPlace(_context, s), is(1));
        assertThat(StringUtil.toString(s), is("\u212Ab"));
    }

    @Test
    public void testAllocatedUsesFullMapping()
    {
        assertThat(StringUtil.toString(UnicodeCaseMapper.toUpperCase(_context, utf8("aaaA"))), is("AAAA"));
        assertThat(StringUtil.toString(UnicodeCaseMapper.toUpperCase(_context, utf8("áâ"))), is("ÁÂ"));
        byte[] upper = UnicodeCaseMapper.toUpperCase(_context, utf8("thiß"));
        assertThat(StringUtil.toString(upper), is("THISS"));
        assertThat(upper.length, is(5));

        assertThat(StringUtil.toString(UnicodeCaseMapper.toLowerCase(_context, utf8("AAAa"))), is("aaaa"));
        assertThat(StringUtil.toString(UnicodeCaseMapper.toLowerCase(_context, utf8("ÁÂ"))), is("áâ"));
        assertThat(UnicodeCaseMapper.toLowerCase(_context, StringUtil.EMPTY).length, is(0));
    }

    @Test
    public void testLocaleAwareMapping()
    {
        UnicodeContext turkish = new UnicodeContext(new ULocale("tr"));
        assertThat(StringUtil.toString(UnicodeCaseMapper.toUpperCase(turkish, utf8("i"))), is("\u0130"));
        assertThat(StringUtil.toString(UnicodeCaseMapper.toUpperCase(_context, utf8("i"))), is("I"));
    }

    @Test
    public void testIntoBufferWritesWholeCodePoints()
    {
        byte[] dst = new byte[5];
        UnicodeCaseMapper.toUpperCase(_context, utf8("ééé"), dst);
        assertThat(StringUtil.toString(dst), is("ÉÉ"));

        dst = new byte[4];
        UnicodeCaseMapper.toUpperCase(_context, utf8("aéé"), dst);
        assertThat(StringUtil.toString(dst), is("AÉ"));
        assertThat(dst[3], is((byte)0));

        dst = new byte[16];
        UnicodeCaseMapper.toLowerCase(_context, utf8("ÀB"), dst);
        assertThat(StringUtil.toString(dst), is("àb"));
    }

    @Test
    public void testMapInPlaceOrCopy()
    {
        byte[] s = utf8("éa");
        assertThat(UnicodeCaseMapper.mapInPlaceOrCopy(_context, s, UnicodeCaseMapper.Mapping.UPPER), sameInstance(s));
        assertThat(StringUtil.toString(s), is("ÉA"));

        s = utf8("thiß");
        byte[] mapped = UnicodeCaseMapper.mapInPlaceOrCopy(_context, s, UnicodeCaseMapper.Mapping.UPPER);
        assertThat(mapped, not(sameInstance(s)));
        assertThat(StringUtil.toString(mapped), is("THISS"));
        assertThat(StringUtil.toString(s), is("thiß"));
    }

    @Test
    public void testInitialCase()
    {
        assertThat(StringUtil.toString(UnicodeCaseMapper.toInitialCase(_context, utf8("éCOLE"))), is("École"));
        assertThat(StringUtil.toString(UnicodeCaseMapper.toInitialCase(_context, utf8("ßIG"))), is("SSig"));
        assertThat(UnicodeCaseMapper.toInitialCase(_context, StringUtil.EMPTY).length, is(0));

        byte[] dst = new byte[4];
        UnicodeCaseMapper.toInitialCase(_context, utf8("éCOLE"), dst);
        assertThat(StringUtil.toString(dst), is("Éc"));
    }

    @Test
    public void testCompareIgnoreCase()
    {
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("Straße"), utf8("STRASSE")), is(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("ÉCOLE"), utf8("école")), is(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("abc"), utf8("ABD")), lessThan(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("abcd"), utf8("ABC")), greaterThan(0));
    }

    @Test
    public void testCompareIgnoreCasePrefix()
    {
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("hello world"), utf8("HELLO there"), 5), is(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("hello world"), utf8("HELLO there"), 7), greaterThan(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("abc"), utf8("ABD"), 2), is(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("abc"), utf8("ABD"), 3), lessThan(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("\u00C9cole"), utf8("\u00E9COLIER"), 5), is(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("ab"), utf8("ABC"), 5), lessThan(0));
        assertThat(UnicodeCaseMapper.compareIgnoreCase(_context, utf8("abc"), utf8("xyz"), 0), is(0));
    }
}
