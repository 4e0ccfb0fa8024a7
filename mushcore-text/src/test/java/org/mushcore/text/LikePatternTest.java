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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

// @checkstyle-disable-check : AvoidEscapedUnicodeCharactersCheck
public class LikePatternTest
{
    @ParameterizedTest
    @CsvSource(delimiter = '|', emptyValue = "", value = {
        "foo*|foo%",
        "f?o|f_o",
        "*foo%bar*|%foo$%bar%",
        "a_b|a$_b",
        "cost$|cost$$",
        "\\*literal\\?|$*literal$?",
        "trailing\\|trailing",
        "''|''"
    })
    public void testGlobToLike(String glob, String like)
    {
        byte[] result = LikePattern.globToLike(StringUtil.toBytes(glob), '$');
        assertThat(StringUtil.toString(result), is(like));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', emptyValue = "", value = {
        "foo%|foo$%",
        "f_o|f$_o",
        "foobar|foobar",
        "a*b?|a*b?",
        "\\%|$%",
        "''|''"
    })
    public void testEscapeLike(String s, String escaped)
    {
        byte[] result = LikePattern.escapeLike(StringUtil.toBytes(s), '$');
        assertThat(StringUtil.toString(result), is(escaped));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "caf\u00E9*|caf\u00E9%",
        "\u00E9_|\u00E9\u00A7_"
    })
    public void testUnicode(String glob, String like)
    {
        byte[] result = LikePattern.globToLike(StringUtil.toBytes(glob), 0xA7);
        assertThat(StringUtil.toString(result), is(like));
    }
}
