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
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;

public class TextLimitsTest
{
    @Test
    public void testParse()
    {
        assertThat(TextLimits.parse("limit", "4096", 100), is(4096));
        assertThat(TextLimits.parse("limit", " 512 ", 100), is(512));
        assertThat(TextLimits.parse("limit", null, 100), is(100));
        assertThat(TextLimits.parse("limit", "lots", 100), is(100));
        assertThat(TextLimits.parse("limit", "0", 100), is(100));
        assertThat(TextLimits.parse("limit", "-8", 100), is(100));
    }

    @Test
    public void testInitFromProperty()
    {
        String property = TextLimitsTest.class.getName() + ".limit";
        try
        {
            System.setProperty(property, "2048");
            assertThat(TextLimits.init(property, "MUSHCORE_TEST_UNSET_LIMIT", 100), is(2048));
            System.clearProperty(property);
            assertThat(TextLimits.init(property, "MUSHCORE_TEST_UNSET_LIMIT", 100), is(100));
        }
        finally
        {
            System.clearProperty(property);
        }
    }

    @Test
    public void testLimits()
    {
        assertThat(TextLimits.bufferLength(), greaterThan(1));
        assertThat(TextLimits.shortBufferLength(), greaterThan(1));
        assertThat(TextLimits.sinkMaxLength(), greaterThan(1));
        assertThat(TextBuffer.newBuffer().capacity(), is(TextLimits.bufferLength()));
        assertThat(TextBuffer.newShortBuffer().capacity(), is(TextLimits.shortBufferLength()));
    }
}
