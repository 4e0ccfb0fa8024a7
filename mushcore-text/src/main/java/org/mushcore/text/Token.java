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
import java.util.Arrays;
import java.util.Objects;

/**
 * A token split out of a string: a slice of the source array, which still owns the bytes.
 */
public class Token
{
    private final byte[] _source;
    private final int _offset;
    private final int _length;

    public Token(byte[] source, int offset, int length)
    {
        _source = Objects.requireNonNull(source);
        if (offset < 0 || length < 0 || offset + length > source.length)
            throw new IllegalArgumentException("Invalid token " + offset + "+" + length + " of " + source.length);
        _offset = offset;
        _length = length;
    }

    public byte[] source()
    {
        return _source;
    }

    public int offset()
    {
        return _offset;
    }

    public int length()
    {
        return _length;
    }

    public boolean isEmpty()
    {
        return _length == 0;
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOfRange(_source, _offset, _offset + _length);
    }

    public String asString()
    {
        return new String(_source, _offset, _length, StandardCharsets.UTF_8);
    }

    /**
     * @param word a string
     * @return true if the token holds exactly the bytes of {@code word} up to its terminator
     */
    public boolean matches(byte[] word)
    {
        int length = StringUtil.length(word);
        if (length != _length)
            return false;
        for (int i = 0; i < length; i++)
        {
            if (_source[_offset + i] != word[i])
                return false;
        }
        return true;
    }

    @Override
    public String toString()
    {
        return String.format("Token@%d+%d[%s]", _offset, _length, asString());
    }
}
