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
 * A decoded codepoint together with where it was found in its UTF-8 source.
 */
public final class CodePoint
{
    private final int _value;
    private final int _offset;
    private final int _length;

    public CodePoint(int value, int offset, int length)
    {
        _value = value;
        _offset = offset;
        _length = length;
    }

    /**
     * @return the Unicode scalar value
     */
    public int value()
    {
        return _value;
    }

    /**
     * @return the byte offset of the first byte of the encoded codepoint
     */
    public int offset()
    {
        return _offset;
    }

    /**
     * @return the number of bytes (1 to 4) the codepoint occupies in the source
     */
    public int length()
    {
        return _length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof CodePoint))
            return false;
        CodePoint that = (CodePoint)o;
        return _value == that._value && _offset == that._offset && _length == that._length;
    }

    @Override
    public int hashCode()
    {
        return 31 * (31 * _value + _offset) + _length;
    }

    @Override
    public String toString()
    {
        return String.format("U+%04X@%d+%d", _value, _offset, _length);
    }
}
