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
 * One user perceived character: a run of codepoints between two extended
 * grapheme cluster boundaries.
 */
public final class GraphemeCluster
{
    private final int _offset;
    private final int _length;
    private final int _ordinal;

    public GraphemeCluster(int offset, int length, int ordinal)
    {
        _offset = offset;
        _length = length;
        _ordinal = ordinal;
    }

    /**
     * @return the byte offset of the cluster in its source
     */
    public int offset()
    {
        return _offset;
    }

    /**
     * @return the number of bytes in the cluster
     */
    public int length()
    {
        return _length;
    }

    /**
     * @return the position of the cluster in its source, counting from 0
     */
    public int ordinal()
    {
        return _ordinal;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof GraphemeCluster))
            return false;
        GraphemeCluster that = (GraphemeCluster)o;
        return _offset == that._offset && _length == that._length && _ordinal == that._ordinal;
    }

    @Override
    public int hashCode()
    {
        return 31 * (31 * _offset + _length) + _ordinal;
    }

    @Override
    public String toString()
    {
        return String.format("#%d@%d+%d", _ordinal, _offset, _length);
    }
}
