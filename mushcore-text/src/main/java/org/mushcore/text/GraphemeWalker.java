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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.ibm.icu.text.BreakIterator;

/**
 * <p>Walks a NUL terminated UTF-8 string one extended grapheme cluster at a time.</p>
 * <p>Cluster boundaries come from the character break iterator of a
 * {@link UnicodeContext}. The walker decodes the string once, keeping the byte
 * offset of every UTF-16 unit so that ICU boundaries map back onto the UTF-8
 * source, then produces clusters lazily.</p>
 */
public class GraphemeWalker implements Iterator<GraphemeCluster>
{
    private static final int SMALL_CLUSTER = 32;
    private static final int INITIAL_WINDOW = 64;

    /**
     * Receives each cluster of a {@link #forEach(UnicodeContext, byte[], Callback)} traversal.
     */
    @FunctionalInterface
    public interface Callback
    {
        /**
         * @param cluster a copy of the cluster bytes in its first {@code length} bytes.
         * The array may be reused for the next cluster and must not be retained.
         * @param length the number of bytes in the cluster
         * @param source the string being walked
         * @param offset the byte offset of the cluster in the source
         * @return true to continue, false to stop the traversal
         */
        boolean onCluster(byte[] cluster, int length, byte[] source, int offset);
    }

    private final int[] _byteOffsets;
    private final int _units;
    private final BreakIterator _breaks;
    private int _boundary;
    private int _ordinal;

    public GraphemeWalker(UnicodeContext context, byte[] source)
    {
        this(context, source, 0, StringUtil.length(source));
    }

    GraphemeWalker(UnicodeContext context, byte[] source, int start, int end)
    {
        Objects.requireNonNull(source);
        StringBuilder text = new StringBuilder(end - start);
        // a UTF-16 unit never takes less than one UTF-8 byte
        _byteOffsets = new int[end - start + 1];
        int offset = start;
        while (offset < end)
        {
            long decoded = Utf8Walker.decode(source, offset);
            int codePoint = Utf8Walker.valueOf(decoded);
            int units = Character.charCount(codePoint);
            for (int i = 0; i < units; i++)
            {
                _byteOffsets[text.length() + i] = offset;
            }
            text.appendCodePoint(codePoint);
            offset += Utf8Walker.lengthOf(decoded);
        }
        _units = text.length();
        _byteOffsets[_units] = offset;
        _breaks = context.newCharacterBreakIterator();
        _breaks.setText(text.toString());
        _boundary = _breaks.first();
    }

    @Override
    public boolean hasNext()
    {
        return _boundary < _units;
    }

    @Override
    public GraphemeCluster next()
    {
        if (!hasNext())
            throw new NoSuchElementException();
        int following = _breaks.next();
        if (following == BreakIterator.DONE)
            following = _units;
        int offset = _byteOffsets[_boundary];
        GraphemeCluster cluster = new GraphemeCluster(offset, _byteOffsets[following] - offset, _ordinal++);
        _boundary = following;
        return cluster;
    }

    /**
     * Calls the callback with a copy of each cluster of the string. Clusters shorter
     * than 32 bytes are copied into one scratch array reused for the whole traversal,
     * longer ones into an array of their own; either is released before the next
     * cluster is produced.
     *
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @param callback the callback
     * @return true if the whole string was walked, false if the callback stopped early
     */
    public static boolean forEach(UnicodeContext context, byte[] s, Callback callback)
    {
        byte[] scratch = new byte[SMALL_CLUSTER];
        GraphemeWalker walker = new GraphemeWalker(context, s);
        while (walker.hasNext())
        {
            GraphemeCluster next = walker.next();
            int length = next.length();
            byte[] cluster = length < SMALL_CLUSTER ? scratch : new byte[length];
            System.arraycopy(s, next.offset(), cluster, 0, length);
            if (!callback.onCluster(cluster, length, s, next.offset()))
                return false;
        }
        return true;
    }

    /**
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @param offset the byte offset of the start of a cluster
     * @return the number of bytes in the cluster at the offset, 0 at the end of the string
     */
    public static int clusterLength(UnicodeContext context, byte[] s, int offset)
    {
        int end = StringUtil.end(s, offset);
        if (offset >= end)
            return 0;

        // There is always a boundary between two ASCII characters, except inside CR LF
        byte b = s[offset];
        if (b >= 0)
        {
            if (offset + 1 == end)
                return 1;
            byte following = s[offset + 1];
            if (following >= 0 && !(b == '\r' && following == '\n'))
                return 1;
        }

        int window = INITIAL_WINDOW;
        while (true)
        {
            int windowEnd = offset;
            while (windowEnd < end && windowEnd - offset < window)
            {
                windowEnd = Utf8Walker.next(s, windowEnd);
            }
            GraphemeCluster cluster = new GraphemeWalker(context, s, offset, windowEnd).next();
            // A boundary before the end of the window cannot move once more text is seen
            if (windowEnd == end || offset + cluster.length() < windowEnd)
                return cluster.length();
            window *= 2;
        }
    }

    /**
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @return the number of grapheme clusters in the string
     */
    public static int clusterCount(UnicodeContext context, byte[] s)
    {
        int n = 0;
        GraphemeWalker walker = new GraphemeWalker(context, s);
        while (walker.hasNext())
        {
            walker.next();
            n++;
        }
        return n;
    }

    /**
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @param clusters the number of clusters to measure
     * @return the number of bytes taken by the first {@code clusters} clusters,
     * or by the whole string if it is shorter
     */
    public static int byteLengthOf(UnicodeContext context, byte[] s, int clusters)
    {
        int length = 0;
        if (clusters <= 0)
            return length;
        GraphemeWalker walker = new GraphemeWalker(context, s);
        while (clusters-- > 0 && walker.hasNext())
        {
            GraphemeCluster cluster = walker.next();
            length = cluster.offset() + cluster.length();
        }
        return length;
    }

    /**
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @param clusters the number of clusters to copy
     * @return a new array holding the first {@code clusters} clusters
     */
    public static byte[] copyOf(UnicodeContext context, byte[] s, int clusters)
    {
        return Arrays.copyOf(s, byteLengthOf(context, s, clusters));
    }

    /**
     * @param context the Unicode context
     * @param s the UTF-8 string
     * @return the byte offset at which each cluster starts, in order
     */
    public static int[] breaks(UnicodeContext context, byte[] s)
    {
        int[] breaks = new int[StringUtil.length(s)];
        int n = 0;
        GraphemeWalker walker = new GraphemeWalker(context, s);
        while (walker.hasNext())
        {
            breaks[n++] = walker.next().offset();
        }
        return Arrays.copyOf(breaks, n);
    }
}
