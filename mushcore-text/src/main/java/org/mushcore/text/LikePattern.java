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
 * Builds SQL {@code LIKE} patterns from UTF-8 text.
 *
 * <p>In both conversions a backslash escapes the character that follows it and
 * {@code %}, {@code _} and the escape character itself are escaped. A backslash at
 * the end of the input is dropped.</p>
 */
public class LikePattern
{
    private LikePattern()
    {
    }

    /**
     * Converts a wildcard pattern: {@code *} matches any run of characters and
     * becomes {@code %}, {@code ?} matches any one character and becomes {@code _}.
     *
     * @param glob the wildcard pattern
     * @param escape the escape codepoint of the {@code LIKE} pattern
     * @return the {@code LIKE} pattern
     */
    public static byte[] globToLike(byte[] glob, int escape)
    {
        return convert(glob, escape, true);
    }

    /**
     * Escapes the {@code LIKE} wildcards of a literal string.
     *
     * @param s the string
     * @param escape the escape codepoint of the {@code LIKE} pattern
     * @return the escaped string
     */
    public static byte[] escapeLike(byte[] s, int escape)
    {
        return convert(s, escape, false);
    }

    private static byte[] convert(byte[] s, int escape, boolean glob)
    {
        TextSink out = new TextSink();
        int offset = 0;
        while (offset < s.length && s[offset] != 0)
        {
            int c = Utf8Walker.codePointAt(s, offset);
            offset = Utf8Walker.next(s, offset);
            if (c == '%' || c == '_' || c == escape)
            {
                out.appendCodePoint(escape).appendCodePoint(c);
            }
            else if (c == '\\')
            {
                c = Utf8Walker.codePointAt(s, offset);
                if (c == 0)
                    break;
                offset = Utf8Walker.next(s, offset);
                out.appendCodePoint(escape).appendCodePoint(c);
            }
            else if (glob && c == '*')
            {
                out.write('%');
            }
            else if (glob && c == '?')
            {
                out.write('_');
            }
            else
            {
                out.appendCodePoint(c);
            }
        }
        return out.finish();
    }
}
