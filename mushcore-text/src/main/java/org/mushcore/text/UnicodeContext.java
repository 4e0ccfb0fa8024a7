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

import java.util.Objects;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>The handle through which the text layer reaches the Unicode tables.</p>
 * <p>A context carries the locale used for full case mapping and a character
 * break iterator that is created on first use and cloned for every walk, as ICU
 * iterators are stateful. A context is meant to be confined to one thread:
 * either construct one and pass it explicitly, or use the per-thread instance
 * returned by {@link #current()}.</p>
 */
public class UnicodeContext
{
    private static final Logger LOG = LoggerFactory.getLogger(UnicodeContext.class);
    private static final ThreadLocal<UnicodeContext> __current = ThreadLocal.withInitial(UnicodeContext::new);

    private final ULocale _locale;
    private BreakIterator _characterBreaks;

    public UnicodeContext()
    {
        this(ULocale.ROOT);
    }

    public UnicodeContext(ULocale locale)
    {
        _locale = Objects.requireNonNull(locale);
    }

    /**
     * @return the context of the calling thread, created with the root locale on first use
     */
    public static UnicodeContext current()
    {
        return __current.get();
    }

    public ULocale getLocale()
    {
        return _locale;
    }

    /**
     * @return a fresh extended grapheme cluster iterator, with no text set
     */
    public BreakIterator newCharacterBreakIterator()
    {
        if (_characterBreaks == null)
        {
            _characterBreaks = BreakIterator.getCharacterInstance(_locale);
            if (LOG.isDebugEnabled())
                LOG.debug("Created character break iterator for {} in {}", _locale, this);
        }
        return (BreakIterator)_characterBreaks.clone();
    }

    /**
     * @param codePoint a codepoint
     * @return the simple (single codepoint) uppercase mapping
     */
    public int toUpperCase(int codePoint)
    {
        return UCharacter.toUpperCase(codePoint);
    }

    /**
     * @param codePoint a codepoint
     * @return the simple (single codepoint) lowercase mapping
     */
    public int toLowerCase(int codePoint)
    {
        return UCharacter.toLowerCase(codePoint);
    }

    /**
     * @param s text to map
     * @return the full uppercase mapping, which may change the length of the text
     */
    public String toUpperCase(String s)
    {
        return UCharacter.toUpperCase(_locale, s);
    }

    /**
     * @param s text to map
     * @return the full lowercase mapping, which may change the length of the text
     */
    public String toLowerCase(String s)
    {
        return UCharacter.toLowerCase(_locale, s);
    }

    /**
     * @param s text to fold
     * @return the full case folding of the text, without the Turkic dotted and dotless i mappings
     */
    public String foldCase(String s)
    {
        return UCharacter.foldCase(s, UCharacter.FOLD_CASE_EXCLUDE_SPECIAL_I);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), _locale);
    }
}
