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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>TextLimits provides the process-wide capacities used by the text layer.</p>
 * <p>Each limit is read once, when this class is initialized, from a System Property,
 * or if not set from an environment variable, or if not set from a built-in default.
 * Values that are not positive integers are reported and ignored.</p>
 * <ul>
 * <li>{@value #BUFFER_LENGTH_PROPERTY} / {@value #BUFFER_LENGTH_ENV}: capacity of long buffers (default {@value #DEFAULT_BUFFER_LENGTH})</li>
 * <li>{@value #SHORT_BUFFER_LENGTH_PROPERTY} / {@value #SHORT_BUFFER_LENGTH_ENV}: capacity of short buffers (default {@value #DEFAULT_SHORT_BUFFER_LENGTH})</li>
 * <li>{@value #SINK_MAX_LENGTH_PROPERTY} / {@value #SINK_MAX_LENGTH_ENV}: maximum length of a {@link TextSink} (defaults to the long buffer capacity)</li>
 * </ul>
 */
public class TextLimits
{
    private static final Logger LOG = LoggerFactory.getLogger(TextLimits.class);

    public static final String BUFFER_LENGTH_PROPERTY = "org.mushcore.text.bufferLength";
    public static final String BUFFER_LENGTH_ENV = "MUSHCORE_BUFFER_LENGTH";
    public static final String SHORT_BUFFER_LENGTH_PROPERTY = "org.mushcore.text.shortBufferLength";
    public static final String SHORT_BUFFER_LENGTH_ENV = "MUSHCORE_SBUF_LENGTH";
    public static final String SINK_MAX_LENGTH_PROPERTY = "org.mushcore.text.sinkMaxLength";
    public static final String SINK_MAX_LENGTH_ENV = "MUSHCORE_SINK_MAX_LENGTH";

    public static final int DEFAULT_BUFFER_LENGTH = 8192;
    public static final int DEFAULT_SHORT_BUFFER_LENGTH = 100;

    private static final int __bufferLength = init(BUFFER_LENGTH_PROPERTY, BUFFER_LENGTH_ENV, DEFAULT_BUFFER_LENGTH);
    private static final int __shortBufferLength = init(SHORT_BUFFER_LENGTH_PROPERTY, SHORT_BUFFER_LENGTH_ENV, DEFAULT_SHORT_BUFFER_LENGTH);
    private static final int __sinkMaxLength = init(SINK_MAX_LENGTH_PROPERTY, SINK_MAX_LENGTH_ENV, __bufferLength);

    private TextLimits()
    {
    }

    static int init(String property, String env, int defaultValue)
    {
        String value = System.getProperty(property, System.getenv(env));
        return parse(property, value, defaultValue);
    }

    static int parse(String name, String value, int defaultValue)
    {
        if (value == null)
            return defaultValue;
        try
        {
            int limit = Integer.parseInt(value.trim());
            if (limit > 0)
                return limit;
            LOG.warn("Ignoring non positive {}={}, using {}", name, value, defaultValue);
        }
        catch (NumberFormatException x)
        {
            LOG.warn("Ignoring invalid {}={}, using {}", name, value, defaultValue);
        }
        return defaultValue;
    }

    /**
     * @return the capacity of a long buffer, including the byte reserved for the terminator
     */
    public static int bufferLength()
    {
        return __bufferLength;
    }

    /**
     * @return the capacity of a short buffer, including the byte reserved for the terminator
     */
    public static int shortBufferLength()
    {
        return __shortBufferLength;
    }

    /**
     * @return the maximum number of bytes a {@link TextSink} accepts
     */
    public static int sinkMaxLength()
    {
        return __sinkMaxLength;
    }
}
