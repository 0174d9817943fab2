/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.restgate.common;

import static java.util.Objects.requireNonNull;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * Selects the {@link Codec} for a request. The {@link Codec} registered for the first matching media type
 * in the {@code accept} header is preferred, then the one registered for the {@code content-type} header.
 * The default {@link Codec} is used when nothing matches.
 */
public final class CodecRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CodecRegistry.class);

    private static final Splitter ACCEPT_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final CodecRegistry DEFAULT = builder().build();

    /**
     * Returns the {@link CodecRegistry} which has no registered media type and always selects
     * the default {@link ProtobufJsonCodec}.
     */
    public static CodecRegistry ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link CodecRegistryBuilder}.
     */
    public static CodecRegistryBuilder builder() {
        return new CodecRegistryBuilder();
    }

    private final Map<String, Codec> codecs;
    private final Codec defaultCodec;

    CodecRegistry(Map<String, Codec> codecs, Codec defaultCodec) {
        this.codecs = ImmutableMap.copyOf(codecs);
        this.defaultCodec = defaultCodec;
    }

    /**
     * Returns the {@link Codec} used when a request does not ask for a registered media type.
     */
    public Codec defaultCodec() {
        return defaultCodec;
    }

    /**
     * Returns the {@link Codec} registered for the specified {@link MediaType}, ignoring its parameters,
     * or {@code null} if there's no such {@link Codec}.
     */
    @Nullable
    public Codec find(MediaType mediaType) {
        requireNonNull(mediaType, "mediaType");
        return codecs.get(key(mediaType));
    }

    /**
     * Returns the {@link Codec} for the request with the specified {@link RequestHeaders}.
     */
    public Codec forRequest(RequestHeaders headers) {
        requireNonNull(headers, "headers");
        for (String accept : headers.getAll(HttpHeaderNames.ACCEPT)) {
            for (String range : ACCEPT_SPLITTER.split(accept)) {
                final Codec codec = findByHeaderValue(range);
                if (codec != null) {
                    return codec;
                }
            }
        }

        final String contentType = headers.get(HttpHeaderNames.CONTENT_TYPE);
        if (contentType != null) {
            final Codec codec = findByHeaderValue(contentType);
            if (codec != null) {
                return codec;
            }
        }
        return defaultCodec;
    }

    @Nullable
    private Codec findByHeaderValue(String value) {
        final MediaType mediaType;
        try {
            mediaType = MediaType.parse(value);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring a malformed media type: {}", value, e);
            return null;
        }
        if (mediaType.hasWildcard()) {
            return null;
        }
        return find(mediaType);
    }

    static String key(MediaType mediaType) {
        return mediaType.type() + '/' + mediaType.subtype();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("codecs", codecs)
                          .add("defaultCodec", defaultCodec)
                          .toString();
    }
}
