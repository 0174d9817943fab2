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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.linecorp.armeria.common.MediaType;

/**
 * A {@link Codec} that encodes plain Java objects, such as POJOs and {@link java.util.Map}s, as JSON
 * using a Jackson {@link ObjectMapper}.
 *
 * <p>This {@link Codec} does not implement {@link DelimitedCodec}, so the elements of a stream are
 * separated by a newline.
 */
public final class JacksonCodec implements Codec {

    private static final JacksonCodec DEFAULT = new JacksonCodec(new ObjectMapper());

    /**
     * Returns the {@link JacksonCodec} that uses a default {@link ObjectMapper}.
     */
    public static JacksonCodec ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link JacksonCodec} that uses the specified {@link ObjectMapper}.
     * The {@link ObjectMapper} must not be reconfigured after this method is called.
     */
    public static JacksonCodec of(ObjectMapper mapper) {
        return new JacksonCodec(requireNonNull(mapper, "mapper"));
    }

    private final ObjectMapper mapper;

    private JacksonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(Object value) {
        requireNonNull(value, "value");
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new EncodingException("failed to serialize " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] data, Class<T> type) {
        requireNonNull(data, "data");
        requireNonNull(type, "type");
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new EncodingException("failed to deserialize " + type.getName(), e);
        }
    }

    @Override
    public MediaType contentType() {
        return MediaType.JSON;
    }

    @Override
    public String toString() {
        return "JacksonCodec";
    }
}
