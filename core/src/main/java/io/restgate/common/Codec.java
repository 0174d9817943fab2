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

import com.linecorp.armeria.common.MediaType;

/**
 * Serializes response messages into wire bytes and deserializes request content.
 * A {@link Codec} is shared by all requests, so an implementation must not keep any per-call state.
 *
 * <p>A {@link Codec} which also implements {@link DelimitedCodec} chooses the bytes written
 * between two consecutive elements of a streaming response. Otherwise, a single newline is used.
 */
public interface Codec {

    /**
     * Serializes the specified {@code value}.
     *
     * @throws EncodingException if the {@code value} cannot be serialized
     */
    byte[] serialize(Object value);

    /**
     * Deserializes the specified {@code data} into a new instance of the specified {@code type}.
     *
     * @throws EncodingException if the {@code data} is malformed or does not match the {@code type}
     */
    <T> T deserialize(byte[] data, Class<T> type);

    /**
     * Returns the {@link MediaType} of the content produced by {@link #serialize(Object)}.
     */
    MediaType contentType();
}
