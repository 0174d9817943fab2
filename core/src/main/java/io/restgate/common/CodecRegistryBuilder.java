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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;

import com.linecorp.armeria.common.MediaType;

/**
 * Builds a new {@link CodecRegistry}.
 *
 * <pre>{@code
 * CodecRegistry registry = CodecRegistry.builder()
 *                                       .add(MediaType.parse("application/x-pojo+json"),
 *                                            JacksonCodec.ofDefault())
 *                                       .defaultCodec(ProtobufJsonCodec.ofDefault())
 *                                       .build();
 * }</pre>
 */
public final class CodecRegistryBuilder {

    private final Map<String, Codec> codecs = new LinkedHashMap<>();
    private Codec defaultCodec = ProtobufJsonCodec.builder()
                                                  .preservingProtoFieldNames(true)
                                                  .build();

    CodecRegistryBuilder() {}

    /**
     * Registers the specified {@link Codec} for the specified {@link MediaType}. The parameters of the
     * {@link MediaType}, such as {@code charset}, are ignored when a request is matched.
     */
    public CodecRegistryBuilder add(MediaType mediaType, Codec codec) {
        requireNonNull(mediaType, "mediaType");
        requireNonNull(codec, "codec");
        checkArgument(!mediaType.hasWildcard(),
                      "mediaType: %s (expected: a media type without a wildcard)", mediaType);
        codecs.put(CodecRegistry.key(mediaType), codec);
        return this;
    }

    /**
     * Registers the specified {@link Codec} for its own {@link Codec#contentType()}.
     */
    public CodecRegistryBuilder add(Codec codec) {
        requireNonNull(codec, "codec");
        return add(codec.contentType(), codec);
    }

    /**
     * Sets the {@link Codec} used when no registered media type matches a request.
     * A {@link ProtobufJsonCodec} which preserves the proto field names is used by default.
     */
    public CodecRegistryBuilder defaultCodec(Codec defaultCodec) {
        this.defaultCodec = requireNonNull(defaultCodec, "defaultCodec");
        return this;
    }

    /**
     * Returns a newly-created {@link CodecRegistry} based on the properties of this builder.
     */
    public CodecRegistry build() {
        return new CodecRegistry(codecs, defaultCodec);
    }
}
