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
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.Internal;
import com.google.protobuf.Message;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;

import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * A {@link Codec} that encodes protobuf {@link Message}s as JSON using {@link JsonFormat}.
 *
 * <p>Values which are not protobuf messages, such as the {@link Map} envelopes of a streaming response
 * and error payloads, are rendered with Jackson. Protobuf messages nested in such a value are still
 * printed with {@link JsonFormat}, so {@code {"result": message}} has the same field names as
 * {@code message} alone.
 */
public final class ProtobufJsonCodec implements Codec, DelimitedCodec {

    private static final ProtobufJsonCodec DEFAULT = builder().build();

    /**
     * Returns the {@link ProtobufJsonCodec} with the default options, which uses lowerCamelCase field
     * names, omits fields set to their default values and separates stream elements with a newline.
     */
    public static ProtobufJsonCodec ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link ProtobufJsonCodecBuilder}.
     */
    public static ProtobufJsonCodecBuilder builder() {
        return new ProtobufJsonCodecBuilder();
    }

    private final JsonFormat.Printer printer;
    private final JsonFormat.Parser parser;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final byte[] delimiter;

    ProtobufJsonCodec(JsonFormat.Printer printer, JsonFormat.Parser parser,
                      ObjectMapper mapper, boolean prettyPrint, byte[] delimiter) {
        this.printer = printer;
        this.parser = parser;
        this.mapper = mapper;
        writer = prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        this.delimiter = delimiter;
    }

    @Override
    public byte[] serialize(Object value) {
        requireNonNull(value, "value");
        try {
            if (value instanceof MessageOrBuilder) {
                return printer.print((MessageOrBuilder) value).getBytes(StandardCharsets.UTF_8);
            }
            return writer.writeValueAsBytes(toJsonNode(value));
        } catch (IOException | IllegalArgumentException e) {
            throw new EncodingException("failed to serialize " + value.getClass().getName(), e);
        }
    }

    private JsonNode toJsonNode(@Nullable Object value) throws IOException {
        if (value instanceof MessageOrBuilder) {
            return mapper.readTree(printer.print((MessageOrBuilder) value));
        }
        if (value instanceof Map) {
            final ObjectNode node = mapper.createObjectNode();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                node.set(String.valueOf(e.getKey()), toJsonNode(e.getValue()));
            }
            return node;
        }
        if (value instanceof Iterable) {
            final ArrayNode node = mapper.createArrayNode();
            for (Object element : (Iterable<?>) value) {
                node.add(toJsonNode(element));
            }
            return node;
        }
        return mapper.valueToTree(value);
    }

    @Override
    public <T> T deserialize(byte[] data, Class<T> type) {
        requireNonNull(data, "data");
        requireNonNull(type, "type");
        try {
            if (!Message.class.isAssignableFrom(type)) {
                return mapper.readValue(data, type);
            }
            @SuppressWarnings("unchecked")
            final Class<? extends Message> messageType = (Class<? extends Message>) type;
            final Message.Builder builder = Internal.getDefaultInstance(messageType).newBuilderForType();
            parser.merge(new String(data, StandardCharsets.UTF_8), builder);
            return type.cast(builder.build());
        } catch (IOException | IllegalArgumentException e) {
            throw new EncodingException("failed to deserialize " + type.getName(), e);
        }
    }

    @Override
    public MediaType contentType() {
        return MediaType.JSON;
    }

    @Override
    public byte[] delimiter() {
        return delimiter.clone();
    }

    @Override
    public String toString() {
        return "ProtobufJsonCodec";
    }
}
