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

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.util.JsonFormat;

/**
 * Builds a new {@link ProtobufJsonCodec}.
 *
 * <pre>{@code
 * ProtobufJsonCodec codec = ProtobufJsonCodec.builder()
 *                                            .preservingProtoFieldNames(true)
 *                                            .includingDefaultValueFields(true)
 *                                            .build();
 * }</pre>
 */
public final class ProtobufJsonCodecBuilder {

    private static final byte[] DEFAULT_DELIMITER = { '\n' };

    private boolean preservingProtoFieldNames;
    private boolean includingDefaultValueFields;
    private boolean prettyPrint;
    private boolean ignoringUnknownFields;
    private byte[] delimiter = DEFAULT_DELIMITER;
    private JsonFormat.TypeRegistry typeRegistry = JsonFormat.TypeRegistry.getEmptyTypeRegistry();
    private ObjectMapper objectMapper = new ObjectMapper();

    ProtobufJsonCodecBuilder() {}

    /**
     * Sets whether the original field names in the {@code .proto} file are used instead of
     * lowerCamelCase names. Disabled by default.
     */
    public ProtobufJsonCodecBuilder preservingProtoFieldNames(boolean preservingProtoFieldNames) {
        this.preservingProtoFieldNames = preservingProtoFieldNames;
        return this;
    }

    /**
     * Sets whether fields set to their default values are printed. Disabled by default.
     */
    public ProtobufJsonCodecBuilder includingDefaultValueFields(boolean includingDefaultValueFields) {
        this.includingDefaultValueFields = includingDefaultValueFields;
        return this;
    }

    /**
     * Sets whether the output is indented. Disabled by default. Note that an indented element of
     * a stream spans more than one line, so a client which splits a stream by newline will not be able
     * to parse it.
     */
    public ProtobufJsonCodecBuilder prettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        return this;
    }

    /**
     * Sets whether unknown fields are ignored when parsing. Disabled by default.
     */
    public ProtobufJsonCodecBuilder ignoringUnknownFields(boolean ignoringUnknownFields) {
        this.ignoringUnknownFields = ignoringUnknownFields;
        return this;
    }

    /**
     * Sets the delimiter written after each element of a stream. {@code "\n"} by default.
     */
    public ProtobufJsonCodecBuilder delimiter(String delimiter) {
        requireNonNull(delimiter, "delimiter");
        return delimiter(delimiter.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sets the delimiter written after each element of a stream. {@code "\n"} by default.
     */
    public ProtobufJsonCodecBuilder delimiter(byte[] delimiter) {
        requireNonNull(delimiter, "delimiter");
        checkArgument(delimiter.length > 0, "delimiter is empty.");
        this.delimiter = delimiter.clone();
        return this;
    }

    /**
     * Sets the {@link JsonFormat.TypeRegistry} used to print and parse {@code google.protobuf.Any}
     * fields.
     */
    public ProtobufJsonCodecBuilder typeRegistry(JsonFormat.TypeRegistry typeRegistry) {
        this.typeRegistry = requireNonNull(typeRegistry, "typeRegistry");
        return this;
    }

    /**
     * Sets the {@link ObjectMapper} used for values which are not protobuf messages.
     */
    public ProtobufJsonCodecBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        return this;
    }

    /**
     * Returns a newly-created {@link ProtobufJsonCodec} based on the properties of this builder.
     */
    public ProtobufJsonCodec build() {
        JsonFormat.Printer printer = JsonFormat.printer().usingTypeRegistry(typeRegistry);
        if (preservingProtoFieldNames) {
            printer = printer.preservingProtoFieldNames();
        }
        if (includingDefaultValueFields) {
            printer = printer.includingDefaultValueFields();
        }
        if (!prettyPrint) {
            printer = printer.omittingInsignificantWhitespace();
        }

        JsonFormat.Parser parser = JsonFormat.parser().usingTypeRegistry(typeRegistry);
        if (ignoringUnknownFields) {
            parser = parser.ignoringUnknownFields();
        }

        return new ProtobufJsonCodec(printer, parser, objectMapper, prettyPrint, delimiter);
    }
}
