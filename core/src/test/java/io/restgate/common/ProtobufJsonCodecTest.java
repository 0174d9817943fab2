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

import static net.javacrumbs.jsonunit.fluent.JsonFluentAssert.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Duration;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.google.rpc.ErrorInfo;
import com.google.rpc.RetryInfo;

import com.linecorp.armeria.common.MediaType;

class ProtobufJsonCodecTest {

    private static final RetryInfo RETRY_INFO =
            RetryInfo.newBuilder()
                     .setRetryDelay(Duration.newBuilder().setSeconds(1))
                     .build();

    @Test
    void serializeMessage() {
        assertThat(toString(ProtobufJsonCodec.ofDefault().serialize(RETRY_INFO)))
                .isEqualTo("{\"retryDelay\":\"1s\"}");
    }

    @Test
    void preservingProtoFieldNames() {
        final ProtobufJsonCodec codec = ProtobufJsonCodec.builder()
                                                         .preservingProtoFieldNames(true)
                                                         .build();
        assertThat(toString(codec.serialize(RETRY_INFO))).isEqualTo("{\"retry_delay\":\"1s\"}");
    }

    @Test
    void includingDefaultValueFields() {
        final ProtobufJsonCodec codec = ProtobufJsonCodec.builder()
                                                         .includingDefaultValueFields(true)
                                                         .build();
        assertThatJson(toString(codec.serialize(ErrorInfo.getDefaultInstance())))
                .isEqualTo("{\"reason\":\"\",\"domain\":\"\",\"metadata\":{}}");
        assertThat(toString(ProtobufJsonCodec.ofDefault().serialize(ErrorInfo.getDefaultInstance())))
                .isEqualTo("{}");
    }

    @Test
    void prettyPrint() {
        final ProtobufJsonCodec codec = ProtobufJsonCodec.builder().prettyPrint(true).build();
        final String json = toString(codec.serialize(ImmutableMap.of("result", RETRY_INFO)));
        assertThat(json).contains("\n");
        assertThatJson(json).isEqualTo("{\"result\":{\"retryDelay\":\"1s\"}}");
    }

    @Test
    void messagesNestedInMap() {
        final byte[] data = ProtobufJsonCodec.ofDefault().serialize(ImmutableMap.of("result", RETRY_INFO));
        assertThat(toString(data)).isEqualTo("{\"result\":{\"retryDelay\":\"1s\"}}");
    }

    @Test
    void messagesNestedInList() {
        final Struct struct = Struct.newBuilder()
                                    .putFields("id", Value.newBuilder().setStringValue("One").build())
                                    .build();
        final byte[] data = ProtobufJsonCodec.ofDefault().serialize(ImmutableList.of(struct, RETRY_INFO));
        assertThat(toString(data)).isEqualTo("[{\"id\":\"One\"},{\"retryDelay\":\"1s\"}]");
    }

    @Test
    void wellKnownTypes() {
        final Value value = Value.newBuilder().setStringValue("foo").build();
        assertThat(toString(ProtobufJsonCodec.ofDefault().serialize(value))).isEqualTo("\"foo\"");
        assertThat(toString(ProtobufJsonCodec.ofDefault().serialize(ImmutableMap.of("result", value))))
                .isEqualTo("{\"result\":\"foo\"}");
    }

    @Test
    void serializePojo() {
        final byte[] data = ProtobufJsonCodec.ofDefault().serialize(ImmutableMap.of("count", 3));
        assertThat(toString(data)).isEqualTo("{\"count\":3}");
    }

    @Test
    void serializationFailure() {
        assertThatThrownBy(() -> ProtobufJsonCodec.ofDefault().serialize(new Object()))
                .isInstanceOf(EncodingException.class);
    }

    @Test
    void deserializeMessage() {
        final RetryInfo parsed = ProtobufJsonCodec.ofDefault().deserialize(
                "{\"retry_delay\":\"2s\"}".getBytes(StandardCharsets.UTF_8), RetryInfo.class);
        assertThat(parsed.getRetryDelay().getSeconds()).isEqualTo(2);
    }

    @Test
    void deserializeUnknownField() {
        final byte[] data = "{\"retryDelay\":\"2s\",\"unknown\":1}".getBytes(StandardCharsets.UTF_8);
        assertThatThrownBy(() -> ProtobufJsonCodec.ofDefault().deserialize(data, RetryInfo.class))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining(RetryInfo.class.getName());

        final ProtobufJsonCodec lenient = ProtobufJsonCodec.builder().ignoringUnknownFields(true).build();
        assertThat(lenient.deserialize(data, RetryInfo.class).getRetryDelay().getSeconds()).isEqualTo(2);
    }

    @Test
    void deserializePojo() {
        final Map<?, ?> map = ProtobufJsonCodec.ofDefault().deserialize(
                "{\"id\":\"foo\"}".getBytes(StandardCharsets.UTF_8), Map.class);
        assertThat(map.get("id")).isEqualTo("foo");
    }

    @Test
    void delimiter() {
        assertThat(ProtobufJsonCodec.ofDefault().delimiter()).containsExactly('\n');
        assertThat(ProtobufJsonCodec.builder().delimiter("\r\n").build().delimiter())
                .containsExactly('\r', '\n');
        assertThatThrownBy(() -> ProtobufJsonCodec.builder().delimiter(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void delimiterIsCopied() {
        final byte[] delimiter = ProtobufJsonCodec.ofDefault().delimiter();
        delimiter[0] = '|';
        assertThat(ProtobufJsonCodec.ofDefault().delimiter()).containsExactly('\n');
    }

    @Test
    void contentType() {
        assertThat(ProtobufJsonCodec.ofDefault().contentType()).isSameAs(MediaType.JSON);
    }

    private static String toString(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }
}
