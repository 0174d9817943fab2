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
package io.restgate.server;

import static io.restgate.server.DefaultHttpErrorWriterTest.newContext;
import static net.javacrumbs.jsonunit.fluent.JsonFluentAssert.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;

import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.grpc.Metadata;
import io.grpc.Status;
import io.restgate.common.Codec;
import io.restgate.common.EncodingException;
import io.restgate.common.ProtobufJsonCodec;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

class StreamForwarderTest {

    private static final Codec codec = ProtobufJsonCodec.ofDefault();

    private static final String ONE = "{\"result\":{\"id\":\"One\"}}";
    private static final String TWO = "{\"result\":{\"id\":\"Two\"}}";
    private static final String OUT_OF_RANGE_CHUNK =
            "{\"error\":{\"grpc_code\":11,\"http_code\":400,\"message\":\"400\"," +
            "\"http_status\":\"Bad Request\"}}";

    private static Stream<Arguments> streams() {
        return Stream.of(
                Arguments.of("encoding", ImmutableList.of(message("One"), message("Two")),
                             HttpStatus.OK, ImmutableList.of(ONE, TWO)),
                Arguments.of("empty", ImmutableList.of(),
                             HttpStatus.OK, ImmutableList.of()),
                Arguments.of("error", ImmutableList.of(outOfRange()),
                             HttpStatus.BAD_REQUEST, ImmutableList.of("{\"error\":\"400\",\"code\":11}")),
                Arguments.of("stream_error", ImmutableList.of(message("One"), message("Two"), outOfRange()),
                             HttpStatus.OK, ImmutableList.of(ONE, TWO, OUT_OF_RANGE_CHUNK)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("streams")
    void forward(String name, List<Object> outcomes, HttpStatus status, List<String> chunks) {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final TestReceiver receiver = new TestReceiver(outcomes);

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(), receiver);

        final ResponseHeaders headers = sink.headers();
        assertThat(headers.status()).isEqualTo(status);
        assertThat(headers.contentType()).isEqualTo(MediaType.JSON);
        final AggregatedHttpResponse res = sink.aggregate();
        if (status == HttpStatus.OK) {
            assertThat(headers.get(HttpHeaderNames.TRANSFER_ENCODING)).isEqualTo("chunked");
            assertThat(headers.contains(HttpHeaderNames.CONTENT_LENGTH)).isFalse();
            assertThat(res.contentUtf8()).isEqualTo(chunks.isEmpty() ? "" : String.join("\n", chunks) + '\n');
        }
        assertChunks(res, chunks);
        assertThat(receiver.calls).isEqualTo(receiver.expectedCalls());
    }

    @Test
    void flushesEveryChunk() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = spy(new AggregatingHttpResponseSink());

        StreamForwarder.ofDefault().forward(
                ctx, codec, sink, ctx.request().headers(),
                new TestReceiver(ImmutableList.of(message("One"), message("Two"), outOfRange())));

        verify(sink, times(3)).flush();
        verify(sink, times(6)).write(any());
    }

    @Test
    void customDelimiter() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final Codec codec = ProtobufJsonCodec.builder().delimiter("|").build();

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(),
                                            new TestReceiver(ImmutableList.of(message("One"), message("Two"))));

        assertThat(sink.aggregate().contentUtf8()).isEqualTo(ONE + '|' + TWO + '|');
    }

    @Test
    void codecWithoutDelimiterUsesNewline() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final Codec codec = new NonDelimitedCodec(ProtobufJsonCodec.builder().delimiter("|").build());
        final TestReceiver receiver = new TestReceiver(ImmutableList.of(message("One"), message("Two")));

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(), receiver);

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.OK);
        assertThat(res.contentUtf8()).isEqualTo(ONE + '\n' + TWO + '\n');
        assertThat(receiver.calls).isEqualTo(3);
    }

    @Test
    void contentTypeIsDecidedBeforeCommit() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();

        StreamForwarder.ofDefault().forward(
                ctx, new ErrorStringCodec(), sink, ctx.request().headers(),
                new TestReceiver(ImmutableList.of(message("One"), outOfRange())));

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.headers().contentType()).isEqualTo(MediaType.JSON);
        assertThat(res.contentUtf8()).isEqualTo(ONE + "\n400\n");
    }

    @Test
    void firstMessageEncodingFailure() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final TestReceiver receiver = new TestReceiver(ImmutableList.of(message("poison"), message("Two")));

        StreamForwarder.ofDefault().forward(ctx, new PoisonCodec(), sink, ctx.request().headers(), receiver);

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThatJson(res.contentUtf8()).isEqualTo("{\"error\":\"poisoned\",\"code\":13}");
        assertThat(receiver.calls).isOne();
    }

    @Test
    void immediateFailureSendsTrailersOnce() {
        final ServiceRequestContext ctx = newContext();
        ServerMetadata.set(ctx, ServerMetadata.of(new Metadata(), countTrailers()));
        final AggregatingHttpResponseSink sink = spy(new AggregatingHttpResponseSink());
        final TestReceiver receiver = new TestReceiver(ImmutableList.of(outOfRange()));

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(), receiver);

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.BAD_REQUEST);
        assertThat(res.trailers().get("grpc-trailer-count")).isEqualTo("0");
        verify(sink, times(1)).sendTrailers(any());
        assertThat(receiver.calls).isOne();
    }

    @Test
    void firstMessageEncodingFailureSendsTrailersOnce() {
        final ServiceRequestContext ctx = newContext();
        ServerMetadata.set(ctx, ServerMetadata.of(new Metadata(), countTrailers()));
        final AggregatingHttpResponseSink sink = spy(new AggregatingHttpResponseSink());

        StreamForwarder.ofDefault().forward(ctx, new PoisonCodec(), sink, ctx.request().headers(),
                                            new TestReceiver(ImmutableList.of(message("poison"))));

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(res.trailers().get("grpc-trailer-count")).isEqualTo("0");
        verify(sink, times(1)).sendTrailers(any());
    }

    @Test
    void laterEncodingFailure() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final TestReceiver receiver =
                new TestReceiver(ImmutableList.of(message("One"), message("poison"), message("Two")));

        final ListAppender<ILoggingEvent> logAppender = new ListAppender<>();
        final Logger forwarderLogger = (Logger) LoggerFactory.getLogger(StreamForwarder.class);
        logAppender.start();
        forwarderLogger.addAppender(logAppender);
        try {
            StreamForwarder.ofDefault().forward(ctx, new PoisonCodec(), sink, ctx.request().headers(),
                                                receiver);
        } finally {
            forwarderLogger.detachAppender(logAppender);
        }

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.OK);
        assertChunks(res, ImmutableList.of(
                ONE,
                "{\"error\":{\"grpc_code\":13,\"http_code\":500,\"message\":\"poisoned\"," +
                "\"http_status\":\"Internal Server Error\"}}"));
        assertThat(receiver.calls).isEqualTo(2);
        assertThat(logAppender.list).filteredOn(event -> event.getLevel() == Level.WARN).hasSize(1);
    }

    @Test
    void unserializableStreamError() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();

        StreamForwarder.ofDefault().forward(
                ctx, new PoisonCodec(), sink, ctx.request().headers(),
                new TestReceiver(ImmutableList.of(message("One"),
                                                  Status.INTERNAL.withDescription("poison")
                                                                 .asRuntimeException())));

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.status()).isSameAs(HttpStatus.OK);
        assertThat(res.contentUtf8()).isEqualTo(ONE + '\n');
    }

    @Test
    void closedResponseStopsTheStream() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = spy(new AggregatingHttpResponseSink());
        doCallRealMethod().doThrow(new ResponseWriteException("closed")).when(sink).flush();
        final TestReceiver receiver =
                new TestReceiver(ImmutableList.of(message("One"), message("Two"), message("Three")));

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(), receiver);

        assertThat(receiver.calls).isEqualTo(2);
        assertThat(sink.aggregate().status()).isSameAs(HttpStatus.OK);
    }

    @Test
    void interruptedReceiver() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();

        StreamForwarder.ofDefault().forward(
                ctx, codec, sink, ctx.request().headers(),
                new TestReceiver(ImmutableList.of(message("One"), new InterruptedException())));

        assertThat(Thread.interrupted()).isTrue();
        final AggregatedHttpResponse res = sink.aggregate();
        assertChunks(res, ImmutableList.of(
                ONE,
                "{\"error\":{\"grpc_code\":13,\"http_code\":500," +
                "\"message\":\"java.lang.InterruptedException\",\"http_status\":\"Internal Server Error\"}}"));
    }

    @Test
    void metadata() {
        final ServiceRequestContext ctx = newContext();
        final Metadata headers = new Metadata();
        headers.put(Metadata.Key.of("request-id", Metadata.ASCII_STRING_MARSHALLER), "42");
        final Metadata trailers = new Metadata();
        trailers.put(Metadata.Key.of("count", Metadata.ASCII_STRING_MARSHALLER), "2");
        ServerMetadata.set(ctx, ServerMetadata.of(headers, trailers));
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();

        StreamForwarder.ofDefault().forward(ctx, codec, sink, ctx.request().headers(),
                                            new TestReceiver(ImmutableList.of(message("One"), message("Two"))));

        final AggregatedHttpResponse res = sink.aggregate();
        assertThat(res.headers().get("grpc-metadata-request-id")).isEqualTo("42");
        assertThat(res.trailers().get("grpc-trailer-count")).isEqualTo("2");
    }

    @Test
    void hookModifiesHeaders() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final Object[] seen = { "unset" };
        final GatewayConfig config = GatewayConfig.builder()
                                                  .addResponseHook((unused, headers, message) -> {
                                                      seen[0] = message;
                                                      headers.set("x-stream", "true");
                                                  })
                                                  .build();

        StreamForwarder.of(config).forward(ctx, codec, sink, ctx.request().headers(),
                                           new TestReceiver(ImmutableList.of(message("One"))));

        assertThat(seen[0]).isNull();
        assertThat(sink.aggregate().headers().get("x-stream")).isEqualTo("true");
    }

    @Test
    void hookFailure() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final GatewayConfig config = GatewayConfig.builder()
                                                  .addResponseHook((unused, headers, message) -> {
                                                      throw Status.PERMISSION_DENIED.asException();
                                                  })
                                                  .build();
        final TestReceiver receiver = new TestReceiver(ImmutableList.of(message("One")));

        StreamForwarder.of(config).forward(ctx, codec, sink, ctx.request().headers(), receiver);

        assertThat(sink.aggregate().status()).isSameAs(HttpStatus.FORBIDDEN);
        assertThat(receiver.calls).isZero();
    }

    @Test
    void customErrorWriter() {
        final ServiceRequestContext ctx = newContext();
        final AggregatingHttpResponseSink sink = new AggregatingHttpResponseSink();
        final HttpErrorWriter errorWriter = (unused, c, s, request, cause) ->
                s.sendHeaders(ResponseHeaders.of(HttpStatus.TOO_MANY_REQUESTS));

        StreamForwarder.of(GatewayConfig.ofDefault(), errorWriter)
                       .forward(ctx, codec, sink, ctx.request().headers(),
                                new TestReceiver(ImmutableList.of(outOfRange())));

        assertThat(sink.aggregate().status()).isSameAs(HttpStatus.TOO_MANY_REQUESTS);
    }

    private static void assertChunks(AggregatedHttpResponse res, List<String> chunks) {
        final List<String> actual = Splitter.on('\n').omitEmptyStrings().splitToList(res.contentUtf8());
        assertThat(actual).hasSameSizeAs(chunks);
        for (int i = 0; i < chunks.size(); i++) {
            assertThatJson(actual.get(i)).isEqualTo(chunks.get(i));
        }
    }

    static Struct message(String id) {
        return Struct.newBuilder()
                     .putFields("id", Value.newBuilder().setStringValue(id).build())
                     .build();
    }

    private static Metadata countTrailers() {
        final Metadata trailers = new Metadata();
        trailers.put(Metadata.Key.of("count", Metadata.ASCII_STRING_MARSHALLER), "0");
        return trailers;
    }

    private static Exception outOfRange() {
        return Status.OUT_OF_RANGE.withDescription("400").asRuntimeException();
    }

    /**
     * Yields the specified messages and exceptions in order, followed by the end of the stream.
     */
    static final class TestReceiver implements StreamReceiver<Object> {

        private final List<?> outcomes;
        int calls;

        TestReceiver(List<?> outcomes) {
            this.outcomes = outcomes;
        }

        @Nullable
        @Override
        public Object receive() throws Exception {
            assertThat(calls).as("receive() called after the stream ended").isLessThanOrEqualTo(lastCall());
            calls++;
            if (calls > outcomes.size()) {
                return null;
            }
            final Object outcome = outcomes.get(calls - 1);
            if (outcome instanceof Exception) {
                throw (Exception) outcome;
            }
            return outcome;
        }

        int expectedCalls() {
            return lastCall() + 1;
        }

        private int lastCall() {
            for (int i = 0; i < outcomes.size(); i++) {
                if (outcomes.get(i) instanceof Exception) {
                    return i;
                }
            }
            return outcomes.size();
        }
    }

    /**
     * Hides the delimiter of the delegate.
     */
    private static final class NonDelimitedCodec implements Codec {

        private final Codec delegate;

        NonDelimitedCodec(Codec delegate) {
            this.delegate = delegate;
        }

        @Override
        public byte[] serialize(Object value) {
            return delegate.serialize(value);
        }

        @Override
        public <T> T deserialize(byte[] data, Class<T> type) {
            return delegate.deserialize(data, type);
        }

        @Override
        public MediaType contentType() {
            return delegate.contentType();
        }
    }

    /**
     * Fails to serialize {@code message("poison")} and any error whose message is {@code "poison"}.
     */
    private static final class PoisonCodec implements Codec {

        private static final Struct POISON = message("poison");

        @Override
        public byte[] serialize(Object value) {
            if (value instanceof Map) {
                final Object result = ((Map<?, ?>) value).get(ErrorEnvelopes.RESULT_KEY);
                if (POISON.equals(result)) {
                    throw new EncodingException("poisoned");
                }
                final Object error = ((Map<?, ?>) value).get(ErrorEnvelopes.ERROR_KEY);
                if (error instanceof StreamError && "poison".equals(((StreamError) error).message())) {
                    throw new EncodingException("poisoned error");
                }
            }
            return codec.serialize(value);
        }

        @Override
        public <T> T deserialize(byte[] data, Class<T> type) {
            return codec.deserialize(data, type);
        }

        @Override
        public MediaType contentType() {
            return codec.contentType();
        }
    }

    /**
     * Writes a stream error as its plain message and reports {@code text/plain} once it did so.
     */
    private static final class ErrorStringCodec implements Codec {

        private boolean errorState;

        @Override
        public byte[] serialize(Object value) {
            if (value instanceof Map) {
                final Object error = ((Map<?, ?>) value).get(ErrorEnvelopes.ERROR_KEY);
                if (error instanceof StreamError) {
                    errorState = true;
                    return ((StreamError) error).message().getBytes(StandardCharsets.UTF_8);
                }
            }
            errorState = false;
            return codec.serialize(value);
        }

        @Override
        public <T> T deserialize(byte[] data, Class<T> type) {
            return codec.deserialize(data, type);
        }

        @Override
        public MediaType contentType() {
            return errorState ? MediaType.PLAIN_TEXT : codec.contentType();
        }
    }
}
