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

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.ResponseHeadersBuilder;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.restgate.common.Codec;
import io.restgate.common.DelimitedCodec;
import io.restgate.common.Statuses;

/**
 * Forwards the messages of a server-streaming call as a chunked HTTP response.
 *
 * <p>Each message is serialized as {@code {"result": message}} followed by the delimiter of the
 * {@link Codec}, and flushed on its own. The HTTP status is decided by the first outcome of the
 * {@link StreamReceiver}:
 * <ul>
 *   <li>a failure is written by the {@link HttpErrorWriter}, just like a failed unary call;</li>
 *   <li>a message or the end of the stream commits {@code 200 OK} with {@code transfer-encoding: chunked}.
 *   </li>
 * </ul>
 * A failure after the response has been committed cannot change the status anymore. It is sent in-band as
 * the last element of the stream, {@code {"error": {...}}}, and the status stays {@code 200 OK}.
 */
public final class StreamForwarder {

    private static final Logger logger = LoggerFactory.getLogger(StreamForwarder.class);

    private static final byte[] DEFAULT_DELIMITER = { '\n' };

    private static final String CHUNKED = "chunked";

    private static final StreamForwarder DEFAULT = of(GatewayConfig.ofDefault());

    /**
     * Returns the {@link StreamForwarder} which uses {@link GatewayConfig#ofDefault()} and
     * {@link HttpErrorWriter#ofDefault()}.
     */
    public static StreamForwarder ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link StreamForwarder} which uses the specified {@link GatewayConfig} and the default
     * {@link HttpErrorWriter} of it.
     */
    public static StreamForwarder of(GatewayConfig config) {
        requireNonNull(config, "config");
        return new StreamForwarder(config, HttpErrorWriter.of(config));
    }

    /**
     * Returns a new {@link StreamForwarder} which uses the specified {@link GatewayConfig} and
     * {@link HttpErrorWriter}.
     */
    public static StreamForwarder of(GatewayConfig config, HttpErrorWriter errorWriter) {
        return new StreamForwarder(requireNonNull(config, "config"),
                                   requireNonNull(errorWriter, "errorWriter"));
    }

    private enum State {
        INIT,
        STREAMING,
        DONE
    }

    private final GatewayConfig config;
    private final HttpErrorWriter errorWriter;

    private StreamForwarder(GatewayConfig config, HttpErrorWriter errorWriter) {
        this.config = config;
        this.errorWriter = errorWriter;
    }

    /**
     * Receives all messages from the specified {@link StreamReceiver} and writes them to the specified
     * {@link HttpResponseSink}. This method blocks until the stream ends, fails or the response is closed.
     * The {@link StreamReceiver} is never invoked again once it returned {@code null} or threw an exception.
     *
     * @param ctx the {@link ServiceRequestContext} of the current request
     * @param codec the {@link Codec} selected for the current request
     * @param sink the uncommitted response of the current request
     * @param request the headers of the current request
     * @param receiver the source of the messages
     */
    public void forward(ServiceRequestContext ctx, Codec codec, HttpResponseSink sink,
                        RequestHeaders request, StreamReceiver<?> receiver) {
        requireNonNull(ctx, "ctx");
        requireNonNull(codec, "codec");
        requireNonNull(sink, "sink");
        requireNonNull(request, "request");
        requireNonNull(receiver, "receiver");

        final ServerMetadata metadata = ServerMetadata.get(ctx);
        final ResponseHeadersBuilder headersBuilder =
                ResponseHeaders.builder(HttpStatus.OK)
                               .contentType(ForwardingUtil.contentType(codec, config))
                               .set(HttpHeaderNames.TRANSFER_ENCODING, CHUNKED);
        ForwardingUtil.addHeaderMetadata(headersBuilder, metadata, config);
        try {
            ForwardingUtil.invokeHooks(ctx, config, headersBuilder, null);
        } catch (Exception e) {
            errorWriter.writeError(ctx, codec, sink, request, e);
            return;
        }
        final ResponseHeaders headers = headersBuilder.build();
        final byte[] delimiter = codec instanceof DelimitedCodec ? ((DelimitedCodec) codec).delimiter()
                                                                 : DEFAULT_DELIMITER;

        State state = State.INIT;
        boolean headersSent = false;
        try {
            while (state != State.DONE) {
                final Object message;
                try {
                    message = receiver.receive();
                } catch (Exception e) {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    onFailure(state, ctx, codec, sink, request, delimiter, e);
                    state = State.DONE;
                    continue;
                }

                if (message == null) {
                    if (state == State.INIT) {
                        sink.sendHeaders(headers);
                        headersSent = true;
                    }
                    state = State.DONE;
                    continue;
                }

                final byte[] chunk;
                try {
                    // Serialize before sending the headers so that the first message can still fail
                    // the response with a proper status.
                    chunk = codec.serialize(ErrorEnvelopes.resultChunk(message));
                } catch (RuntimeException e) {
                    if (state == State.INIT) {
                        // Later failures are logged by onFailure().
                        logger.warn("{} Failed to serialize a response message of {} {} with {}:",
                                    ctx, request.method(), request.path(), codec, e);
                    }
                    onFailure(state, ctx, codec, sink, request, delimiter, e);
                    state = State.DONE;
                    continue;
                }

                if (state == State.INIT) {
                    sink.sendHeaders(headers);
                    headersSent = true;
                    state = State.STREAMING;
                }
                writeChunk(sink, chunk, delimiter);
            }

            // The error writer sends its own trailers when it takes over the response.
            if (headersSent) {
                final HttpHeaders trailers = ForwardingUtil.trailers(metadata, config);
                if (!trailers.isEmpty()) {
                    sink.sendTrailers(trailers);
                }
            }
        } catch (ResponseWriteException e) {
            logger.debug("{} Stopped forwarding the stream of {} {}; the response is closed:",
                         ctx, request.method(), request.path(), e);
        }
    }

    private void onFailure(State state, ServiceRequestContext ctx, Codec codec, HttpResponseSink sink,
                           RequestHeaders request, byte[] delimiter, Throwable cause) {
        if (state == State.INIT) {
            errorWriter.writeError(ctx, codec, sink, request, cause);
            return;
        }

        if (Statuses.hasStatus(cause)) {
            logger.debug("{} The stream of {} {} failed after the response was committed:",
                         ctx, request.method(), request.path(), cause);
        } else {
            logger.warn("{} The stream of {} {} failed after the response was committed:",
                        ctx, request.method(), request.path(), cause);
        }

        final byte[] chunk = serializeError(ctx, codec, cause);
        if (chunk != null) {
            writeChunk(sink, chunk, delimiter);
        }
    }

    @Nullable
    private static byte[] serializeError(ServiceRequestContext ctx, Codec codec, Throwable cause) {
        try {
            return codec.serialize(ErrorEnvelopes.errorChunk(cause));
        } catch (RuntimeException e) {
            logger.warn("{} Failed to serialize a stream error with {}; ending the stream without it:",
                        ctx, codec, e);
            return null;
        }
    }

    private static void writeChunk(HttpResponseSink sink, byte[] chunk, byte[] delimiter) {
        sink.write(chunk);
        sink.write(delimiter);
        sink.flush();
    }

    @Override
    public String toString() {
        return "StreamForwarder(" + config + ", " + errorWriter + ')';
    }
}
