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

import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.ResponseHeadersBuilder;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.restgate.common.Codec;

/**
 * Forwards the result of a unary call as a single HTTP response.
 *
 * <p>The message is serialized as it is, without the {@code {"result": ...}} envelope used for streams.
 * If the message or a {@link ForwardResponseHook} fails, the response is written by the
 * {@link HttpErrorWriter} instead.
 */
public final class ResponseForwarder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseForwarder.class);

    private static final ResponseForwarder DEFAULT = of(GatewayConfig.ofDefault());

    /**
     * Returns the {@link ResponseForwarder} which uses {@link GatewayConfig#ofDefault()}.
     */
    public static ResponseForwarder ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link ResponseForwarder} which uses the specified {@link GatewayConfig}.
     */
    public static ResponseForwarder of(GatewayConfig config) {
        requireNonNull(config, "config");
        return new ResponseForwarder(config, HttpErrorWriter.of(config));
    }

    /**
     * Returns a new {@link ResponseForwarder} which uses the specified {@link GatewayConfig} and
     * {@link HttpErrorWriter}.
     */
    public static ResponseForwarder of(GatewayConfig config, HttpErrorWriter errorWriter) {
        return new ResponseForwarder(requireNonNull(config, "config"),
                                     requireNonNull(errorWriter, "errorWriter"));
    }

    private final GatewayConfig config;
    private final HttpErrorWriter errorWriter;

    private ResponseForwarder(GatewayConfig config, HttpErrorWriter errorWriter) {
        this.config = config;
        this.errorWriter = errorWriter;
    }

    /**
     * Writes the specified {@code message} to the specified {@link HttpResponseSink} with
     * {@link HttpStatus#OK}.
     */
    public void forward(ServiceRequestContext ctx, Codec codec, HttpResponseSink sink,
                        RequestHeaders request, Object message) {
        requireNonNull(ctx, "ctx");
        requireNonNull(codec, "codec");
        requireNonNull(sink, "sink");
        requireNonNull(request, "request");
        requireNonNull(message, "message");

        final ServerMetadata metadata = ServerMetadata.get(ctx);
        final ResponseHeadersBuilder headersBuilder = ResponseHeaders.builder(HttpStatus.OK);
        ForwardingUtil.addHeaderMetadata(headersBuilder, metadata, config);

        final byte[] body;
        try {
            ForwardingUtil.invokeHooks(ctx, config, headersBuilder, message);
            body = codec.serialize(message);
        } catch (Exception e) {
            errorWriter.writeError(ctx, codec, sink, request, e);
            return;
        }
        headersBuilder.contentType(ForwardingUtil.contentType(codec, config));

        try {
            sink.sendHeaders(headersBuilder.build());
            sink.write(body);
            sink.flush();
            final HttpHeaders trailers = ForwardingUtil.trailers(metadata, config);
            if (!trailers.isEmpty()) {
                sink.sendTrailers(trailers);
            }
        } catch (ResponseWriteException e) {
            logger.debug("{} Failed to write the response of {} {}:",
                         ctx, request.method(), request.path(), e);
        }
    }

    @Override
    public String toString() {
        return "ResponseForwarder(" + config + ", " + errorWriter + ')';
    }
}
