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

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.ResponseHeadersBuilder;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.restgate.common.Codec;
import io.restgate.common.HttpStatusMapper;

/**
 * The default {@link HttpErrorWriter}.
 *
 * @see HttpErrorWriter#of(GatewayConfig)
 */
final class DefaultHttpErrorWriter implements HttpErrorWriter {

    private static final Logger logger = LoggerFactory.getLogger(DefaultHttpErrorWriter.class);

    static final DefaultHttpErrorWriter DEFAULT = new DefaultHttpErrorWriter(GatewayConfig.ofDefault());

    static final String FALLBACK_MESSAGE = "failed to marshal error message";

    private static final byte[] FALLBACK_BODY =
            ("{\"error\": \"" + FALLBACK_MESSAGE + "\"}").getBytes(StandardCharsets.UTF_8);

    private final GatewayConfig config;

    DefaultHttpErrorWriter(GatewayConfig config) {
        this.config = config;
    }

    @Override
    public void writeError(ServiceRequestContext ctx, Codec codec, HttpResponseSink sink,
                           RequestHeaders request, Throwable cause) {
        requireNonNull(ctx, "ctx");
        requireNonNull(codec, "codec");
        requireNonNull(sink, "sink");
        requireNonNull(request, "request");
        requireNonNull(cause, "cause");

        if (sink.isCommitted()) {
            logger.warn("{} Cannot send an error response for {} {}; the response is committed already:",
                        ctx, request.method(), request.path(), cause);
            return;
        }

        HttpStatus status = HttpStatusMapper.toHttpStatus(cause);
        byte[] body;
        MediaType contentType;
        try {
            body = codec.serialize(ErrorEnvelopes.errorBody(cause));
            // A codec may report a different content type once it has serialized an error.
            contentType = ForwardingUtil.contentType(codec, config);
        } catch (RuntimeException e) {
            logger.warn("{} Failed to serialize an error response with {}; sending {}:",
                        ctx, codec, HttpStatus.INTERNAL_SERVER_ERROR, e);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            body = FALLBACK_BODY.clone();
            contentType = MediaType.JSON;
        }

        final ServerMetadata metadata = ServerMetadata.get(ctx);
        final ResponseHeadersBuilder headers = ResponseHeaders.builder(status).contentType(contentType);
        ForwardingUtil.addHeaderMetadata(headers, metadata, config);
        final HttpHeaders trailers = ForwardingUtil.trailers(metadata, config);

        try {
            sink.sendHeaders(headers.build());
            sink.write(body);
            sink.flush();
            if (!trailers.isEmpty()) {
                sink.sendTrailers(trailers);
            }
        } catch (ResponseWriteException e) {
            logger.debug("{} Failed to send an error response ({}) for {} {}:",
                         ctx, status, request.method(), request.path(), e);
        }
    }

    @Override
    public String toString() {
        return "DefaultHttpErrorWriter(" + config + ')';
    }
}
