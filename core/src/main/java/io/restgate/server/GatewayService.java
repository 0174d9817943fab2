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

import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.HttpResponseWriter;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.util.Exceptions;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.restgate.common.Codec;
import io.restgate.common.CodecRegistry;

/**
 * An {@link HttpService} which exposes a unary or server-streaming call over HTTP/JSON.
 *
 * <pre>{@code
 * Server.builder()
 *       .service("/v1/echo", GatewayService.builder()
 *                                          .unary((ctx, req) -> echo(req.contentAs(EchoRequest.class)))
 *                                          .build())
 *       .service("/v1/watch", GatewayService.builder()
 *                                           .serverStreaming((ctx, req) -> watch(req))
 *                                           .build())
 *       .build();
 * }</pre>
 *
 * <p>The calls are invoked from {@link ServiceRequestContext#blockingTaskExecutor()} because
 * {@link StreamReceiver#receive()} blocks.
 */
public final class GatewayService implements HttpService {

    private static final Logger logger = LoggerFactory.getLogger(GatewayService.class);

    /**
     * Returns a new {@link GatewayServiceBuilder}.
     */
    public static GatewayServiceBuilder builder() {
        return new GatewayServiceBuilder();
    }

    private final CodecRegistry codecRegistry;
    private final HttpErrorWriter errorWriter;
    private final ResponseForwarder responseForwarder;
    private final StreamForwarder streamForwarder;
    @Nullable
    private final UnaryCall<?> unaryCall;
    @Nullable
    private final ServerStreamingCall<?> streamingCall;

    GatewayService(CodecRegistry codecRegistry, GatewayConfig config, HttpErrorWriter errorWriter,
                   @Nullable UnaryCall<?> unaryCall, @Nullable ServerStreamingCall<?> streamingCall) {
        this.codecRegistry = codecRegistry;
        this.errorWriter = errorWriter;
        responseForwarder = ResponseForwarder.of(config, errorWriter);
        streamForwarder = StreamForwarder.of(config, errorWriter);
        this.unaryCall = unaryCall;
        this.streamingCall = streamingCall;
    }

    @Override
    public HttpResponse serve(ServiceRequestContext ctx, HttpRequest req) throws Exception {
        final HttpResponseWriter res = HttpResponse.streaming();
        req.aggregate().handleAsync((aggregated, cause) -> {
            final HttpResponseWriterSink sink = new HttpResponseWriterSink(res);
            try {
                if (cause != null) {
                    res.close(Exceptions.peel(cause));
                    return null;
                }
                handle(ctx, aggregated, sink);
                sink.close();
            } catch (Throwable t) {
                logger.warn("{} Unexpected exception while serving {}:", ctx, req.path(), t);
                res.close(t);
            }
            return null;
        }, ctx.blockingTaskExecutor());
        return res;
    }

    private void handle(ServiceRequestContext ctx, AggregatedHttpRequest aggregated,
                        HttpResponseSink sink) {
        final RequestHeaders headers = aggregated.headers();
        final Codec codec = codecRegistry.forRequest(headers);
        final GatewayRequest request = new GatewayRequest(aggregated, codec);

        if (unaryCall != null) {
            final Object message;
            try {
                message = requireNonNull(unaryCall.invoke(ctx, request), "unaryCall.invoke() returned null");
            } catch (Exception e) {
                restoreInterrupt(e);
                errorWriter.writeError(ctx, codec, sink, headers, e);
                return;
            }
            responseForwarder.forward(ctx, codec, sink, headers, message);
            return;
        }

        assert streamingCall != null;
        final StreamReceiver<?> receiver;
        try {
            receiver = requireNonNull(streamingCall.invoke(ctx, request),
                                      "serverStreamingCall.invoke() returned null");
        } catch (Exception e) {
            restoreInterrupt(e);
            errorWriter.writeError(ctx, codec, sink, headers, e);
            return;
        }
        streamForwarder.forward(ctx, codec, sink, headers, receiver);
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        final String type = unaryCall != null ? "unary" : "serverStreaming";
        return "GatewayService(" + codecRegistry + ", " + type + ')';
    }
}
