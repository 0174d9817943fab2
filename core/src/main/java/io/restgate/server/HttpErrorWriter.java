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

import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.restgate.common.Codec;

/**
 * Writes a complete HTTP error response for a failure which occurred before the response was committed.
 *
 * <pre>{@code
 * HttpErrorWriter writer = (ctx, codec, sink, request, cause) -> {
 *     if (cause instanceof QuotaExceededException) {
 *         sink.sendHeaders(ResponseHeaders.of(HttpStatus.TOO_MANY_REQUESTS));
 *         return;
 *     }
 *     HttpErrorWriter.ofDefault().writeError(ctx, codec, sink, request, cause);
 * };
 * }</pre>
 */
@FunctionalInterface
public interface HttpErrorWriter {

    /**
     * Returns the default {@link HttpErrorWriter} which uses {@link GatewayConfig#ofDefault()}.
     */
    static HttpErrorWriter ofDefault() {
        return DefaultHttpErrorWriter.DEFAULT;
    }

    /**
     * Returns the default {@link HttpErrorWriter} which uses the specified {@link GatewayConfig}.
     * It writes:
     * <ul>
     *   <li>the {@link io.grpc.Status} carried by the failure, or {@code INTERNAL} if none, mapped with
     *       {@link io.restgate.common.HttpStatusMapper},</li>
     *   <li>an {@link ErrorBody} serialized with the {@link Codec}, with the content type the
     *       {@link Codec} reports after serializing it, and</li>
     *   <li>{@code 500 Internal Server Error} with {@code {"error": "failed to marshal error message"}}
     *       if the {@link Codec} fails to serialize the {@link ErrorBody}.</li>
     * </ul>
     */
    static HttpErrorWriter of(GatewayConfig config) {
        return new DefaultHttpErrorWriter(requireNonNull(config, "config"));
    }

    /**
     * Writes the HTTP error response for the specified {@link Throwable}. This method must not throw an
     * exception, even if the {@link Codec} or the {@link HttpResponseSink} fails.
     *
     * @param ctx the {@link ServiceRequestContext} of the current request
     * @param codec the {@link Codec} selected for the current request
     * @param sink the uncommitted response of the current request
     * @param request the headers of the current request
     * @param cause the failure
     */
    void writeError(ServiceRequestContext ctx, Codec codec, HttpResponseSink sink,
                    RequestHeaders request, Throwable cause);
}
