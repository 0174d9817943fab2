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

import com.linecorp.armeria.common.ResponseHeadersBuilder;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.server.ServiceRequestContext;

/**
 * A hook invoked right before a response is committed, which may add or modify its headers.
 * A hook which throws an exception fails the request, and the exception is written by the
 * {@link HttpErrorWriter} in place of the response.
 *
 * <pre>{@code
 * GatewayConfig config =
 *         GatewayConfig.builder()
 *                      .addResponseHook((ctx, headers, message) -> {
 *                          headers.set("cache-control", "no-store");
 *                      })
 *                      .build();
 * }</pre>
 */
@FunctionalInterface
public interface ForwardResponseHook {

    /**
     * Invoked before the response headers are sent.
     *
     * @param ctx the {@link ServiceRequestContext} of the current request
     * @param headers the headers which are about to be sent
     * @param message the message of a unary response, or {@code null} for a streaming response
     */
    void beforeCommit(ServiceRequestContext ctx, ResponseHeadersBuilder headers,
                      @Nullable Object message) throws Exception;
}
