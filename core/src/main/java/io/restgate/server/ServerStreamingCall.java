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

import com.linecorp.armeria.server.ServiceRequestContext;

/**
 * A call which produces a stream of response messages for a request.
 *
 * @param <T> the type of the response messages
 */
@FunctionalInterface
public interface ServerStreamingCall<T> {

    /**
     * Starts this call and returns the {@link StreamReceiver} of its messages. A failure thrown from this
     * method is written as an HTTP error response, just like a failure of the first
     * {@link StreamReceiver#receive()}.
     */
    StreamReceiver<T> invoke(ServiceRequestContext ctx, GatewayRequest request) throws Exception;
}
