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
 * A call which produces a single response message for a request.
 *
 * @param <T> the type of the response message
 */
@FunctionalInterface
public interface UnaryCall<T> {

    /**
     * Invokes this call. A {@link io.grpc.StatusRuntimeException} or {@link io.grpc.StatusException}
     * thrown from this method is translated into the matching HTTP status.
     */
    T invoke(ServiceRequestContext ctx, GatewayRequest request) throws Exception;
}
