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

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * Yields the response messages of a streaming call one at a time.
 *
 * @param <T> the type of the response messages
 */
@FunctionalInterface
public interface StreamReceiver<T> {

    /**
     * Blocks until the next outcome of the call is available and returns it.
     *
     * @return the next message, or {@code null} if the stream ended successfully
     * @throws Exception if the call failed. A gRPC failure is usually a
     *                   {@link io.grpc.StatusRuntimeException}.
     */
    @Nullable
    T receive() throws Exception;
}
