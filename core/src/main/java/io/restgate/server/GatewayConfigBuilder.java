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

import java.util.ArrayList;
import java.util.List;

import com.linecorp.armeria.common.MediaType;

/**
 * Builds a new {@link GatewayConfig}.
 */
public final class GatewayConfigBuilder {

    private OutgoingHeaderMatcher headerMatcher =
            OutgoingHeaderMatcher.ofPrefix(GatewayConfig.DEFAULT_METADATA_HEADER_PREFIX);
    private OutgoingHeaderMatcher trailerMatcher =
            OutgoingHeaderMatcher.ofPrefix(GatewayConfig.DEFAULT_METADATA_TRAILER_PREFIX);
    private final List<ForwardResponseHook> responseHooks = new ArrayList<>();
    private MediaType fallbackContentType = MediaType.JSON;

    GatewayConfigBuilder() {}

    /**
     * Sets the {@link OutgoingHeaderMatcher} which names the HTTP headers of gRPC header metadata.
     * Every key is prefixed with {@value GatewayConfig#DEFAULT_METADATA_HEADER_PREFIX} by default.
     */
    public GatewayConfigBuilder headerMatcher(OutgoingHeaderMatcher headerMatcher) {
        this.headerMatcher = requireNonNull(headerMatcher, "headerMatcher");
        return this;
    }

    /**
     * Sets the {@link OutgoingHeaderMatcher} which names the HTTP trailers of gRPC trailer metadata.
     * Every key is prefixed with {@value GatewayConfig#DEFAULT_METADATA_TRAILER_PREFIX} by default.
     */
    public GatewayConfigBuilder trailerMatcher(OutgoingHeaderMatcher trailerMatcher) {
        this.trailerMatcher = requireNonNull(trailerMatcher, "trailerMatcher");
        return this;
    }

    /**
     * Adds a {@link ForwardResponseHook}. The hooks are invoked in the order they were added.
     */
    public GatewayConfigBuilder addResponseHook(ForwardResponseHook responseHook) {
        responseHooks.add(requireNonNull(responseHook, "responseHook"));
        return this;
    }

    /**
     * Sets the content type of a response when the codec cannot provide one.
     * {@link MediaType#JSON} by default.
     */
    public GatewayConfigBuilder fallbackContentType(MediaType fallbackContentType) {
        this.fallbackContentType = requireNonNull(fallbackContentType, "fallbackContentType");
        return this;
    }

    /**
     * Returns a newly-created {@link GatewayConfig} based on the properties of this builder.
     */
    public GatewayConfig build() {
        return new GatewayConfig(headerMatcher, trailerMatcher, responseHooks, fallbackContentType);
    }
}
