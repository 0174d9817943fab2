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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.armeria.common.MediaType;

/**
 * The immutable configuration shared by the {@link HttpErrorWriter}, the {@link StreamForwarder} and the
 * {@link ResponseForwarder} of a gateway. A single instance is safe to use for all requests.
 */
public final class GatewayConfig {

    /**
     * The default prefix of the HTTP headers which carry gRPC header metadata.
     */
    public static final String DEFAULT_METADATA_HEADER_PREFIX = "Grpc-Metadata-";

    /**
     * The default prefix of the HTTP trailers which carry gRPC trailer metadata.
     */
    public static final String DEFAULT_METADATA_TRAILER_PREFIX = "Grpc-Trailer-";

    private static final GatewayConfig DEFAULT = builder().build();

    /**
     * Returns the {@link GatewayConfig} with the default settings.
     */
    public static GatewayConfig ofDefault() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link GatewayConfigBuilder}.
     */
    public static GatewayConfigBuilder builder() {
        return new GatewayConfigBuilder();
    }

    private final OutgoingHeaderMatcher headerMatcher;
    private final OutgoingHeaderMatcher trailerMatcher;
    private final List<ForwardResponseHook> responseHooks;
    private final MediaType fallbackContentType;

    GatewayConfig(OutgoingHeaderMatcher headerMatcher, OutgoingHeaderMatcher trailerMatcher,
                  List<ForwardResponseHook> responseHooks, MediaType fallbackContentType) {
        this.headerMatcher = headerMatcher;
        this.trailerMatcher = trailerMatcher;
        this.responseHooks = ImmutableList.copyOf(responseHooks);
        this.fallbackContentType = fallbackContentType;
    }

    /**
     * Returns the {@link OutgoingHeaderMatcher} which names the HTTP headers of gRPC header metadata.
     */
    public OutgoingHeaderMatcher headerMatcher() {
        return headerMatcher;
    }

    /**
     * Returns the {@link OutgoingHeaderMatcher} which names the HTTP trailers of gRPC trailer metadata.
     */
    public OutgoingHeaderMatcher trailerMatcher() {
        return trailerMatcher;
    }

    /**
     * Returns the {@link ForwardResponseHook}s invoked before a response is committed, in order.
     */
    public List<ForwardResponseHook> responseHooks() {
        return responseHooks;
    }

    /**
     * Returns the content type of a response when the codec cannot provide one.
     */
    public MediaType fallbackContentType() {
        return fallbackContentType;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("headerMatcher", headerMatcher)
                          .add("trailerMatcher", trailerMatcher)
                          .add("responseHooks", responseHooks)
                          .add("fallbackContentType", fallbackContentType)
                          .toString();
    }
}
