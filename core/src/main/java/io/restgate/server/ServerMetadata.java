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

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.RequestContext;
import com.linecorp.armeria.common.annotation.Nullable;

import io.grpc.Metadata;
import io.netty.util.AttributeKey;

/**
 * The gRPC header and trailer {@link Metadata} of a call, carried by the {@link RequestContext} of the
 * HTTP request it serves. The forwarders merge the header {@link Metadata} into the HTTP response
 * headers and the trailer {@link Metadata} into the HTTP response trailers.
 *
 * <p>The {@link Metadata} instances are filled by the transport while the call is in progress and read
 * by the forwarder of the same request, so they must not be shared with other requests.
 */
public final class ServerMetadata {

    private static final AttributeKey<ServerMetadata> SERVER_METADATA =
            AttributeKey.valueOf(ServerMetadata.class, "SERVER_METADATA");

    /**
     * Returns a new {@link ServerMetadata} with empty header and trailer {@link Metadata}.
     */
    public static ServerMetadata of() {
        return new ServerMetadata(new Metadata(), new Metadata());
    }

    /**
     * Returns a new {@link ServerMetadata} with the specified header and trailer {@link Metadata}.
     */
    public static ServerMetadata of(Metadata headers, Metadata trailers) {
        return new ServerMetadata(requireNonNull(headers, "headers"), requireNonNull(trailers, "trailers"));
    }

    /**
     * Returns the {@link ServerMetadata} attached to the specified {@link RequestContext},
     * or {@code null} if there's none.
     */
    @Nullable
    public static ServerMetadata get(RequestContext ctx) {
        requireNonNull(ctx, "ctx");
        return ctx.attr(SERVER_METADATA);
    }

    /**
     * Attaches the specified {@link ServerMetadata} to the specified {@link RequestContext}.
     */
    public static void set(RequestContext ctx, ServerMetadata metadata) {
        requireNonNull(ctx, "ctx");
        requireNonNull(metadata, "metadata");
        ctx.setAttr(SERVER_METADATA, metadata);
    }

    private final Metadata headers;
    private final Metadata trailers;

    private ServerMetadata(Metadata headers, Metadata trailers) {
        this.headers = headers;
        this.trailers = trailers;
    }

    /**
     * Returns the header {@link Metadata} of the call.
     */
    public Metadata headers() {
        return headers;
    }

    /**
     * Returns the trailer {@link Metadata} of the call.
     */
    public Metadata trailers() {
        return trailers;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("headers", headers)
                          .add("trailers", trailers)
                          .toString();
    }
}
