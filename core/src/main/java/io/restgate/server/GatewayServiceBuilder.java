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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.linecorp.armeria.common.annotation.Nullable;

import io.restgate.common.CodecRegistry;

/**
 * Builds a new {@link GatewayService}. Exactly one of {@link #unary(UnaryCall)} and
 * {@link #serverStreaming(ServerStreamingCall)} must be set.
 */
public final class GatewayServiceBuilder {

    private CodecRegistry codecRegistry = CodecRegistry.ofDefault();
    private GatewayConfig config = GatewayConfig.ofDefault();
    @Nullable
    private HttpErrorWriter errorWriter;
    @Nullable
    private UnaryCall<?> unaryCall;
    @Nullable
    private ServerStreamingCall<?> streamingCall;

    GatewayServiceBuilder() {}

    /**
     * Sets the {@link CodecRegistry} which selects the {@link io.restgate.common.Codec} of each request.
     * {@link CodecRegistry#ofDefault()} by default.
     */
    public GatewayServiceBuilder codecRegistry(CodecRegistry codecRegistry) {
        this.codecRegistry = requireNonNull(codecRegistry, "codecRegistry");
        return this;
    }

    /**
     * Sets the {@link GatewayConfig}. {@link GatewayConfig#ofDefault()} by default.
     */
    public GatewayServiceBuilder config(GatewayConfig config) {
        this.config = requireNonNull(config, "config");
        return this;
    }

    /**
     * Sets the {@link HttpErrorWriter}. {@link HttpErrorWriter#of(GatewayConfig)} by default.
     */
    public GatewayServiceBuilder errorWriter(HttpErrorWriter errorWriter) {
        this.errorWriter = requireNonNull(errorWriter, "errorWriter");
        return this;
    }

    /**
     * Sets the {@link UnaryCall} served by the {@link GatewayService}.
     */
    public GatewayServiceBuilder unary(UnaryCall<?> unaryCall) {
        this.unaryCall = requireNonNull(unaryCall, "unaryCall");
        return this;
    }

    /**
     * Sets the {@link ServerStreamingCall} served by the {@link GatewayService}.
     */
    public GatewayServiceBuilder serverStreaming(ServerStreamingCall<?> streamingCall) {
        this.streamingCall = requireNonNull(streamingCall, "streamingCall");
        return this;
    }

    /**
     * Returns a newly-created {@link GatewayService} based on the properties of this builder.
     */
    public GatewayService build() {
        checkState(unaryCall != null || streamingCall != null,
                   "either unary() or serverStreaming() must be set");
        checkState(unaryCall == null || streamingCall == null,
                   "unary() and serverStreaming() are mutually exclusive");
        final HttpErrorWriter errorWriter = this.errorWriter != null ? this.errorWriter
                                                                     : HttpErrorWriter.of(config);
        return new GatewayService(codecRegistry, config, errorWriter, unaryCall, streamingCall);
    }
}
