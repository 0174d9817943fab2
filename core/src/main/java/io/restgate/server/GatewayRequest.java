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

import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.RequestHeaders;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.restgate.common.Codec;
import io.restgate.common.EncodingException;

/**
 * An aggregated HTTP request with the {@link Codec} selected for it.
 */
public final class GatewayRequest {

    private final AggregatedHttpRequest request;
    private final Codec codec;

    GatewayRequest(AggregatedHttpRequest request, Codec codec) {
        this.request = requireNonNull(request, "request");
        this.codec = requireNonNull(codec, "codec");
    }

    /**
     * Returns the {@link RequestHeaders} of this request.
     */
    public RequestHeaders headers() {
        return request.headers();
    }

    /**
     * Returns the content of this request decoded as UTF-8.
     */
    public String contentUtf8() {
        return request.contentUtf8();
    }

    /**
     * Returns the {@link Codec} selected for this request.
     */
    public Codec codec() {
        return codec;
    }

    /**
     * Deserializes the content of this request into the specified type with the {@link Codec}.
     *
     * @throws StatusRuntimeException with {@link Status#INVALID_ARGUMENT} if the content is not
     *                                a valid {@code type}
     */
    public <T> T contentAs(Class<T> type) {
        requireNonNull(type, "type");
        try {
            return codec.deserialize(request.content().array(), type);
        } catch (EncodingException e) {
            throw Status.INVALID_ARGUMENT.withDescription(e.getMessage()).withCause(e).asRuntimeException();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("headers", request.headers())
                          .add("codec", codec)
                          .toString();
    }
}
