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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * An error which occurred after a streaming response has been committed. It is sent in-band as the last
 * element of the stream, wrapped as {@code {"error": {...}}}.
 */
public final class StreamError {

    private final int grpcCode;
    private final int httpCode;
    private final String message;
    private final String httpStatus;
    private final List<ErrorDetail> details;

    StreamError(int grpcCode, int httpCode, String message, String httpStatus, List<ErrorDetail> details) {
        this.grpcCode = grpcCode;
        this.httpCode = httpCode;
        this.message = requireNonNull(message, "message");
        this.httpStatus = requireNonNull(httpStatus, "httpStatus");
        this.details = ImmutableList.copyOf(details);
    }

    /**
     * Returns the numeric value of the canonical gRPC status code.
     */
    @JsonProperty("grpc_code")
    public int grpcCode() {
        return grpcCode;
    }

    /**
     * Returns the HTTP status code the error would have had if it occurred before the response was
     * committed.
     */
    @JsonProperty("http_code")
    public int httpCode() {
        return httpCode;
    }

    @JsonProperty("message")
    public String message() {
        return message;
    }

    /**
     * Returns the reason phrase of {@link #httpCode()}.
     */
    @JsonProperty("http_status")
    public String httpStatus() {
        return httpStatus;
    }

    @JsonProperty("details")
    @JsonInclude(Include.NON_EMPTY)
    public List<ErrorDetail> details() {
        return details;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamError)) {
            return false;
        }
        final StreamError that = (StreamError) o;
        return grpcCode == that.grpcCode && httpCode == that.httpCode &&
               message.equals(that.message) && httpStatus.equals(that.httpStatus) &&
               details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(grpcCode, httpCode, message, httpStatus, details);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("grpcCode", grpcCode)
                          .add("httpCode", httpCode)
                          .add("message", message)
                          .add("httpStatus", httpStatus)
                          .add("details", details)
                          .toString();
    }
}
