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
 * The body of an HTTP error response which is sent before any part of the response is committed.
 * It is serialized as {@code {"error": "<message>", "code": <gRPC code>, "details": [...]}}.
 */
public final class ErrorBody {

    private final String error;
    private final int code;
    private final List<ErrorDetail> details;

    ErrorBody(String error, int code, List<ErrorDetail> details) {
        this.error = requireNonNull(error, "error");
        this.code = code;
        this.details = ImmutableList.copyOf(details);
    }

    /**
     * Returns the error message.
     */
    @JsonProperty("error")
    public String error() {
        return error;
    }

    /**
     * Returns the numeric value of the canonical gRPC status code.
     */
    @JsonProperty("code")
    public int code() {
        return code;
    }

    /**
     * Returns the details of the error.
     */
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
        if (!(o instanceof ErrorBody)) {
            return false;
        }
        final ErrorBody that = (ErrorBody) o;
        return code == that.code && error.equals(that.error) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(error, code, details);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("error", error)
                          .add("code", code)
                          .add("details", details)
                          .toString();
    }
}
