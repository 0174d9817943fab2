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

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * A detail of a failed RPC, taken from the {@code details} of its {@code google.rpc.Status}.
 */
public final class ErrorDetail {

    private final String typeUrl;
    private final byte[] value;

    /**
     * Creates a new instance.
     */
    public ErrorDetail(String typeUrl, byte[] value) {
        this.typeUrl = requireNonNull(typeUrl, "typeUrl");
        this.value = requireNonNull(value, "value").clone();
    }

    /**
     * Returns the type URL of the packed message, e.g.
     * {@code type.googleapis.com/google.rpc.ErrorInfo}.
     */
    @JsonProperty("type_url")
    public String typeUrl() {
        return typeUrl;
    }

    /**
     * Returns the serialized message. JSON codecs encode it in Base64.
     */
    @JsonProperty("value")
    public byte[] value() {
        return value.clone();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorDetail)) {
            return false;
        }
        final ErrorDetail that = (ErrorDetail) o;
        return typeUrl.equals(that.typeUrl) && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return typeUrl.hashCode() * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("typeUrl", typeUrl)
                          .add("valueLength", value.length)
                          .toString();
    }
}
