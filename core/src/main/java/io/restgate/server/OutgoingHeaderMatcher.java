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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * Decides the name of the HTTP header which carries a gRPC metadata entry.
 */
@FunctionalInterface
public interface OutgoingHeaderMatcher {

    /**
     * Returns an {@link OutgoingHeaderMatcher} which prepends the specified prefix to every key.
     */
    static OutgoingHeaderMatcher ofPrefix(String prefix) {
        requireNonNull(prefix, "prefix");
        checkArgument(!prefix.isEmpty(), "prefix is empty.");
        return key -> prefix + key;
    }

    /**
     * Returns an {@link OutgoingHeaderMatcher} which drops every key.
     */
    static OutgoingHeaderMatcher none() {
        return key -> null;
    }

    /**
     * Returns the HTTP header name for the specified metadata key, or {@code null} to drop the entry.
     */
    @Nullable
    String headerName(String metadataKey);
}
