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
package io.restgate.common;

/**
 * An optional capability of a {@link Codec} which separates the elements of a streaming response
 * with its own delimiter.
 */
@FunctionalInterface
public interface DelimitedCodec {

    /**
     * Returns the bytes written after each serialized element of a stream.
     */
    byte[] delimiter();
}
