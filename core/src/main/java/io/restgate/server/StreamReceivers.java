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

import java.util.Iterator;

/**
 * Creates {@link StreamReceiver}s.
 */
public final class StreamReceivers {

    /**
     * Returns a {@link StreamReceiver} which yields the elements of the specified {@link Iterator}.
     * The {@link Iterator} returned by a gRPC blocking stub for a server-streaming method fits here:
     * it blocks until the next message arrives and throws a {@link io.grpc.StatusRuntimeException}
     * when the call fails.
     */
    public static <T> StreamReceiver<T> fromIterator(Iterator<? extends T> iterator) {
        requireNonNull(iterator, "iterator");
        return () -> iterator.hasNext() ? requireNonNull(iterator.next(), "iterator.next() returned null")
                                        : null;
    }

    /**
     * Returns a {@link StreamReceiver} which yields the elements of the specified {@link Iterable}.
     */
    public static <T> StreamReceiver<T> of(Iterable<? extends T> messages) {
        requireNonNull(messages, "messages");
        return fromIterator(messages.iterator());
    }

    private StreamReceivers() {}
}
