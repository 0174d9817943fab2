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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Test;

import io.grpc.Status;
import io.grpc.Status.Code;

class StatusesTest {

    @Test
    void statusRuntimeException() {
        final Status status = Status.NOT_FOUND.withDescription("no such resource");
        assertThat(Statuses.fromThrowable(status.asRuntimeException())).isSameAs(status);
    }

    @Test
    void statusException() {
        final Status status = Status.ABORTED.withDescription("conflict");
        assertThat(Statuses.fromThrowable(status.asException())).isSameAs(status);
    }

    @Test
    void wrappedStatus() {
        final Throwable cause = new CompletionException(Status.UNAVAILABLE.asRuntimeException());
        assertThat(Statuses.fromThrowable(cause).getCode()).isSameAs(Code.UNAVAILABLE);
        assertThat(Statuses.hasStatus(cause)).isTrue();
    }

    @Test
    void plainException() {
        final IllegalStateException cause = new IllegalStateException("example error");
        final Status status = Statuses.fromThrowable(cause);
        assertThat(status.getCode()).isSameAs(Code.INTERNAL);
        assertThat(status.getDescription()).isEqualTo("example error");
        assertThat(status.getCause()).isSameAs(cause);
        assertThat(Statuses.hasStatus(cause)).isFalse();
    }

    @Test
    void exceptionWithoutMessage() {
        final Status status = Statuses.fromThrowable(new IllegalStateException());
        assertThat(status.getDescription()).isEqualTo("java.lang.IllegalStateException");
    }
}
