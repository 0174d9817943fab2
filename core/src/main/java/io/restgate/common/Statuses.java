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

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Utility methods that extract a canonical gRPC {@link Status} from a {@link Throwable}.
 */
public final class Statuses {

    /**
     * Returns the {@link Status} carried by the specified {@link Throwable} or one of its causes.
     * If none carries a {@link Status}, a {@link Status#INTERNAL} whose description is the message of
     * the {@link Throwable} is returned.
     */
    public static Status fromThrowable(Throwable cause) {
        requireNonNull(cause, "cause");
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof StatusRuntimeException) {
                return ((StatusRuntimeException) t).getStatus();
            }
            if (t instanceof StatusException) {
                return ((StatusException) t).getStatus();
            }
        }
        return Status.INTERNAL.withDescription(describe(cause)).withCause(cause);
    }

    /**
     * Returns whether the specified {@link Throwable} or one of its causes carries a gRPC {@link Status}.
     */
    public static boolean hasStatus(Throwable cause) {
        requireNonNull(cause, "cause");
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof StatusRuntimeException || t instanceof StatusException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable cause) {
        return MoreObjects.firstNonNull(cause.getMessage(), cause.toString());
    }

    private Statuses() {}
}
