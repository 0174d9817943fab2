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

import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.annotation.Nullable;

import io.grpc.Status;

/**
 * Maps a canonical gRPC {@link Status.Code} to the {@link HttpStatus} of a gateway response.
 *
 * <table>
 * <caption>gRPC code to HTTP status</caption>
 * <tr><th>gRPC code</th><th>HTTP status</th></tr>
 * <tr><td>{@code OK}</td><td>200</td></tr>
 * <tr><td>{@code CANCELLED}</td><td>408</td></tr>
 * <tr><td>{@code INVALID_ARGUMENT}, {@code FAILED_PRECONDITION}, {@code OUT_OF_RANGE}</td><td>400</td></tr>
 * <tr><td>{@code UNAUTHENTICATED}</td><td>401</td></tr>
 * <tr><td>{@code PERMISSION_DENIED}</td><td>403</td></tr>
 * <tr><td>{@code NOT_FOUND}</td><td>404</td></tr>
 * <tr><td>{@code ALREADY_EXISTS}, {@code ABORTED}</td><td>409</td></tr>
 * <tr><td>{@code RESOURCE_EXHAUSTED}</td><td>429</td></tr>
 * <tr><td>{@code UNIMPLEMENTED}</td><td>501</td></tr>
 * <tr><td>{@code UNAVAILABLE}</td><td>503</td></tr>
 * <tr><td>{@code DEADLINE_EXCEEDED}</td><td>504</td></tr>
 * <tr><td>{@code UNKNOWN}, {@code INTERNAL}, {@code DATA_LOSS} and anything else</td><td>500</td></tr>
 * </table>
 */
public final class HttpStatusMapper {

    /**
     * Returns the {@link HttpStatus} for the specified gRPC {@link Status.Code}.
     * {@code null} is mapped to {@link HttpStatus#INTERNAL_SERVER_ERROR}.
     */
    public static HttpStatus toHttpStatus(@Nullable Status.Code code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (code) {
            case OK:
                return HttpStatus.OK;
            case CANCELLED:
                return HttpStatus.REQUEST_TIMEOUT;
            case INVALID_ARGUMENT:
            case FAILED_PRECONDITION:
            case OUT_OF_RANGE:
                return HttpStatus.BAD_REQUEST;
            case UNAUTHENTICATED:
                return HttpStatus.UNAUTHORIZED;
            case PERMISSION_DENIED:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS:
            case ABORTED:
                return HttpStatus.CONFLICT;
            case RESOURCE_EXHAUSTED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case UNIMPLEMENTED:
                return HttpStatus.NOT_IMPLEMENTED;
            case UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case DEADLINE_EXCEEDED:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    /**
     * Returns the {@link HttpStatus} for the specified {@link Throwable}. A {@link Throwable} which does
     * not carry a gRPC {@link Status} is treated as {@link Status.Code#INTERNAL}.
     *
     * @see Statuses#fromThrowable(Throwable)
     */
    public static HttpStatus toHttpStatus(Throwable cause) {
        requireNonNull(cause, "cause");
        return toHttpStatus(Statuses.fromThrowable(cause).getCode());
    }

    private HttpStatusMapper() {}
}
