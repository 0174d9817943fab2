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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Any;

import com.linecorp.armeria.common.HttpStatus;

import io.grpc.Status;
import io.grpc.protobuf.StatusProto;
import io.restgate.common.HttpStatusMapper;
import io.restgate.common.Statuses;

/**
 * Builds the payloads sent to a client: the {@code {"result": ...}} container of a stream element and
 * the error payloads built from an arbitrary {@link Throwable}. None of the methods in this class fail
 * for a non-null input.
 */
public final class ErrorEnvelopes {

    private static final Logger logger = LoggerFactory.getLogger(ErrorEnvelopes.class);

    /**
     * The key of the container which holds a successful stream element.
     */
    public static final String RESULT_KEY = "result";

    /**
     * The key of the container which holds an error.
     */
    public static final String ERROR_KEY = "error";

    /**
     * Returns {@code {"result": message}}.
     */
    public static Map<String, Object> resultChunk(Object message) {
        requireNonNull(message, "message");
        return ImmutableMap.of(RESULT_KEY, message);
    }

    /**
     * Returns {@code {"error": streamError(cause)}}.
     */
    public static Map<String, Object> errorChunk(Throwable cause) {
        requireNonNull(cause, "cause");
        return ImmutableMap.of(ERROR_KEY, streamError(cause));
    }

    /**
     * Returns the {@link ErrorBody} of the specified {@link Throwable}.
     */
    public static ErrorBody errorBody(Throwable cause) {
        requireNonNull(cause, "cause");
        final Status status = Statuses.fromThrowable(cause);
        return new ErrorBody(message(status), status.getCode().value(), details(cause));
    }

    /**
     * Returns the {@link StreamError} of the specified {@link Throwable}.
     */
    public static StreamError streamError(Throwable cause) {
        requireNonNull(cause, "cause");
        final Status status = Statuses.fromThrowable(cause);
        final HttpStatus httpStatus = HttpStatusMapper.toHttpStatus(status.getCode());
        return new StreamError(status.getCode().value(), httpStatus.code(), message(status),
                               httpStatus.reasonPhrase(), details(cause));
    }

    private static String message(Status status) {
        return Strings.nullToEmpty(status.getDescription());
    }

    private static List<ErrorDetail> details(Throwable cause) {
        if (!Statuses.hasStatus(cause)) {
            return ImmutableList.of();
        }

        final com.google.rpc.Status statusProto;
        try {
            statusProto = StatusProto.fromThrowable(cause);
        } catch (RuntimeException e) {
            logger.debug("Failed to decode the status details of: {}", cause, e);
            return ImmutableList.of();
        }
        if (statusProto == null || statusProto.getDetailsCount() == 0) {
            return ImmutableList.of();
        }

        final ImmutableList.Builder<ErrorDetail> builder = ImmutableList.builder();
        for (Any detail : statusProto.getDetailsList()) {
            builder.add(new ErrorDetail(detail.getTypeUrl(), detail.getValue().toByteArray()));
        }
        return builder.build();
    }

    private ErrorEnvelopes() {}
}
