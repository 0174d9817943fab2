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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;

import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.ResponseHeaders;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * An {@link HttpResponseSink} which collects the whole response in memory.
 * Use {@link #aggregate()} to get the collected response.
 */
public final class AggregatingHttpResponseSink implements HttpResponseSink {

    private final ByteArrayOutputStream content = new ByteArrayOutputStream();
    @Nullable
    private ResponseHeaders headers;
    private HttpHeaders trailers = HttpHeaders.of();
    private boolean trailersSent;
    private boolean closed;

    @Override
    public void sendHeaders(ResponseHeaders headers) {
        requireNonNull(headers, "headers");
        ensureOpen();
        checkState(this.headers == null, "headers sent already");
        this.headers = headers;
    }

    @Override
    public void write(byte[] data) {
        requireNonNull(data, "data");
        ensureOpen();
        checkState(headers != null, "headers not sent yet");
        checkState(!trailersSent, "trailers sent already");
        content.write(data, 0, data.length);
    }

    @Override
    public void flush() {
        ensureOpen();
    }

    @Override
    public void sendTrailers(HttpHeaders trailers) {
        requireNonNull(trailers, "trailers");
        ensureOpen();
        checkState(headers != null, "headers not sent yet");
        checkState(!trailersSent, "trailers sent already");
        this.trailers = trailers;
        trailersSent = true;
    }

    @Override
    public boolean isCommitted() {
        return headers != null;
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Returns the {@link ResponseHeaders} exactly as they were sent. Unlike the headers of
     * {@link #aggregate()}, they keep {@code transfer-encoding} and have no {@code content-length} added.
     *
     * @throws IllegalStateException if the headers were not sent
     */
    public ResponseHeaders headers() {
        final ResponseHeaders headers = this.headers;
        checkState(headers != null, "headers not sent");
        return headers;
    }

    /**
     * Returns the collected response. Note that {@link AggregatedHttpResponse} normalizes the headers.
     * Use {@link #headers()} to see what was sent.
     *
     * @throws IllegalStateException if the headers were not sent
     */
    public AggregatedHttpResponse aggregate() {
        final ResponseHeaders headers = this.headers;
        checkState(headers != null, "headers not sent");
        return AggregatedHttpResponse.of(headers, HttpData.wrap(content.toByteArray()), trailers);
    }

    private void ensureOpen() {
        if (closed) {
            throw new ResponseWriteException("response closed already");
        }
    }
}
