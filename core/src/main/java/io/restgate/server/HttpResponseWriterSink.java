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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.HttpResponseWriter;
import com.linecorp.armeria.common.ResponseHeaders;

/**
 * An {@link HttpResponseSink} which writes to an Armeria {@link HttpResponseWriter}.
 * The bytes given to {@link #write(byte[])} are buffered, and each {@link #flush()} sends them as
 * one {@link HttpData}, so the client receives every stream element as soon as it is complete.
 */
public final class HttpResponseWriterSink implements HttpResponseSink {

    private static final Logger logger = LoggerFactory.getLogger(HttpResponseWriterSink.class);

    private final HttpResponseWriter writer;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean headersSent;
    private boolean trailersSent;

    /**
     * Creates a new instance which writes to the specified {@link HttpResponseWriter}.
     */
    public HttpResponseWriterSink(HttpResponseWriter writer) {
        this.writer = requireNonNull(writer, "writer");
    }

    @Override
    public void sendHeaders(ResponseHeaders headers) {
        requireNonNull(headers, "headers");
        checkState(!headersSent, "headers sent already");
        if (!writer.tryWrite(headers)) {
            throw new ResponseWriteException("failed to send the response headers: " + headers.status());
        }
        headersSent = true;
    }

    @Override
    public void write(byte[] data) {
        requireNonNull(data, "data");
        checkState(headersSent, "headers not sent yet");
        checkState(!trailersSent, "trailers sent already");
        if (!writer.isOpen()) {
            throw new ResponseWriteException("response closed already");
        }
        buffer.write(data, 0, data.length);
    }

    @Override
    public void flush() {
        if (buffer.size() == 0) {
            return;
        }
        final int length = buffer.size();
        final HttpData data = HttpData.wrap(buffer.toByteArray());
        buffer.reset();
        if (!writer.tryWrite(data)) {
            throw new ResponseWriteException("failed to send " + length + " byte(s)");
        }
    }

    @Override
    public void sendTrailers(HttpHeaders trailers) {
        requireNonNull(trailers, "trailers");
        checkState(headersSent, "headers not sent yet");
        checkState(!trailersSent, "trailers sent already");
        flush();
        trailersSent = true;
        if (!trailers.isEmpty() && !writer.tryWrite(trailers)) {
            throw new ResponseWriteException("failed to send the response trailers");
        }
    }

    @Override
    public boolean isCommitted() {
        return headersSent;
    }

    @Override
    public void close() {
        if (headersSent) {
            try {
                flush();
            } catch (ResponseWriteException e) {
                logger.debug("Failed to flush the remaining content of a closed response:", e);
            }
        }
        writer.close();
    }
}
