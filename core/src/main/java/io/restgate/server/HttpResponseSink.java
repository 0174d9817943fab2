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

import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.ResponseHeaders;

/**
 * The HTTP response of a single request, written by a forwarder or an {@link HttpErrorWriter}.
 * Once {@link #sendHeaders(ResponseHeaders)} is called, the response is committed and its status and
 * headers cannot change anymore.
 *
 * <p>An {@link HttpResponseSink} is owned by one request and is not thread-safe.
 */
public interface HttpResponseSink {

    /**
     * Sends the {@link ResponseHeaders}. This method must be called exactly once, before any content.
     *
     * @throws IllegalStateException if the headers were sent already
     * @throws ResponseWriteException if the response has been closed
     */
    void sendHeaders(ResponseHeaders headers);

    /**
     * Appends the specified bytes to the response body. The bytes may be buffered until
     * {@link #flush()} is called.
     *
     * @throws IllegalStateException if the headers were not sent yet
     * @throws ResponseWriteException if the response has been closed
     */
    void write(byte[] data);

    /**
     * Sends the bytes buffered so far to the client.
     *
     * @throws ResponseWriteException if the response has been closed
     */
    void flush();

    /**
     * Flushes the buffered bytes and sends the specified trailers. Nothing can be written afterwards.
     *
     * @throws ResponseWriteException if the response has been closed
     */
    void sendTrailers(HttpHeaders trailers);

    /**
     * Returns whether the response headers were sent.
     */
    boolean isCommitted();

    /**
     * Flushes the buffered bytes, if possible, and ends the response.
     */
    void close();
}
