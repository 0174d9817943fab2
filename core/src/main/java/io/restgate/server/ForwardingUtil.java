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

import java.util.Base64;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.HttpHeadersBuilder;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.ResponseHeadersBuilder;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.grpc.Metadata;
import io.restgate.common.Codec;

/**
 * Helpers shared by the forwarders and the {@link DefaultHttpErrorWriter}.
 */
final class ForwardingUtil {

    private static final Logger logger = LoggerFactory.getLogger(ForwardingUtil.class);

    private static final Base64.Encoder BASE64 = Base64.getEncoder();

    /**
     * Returns the content type of the specified {@link Codec}, or the fallback content type if the
     * {@link Codec} fails to provide one.
     */
    static MediaType contentType(Codec codec, GatewayConfig config) {
        final MediaType contentType;
        try {
            contentType = codec.contentType();
        } catch (RuntimeException e) {
            logger.warn("{} failed to provide a content type; using {}:",
                        codec, config.fallbackContentType(), e);
            return config.fallbackContentType();
        }
        return contentType != null ? contentType : config.fallbackContentType();
    }

    static void invokeHooks(ServiceRequestContext ctx, GatewayConfig config,
                            ResponseHeadersBuilder headers, @Nullable Object message) throws Exception {
        for (ForwardResponseHook hook : config.responseHooks()) {
            hook.beforeCommit(ctx, headers, message);
        }
    }

    static void addHeaderMetadata(ResponseHeadersBuilder headers, @Nullable ServerMetadata metadata,
                                  GatewayConfig config) {
        if (metadata != null) {
            addMetadata(headers, metadata.headers(), config.headerMatcher());
        }
    }

    static HttpHeaders trailers(@Nullable ServerMetadata metadata, GatewayConfig config) {
        if (metadata == null || metadata.trailers().keys().isEmpty()) {
            return HttpHeaders.of();
        }
        final Metadata trailers = metadata.trailers();
        final HttpHeadersBuilder builder = HttpHeaders.builder();
        addMetadata(builder, trailers, config.trailerMatcher());
        return builder.build();
    }

    private static void addMetadata(HttpHeadersBuilder builder, Metadata metadata,
                                    OutgoingHeaderMatcher matcher) {
        for (String key : metadata.keys()) {
            final String name = matcher.headerName(key);
            if (name == null) {
                continue;
            }
            if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                final Iterable<byte[]> values =
                        metadata.getAll(Metadata.Key.of(key, Metadata.BINARY_BYTE_MARSHALLER));
                if (values != null) {
                    for (byte[] value : values) {
                        builder.add(name, BASE64.encodeToString(value));
                    }
                }
            } else {
                final Iterable<String> values =
                        metadata.getAll(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
                if (values != null) {
                    for (String value : values) {
                        builder.add(name, value);
                    }
                }
            }
        }
    }

    private ForwardingUtil() {}
}
