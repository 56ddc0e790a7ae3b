/*
 * Copyright (c) 2020 Jon Chambers
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package com.eatthepath.gcm;

import io.netty.handler.ssl.SslContext;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A simple carrier for GCM sender configuration options.
 */
class GcmSenderConfiguration {

    private final URI endpoint;
    private final String apiKey;
    private final SslContext sslContext;
    private final Duration connectionTimeout;
    private final Duration requestTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int concurrentConnections;
    private final GcmSenderMetricsListener metricsListener;

    GcmSenderConfiguration(final URI endpoint,
                           final String apiKey,
                           final SslContext sslContext,
                           final Duration connectionTimeout,
                           final Duration requestTimeout,
                           final Duration initialBackoff,
                           final Duration maxBackoff,
                           final int concurrentConnections,
                           final GcmSenderMetricsListener metricsListener) {

        this.endpoint = Objects.requireNonNull(endpoint);
        this.apiKey = Objects.requireNonNull(apiKey);
        this.sslContext = sslContext;
        this.connectionTimeout = connectionTimeout;
        this.requestTimeout = requestTimeout;
        this.initialBackoff = Objects.requireNonNull(initialBackoff);
        this.maxBackoff = Objects.requireNonNull(maxBackoff);
        this.concurrentConnections = concurrentConnections;
        this.metricsListener = metricsListener;
    }

    URI getEndpoint() {
        return endpoint;
    }

    String getApiKey() {
        return apiKey;
    }

    Optional<SslContext> getSslContext() {
        return Optional.ofNullable(sslContext);
    }

    Optional<Duration> getConnectionTimeout() {
        return Optional.ofNullable(connectionTimeout);
    }

    Optional<Duration> getRequestTimeout() {
        return Optional.ofNullable(requestTimeout);
    }

    Duration getInitialBackoff() {
        return initialBackoff;
    }

    Duration getMaxBackoff() {
        return maxBackoff;
    }

    int getConcurrentConnections() {
        return concurrentConnections;
    }

    Optional<GcmSenderMetricsListener> getMetricsListener() {
        return Optional.ofNullable(metricsListener);
    }
}
