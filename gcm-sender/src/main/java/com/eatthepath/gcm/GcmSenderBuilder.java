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

import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.io.File;
import java.io.InputStream;
import java.net.URI;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Objects;

/**
 * <p>A {@code GcmSenderBuilder} constructs new {@link GcmSender} instances. Callers must specify the server API key
 * with which the sender will authenticate itself; all other settings are optional. By default, senders deliver
 * messages to the legacy GCM HTTP endpoint ({@value GCM_ENDPOINT}).</p>
 *
 * <p>Sender builders may be reused to generate multiple senders, and their settings may be changed from one sender to
 * the next.</p>
 *
 * <p>Sender builders are <em>not</em> thread-safe, and should not be shared between threads.</p>
 */
public class GcmSenderBuilder {

    private URI endpoint = URI.create(GCM_ENDPOINT);
    private String apiKey;

    private File trustedServerCertificatePemFile;
    private InputStream trustedServerCertificateInputStream;
    private X509Certificate[] trustedServerCertificates;

    private EventLoopGroup eventLoopGroup;
    private int concurrentConnections = 1;

    private Duration connectionTimeout;
    private Duration requestTimeout;

    private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = DEFAULT_MAX_BACKOFF;

    private GcmSenderMetricsListener metricsListener;

    /**
     * The URI of the legacy GCM HTTP connection server.
     */
    public static final String GCM_ENDPOINT = "https://android.googleapis.com/gcm/send";

    /**
     * The URI of the legacy FCM HTTP connection server, which accepts the same requests as the GCM server.
     */
    public static final String FCM_ENDPOINT = "https://fcm.googleapis.com/fcm/send";

    /**
     * The default delay before the first retry of a message.
     */
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);

    /**
     * The default upper bound on the nominal delay between retries.
     */
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMillis(1_024_000);

    /**
     * Sets the URI of the connection server to which the sender under construction will post messages. Both
     * {@code http} and {@code https} URIs are accepted; {@code http} is generally only useful when talking to a mock
     * server. By default, senders use {@value GCM_ENDPOINT}.
     *
     * @param endpoint the URI of the connection server
     *
     * @return a reference to this builder
     *
     * @see GcmSenderBuilder#GCM_ENDPOINT
     * @see GcmSenderBuilder#FCM_ENDPOINT
     */
    public GcmSenderBuilder setEndpoint(final URI endpoint) {
        Objects.requireNonNull(endpoint, "Endpoint must not be null.");

        if (!"http".equalsIgnoreCase(endpoint.getScheme()) && !"https".equalsIgnoreCase(endpoint.getScheme())) {
            throw new IllegalArgumentException("Endpoint must be an http or https URI: " + endpoint);
        }

        if (endpoint.getHost() == null) {
            throw new IllegalArgumentException("Endpoint must name a host: " + endpoint);
        }

        this.endpoint = endpoint;
        return this;
    }

    /**
     * Sets the URI of the connection server to which the sender under construction will post messages.
     *
     * @param endpoint the URI of the connection server
     *
     * @return a reference to this builder
     *
     * @see GcmSenderBuilder#setEndpoint(URI)
     */
    public GcmSenderBuilder setEndpoint(final String endpoint) {
        return this.setEndpoint(URI.create(endpoint));
    }

    /**
     * Sets the server API key the sender under construction will present with every request. An API key must be set
     * before a sender can be built.
     *
     * @param apiKey the server API key
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setApiKey(final String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    /**
     * <p>Sets the trusted certificate chain for the sender under construction using the contents of the given PEM
     * file. If not set (or {@code null}), the sender will use the JVM's default trust manager.</p>
     *
     * <p>Callers will generally not need to set a trusted server certificate chain in normal operation, but may wish
     * to do so for certificate pinning or connecting to a mock server over TLS.</p>
     *
     * @param certificatePemFile a PEM file containing one or more trusted certificates
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setTrustedServerCertificateChain(final File certificatePemFile) {
        this.trustedServerCertificatePemFile = certificatePemFile;
        this.trustedServerCertificateInputStream = null;
        this.trustedServerCertificates = null;

        return this;
    }

    /**
     * Sets the trusted certificate chain for the sender under construction using the contents of the given PEM input
     * stream. If not set (or {@code null}), the sender will use the JVM's default trust manager.
     *
     * @param certificateInputStream an input stream to PEM-formatted data containing one or more trusted certificates
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setTrustedServerCertificateChain(final InputStream certificateInputStream) {
        this.trustedServerCertificatePemFile = null;
        this.trustedServerCertificateInputStream = certificateInputStream;
        this.trustedServerCertificates = null;

        return this;
    }

    /**
     * Sets the trusted certificate chain for the sender under construction. If not set (or {@code null}), the sender
     * will use the JVM's default trust manager.
     *
     * @param certificates one or more trusted certificates
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setTrustedServerCertificateChain(final X509Certificate... certificates) {
        this.trustedServerCertificatePemFile = null;
        this.trustedServerCertificateInputStream = null;
        this.trustedServerCertificates = certificates;

        return this;
    }

    /**
     * <p>Sets the event loop group to be used by the sender under construction. If not set (or if {@code null}), the
     * sender will create and manage its own event loop group.</p>
     *
     * <p>Generally speaking, callers don't need to set event loop groups for senders, but it may be useful to specify
     * an event loop group under certain circumstances. In particular, specifying an event loop group that is shared
     * among multiple senders may be useful in keeping thread counts manageable.</p>
     *
     * @param eventLoopGroup the event loop group to use for this sender, or {@code null} to let the sender manage its
     * own event loop group
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setEventLoopGroup(final EventLoopGroup eventLoopGroup) {
        this.eventLoopGroup = eventLoopGroup;
        return this;
    }

    /**
     * Sets the maximum number of concurrent connections the sender under construction may attempt to maintain to the
     * connection server. By default, senders will attempt to maintain a single connection; since each connection
     * carries one request at a time, callers that send from many threads at once may wish to raise this number.
     *
     * @param concurrentConnections the maximum number of concurrent connections the sender under construction may
     * attempt to maintain
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setConcurrentConnections(final int concurrentConnections) {
        if (concurrentConnections < 1) {
            throw new IllegalArgumentException("Senders must maintain at least one connection.");
        }

        this.concurrentConnections = concurrentConnections;
        return this;
    }

    /**
     * Sets the maximum amount of time the sender under construction will wait to establish a connection with the
     * connection server before the connection attempt is considered a failure.
     *
     * @param connectionTimeout the maximum amount of time to wait for a connection attempt to complete
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setConnectionTimeout(final Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the maximum amount of time the sender under construction will wait for the connection server to answer a
     * single request. A request that times out fails with a non-retryable {@link java.io.IOException}. By default,
     * senders wait indefinitely.
     *
     * @param requestTimeout the maximum amount of time to wait for a response
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setRequestTimeout(final Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Sets the nominal delay before the first retry of a message. Each subsequent delay doubles, up to the maximum set
     * by {@link #setMaxBackoff(Duration)}; actual delays are randomized to between one half and one and a half times
     * the nominal delay. Defaults to one second.
     *
     * @param initialBackoff the nominal delay before the first retry; must be at least one millisecond
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setInitialBackoff(final Duration initialBackoff) {
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "Initial backoff must not be null.");
        return this;
    }

    /**
     * Sets the upper bound on the nominal delay between retries. Defaults to 1,024 seconds.
     *
     * @param maxBackoff the upper bound on the nominal delay between retries
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setMaxBackoff(final Duration maxBackoff) {
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "Max backoff must not be null.");
        return this;
    }

    /**
     * Sets the metrics listener for the sender under construction. Metrics listeners gather information that
     * describes the performance and behavior of a sender, and are completely optional.
     *
     * @param metricsListener the metrics listener for the sender under construction, or {@code null} if this sender
     * should not report metrics to a listener
     *
     * @return a reference to this builder
     */
    public GcmSenderBuilder setMetricsListener(final GcmSenderMetricsListener metricsListener) {
        this.metricsListener = metricsListener;
        return this;
    }

    /**
     * Constructs a new {@link GcmSender} with the previously-set configuration.
     *
     * @return a new sender instance with the previously-set configuration
     *
     * @throws SSLException if an SSL context could not be created for the new sender for any reason
     * @throws IllegalStateException if no API key has been set, or if the backoff settings are inconsistent
     */
    public GcmSender build() throws SSLException {
        if (this.apiKey == null || this.apiKey.isEmpty()) {
            throw new IllegalStateException("No API key specified.");
        }

        if (this.initialBackoff.toMillis() < 1) {
            throw new IllegalStateException("Initial backoff must be at least one millisecond.");
        }

        if (this.maxBackoff.compareTo(this.initialBackoff) < 0) {
            throw new IllegalStateException("Max backoff must not be shorter than the initial backoff.");
        }

        final SslContext sslContext;

        if ("https".equalsIgnoreCase(this.endpoint.getScheme())) {
            final SslContextBuilder sslContextBuilder = SslContextBuilder.forClient()
                    .sslProvider(SslUtil.getSslProvider());

            if (this.trustedServerCertificatePemFile != null) {
                sslContextBuilder.trustManager(this.trustedServerCertificatePemFile);
            } else if (this.trustedServerCertificateInputStream != null) {
                sslContextBuilder.trustManager(this.trustedServerCertificateInputStream);
            } else if (this.trustedServerCertificates != null) {
                sslContextBuilder.trustManager(this.trustedServerCertificates);
            }

            sslContext = sslContextBuilder.build();
        } else {
            sslContext = null;
        }

        final GcmSenderConfiguration configuration = new GcmSenderConfiguration(this.endpoint, this.apiKey, sslContext,
                this.connectionTimeout, this.requestTimeout, this.initialBackoff, this.maxBackoff,
                this.concurrentConnections, this.metricsListener);

        return new GcmSender(configuration, this.eventLoopGroup);
    }
}
