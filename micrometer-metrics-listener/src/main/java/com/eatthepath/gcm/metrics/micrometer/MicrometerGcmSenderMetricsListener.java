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

package com.eatthepath.gcm.metrics.micrometer;

import com.eatthepath.gcm.GcmSender;
import com.eatthepath.gcm.GcmSenderMetricsListener;
import com.eatthepath.gcm.HttpStatusException;
import io.micrometer.core.instrument.*;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>A {@link GcmSenderMetricsListener} implementation that gathers and reports metrics using the
 * <a href="http://micrometer.io/">Micrometer application monitoring library</a>. A
 * {@code MicrometerGcmSenderMetricsListener} is intended to be used with a single {@link GcmSender} instance; to
 * gather metrics from multiple senders, callers should create multiple listeners and should consider providing
 * separate sets of identifying tags to each listener.</p>
 *
 * <p>Callers provide a {@link io.micrometer.core.instrument.MeterRegistry} to the
 * {@code MicrometerGcmSenderMetricsListener} at construction time, and the listener populates the registry with the
 * following metrics:</p>
 *
 * <dl>
 *  <dt>{@value #SENT_REQUESTS_COUNTER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Counter} that measures the number of requests written to the
 *  connection server.</dd>
 *
 *  <dt>{@value #FAILED_REQUESTS_COUNTER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Counter} that measures the number of requests that did not produce a
 *  usable response. In addition to the tags provided at listener construction time, this counter will also be tagged
 *  with:
 *
 *  <dl>
 *    <dt>{@value #STATUS_TAG_NAME}</dt>
 *    <dd>The HTTP status code returned by the server, or "none" if the server did not answer</dd>
 *  </dl>
 *  </dd>
 *
 *  <dt>{@value #ACKNOWLEDGED_REQUESTS_TIMER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Timer} that measures the time between sending requests and receiving a
 *  {@code 200 OK} reply from the server.</dd>
 *
 *  <dt>{@value #RECIPIENTS_COUNTER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Counter} that measures the number of per-recipient outcomes reported by
 *  the server. In addition to the tags provided at listener construction time, this counter will also be tagged
 *  with:
 *
 *  <dl>
 *    <dt>{@value #OUTCOME_TAG_NAME}</dt>
 *    <dd>"success" or "failure"</dd>
 *  </dl>
 *  </dd>
 *
 *  <dt>{@value #SCHEDULED_RETRIES_COUNTER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Counter} that measures the number of retry rounds scheduled.</dd>
 *
 *  <dt>{@value #OPEN_CONNECTIONS_GAUGE_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Gauge} that indicates number of open connections.</dd>
 *
 *  <dt>{@value #CONNECTION_FAILURES_COUNTER_NAME}</dt>
 *  <dd>A {@link io.micrometer.core.instrument.Counter} that measures the number of failed attempts to connect to the
 *  connection server.</dd>
 * </dl>
 */
public class MicrometerGcmSenderMetricsListener implements GcmSenderMetricsListener {

    private final MeterRegistry meterRegistry;
    private final Tags tags;

    private final Counter sentRequests;
    private final Timer acknowledgedRequests;
    private final Counter successfulRecipients;
    private final Counter failedRecipients;
    private final Counter scheduledRetries;

    private final AtomicInteger openConnections = new AtomicInteger(0);
    private final Counter connectionFailures;

    /**
     * The name of a {@link io.micrometer.core.instrument.Counter} that measures the number of requests sent.
     */
    public static final String SENT_REQUESTS_COUNTER_NAME = "gcm.requests.sent";

    /**
     * The name of a {@link io.micrometer.core.instrument.Counter} that measures the number of requests that failed.
     */
    public static final String FAILED_REQUESTS_COUNTER_NAME = "gcm.requests.failed";

    /**
     * The name of a {@link io.micrometer.core.instrument.Timer} that measures round-trip time for requests.
     */
    public static final String ACKNOWLEDGED_REQUESTS_TIMER_NAME = "gcm.requests.acknowledged";

    /**
     * The name of a {@link io.micrometer.core.instrument.Counter} that measures per-recipient outcomes.
     */
    public static final String RECIPIENTS_COUNTER_NAME = "gcm.recipients";

    /**
     * The name of a {@link io.micrometer.core.instrument.Counter} that measures the number of scheduled retries.
     */
    public static final String SCHEDULED_RETRIES_COUNTER_NAME = "gcm.retries.scheduled";

    /**
     * The name of a {@link io.micrometer.core.instrument.Gauge} that measures the number of open connections in a
     * sender's internal connection pool.
     */
    public static final String OPEN_CONNECTIONS_GAUGE_NAME = "gcm.connections.open";

    /**
     * The name of a {@link io.micrometer.core.instrument.Counter} that measures the number of a sender's failed
     * connection attempts.
     */
    public static final String CONNECTION_FAILURES_COUNTER_NAME = "gcm.connections.failed";

    /**
     * The name of a tag attached to the {@value #FAILED_REQUESTS_COUNTER_NAME} counter indicating the HTTP status code
     * reported by the server.
     */
    public static final String STATUS_TAG_NAME = "status";

    /**
     * The name of a tag attached to the {@value #RECIPIENTS_COUNTER_NAME} counter indicating whether the server
     * reported success or failure for a recipient.
     */
    public static final String OUTCOME_TAG_NAME = "outcome";

    /**
     * Constructs a new Micrometer metrics listener that adds metrics to the given registry with the given list of tags.
     *
     * @param meterRegistry the registry to which to add metrics
     * @param tagKeysAndValues an optional list of tag keys/values to attach to all metrics produced by this listener;
     * must be an even number of strings representing alternating key/value pairs
     */
    public MicrometerGcmSenderMetricsListener(final MeterRegistry meterRegistry, final String... tagKeysAndValues) {
        this(meterRegistry, Tags.of(tagKeysAndValues));
    }

    /**
     * Constructs a new Micrometer metrics listener that adds metrics to the given registry with the given list of tags.
     *
     * @param meterRegistry the registry to which to add metrics
     * @param tags an optional collection of tags to attach to all metrics produced by this listener; may be empty
     * or {@code null}
     */
    public MicrometerGcmSenderMetricsListener(final MeterRegistry meterRegistry, final Iterable<Tag> tags) {
        this.meterRegistry = meterRegistry;
        this.tags = Tags.of(tags);

        this.sentRequests = meterRegistry.counter(SENT_REQUESTS_COUNTER_NAME, this.tags);
        this.acknowledgedRequests = meterRegistry.timer(ACKNOWLEDGED_REQUESTS_TIMER_NAME, this.tags);
        this.successfulRecipients = meterRegistry.counter(RECIPIENTS_COUNTER_NAME, this.tags.and(OUTCOME_TAG_NAME, "success"));
        this.failedRecipients = meterRegistry.counter(RECIPIENTS_COUNTER_NAME, this.tags.and(OUTCOME_TAG_NAME, "failure"));
        this.scheduledRetries = meterRegistry.counter(SCHEDULED_RETRIES_COUNTER_NAME, this.tags);

        this.connectionFailures = meterRegistry.counter(CONNECTION_FAILURES_COUNTER_NAME, this.tags);
        meterRegistry.gauge(OPEN_CONNECTIONS_GAUGE_NAME, this.tags, openConnections);
    }

    @Override
    public void handleRequestSent(final int recipientCount) {
        this.sentRequests.increment();
    }

    /**
     * Records a request that did not produce a usable response and updates metrics accordingly.
     *
     * @param cause the reason the request failed
     */
    @Override
    public void handleRequestFailed(final Throwable cause) {
        final String status = cause instanceof HttpStatusException ?
                String.valueOf(((HttpStatusException) cause).getStatusCode()) : "none";

        this.meterRegistry.counter(FAILED_REQUESTS_COUNTER_NAME, this.tags.and(STATUS_TAG_NAME, status)).increment();
    }

    /**
     * Records that the server answered a request and updates metrics accordingly.
     *
     * @param success the number of recipients to which the server reported successful delivery
     * @param failure the number of recipients for which the server reported an error
     * @param durationNanos the duration, in nanoseconds, between sending the request and receiving the reply
     */
    @Override
    public void handleRequestAcknowledged(final int success, final int failure, final long durationNanos) {
        this.acknowledgedRequests.record(durationNanos, TimeUnit.NANOSECONDS);

        this.successfulRecipients.increment(success);
        this.failedRecipients.increment(failure);
    }

    @Override
    public void handleRetryScheduled(final int recipientCount, final long delayMillis) {
        this.scheduledRetries.increment();
    }

    @Override
    public void handleConnectionAdded() {
        this.openConnections.incrementAndGet();
    }

    @Override
    public void handleConnectionRemoved() {
        this.openConnections.decrementAndGet();
    }

    /**
     * Records that an attempt to connect to the connection server failed and updates metrics accordingly.
     */
    @Override
    public void handleConnectionCreationFailed() {
        this.connectionFailures.increment();
    }
}
