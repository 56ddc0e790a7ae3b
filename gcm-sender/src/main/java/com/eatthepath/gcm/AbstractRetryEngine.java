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

import java.io.IOException;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Shared machinery for the sender's retry engines: blocking on the transport, sleeping between attempts and handing
 * out a fresh {@link BackoffPolicy} for each top-level send.
 */
abstract class AbstractRetryEngine {

    private final GcmTransport transport;
    private final GcmSenderMetricsListener metricsListener;

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Supplier<Random> randomSupplier;

    AbstractRetryEngine(final GcmTransport transport,
                        final GcmSenderMetricsListener metricsListener,
                        final Duration initialBackoff,
                        final Duration maxBackoff) {

        this(transport, metricsListener, initialBackoff, maxBackoff, ThreadLocalRandom::current);
    }

    AbstractRetryEngine(final GcmTransport transport,
                        final GcmSenderMetricsListener metricsListener,
                        final Duration initialBackoff,
                        final Duration maxBackoff,
                        final Supplier<Random> randomSupplier) {

        this.transport = transport;
        this.metricsListener = metricsListener;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.randomSupplier = randomSupplier;
    }

    BackoffPolicy newBackoffPolicy() {
        return new BackoffPolicy(this.initialBackoff.toMillis(), this.maxBackoff.toMillis(), this.randomSupplier.get());
    }

    /**
     * Sends a request and blocks until the server responds. If the calling thread is interrupted while waiting, the
     * pending request is cancelled.
     *
     * @param request the request to send
     *
     * @return the server's response
     *
     * @throws IOException if the server answered with an unsuccessful status or no usable response was obtained
     * @throws InterruptedException if the calling thread was interrupted while waiting for a response
     */
    GcmResponse awaitResponse(final DownstreamRequest request) throws IOException, InterruptedException {
        final CompletableFuture<GcmResponse> responseFuture = this.transport.send(request);

        try {
            return responseFuture.get();
        } catch (final InterruptedException e) {
            responseFuture.cancel(true);
            throw e;
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }

            throw new IOException(e.getCause());
        }
    }

    /**
     * Waits for the next delay from the given backoff policy.
     *
     * @param backoffPolicy the backoff policy for the current send
     * @param recipientCount the number of recipients that will be retried after the delay
     *
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    void sleep(final BackoffPolicy backoffPolicy, final int recipientCount) throws InterruptedException {
        final long delayMillis = backoffPolicy.nextDelayMillis();

        this.metricsListener.handleRetryScheduled(recipientCount, delayMillis);
        Thread.sleep(delayMillis);
    }
}
