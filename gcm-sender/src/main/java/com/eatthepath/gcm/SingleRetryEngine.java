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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Sends a message to a single target (a registration ID, a topic or a device group) and retries the whole call while
 * the server reports a transient failure.
 */
class SingleRetryEngine extends AbstractRetryEngine {

    private static final Logger log = LoggerFactory.getLogger(SingleRetryEngine.class);

    SingleRetryEngine(final GcmTransport transport,
                      final GcmSenderMetricsListener metricsListener,
                      final Duration initialBackoff,
                      final Duration maxBackoff) {

        super(transport, metricsListener, initialBackoff, maxBackoff);
    }

    SingleRetryEngine(final GcmTransport transport,
                      final GcmSenderMetricsListener metricsListener,
                      final Duration initialBackoff,
                      final Duration maxBackoff,
                      final Supplier<Random> randomSupplier) {

        super(transport, metricsListener, initialBackoff, maxBackoff, randomSupplier);
    }

    /**
     * Sends a message to a single target exactly once.
     *
     * @param message the message to send
     * @param to the registration ID, topic or notification key to which to send the message
     *
     * @return the outcome reported by the server
     *
     * @throws IOException if the server answered with an unsuccessful status or no usable response was obtained
     * @throws InterruptedException if the calling thread was interrupted while waiting for a response
     */
    Result send(final Message message, final String to) throws IOException, InterruptedException {
        return this.awaitResponse(DownstreamRequest.forTarget(message, to)).toResult(to);
    }

    /**
     * <p>Sends a message to a single target, retrying up to {@code retries} times if the server reports a retryable
     * error code or answers with a 5xx status.</p>
     *
     * <p>Running out of retries while the server still reports a retryable error code is not an error: the last
     * result is returned, since the server did answer. A device group result is always final, even if some members of
     * the group could not be reached.</p>
     *
     * @param message the message to send
     * @param to the registration ID, topic or notification key to which to send the message
     * @param retries the maximum number of times to retry
     *
     * @return the last outcome reported by the server
     *
     * @throws IOException if the last attempt failed without a usable response
     * @throws InterruptedException if the calling thread was interrupted before any response was obtained
     */
    Result sendWithRetries(final Message message, final String to, final int retries) throws IOException, InterruptedException {
        final BackoffPolicy backoffPolicy = this.newBackoffPolicy();

        int attempt = 0;

        while (true) {
            attempt++;

            Result result = null;
            IOException failure = null;

            try {
                result = this.send(message, to);
            } catch (final IOException e) {
                failure = e;
            }

            final boolean shouldRetry = attempt <= retries &&
                    (result != null ? ErrorClassifier.isRetryable(result) : ErrorClassifier.isRetryable(failure));

            if (!shouldRetry) {
                if (failure != null) {
                    throw failure;
                }

                return result;
            }

            log.debug("Attempt {} to send message to {} failed ({}); will retry.", attempt, to,
                    failure != null ? failure.getMessage() : result);

            try {
                this.sleep(backoffPolicy, 1);
            } catch (final InterruptedException e) {
                if (result == null) {
                    throw e;
                }

                Thread.currentThread().interrupt();
                return result;
            }
        }
    }
}
