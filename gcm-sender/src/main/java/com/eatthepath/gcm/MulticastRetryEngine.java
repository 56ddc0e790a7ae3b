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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Sends a message to a list of registration IDs and, in each subsequent round, retries only the recipients for which
 * the server reported a transient failure.
 */
class MulticastRetryEngine extends AbstractRetryEngine {

    private static final Logger log = LoggerFactory.getLogger(MulticastRetryEngine.class);

    MulticastRetryEngine(final GcmTransport transport,
                         final GcmSenderMetricsListener metricsListener,
                         final Duration initialBackoff,
                         final Duration maxBackoff) {

        super(transport, metricsListener, initialBackoff, maxBackoff);
    }

    MulticastRetryEngine(final GcmTransport transport,
                         final GcmSenderMetricsListener metricsListener,
                         final Duration initialBackoff,
                         final Duration maxBackoff,
                         final Supplier<Random> randomSupplier) {

        super(transport, metricsListener, initialBackoff, maxBackoff, randomSupplier);
    }

    /**
     * Sends a message to a list of registration IDs exactly once.
     *
     * @param message the message to send
     * @param registrationIds the registration IDs to which to send the message
     *
     * @return the outcome reported by the server, aligned with {@code registrationIds}
     *
     * @throws IOException if the server answered with an unsuccessful status or no usable response was obtained
     * @throws InterruptedException if the calling thread was interrupted while waiting for a response
     */
    MulticastResult send(final Message message, final List<String> registrationIds) throws IOException, InterruptedException {
        return this.sendRound(message, registrationIds).toMulticastResult();
    }

    /**
     * <p>Sends a message to a list of registration IDs, retrying up to {@code retries} times. After each round, only
     * the recipients whose outcome carries a retryable error code are sent again; if a round fails outright with a 5xx
     * status, every recipient of that round is sent again.</p>
     *
     * <p>If the first round fails with a non-retryable error, that error is thrown. If a later round fails with a
     * non-retryable error, retrying stops and the outcomes gathered by earlier rounds are returned without an
     * error.</p>
     *
     * @param message the message to send
     * @param registrationIds the registration IDs to which to send the message; duplicates are permitted
     * @param retries the maximum number of retry rounds
     *
     * @return the reconciled outcome of all rounds, aligned index-for-index with {@code registrationIds}
     *
     * @throws IOException if the first round failed with a non-retryable error
     * @throws InterruptedException if the calling thread was interrupted during the first round
     */
    MulticastResult sendWithRetries(final Message message, final List<String> registrationIds, final int retries)
            throws IOException, InterruptedException {

        final BackoffPolicy backoffPolicy = this.newBackoffPolicy();
        final Map<String, DeviceResult> outcomesByRegistrationId = new HashMap<>(registrationIds.size());

        long multicastId = 0;
        final List<Long> retryMulticastIds = new ArrayList<>();

        List<String> currentRegistrationIds = Collections.unmodifiableList(new ArrayList<>(registrationIds));
        int retriesRemaining = retries;
        boolean firstRound = true;

        while (true) {
            GcmResponse response = null;

            try {
                response = this.sendRound(message, currentRegistrationIds);
            } catch (final IOException e) {
                if (ErrorClassifier.isRetryable(e)) {
                    log.debug("Multicast round to {} recipients failed with a retryable error.", currentRegistrationIds.size(), e);
                } else if (firstRound) {
                    throw e;
                } else {
                    log.warn("Multicast retry round failed with a non-retryable error; returning results from earlier rounds.", e);
                    break;
                }
            } catch (final InterruptedException e) {
                if (firstRound) {
                    throw e;
                }

                Thread.currentThread().interrupt();
                break;
            }

            final List<String> retryRegistrationIds;

            if (response != null) {
                if (response.getMulticastId() != 0) {
                    if (firstRound) {
                        multicastId = response.getMulticastId();
                    } else {
                        retryMulticastIds.add(response.getMulticastId());
                    }
                }

                final List<DeviceResult> results = response.getResults();
                retryRegistrationIds = new ArrayList<>();

                for (int i = 0; i < results.size(); i++) {
                    final String registrationId = currentRegistrationIds.get(i);
                    final DeviceResult result = results.get(i);

                    outcomesByRegistrationId.put(registrationId, result);

                    if (ErrorClassifier.isRetryable(result)) {
                        retryRegistrationIds.add(registrationId);
                    }
                }
            } else {
                retryRegistrationIds = currentRegistrationIds;
            }

            firstRound = false;

            if (retriesRemaining <= 0 || retryRegistrationIds.isEmpty()) {
                break;
            }

            currentRegistrationIds = Collections.unmodifiableList(new ArrayList<>(retryRegistrationIds));

            try {
                this.sleep(backoffPolicy, currentRegistrationIds.size());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            retriesRemaining--;
        }

        return ResultReconciler.reconcile(registrationIds, outcomesByRegistrationId, multicastId, retryMulticastIds);
    }

    private GcmResponse sendRound(final Message message, final List<String> registrationIds) throws IOException, InterruptedException {
        final GcmResponse response = this.awaitResponse(DownstreamRequest.forRegistrationIds(message, registrationIds));

        if (response.getResults().size() != registrationIds.size()) {
            throw new IOException(String.format("Sent message to %d recipients, but received %d results.",
                    registrationIds.size(), response.getResults().size()));
        }

        return response;
    }
}
