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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>The outcome of sending a message to a list of registration IDs. When a multicast message is sent with retries,
 * the server may be called several times with shrinking subsets of the original list; a multicast result folds all
 * of those calls back into a single view whose {@linkplain #getResults() results} line up index-for-index with the
 * registration IDs the caller provided.</p>
 *
 * <p>For every multicast result, {@code getSuccess() + getFailure() == getResults().size()} and
 * {@code getCanonicalIds() <= getSuccess()}.</p>
 */
public class MulticastResult {

    private final int success;
    private final int failure;
    private final int canonicalIds;
    private final long multicastId;
    private final List<DeviceResult> results;
    private final List<Long> retryMulticastIds;

    MulticastResult(final int success, final int failure, final int canonicalIds, final long multicastId,
                    final List<DeviceResult> results, final List<Long> retryMulticastIds) {

        this.success = success;
        this.failure = failure;
        this.canonicalIds = canonicalIds;
        this.multicastId = multicastId;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.retryMulticastIds = Collections.unmodifiableList(new ArrayList<>(retryMulticastIds));
    }

    /**
     * Returns the number of recipients to which the message was delivered.
     *
     * @return the number of recipients to which the message was delivered
     */
    public int getSuccess() {
        return this.success;
    }

    /**
     * Returns the number of recipients to which the message could not be delivered, including recipients for which the
     * server never reported an outcome.
     *
     * @return the number of recipients to which the message could not be delivered
     */
    public int getFailure() {
        return this.failure;
    }

    /**
     * Returns the number of delivered results that carry a canonical registration ID.
     *
     * @return the number of results with a canonical registration ID
     */
    public int getCanonicalIds() {
        return this.canonicalIds;
    }

    /**
     * Returns the ID the server assigned to the first call for this message.
     *
     * @return the multicast ID of the first call, or zero if the server did not report one
     */
    public long getMulticastId() {
        return this.multicastId;
    }

    /**
     * Returns the per-recipient results in the same order as the registration IDs to which the message was sent.
     *
     * @return an unmodifiable list of per-recipient results
     */
    public List<DeviceResult> getResults() {
        return this.results;
    }

    /**
     * Returns the multicast IDs the server assigned to each retry call, in the order the calls were made.
     *
     * @return an unmodifiable list of retry multicast IDs; empty if no retry call produced a response
     */
    public List<Long> getRetryMulticastIds() {
        return this.retryMulticastIds;
    }

    public int getTotal() {
        return this.success + this.failure;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final MulticastResult that = (MulticastResult) o;

        return success == that.success &&
                failure == that.failure &&
                canonicalIds == that.canonicalIds &&
                multicastId == that.multicastId &&
                results.equals(that.results) &&
                retryMulticastIds.equals(that.retryMulticastIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, failure, canonicalIds, multicastId, results, retryMulticastIds);
    }

    @Override
    public String toString() {
        return "MulticastResult{" +
                "success=" + success +
                ", failure=" + failure +
                ", canonicalIds=" + canonicalIds +
                ", multicastId=" + multicastId +
                ", results=" + results +
                ", retryMulticastIds=" + retryMulticastIds +
                '}';
    }
}
