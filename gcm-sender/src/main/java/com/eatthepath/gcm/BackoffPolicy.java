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

import java.util.Random;

/**
 * <p>Produces a randomized, capped, exponentially-growing sequence of delays between retry attempts. Each delay is
 * drawn uniformly from {@code [backoff / 2, 3 * backoff / 2)}, after which {@code backoff} doubles up to the
 * configured maximum.</p>
 *
 * <p>Backoff policies are stateful and are <em>not</em> thread-safe; each top-level send call uses its own
 * instance.</p>
 */
class BackoffPolicy {

    private final long maxDelayMillis;
    private final Random random;

    private long backoffMillis;

    BackoffPolicy(final long initialDelayMillis, final long maxDelayMillis, final Random random) {
        if (initialDelayMillis <= 0) {
            throw new IllegalArgumentException("Initial delay must be positive.");
        }

        if (maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("Maximum delay must not be shorter than the initial delay.");
        }

        this.backoffMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.random = random;
    }

    /**
     * Returns the delay to wait before the next retry and advances this policy.
     *
     * @return the number of milliseconds to wait before the next retry
     */
    long nextDelayMillis() {
        final long delayMillis = (this.backoffMillis / 2) + (long) (this.random.nextDouble() * this.backoffMillis);
        this.backoffMillis = Math.min(2 * this.backoffMillis, this.maxDelayMillis);

        return delayMillis;
    }
}
