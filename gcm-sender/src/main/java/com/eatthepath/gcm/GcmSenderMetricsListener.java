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

/**
 * <p>A GCM sender metrics listener receives events from a {@link GcmSender} that can be used to measure the
 * performance and behavior of the sender. Although the information sent to a metrics listener is generally available
 * by other means, it is provided to metrics listeners in a more structured form.</p>
 *
 * <p>Sender metrics listeners are notified from the sender's event loop thread and from the threads that call the
 * sender's send methods, and must therefore be thread-safe. Listeners should not block.</p>
 */
public interface GcmSenderMetricsListener {

    /**
     * Indicates that a request was written to the GCM connection server.
     *
     * @param recipientCount the number of recipients addressed by the request
     */
    void handleRequestSent(int recipientCount);

    /**
     * Indicates that a request did not produce a usable response, either because the server answered with a status
     * other than {@code 200 OK} or because no response could be obtained at all.
     *
     * @param cause the reason the request failed; an {@link HttpStatusException} if the server answered with an
     * unsuccessful status
     */
    void handleRequestFailed(Throwable cause);

    /**
     * Indicates that the server answered a request with a well-formed {@code 200 OK} response.
     *
     * @param success the number of recipients to which the server reported successful delivery in this response
     * @param failure the number of recipients for which the server reported an error in this response
     * @param durationNanos the time, in nanoseconds, between writing the request and receiving the response
     */
    void handleRequestAcknowledged(int success, int failure, long durationNanos);

    /**
     * Indicates that the sender will retry some or all recipients of a message after a delay.
     *
     * @param recipientCount the number of recipients that will be retried
     * @param delayMillis the number of milliseconds the sender will wait before retrying
     */
    void handleRetryScheduled(int recipientCount, long delayMillis);

    /**
     * Indicates that the sender has opened a new connection to the GCM connection server.
     */
    void handleConnectionAdded();

    /**
     * Indicates that a previously-opened connection to the GCM connection server has closed.
     */
    void handleConnectionRemoved();

    /**
     * Indicates that an attempt to open a connection to the GCM connection server failed.
     */
    void handleConnectionCreationFailed();
}
