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
import io.netty.channel.nio.NioEventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>A GCM sender delivers downstream messages to the GCM (or FCM) legacy HTTP connection server. A message may be
 * sent to a single target (a registration ID, a topic or a device group notification key) or to a list of
 * registration IDs in a single multicast request.</p>
 *
 * <p>Senders are constructed using a {@link GcmSenderBuilder}. Callers may optionally specify an
 * {@link EventLoopGroup} when constructing a new sender. If no event loop group is specified, senders will create and
 * manage their own single-thread event loop group.</p>
 *
 * <p>Unlike the underlying transport, the send methods of this class block until the server has answered (and, for
 * the retrying variants, until all retries have finished). The retrying variants wait between attempts using
 * randomized exponential backoff. A multicast send only retries the registration IDs for which the server reported a
 * transient failure, and always returns results aligned index-for-index with the caller's list of registration
 * IDs.</p>
 *
 * <p>Senders are intended to be long-lived, persistent resources. They are thread-safe and can be shared across many
 * threads. Callers must shut them down via the {@link GcmSender#close()} method when they are no longer needed.</p>
 */
public class GcmSender {

    /**
     * The prefix that identifies a topic target. Targets beginning with this prefix receive a {@link TopicResult}.
     */
    public static final String TOPIC_PREFIX = "/topics/";

    private final EventLoopGroup eventLoopGroup;
    private final boolean shouldShutDownEventLoopGroup;

    private final GcmTransport transport;

    private final SingleRetryEngine singleRetryEngine;
    private final MulticastRetryEngine multicastRetryEngine;

    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    private static final Logger log = LoggerFactory.getLogger(GcmSender.class);

    private static class NoopGcmSenderMetricsListener implements GcmSenderMetricsListener {

        @Override
        public void handleRequestSent(final int recipientCount) {
        }

        @Override
        public void handleRequestFailed(final Throwable cause) {
        }

        @Override
        public void handleRequestAcknowledged(final int success, final int failure, final long durationNanos) {
        }

        @Override
        public void handleRetryScheduled(final int recipientCount, final long delayMillis) {
        }

        @Override
        public void handleConnectionAdded() {
        }

        @Override
        public void handleConnectionRemoved() {
        }

        @Override
        public void handleConnectionCreationFailed() {
        }
    }

    GcmSender(final GcmSenderConfiguration configuration, final EventLoopGroup eventLoopGroup) {
        if (eventLoopGroup != null) {
            this.eventLoopGroup = eventLoopGroup;
            this.shouldShutDownEventLoopGroup = false;
        } else {
            this.eventLoopGroup = new NioEventLoopGroup(1);
            this.shouldShutDownEventLoopGroup = true;
        }

        final GcmSenderMetricsListener metricsListener =
                configuration.getMetricsListener().orElseGet(NoopGcmSenderMetricsListener::new);

        this.transport = new NettyGcmTransport(configuration, metricsListener, this.eventLoopGroup);

        this.singleRetryEngine = new SingleRetryEngine(this.transport, metricsListener,
                configuration.getInitialBackoff(), configuration.getMaxBackoff());

        this.multicastRetryEngine = new MulticastRetryEngine(this.transport, metricsListener,
                configuration.getInitialBackoff(), configuration.getMaxBackoff());
    }

    /**
     * Sends a message to a single target without retrying.
     *
     * @param message the message to send
     * @param to the registration ID, topic (beginning with {@value TOPIC_PREFIX}) or device group notification key to
     * which to send the message
     *
     * @return a {@link DeviceResult}, {@link TopicResult} or {@link DeviceGroupResult}, depending on the kind of target
     *
     * @throws NullPointerException if {@code message} is {@code null}
     * @throws IllegalArgumentException if the target is missing or the message's time to live is out of range
     * @throws HttpStatusException if the server answered with a status other than {@code 200 OK}
     * @throws IOException if no usable response could be obtained from the server
     * @throws InterruptedException if the calling thread was interrupted while waiting for a response
     */
    public Result sendNoRetry(final Message message, final String to) throws IOException, InterruptedException {
        validateMessage(message);
        validateTarget(to);
        this.checkOpen();

        return this.singleRetryEngine.send(message, to);
    }

    /**
     * <p>Sends a message to a single target, retrying up to {@code retries} times while the server reports a transient
     * failure (an {@link ErrorCode#UNAVAILABLE} or {@link ErrorCode#INTERNAL_SERVER_ERROR} error code, or a 5xx
     * status).</p>
     *
     * <p>If retries run out while the server still reports a transient error code, the last result is returned rather
     * than an exception thrown. If retries run out on a 5xx status, the {@link HttpStatusException} is thrown.</p>
     *
     * @param message the message to send
     * @param to the registration ID, topic or device group notification key to which to send the message
     * @param retries the maximum number of times to retry; zero sends exactly once
     *
     * @return the last result reported by the server
     *
     * @throws NullPointerException if {@code message} is {@code null}
     * @throws IllegalArgumentException if the target is missing, {@code retries} is negative or the message's time to
     * live is out of range
     * @throws HttpStatusException if the last attempt was answered with a status other than {@code 200 OK}
     * @throws IOException if no usable response could be obtained from the server
     * @throws InterruptedException if the calling thread was interrupted before any response was obtained
     */
    public Result sendWithRetries(final Message message, final String to, final int retries) throws IOException, InterruptedException {
        validateMessage(message);
        validateTarget(to);
        validateRetries(retries);
        this.checkOpen();

        return this.singleRetryEngine.sendWithRetries(message, to, retries);
    }

    /**
     * Sends a message to a list of registration IDs in a single multicast request without retrying.
     *
     * @param message the message to send
     * @param registrationIds the registration IDs to which to send the message
     *
     * @return the server's outcome, aligned index-for-index with {@code registrationIds}
     *
     * @throws NullPointerException if {@code message} is {@code null}
     * @throws IllegalArgumentException if the list of registration IDs is empty or the message's time to live is out
     * of range
     * @throws HttpStatusException if the server answered with a status other than {@code 200 OK}
     * @throws IOException if no usable response could be obtained from the server
     * @throws InterruptedException if the calling thread was interrupted while waiting for a response
     */
    public MulticastResult sendMulticastNoRetry(final Message message, final List<String> registrationIds)
            throws IOException, InterruptedException {

        validateMessage(message);
        validateRegistrationIds(registrationIds);
        this.checkOpen();

        return this.multicastRetryEngine.send(message, registrationIds);
    }

    /**
     * <p>Sends a message to a list of registration IDs, retrying up to {@code retries} times. Each retry round only
     * addresses the registration IDs for which the previous round reported a transient failure; a round answered with
     * a 5xx status is repeated in full.</p>
     *
     * <p>The returned result is aligned index-for-index with {@code registrationIds}, and each position reports the
     * latest outcome for its registration ID. If a retry round (but not the first round) fails with a permanent error,
     * retrying stops and the outcomes gathered so far are returned.</p>
     *
     * @param message the message to send
     * @param registrationIds the registration IDs to which to send the message
     * @param retries the maximum number of retry rounds; zero sends exactly once
     *
     * @return the reconciled outcome of all rounds
     *
     * @throws NullPointerException if {@code message} is {@code null}
     * @throws IllegalArgumentException if the list of registration IDs is empty, {@code retries} is negative or the
     * message's time to live is out of range
     * @throws HttpStatusException if the first round was answered with a permanent error status
     * @throws IOException if the first round failed without a usable response
     * @throws InterruptedException if the calling thread was interrupted during the first round
     */
    public MulticastResult sendMulticastWithRetries(final Message message, final List<String> registrationIds, final int retries)
            throws IOException, InterruptedException {

        validateMessage(message);
        validateRegistrationIds(registrationIds);
        validateRetries(retries);
        this.checkOpen();

        return this.multicastRetryEngine.sendWithRetries(message, registrationIds, retries);
    }

    private static void validateMessage(final Message message) {
        Objects.requireNonNull(message, "Message must not be null.");

        final Integer timeToLive = message.getTimeToLive();

        if (timeToLive != null && (timeToLive < 0 || timeToLive > Message.MAX_TIME_TO_LIVE_SECONDS)) {
            throw new IllegalArgumentException("Time to live must be between 0 and " +
                    Message.MAX_TIME_TO_LIVE_SECONDS + " seconds, but was " + timeToLive + ".");
        }
    }

    private static void validateTarget(final String to) {
        if (to == null || to.isEmpty()) {
            throw new IllegalArgumentException("Missing recipient(s).");
        }
    }

    private static void validateRegistrationIds(final List<String> registrationIds) {
        if (registrationIds == null || registrationIds.isEmpty()) {
            throw new IllegalArgumentException("Missing recipient(s).");
        }

        if (registrationIds.contains(null)) {
            throw new IllegalArgumentException("Registration IDs must not be null.");
        }
    }

    private static void validateRetries(final int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("Retries must not be negative.");
        }
    }

    private void checkOpen() {
        if (this.isClosed.get()) {
            throw new IllegalStateException("Sender has been closed and can no longer send messages.");
        }
    }

    /**
     * <p>Shuts down the sender, closing all connections and releasing all persistent resources. Sends that are in
     * progress when the sender is closed may fail.</p>
     *
     * <p>The returned {@code Future} will be marked as complete when all connections in this sender's pool have closed
     * and (if no {@code EventLoopGroup} was provided at construction time) the sender's event loop group has shut down.
     * If the sender has already shut down, the returned {@code Future} will be marked as complete immediately.</p>
     *
     * <p>Senders may not be reused once they have been closed.</p>
     *
     * @return a {@code Future} that will be marked as complete when the sender has finished shutting down
     */
    public CompletableFuture<Void> close() {
        log.info("Shutting down.");

        final CompletableFuture<Void> closeFuture;

        if (this.isClosed.compareAndSet(false, true)) {
            closeFuture = new CompletableFuture<>();

            this.transport.close().whenComplete((ignored, cause) -> {
                if (this.shouldShutDownEventLoopGroup) {
                    this.eventLoopGroup.shutdownGracefully().addListener(future -> closeFuture.complete(null));
                } else {
                    closeFuture.complete(null);
                }
            });
        } else {
            closeFuture = CompletableFuture.completedFuture(null);
        }

        return closeFuture;
    }
}
