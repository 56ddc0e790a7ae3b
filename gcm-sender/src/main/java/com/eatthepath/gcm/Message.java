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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <p>A downstream message: an optional data payload and/or {@link Notification} plus the options that control its
 * delivery. Messages carry no recipients; the same message may be sent to a single registration ID, a topic, a device
 * group or a list of registration IDs through a {@link GcmSender}.</p>
 *
 * <p>Messages are immutable and are constructed with a {@link Message.Builder}.</p>
 *
 * @see <a href="https://developers.google.com/cloud-messaging/http-server-ref#downstream-http-messages-json">Downstream
 * HTTP messages (JSON)</a>
 */
public class Message {

    private final String collapseKey;
    private final boolean delayWhileIdle;
    private final Integer timeToLive;
    private final String restrictedPackageName;
    private final boolean dryRun;
    private final boolean contentAvailable;
    private final Priority priority;
    private final Map<String, String> data;
    private final Notification notification;

    /**
     * The longest time-to-live, in seconds, the GCM connection server accepts (four weeks).
     */
    public static final int MAX_TIME_TO_LIVE_SECONDS = (int) Duration.ofDays(28).getSeconds();

    /**
     * Constructs new {@link Message} instances. Builders may be reused; each call to {@link #build()} takes a snapshot
     * of the builder's current state.
     */
    public static class Builder {
        private String collapseKey;
        private boolean delayWhileIdle;
        private Integer timeToLive;
        private String restrictedPackageName;
        private boolean dryRun;
        private boolean contentAvailable;
        private Priority priority;
        private final Map<String, String> data = new LinkedHashMap<>();
        private Notification notification;

        /**
         * Sets an identifier for a group of messages that can be collapsed, so that only the last message is sent
         * when delivery can be resumed.
         *
         * @param collapseKey the collapse key for the message; may be {@code null}
         *
         * @return a reference to this builder
         */
        public Builder setCollapseKey(final String collapseKey) {
            this.collapseKey = collapseKey;
            return this;
        }

        public Builder setDelayWhileIdle(final boolean delayWhileIdle) {
            this.delayWhileIdle = delayWhileIdle;
            return this;
        }

        /**
         * Sets how long, in seconds, the message should be kept in storage if the device is offline. Values are
         * checked against {@link #MAX_TIME_TO_LIVE_SECONDS} when the message is sent, not here.
         *
         * @param timeToLiveSeconds the message's time-to-live in seconds; may be {@code null} to use the server's
         * default
         *
         * @return a reference to this builder
         */
        public Builder setTimeToLive(final Integer timeToLiveSeconds) {
            this.timeToLive = timeToLiveSeconds;
            return this;
        }

        public Builder setRestrictedPackageName(final String restrictedPackageName) {
            this.restrictedPackageName = restrictedPackageName;
            return this;
        }

        /**
         * Marks the message as a test request; the server validates it but does not deliver it to any device.
         *
         * @param dryRun {@code true} if the message should not actually be delivered
         *
         * @return a reference to this builder
         */
        public Builder setDryRun(final boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder setContentAvailable(final boolean contentAvailable) {
            this.contentAvailable = contentAvailable;
            return this;
        }

        public Builder setPriority(final Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder addData(final String key, final String value) {
            this.data.put(Objects.requireNonNull(key, "Data keys must not be null."), value);
            return this;
        }

        public Builder addData(final Map<String, String> data) {
            data.forEach(this::addData);
            return this;
        }

        public Builder setNotification(final Notification notification) {
            this.notification = notification;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }

    private Message(final Builder builder) {
        this.collapseKey = builder.collapseKey;
        this.delayWhileIdle = builder.delayWhileIdle;
        this.timeToLive = builder.timeToLive;
        this.restrictedPackageName = builder.restrictedPackageName;
        this.dryRun = builder.dryRun;
        this.contentAvailable = builder.contentAvailable;
        this.priority = builder.priority;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.notification = builder.notification;
    }

    public String getCollapseKey() {
        return this.collapseKey;
    }

    public boolean isDelayWhileIdle() {
        return this.delayWhileIdle;
    }

    /**
     * Returns the message's time-to-live in seconds.
     *
     * @return the message's time-to-live in seconds, or {@code null} if the server's default applies
     */
    public Integer getTimeToLive() {
        return this.timeToLive;
    }

    public String getRestrictedPackageName() {
        return this.restrictedPackageName;
    }

    public boolean isDryRun() {
        return this.dryRun;
    }

    public boolean isContentAvailable() {
        return this.contentAvailable;
    }

    public Priority getPriority() {
        return this.priority;
    }

    /**
     * Returns the custom key/value payload of this message.
     *
     * @return an unmodifiable view of this message's data payload; empty if no data was set
     */
    public Map<String, String> getData() {
        return this.data;
    }

    public Notification getNotification() {
        return this.notification;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Message message = (Message) o;

        return delayWhileIdle == message.delayWhileIdle &&
                dryRun == message.dryRun &&
                contentAvailable == message.contentAvailable &&
                Objects.equals(collapseKey, message.collapseKey) &&
                Objects.equals(timeToLive, message.timeToLive) &&
                Objects.equals(restrictedPackageName, message.restrictedPackageName) &&
                priority == message.priority &&
                data.equals(message.data) &&
                Objects.equals(notification, message.notification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collapseKey, delayWhileIdle, timeToLive, restrictedPackageName, dryRun, contentAvailable,
                priority, data, notification);
    }

    @Override
    public String toString() {
        return "Message{" +
                "collapseKey='" + collapseKey + '\'' +
                ", delayWhileIdle=" + delayWhileIdle +
                ", timeToLive=" + timeToLive +
                ", restrictedPackageName='" + restrictedPackageName + '\'' +
                ", dryRun=" + dryRun +
                ", contentAvailable=" + contentAvailable +
                ", priority=" + priority +
                ", data=" + data +
                ", notification=" + notification +
                '}';
    }
}
