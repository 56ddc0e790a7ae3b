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

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of sending a message to one registration ID. A device result is exactly one of:
 *
 * <ul>
 *     <li>delivered, with a message ID</li>
 *     <li>delivered with a canonical registration ID, meaning the registration ID used for the send is stale and the
 *     caller should replace it with {@link #getCanonicalRegistrationId()}</li>
 *     <li>failed, with an {@linkplain #getError() error code}</li>
 *     <li>unknown, if the server never reported an outcome for the recipient</li>
 * </ul>
 */
public class DeviceResult implements Result {

    private final String messageId;
    private final String canonicalRegistrationId;
    private final String error;

    static final DeviceResult UNKNOWN = new DeviceResult(null, null, null);

    DeviceResult(final String messageId, final String canonicalRegistrationId, final String error) {
        this.messageId = messageId;
        this.canonicalRegistrationId = canonicalRegistrationId;
        this.error = error;
    }

    /**
     * Returns the ID the server assigned to the delivered message.
     *
     * @return the server-assigned message ID, or empty if the message was not delivered to this recipient
     */
    public Optional<String> getMessageId() {
        return Optional.ofNullable(this.messageId);
    }

    /**
     * Returns the registration ID that should be used for this recipient in place of the one the message was sent to.
     *
     * @return the canonical registration ID for this recipient, or empty if the registration ID used was current
     */
    public Optional<String> getCanonicalRegistrationId() {
        return Optional.ofNullable(this.canonicalRegistrationId);
    }

    @Override
    public Optional<String> getError() {
        return Optional.ofNullable(this.error);
    }

    @Override
    public boolean isSuccessful() {
        return this.messageId != null && !this.messageId.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DeviceResult that = (DeviceResult) o;

        return Objects.equals(messageId, that.messageId) &&
                Objects.equals(canonicalRegistrationId, that.canonicalRegistrationId) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, canonicalRegistrationId, error);
    }

    @Override
    public String toString() {
        return "DeviceResult{" +
                "messageId='" + messageId + '\'' +
                ", canonicalRegistrationId='" + canonicalRegistrationId + '\'' +
                ", error='" + error + '\'' +
                '}';
    }
}
