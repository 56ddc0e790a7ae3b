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
 * The outcome of sending a message to a topic. The server reports either a message ID, meaning it will attempt to
 * deliver the message to all subscribed devices, or an error code.
 */
public class TopicResult implements Result {

    private final String messageId;
    private final String error;

    TopicResult(final String messageId, final String error) {
        this.messageId = messageId;
        this.error = error;
    }

    /**
     * Returns the ID the server assigned to the topic message.
     *
     * @return the server-assigned message ID, or empty if the server rejected the message
     */
    public Optional<String> getMessageId() {
        return Optional.ofNullable(this.messageId);
    }

    @Override
    public Optional<String> getError() {
        return Optional.ofNullable(this.error);
    }

    @Override
    public boolean isSuccessful() {
        return this.messageId != null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TopicResult that = (TopicResult) o;

        return Objects.equals(messageId, that.messageId) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, error);
    }

    @Override
    public String toString() {
        return "TopicResult{" +
                "messageId='" + messageId + '\'' +
                ", error='" + error + '\'' +
                '}';
    }
}
