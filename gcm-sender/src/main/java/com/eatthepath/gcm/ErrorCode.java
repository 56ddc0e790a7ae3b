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

import java.util.Optional;

/**
 * An enumeration of the application-level error codes a GCM connection server may report for an individual recipient
 * (or, for topic messages, for the whole call). The most up-to-date descriptions of each code are available in the
 * <a href="https://developers.google.com/cloud-messaging/http-server-ref#error-codes">GCM HTTP connection server
 * reference</a>.
 *
 * @see ErrorClassifier#isRetryableError(String)
 */
public enum ErrorCode {
    MISSING_REGISTRATION("MissingRegistration"),
    INVALID_REGISTRATION("InvalidRegistration"),
    NOT_REGISTERED("NotRegistered"),
    INVALID_PACKAGE_NAME("InvalidPackageName"),
    MISMATCH_SENDER_ID("MismatchSenderId"),
    MESSAGE_TOO_BIG("MessageTooBig"),
    INVALID_DATA_KEY("InvalidDataKey"),
    INVALID_TTL("InvalidTtl"),
    UNAVAILABLE("Unavailable"),
    INTERNAL_SERVER_ERROR("InternalServerError"),
    DEVICE_MESSAGE_RATE_EXCEEDED("DeviceMessageRateExceeded"),
    TOPICS_MESSAGE_RATE_EXCEEDED("TopicsMessageRateExceeded");

    private final String value;

    ErrorCode(final String value) {
        this.value = value;
    }

    /**
     * Returns the string with which this error code appears on the wire.
     *
     * @return the wire representation of this error code
     */
    public String getValue() {
        return this.value;
    }

    /**
     * Finds the error code with the given wire representation.
     *
     * @param value the wire representation of an error code
     *
     * @return the matching error code, or empty if the server reported a code this client does not recognize
     */
    public static Optional<ErrorCode> fromValue(final String value) {
        for (final ErrorCode errorCode : ErrorCode.values()) {
            if (errorCode.value.equals(value)) {
                return Optional.of(errorCode);
            }
        }

        return Optional.empty();
    }
}
