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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    @ParameterizedTest
    @ValueSource(ints = {500, 501, 503, 599})
    void isRetryableStatus(final int statusCode) {
        assertTrue(ErrorClassifier.isRetryableStatus(statusCode));
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 400, 401, 404, 499, 600})
    void isRetryableStatusPermanent(final int statusCode) {
        assertFalse(ErrorClassifier.isRetryableStatus(statusCode));
    }

    @ParameterizedTest
    @EnumSource(ErrorCode.class)
    void isRetryableError(final ErrorCode errorCode) {
        final boolean expectRetryable =
                errorCode == ErrorCode.UNAVAILABLE || errorCode == ErrorCode.INTERNAL_SERVER_ERROR;

        assertEquals(expectRetryable, ErrorClassifier.isRetryableError(errorCode.getValue()));
    }

    @Test
    void isRetryableErrorUnknownOrMissing() {
        assertFalse(ErrorClassifier.isRetryableError(null));
        assertFalse(ErrorClassifier.isRetryableError(""));
        assertFalse(ErrorClassifier.isRetryableError("unavailable"));
        assertFalse(ErrorClassifier.isRetryableError("SomethingNew"));
    }

    @Test
    void isRetryableResult() {
        assertTrue(ErrorClassifier.isRetryable(new DeviceResult(null, null, "Unavailable")));
        assertTrue(ErrorClassifier.isRetryable(new TopicResult(null, "InternalServerError")));

        assertFalse(ErrorClassifier.isRetryable(new DeviceResult("id1", null, null)));
        assertFalse(ErrorClassifier.isRetryable(new DeviceResult(null, null, "NotRegistered")));
        assertFalse(ErrorClassifier.isRetryable(new TopicResult(null, "TopicsMessageRateExceeded")));
        assertFalse(ErrorClassifier.isRetryable(DeviceResult.UNKNOWN));

        // Device group results are never retried, even with failures
        assertFalse(ErrorClassifier.isRetryable(new DeviceGroupResult(1, 2, Collections.singletonList("id1"))));
    }

    @Test
    void isRetryableThrowable() {
        assertTrue(ErrorClassifier.isRetryable(new HttpStatusException(500, "Internal Server Error")));
        assertTrue(ErrorClassifier.isRetryable(new CompletionException(new HttpStatusException(503, "Service Unavailable"))));
        assertTrue(ErrorClassifier.isRetryable(new ExecutionException(new HttpStatusException(502, "Bad Gateway"))));

        assertFalse(ErrorClassifier.isRetryable(new HttpStatusException(400, "Bad Request")));
        assertFalse(ErrorClassifier.isRetryable(new HttpStatusException(401, "Unauthorized")));
        assertFalse(ErrorClassifier.isRetryable(new IOException("Connection refused")));
        assertFalse(ErrorClassifier.isRetryable(new CompletionException(new IOException("Connection refused"))));
    }
}
