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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides which failures reported by the GCM connection server are transient and may be retried. Two independent
 * rules apply: an unsuccessful HTTP status is retryable only in the 5xx range, and an application-level error code is
 * retryable only if it is {@link ErrorCode#UNAVAILABLE} or {@link ErrorCode#INTERNAL_SERVER_ERROR}.
 */
final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /**
     * Indicates whether a call that failed with the given HTTP status may be retried.
     *
     * @param statusCode the HTTP status of an unsuccessful call
     *
     * @return {@code true} if the status is in the 500-599 range or {@code false} otherwise
     */
    static boolean isRetryableStatus(final int statusCode) {
        return statusCode >= 500 && statusCode < 600;
    }

    /**
     * Indicates whether a recipient (or a topic message) that failed with the given application error code may be
     * retried.
     *
     * @param errorCode the error code reported by the server; may be {@code null}
     *
     * @return {@code true} if the code signals a transient server condition or {@code false} otherwise
     */
    static boolean isRetryableError(final String errorCode) {
        return ErrorCode.UNAVAILABLE.getValue().equals(errorCode) ||
                ErrorCode.INTERNAL_SERVER_ERROR.getValue().equals(errorCode);
    }

    static boolean isRetryable(final Result result) {
        return result.getError().map(ErrorClassifier::isRetryableError).orElse(false);
    }

    /**
     * Indicates whether a call that failed with the given cause may be retried. Only HTTP failures with a retryable
     * status qualify; connection failures and malformed responses are permanent.
     *
     * @param cause the cause of a failed call, possibly wrapped by a future
     *
     * @return {@code true} if the call may be retried or {@code false} otherwise
     */
    static boolean isRetryable(final Throwable cause) {
        Throwable unwrapped = cause;

        while ((unwrapped instanceof CompletionException || unwrapped instanceof ExecutionException) &&
                unwrapped.getCause() != null) {

            unwrapped = unwrapped.getCause();
        }

        return unwrapped instanceof HttpStatusException &&
                isRetryableStatus(((HttpStatusException) unwrapped).getStatusCode());
    }
}
