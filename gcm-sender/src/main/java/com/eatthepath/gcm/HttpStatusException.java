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

import java.io.IOException;

/**
 * Indicates that the GCM connection server answered a request with a status other than {@code 200 OK}. Statuses in
 * the 5xx range signal a transient server condition and may be retried; all others (a malformed request, an
 * authentication failure and so on) are permanent.
 *
 * @see ErrorClassifier#isRetryableStatus(int)
 */
public class HttpStatusException extends IOException {

    private final int statusCode;
    private final String reasonPhrase;

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception for the given HTTP status.
     *
     * @param statusCode the numeric HTTP status reported by the server
     * @param reasonPhrase the reason phrase that accompanied the status; may be {@code null}
     */
    public HttpStatusException(final int statusCode, final String reasonPhrase) {
        super(statusCode + " error: " + statusCode + " " + reasonPhrase);

        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
    }

    /**
     * Returns the numeric HTTP status reported by the server.
     *
     * @return the numeric HTTP status reported by the server
     */
    public int getStatusCode() {
        return this.statusCode;
    }

    /**
     * Returns the reason phrase that accompanied the HTTP status.
     *
     * @return the reason phrase that accompanied the HTTP status; may be {@code null}
     */
    public String getReasonPhrase() {
        return this.reasonPhrase;
    }
}
