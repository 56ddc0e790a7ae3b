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

package com.eatthepath.gcm.server;

import java.util.Objects;
import java.util.Optional;

/**
 * A canned answer from a {@link MockGcmServer}: an HTTP status and, for successful responses, a JSON body.
 */
public final class MockGcmResponse {

    private final int statusCode;
    private final String body;

    private MockGcmResponse(final int statusCode, final String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    /**
     * Returns a {@code 200 OK} response with the given JSON body.
     *
     * @param json the response body
     *
     * @return a successful response carrying the given body
     */
    public static MockGcmResponse ok(final String json) {
        return new MockGcmResponse(200, Objects.requireNonNull(json, "JSON body must not be null."));
    }

    /**
     * Returns a response with the given status and no body.
     *
     * @param statusCode the HTTP status code of the response
     *
     * @return a response with the given status
     */
    public static MockGcmResponse status(final int statusCode) {
        return new MockGcmResponse(statusCode, null);
    }

    public int getStatusCode() {
        return this.statusCode;
    }

    public Optional<String> getBody() {
        return Optional.ofNullable(this.body);
    }

    @Override
    public String toString() {
        return "MockGcmResponse{" +
                "statusCode=" + statusCode +
                ", body='" + body + '\'' +
                '}';
    }
}
