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

import java.util.concurrent.CompletableFuture;

/**
 * Delivers serialized requests to the GCM connection server.
 */
interface GcmTransport {

    /**
     * Sends a request to the GCM connection server.
     *
     * @param request the request to send
     *
     * @return a future that completes with the server's response if the server answered {@code 200 OK}, or
     * completes exceptionally with an {@link HttpStatusException} if the server answered with any other status or with
     * another {@link java.io.IOException} if no well-formed response could be obtained
     */
    CompletableFuture<GcmResponse> send(DownstreamRequest request);

    /**
     * Closes all connections held by this transport and releases its resources.
     *
     * @return a future that completes when this transport has shut down
     */
    CompletableFuture<Void> close();
}
