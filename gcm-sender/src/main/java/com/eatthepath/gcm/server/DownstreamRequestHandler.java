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

import com.google.gson.JsonObject;
import io.netty.handler.codec.http.HttpHeaders;

/**
 * <p>A downstream request handler decides how a {@link MockGcmServer} answers each message posted to it. Handlers
 * may be called from the server's event loop threads and must therefore be thread-safe.</p>
 *
 * <p>If a handler throws a {@link RuntimeException}, the server answers with {@code 500 Internal Server Error}.</p>
 */
@FunctionalInterface
public interface DownstreamRequestHandler {

    /**
     * Produces the server's answer to a downstream message request.
     *
     * @param headers the request's HTTP headers, including its {@code Authorization} header
     * @param request the parsed JSON body of the request
     *
     * @return the response the server should send
     */
    MockGcmResponse handleDownstreamRequest(HttpHeaders headers, JsonObject request);
}
