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

import io.netty.channel.EventLoopGroup;

/**
 * A {@code MockGcmServerBuilder} constructs new {@link MockGcmServer} instances. Callers must provide a
 * {@link DownstreamRequestHandler} before building a server.
 */
public class MockGcmServerBuilder {

    private EventLoopGroup eventLoopGroup;
    private DownstreamRequestHandler handler;

    /**
     * Sets the event loop group to be used by the server under construction. If not set (or if {@code null}), the
     * server will create and manage its own event loop group.
     *
     * @param eventLoopGroup the event loop group to use for this server, or {@code null} to let the server manage its
     * own event loop group
     *
     * @return a reference to this builder
     */
    public MockGcmServerBuilder setEventLoopGroup(final EventLoopGroup eventLoopGroup) {
        this.eventLoopGroup = eventLoopGroup;
        return this;
    }

    /**
     * Sets the handler that decides how the server under construction answers each request.
     *
     * @param handler the request handler for the server under construction
     *
     * @return a reference to this builder
     */
    public MockGcmServerBuilder setHandler(final DownstreamRequestHandler handler) {
        this.handler = handler;
        return this;
    }

    /**
     * Constructs a new {@link MockGcmServer} with the previously-set configuration.
     *
     * @return a new mock server with the previously-set configuration
     *
     * @throws IllegalStateException if no request handler has been set
     */
    public MockGcmServer build() {
        if (this.handler == null) {
            throw new IllegalStateException("Must provide a downstream request handler before building a mock server.");
        }

        return new MockGcmServer(this.eventLoopGroup, this.handler);
    }
}
