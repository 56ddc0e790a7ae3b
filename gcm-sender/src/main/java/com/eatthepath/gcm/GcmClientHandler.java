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

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Completes the pending response future of a connection when the connection server answers, and fails it if the
 * connection breaks first. Each connection carries at most one request at a time.
 */
class GcmClientHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

    private final GcmSenderMetricsListener metricsListener;

    private static final Logger log = LoggerFactory.getLogger(GcmClientHandler.class);

    GcmClientHandler(final GcmSenderMetricsListener metricsListener) {
        this.metricsListener = metricsListener;
    }

    @Override
    public void channelActive(final ChannelHandlerContext context) throws Exception {
        this.metricsListener.handleConnectionAdded();
        super.channelActive(context);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext context, final FullHttpResponse response) {
        final CompletableFuture<GcmResponse> responseFuture =
                context.channel().attr(NettyGcmTransport.RESPONSE_FUTURE_ATTRIBUTE_KEY).getAndSet(null);

        if (responseFuture == null) {
            log.warn("Received a response with no pending request; closing connection.");
            context.close();
            return;
        }

        final HttpResponseStatus status = response.status();
        final String body = response.content().toString(StandardCharsets.UTF_8);

        if (status.code() == HttpResponseStatus.OK.code()) {
            log.trace("Received response: {}", body);

            try {
                responseFuture.complete(GcmResponse.fromJson(body));
            } catch (final IOException e) {
                responseFuture.completeExceptionally(e);
            }
        } else {
            log.debug("Server answered with status {}: {}", status, body);
            responseFuture.completeExceptionally(new HttpStatusException(status.code(), status.reasonPhrase()));
        }

        if (!HttpUtil.isKeepAlive(response)) {
            context.close();
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext context) throws Exception {
        final CompletableFuture<GcmResponse> responseFuture =
                context.channel().attr(NettyGcmTransport.RESPONSE_FUTURE_ATTRIBUTE_KEY).getAndSet(null);

        if (responseFuture != null) {
            responseFuture.completeExceptionally(new IOException("Connection closed before a reply was received."));
        }

        this.metricsListener.handleConnectionRemoved();
        super.channelInactive(context);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
        log.warn("Connection to server failed; closing.", cause);

        final CompletableFuture<GcmResponse> responseFuture =
                context.channel().attr(NettyGcmTransport.RESPONSE_FUTURE_ATTRIBUTE_KEY).getAndSet(null);

        if (responseFuture != null) {
            responseFuture.completeExceptionally(cause instanceof IOException ? cause : new IOException(cause));
        }

        context.close();
    }
}
