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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.pool.AbstractChannelPoolHandler;
import io.netty.channel.pool.FixedChannelPool;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.AttributeKey;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A {@link GcmTransport} that posts JSON requests to the connection server over a pool of persistent HTTP/1.1
 * connections.
 */
class NettyGcmTransport implements GcmTransport {

    private final URI endpoint;
    private final String requestPath;
    private final String hostHeader;
    private final String authorizationHeader;

    private final Duration requestTimeout;
    private final GcmSenderMetricsListener metricsListener;

    private final FixedChannelPool channelPool;

    static final AttributeKey<CompletableFuture<GcmResponse>> RESPONSE_FUTURE_ATTRIBUTE_KEY =
            AttributeKey.valueOf(NettyGcmTransport.class, "responseFuture");

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private static final Logger log = LoggerFactory.getLogger(NettyGcmTransport.class);

    NettyGcmTransport(final GcmSenderConfiguration configuration,
                      final GcmSenderMetricsListener metricsListener,
                      final EventLoopGroup eventLoopGroup) {

        this.endpoint = configuration.getEndpoint();
        this.requestTimeout = configuration.getRequestTimeout().orElse(null);
        this.metricsListener = metricsListener;
        this.authorizationHeader = "key=" + configuration.getApiKey();

        final String host = this.endpoint.getHost();
        final int port = this.endpoint.getPort() != -1 ?
                this.endpoint.getPort() :
                ("https".equalsIgnoreCase(this.endpoint.getScheme()) ? 443 : 80);

        this.hostHeader = this.endpoint.getPort() != -1 ? host + ":" + port : host;

        {
            final String rawPath = this.endpoint.getRawPath();
            final String path = rawPath == null || rawPath.isEmpty() ? "/" : rawPath;

            this.requestPath = this.endpoint.getRawQuery() != null ? path + "?" + this.endpoint.getRawQuery() : path;
        }

        final SslContext sslContext = configuration.getSslContext().orElse(null);

        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoopGroup);
        bootstrap.channel(ClientSocketChannelClassUtil.getSocketChannelClass(eventLoopGroup));
        bootstrap.option(ChannelOption.TCP_NODELAY, true);
        bootstrap.remoteAddress(host, port);

        configuration.getConnectionTimeout().ifPresent(timeout ->
                bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis()));

        this.channelPool = new FixedChannelPool(bootstrap, new AbstractChannelPoolHandler() {

            @Override
            public void channelCreated(final Channel channel) {
                final ChannelPipeline pipeline = channel.pipeline();

                if (sslContext != null) {
                    final SslHandler sslHandler = sslContext.newHandler(channel.alloc(), host, port);

                    final SSLEngine sslEngine = sslHandler.engine();
                    final SSLParameters sslParameters = sslEngine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
                    sslEngine.setSSLParameters(sslParameters);

                    pipeline.addLast(sslHandler);
                }

                pipeline.addLast(new HttpClientCodec());
                pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                pipeline.addLast(new GcmClientHandler(NettyGcmTransport.this.metricsListener));
            }
        }, configuration.getConcurrentConnections());
    }

    @Override
    public CompletableFuture<GcmResponse> send(final DownstreamRequest request) {
        final CompletableFuture<GcmResponse> responseFuture = new CompletableFuture<>();
        final String body = request.toJson();

        this.channelPool.acquire().addListener((GenericFutureListener<Future<Channel>>) acquireFuture -> {
            if (!acquireFuture.isSuccess()) {
                log.debug("Failed to acquire a connection to {}.", this.endpoint, acquireFuture.cause());

                this.metricsListener.handleConnectionCreationFailed();
                this.metricsListener.handleRequestFailed(acquireFuture.cause());

                responseFuture.completeExceptionally(acquireFuture.cause());
                return;
            }

            final Channel channel = acquireFuture.getNow();

            if (responseFuture.isDone()) {
                // Cancelled while waiting for a connection
                this.channelPool.release(channel);
                return;
            }

            channel.attr(RESPONSE_FUTURE_ATTRIBUTE_KEY).set(responseFuture);

            final long start = System.nanoTime();

            final ScheduledFuture<?> timeoutFuture = this.requestTimeout != null ?
                    channel.eventLoop().schedule(() -> responseFuture.completeExceptionally(
                            new SocketTimeoutException("No response received within " + this.requestTimeout.toMillis() + " ms.")),
                            this.requestTimeout.toMillis(), TimeUnit.MILLISECONDS) :
                    null;

            responseFuture.whenComplete((response, cause) -> {
                if (timeoutFuture != null) {
                    timeoutFuture.cancel(false);
                }

                channel.attr(RESPONSE_FUTURE_ATTRIBUTE_KEY).compareAndSet(responseFuture, null);

                if (response != null) {
                    this.metricsListener.handleRequestAcknowledged(response.getSuccess(), response.getFailure(),
                            System.nanoTime() - start);
                } else {
                    this.metricsListener.handleRequestFailed(cause);

                    // An error status is a complete reply; anything else may leave a late reply on the wire that must
                    // not be read as the answer to the next request on this connection.
                    if (!(cause instanceof HttpStatusException)) {
                        channel.close();
                    }
                }

                this.channelPool.release(channel);
            });

            log.trace("Sending request to {}: {}", this.endpoint, body);

            channel.writeAndFlush(this.buildHttpRequest(body)).addListener((GenericFutureListener<ChannelFuture>) writeFuture -> {
                if (writeFuture.isSuccess()) {
                    this.metricsListener.handleRequestSent(request.getRecipientCount());
                } else {
                    responseFuture.completeExceptionally(writeFuture.cause());
                }
            });
        });

        return responseFuture;
    }

    private FullHttpRequest buildHttpRequest(final String body) {
        final ByteBuf content = Unpooled.copiedBuffer(body, StandardCharsets.UTF_8);
        final FullHttpRequest httpRequest =
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, this.requestPath, content);

        httpRequest.headers()
                .set(HttpHeaderNames.HOST, this.hostHeader)
                .set(HttpHeaderNames.AUTHORIZATION, this.authorizationHeader)
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes())
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);

        return httpRequest;
    }

    @Override
    public CompletableFuture<Void> close() {
        final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

        this.channelPool.closeAsync().addListener(future -> closeFuture.complete(null));

        return closeFuture;
    }
}
