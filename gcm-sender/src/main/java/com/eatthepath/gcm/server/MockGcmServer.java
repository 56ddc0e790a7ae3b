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

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.Future;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * <p>A mock GCM connection server is an HTTP/1.1 server that accepts downstream message requests and answers them as
 * directed by a {@link DownstreamRequestHandler}. Mock servers are intended for integration testing and speak plain
 * HTTP; senders reach them through an {@code http://} endpoint URI.</p>
 *
 * <p>Mock servers are constructed with a {@link MockGcmServerBuilder}.</p>
 */
public class MockGcmServer {

    private final ServerBootstrap bootstrap;
    private final boolean shouldShutDownEventLoopGroup;

    private final ChannelGroup allChannels;

    MockGcmServer(final EventLoopGroup eventLoopGroup, final DownstreamRequestHandler requestHandler) {
        this.bootstrap = new ServerBootstrap();

        if (eventLoopGroup != null) {
            this.bootstrap.group(eventLoopGroup);
            this.shouldShutDownEventLoopGroup = false;
        } else {
            this.bootstrap.group(new NioEventLoopGroup(1));
            this.shouldShutDownEventLoopGroup = true;
        }

        this.allChannels = new DefaultChannelGroup(this.bootstrap.config().group().next());

        this.bootstrap.channel(ServerSocketChannelClassUtil.getServerSocketChannelClass(this.bootstrap.config().group()));
        this.bootstrap.childHandler(new ChannelInitializer<SocketChannel>() {

            @Override
            protected void initChannel(final SocketChannel channel) {
                channel.pipeline().addLast(new HttpServerCodec());
                channel.pipeline().addLast(new HttpObjectAggregator(1024 * 1024));
                channel.pipeline().addLast(new MockGcmServerHandler(requestHandler));

                MockGcmServer.this.allChannels.add(channel);
            }
        });
    }

    /**
     * Starts this mock server and listens for traffic on the given port.
     *
     * @param port the port to which this server should bind; zero binds to any free port
     *
     * @return a {@code Future} that will succeed with the port to which the server has bound when it is ready to
     * accept traffic
     */
    public CompletableFuture<Integer> start(final int port) {
        final ChannelFuture channelFuture = this.bootstrap.bind(port);
        this.allChannels.add(channelFuture.channel());

        final CompletableFuture<Integer> startFuture = new CompletableFuture<>();

        channelFuture.addListener(future -> {
            if (future.isSuccess()) {
                startFuture.complete(((InetSocketAddress) channelFuture.channel().localAddress()).getPort());
            } else {
                startFuture.completeExceptionally(future.cause());
            }
        });

        return startFuture;
    }

    /**
     * <p>Shuts down this server and releases the port to which this server was bound. If a {@code null} event loop
     * group was provided at construction time, the server will also shut down its internally-managed event loop
     * group.</p>
     *
     * <p>If a non-null {@code EventLoopGroup} was provided at construction time, mock servers may be restarted after
     * they have been shut down.</p>
     *
     * @return a {@code Future} that will succeed once the server has finished unbinding from its port and, if the
     * server was managing its own event loop group, its event loop group has shut down
     */
    public CompletableFuture<Void> shutdown() {
        final CompletableFuture<Void> shutdownFuture = new CompletableFuture<>();
        final Future<Void> channelCloseFuture = this.allChannels.close();

        if (this.shouldShutDownEventLoopGroup) {
            // Wait for the channels to close before we try to shut down the event loop group
            channelCloseFuture.addListener(future ->
                    MockGcmServer.this.bootstrap.config().group().shutdownGracefully());

            this.bootstrap.config().group().terminationFuture().addListener(future -> {
                if (future.isSuccess()) {
                    shutdownFuture.complete(null);
                } else {
                    shutdownFuture.completeExceptionally(future.cause());
                }
            });
        } else {
            channelCloseFuture.addListener(future -> {
                if (future.isSuccess()) {
                    shutdownFuture.complete(null);
                } else {
                    shutdownFuture.completeExceptionally(future.cause());
                }
            });
        }

        return shutdownFuture;
    }
}
