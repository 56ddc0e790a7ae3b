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
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

class MockGcmServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final DownstreamRequestHandler requestHandler;

    private static final Logger log = LoggerFactory.getLogger(MockGcmServerHandler.class);

    MockGcmServerHandler(final DownstreamRequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext context, final FullHttpRequest request) {
        MockGcmResponse response;

        if (!HttpMethod.POST.equals(request.method())) {
            response = MockGcmResponse.status(HttpResponseStatus.METHOD_NOT_ALLOWED.code());
        } else {
            JsonObject body = null;

            try {
                body = JsonParser.parseString(request.content().toString(StandardCharsets.UTF_8)).getAsJsonObject();
            } catch (final JsonParseException | IllegalStateException e) {
                log.debug("Received a request with a malformed body.", e);
            }

            if (body == null) {
                response = MockGcmResponse.status(HttpResponseStatus.BAD_REQUEST.code());
            } else {
                try {
                    response = Objects.requireNonNull(this.requestHandler.handleDownstreamRequest(request.headers(), body),
                            "Request handler must not return null.");
                } catch (final RuntimeException e) {
                    log.warn("Request handler failed.", e);
                    response = MockGcmResponse.status(HttpResponseStatus.INTERNAL_SERVER_ERROR.code());
                }
            }
        }

        final boolean keepAlive = HttpUtil.isKeepAlive(request);

        final ByteBuf content = response.getBody()
                .map(body -> Unpooled.copiedBuffer(body, StandardCharsets.UTF_8))
                .orElse(Unpooled.EMPTY_BUFFER);

        final FullHttpResponse httpResponse = new DefaultFullHttpResponse(request.protocolVersion(),
                HttpResponseStatus.valueOf(response.getStatusCode()), content);

        httpResponse.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());

        if (response.getBody().isPresent()) {
            httpResponse.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }

        HttpUtil.setKeepAlive(httpResponse, keepAlive);

        if (keepAlive) {
            context.writeAndFlush(httpResponse);
        } else {
            context.writeAndFlush(httpResponse).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
        log.debug("Mock server caught an exception; closing connection.", cause);
        context.close();
    }
}
