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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A transport that answers each request with the next scripted outcome and records every request it receives.
 */
class ScriptedGcmTransport implements GcmTransport {

    private final Deque<Supplier<CompletableFuture<GcmResponse>>> script = new ArrayDeque<>();
    private final List<DownstreamRequest> requests = new ArrayList<>();

    ScriptedGcmTransport thenRespond(final String json) {
        this.script.add(() -> {
            try {
                return CompletableFuture.completedFuture(GcmResponse.fromJson(json));
            } catch (final IOException e) {
                throw new AssertionError(e);
            }
        });

        return this;
    }

    ScriptedGcmTransport thenFail(final IOException cause) {
        this.script.add(() -> {
            final CompletableFuture<GcmResponse> future = new CompletableFuture<>();
            future.completeExceptionally(cause);

            return future;
        });

        return this;
    }

    ScriptedGcmTransport thenHang() {
        this.script.add(CompletableFuture::new);
        return this;
    }

    List<DownstreamRequest> getRequests() {
        return this.requests;
    }

    List<String> getRegistrationIds(final int requestIndex) {
        return this.requests.get(requestIndex).getRegistrationIds();
    }

    @Override
    public synchronized CompletableFuture<GcmResponse> send(final DownstreamRequest request) {
        this.requests.add(request);

        final Supplier<CompletableFuture<GcmResponse>> next = this.script.poll();

        if (next == null) {
            throw new AssertionError("Unexpected request: " + request);
        }

        return next.get();
    }

    @Override
    public CompletableFuture<Void> close() {
        return CompletableFuture.completedFuture(null);
    }
}
