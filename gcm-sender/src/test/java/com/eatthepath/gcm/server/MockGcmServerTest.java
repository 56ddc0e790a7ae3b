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

import com.eatthepath.gcm.GcmSender;
import com.eatthepath.gcm.GcmSenderBuilder;
import com.eatthepath.gcm.HttpStatusException;
import com.eatthepath.gcm.Message;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MockGcmServerTest {

    @Test
    void buildWithoutHandler() {
        assertThrows(IllegalStateException.class, () -> new MockGcmServerBuilder().build());
    }

    @Test
    void startAndShutdown() throws Exception {
        final MockGcmServer server = new MockGcmServerBuilder()
                .setHandler((headers, request) -> MockGcmResponse.ok("{}"))
                .build();

        final int port = server.start(0).get();

        assertTrue(port > 0);
        assertDoesNotThrow(() -> server.shutdown().get());
    }

    @Test
    void mockGcmResponse() {
        assertEquals(200, MockGcmResponse.ok("{}").getStatusCode());
        assertEquals("{}", MockGcmResponse.ok("{}").getBody().orElse(null));

        assertEquals(503, MockGcmResponse.status(503).getStatusCode());
        assertFalse(MockGcmResponse.status(503).getBody().isPresent());

        assertThrows(NullPointerException.class, () -> MockGcmResponse.ok(null));
    }

    @Test
    void handlerFailureAnsweredWithInternalServerError() throws Exception {
        final MockGcmServer server = new MockGcmServerBuilder()
                .setHandler((headers, request) -> {
                    throw new IllegalStateException("Unexpected request");
                })
                .build();

        final int port = server.start(0).get();

        final GcmSender sender = new GcmSenderBuilder()
                .setApiKey("test-api-key")
                .setEndpoint("http://localhost:" + port + "/gcm/send")
                .build();

        try {
            final HttpStatusException exception = assertThrows(HttpStatusException.class,
                    () -> sender.sendNoRetry(new Message.Builder().build(), "registration-id"));

            assertEquals(500, exception.getStatusCode());
        } finally {
            sender.close().get();
            server.shutdown().get();
        }
    }
}
