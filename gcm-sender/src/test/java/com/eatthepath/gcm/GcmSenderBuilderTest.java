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

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GcmSenderBuilderTest {

    @Test
    void buildWithoutApiKey() {
        assertThrows(IllegalStateException.class, () -> new GcmSenderBuilder().build());
        assertThrows(IllegalStateException.class, () -> new GcmSenderBuilder().setApiKey("").build());
    }

    @Test
    void buildWithInconsistentBackoff() {
        assertThrows(IllegalStateException.class, () -> new GcmSenderBuilder()
                .setApiKey("key")
                .setInitialBackoff(Duration.ofSeconds(10))
                .setMaxBackoff(Duration.ofSeconds(1))
                .build());

        assertThrows(IllegalStateException.class, () -> new GcmSenderBuilder()
                .setApiKey("key")
                .setInitialBackoff(Duration.ZERO)
                .build());
    }

    @Test
    void setEndpoint() {
        assertThrows(IllegalArgumentException.class, () -> new GcmSenderBuilder().setEndpoint("ftp://example.com/send"));
        assertThrows(IllegalArgumentException.class, () -> new GcmSenderBuilder().setEndpoint(URI.create("/gcm/send")));
        assertThrows(NullPointerException.class, () -> new GcmSenderBuilder().setEndpoint((URI) null));

        assertDoesNotThrow(() -> new GcmSenderBuilder().setEndpoint(GcmSenderBuilder.FCM_ENDPOINT));
        assertDoesNotThrow(() -> new GcmSenderBuilder().setEndpoint("http://localhost:8080/gcm/send"));
    }

    @Test
    void setConcurrentConnections() {
        assertThrows(IllegalArgumentException.class, () -> new GcmSenderBuilder().setConcurrentConnections(0));
    }

    @Test
    void build() throws Exception {
        final GcmSender sender = new GcmSenderBuilder()
                .setApiKey("key")
                .setEndpoint(GcmSenderBuilder.FCM_ENDPOINT)
                .setConnectionTimeout(Duration.ofSeconds(5))
                .build();

        sender.close().get();
    }
}
