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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SingleRetryEngineTest {

    private static final String REGISTRATION_ID = "registration-id";

    private ScriptedGcmTransport transport;
    private RecordingMetricsListener metricsListener;
    private Message message;

    @BeforeEach
    void setUp() {
        this.transport = new ScriptedGcmTransport();
        this.metricsListener = new RecordingMetricsListener();
        this.message = new Message.Builder()
                .addData("key", "value")
                .build();
    }

    @AfterEach
    void tearDown() {
        // Don't leak an interrupt into the next test
        Thread.interrupted();
    }

    private SingleRetryEngine buildEngine(final Duration backoff) {
        return new SingleRetryEngine(this.transport, this.metricsListener, backoff, backoff);
    }

    private SingleRetryEngine buildEngine() {
        return this.buildEngine(Duration.ofMillis(1));
    }

    @Test
    void send() throws Exception {
        this.transport.thenRespond("{\"multicast_id\":1,\"success\":1,\"results\":[{\"message_id\":\"id\"}]}");

        final Result result = this.buildEngine().send(this.message, REGISTRATION_ID);

        assertEquals(new DeviceResult("id", null, null), result);
        assertEquals(REGISTRATION_ID, this.transport.getRequests().get(0).getTo());
        assertNull(this.transport.getRequests().get(0).getRegistrationIds());
    }

    @Test
    void sendWithRetriesAfterApplicationError() throws Exception {
        this.transport
                .thenRespond("{\"failure\":1,\"results\":[{\"error\":\"Unavailable\"}]}")
                .thenRespond("{\"success\":1,\"results\":[{\"message_id\":\"id\"}]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 1);

        assertTrue(result.isSuccessful());
        assertEquals(new DeviceResult("id", null, null), result);
        assertEquals(2, this.transport.getRequests().size());
        assertEquals(Collections.singletonList(1), this.metricsListener.retriedRecipientCounts);
    }

    @Test
    void sendWithRetriesAfterServerError() throws Exception {
        this.transport
                .thenFail(new HttpStatusException(500, "Internal Server Error"))
                .thenRespond("{\"success\":1,\"results\":[{\"message_id\":\"id\"}]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 1);

        assertEquals(new DeviceResult("id", null, null), result);
        assertEquals(2, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesExceededReturnsLastResult() throws Exception {
        this.transport
                .thenRespond("{\"failure\":1,\"results\":[{\"error\":\"Unavailable\"}]}")
                .thenRespond("{\"failure\":1,\"results\":[{\"error\":\"Unavailable\"}]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 1);

        assertFalse(result.isSuccessful());
        assertEquals(new DeviceResult(null, null, ErrorCode.UNAVAILABLE.getValue()), result);
        assertEquals(2, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesExceededOnServerError() {
        this.transport
                .thenFail(new HttpStatusException(503, "Service Unavailable"))
                .thenFail(new HttpStatusException(503, "Service Unavailable"))
                .thenFail(new HttpStatusException(503, "Service Unavailable"));

        final HttpStatusException exception = assertThrows(HttpStatusException.class,
                () -> this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 2));

        assertEquals(503, exception.getStatusCode());
        assertEquals(3, this.transport.getRequests().size());
    }

    @Test
    void sendWithZeroRetries() throws Exception {
        this.transport.thenRespond("{\"failure\":1,\"results\":[{\"error\":\"Unavailable\"}]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 0);

        assertEquals(Optional.of(ErrorCode.UNAVAILABLE.getValue()), result.getError());
        assertEquals(1, this.transport.getRequests().size());
        assertTrue(this.metricsListener.retriedRecipientCounts.isEmpty());
    }

    @Test
    void sendWithRetriesPermanentApplicationError() throws Exception {
        this.transport.thenRespond("{\"failure\":1,\"results\":[{\"error\":\"NotRegistered\"}]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 3);

        assertEquals(new DeviceResult(null, null, ErrorCode.NOT_REGISTERED.getValue()), result);
        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesTopicRateExceeded() throws Exception {
        this.transport.thenRespond("{\"error\":\"TopicsMessageRateExceeded\"}");

        final Result result = this.buildEngine().sendWithRetries(this.message, "/topics/news", 2);

        assertEquals(new TopicResult(null, ErrorCode.TOPICS_MESSAGE_RATE_EXCEEDED.getValue()), result);
        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesTopic() throws Exception {
        this.transport.thenRespond("{\"message_id\":10}");

        final Result result = this.buildEngine().sendWithRetries(this.message, "/topics/news", 2);

        assertTrue(result instanceof TopicResult);
        assertEquals("10", ((TopicResult) result).getMessageId().orElse(null));
        assertTrue(result.isSuccessful());
    }

    @Test
    void sendWithRetriesDeviceGroupPartialFailure() throws Exception {
        this.transport.thenRespond("{\"success\":1,\"failure\":2,\"failed_registration_ids\":[\"id1\",\"id2\"]}");

        final Result result = this.buildEngine().sendWithRetries(this.message, "notification-key", 2);

        assertEquals(new DeviceGroupResult(1, 2, Arrays.asList("id1", "id2")), result);
        assertTrue(result.isSuccessful());
        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesBadRequest() {
        this.transport.thenFail(new HttpStatusException(400, "Bad Request"));

        final HttpStatusException exception = assertThrows(HttpStatusException.class,
                () -> this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 2));

        assertEquals("400 error: 400 Bad Request", exception.getMessage());
        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesConnectionFailure() {
        final IOException connectionFailure = new IOException("Connection refused");
        this.transport.thenFail(connectionFailure);

        final IOException exception = assertThrows(IOException.class,
                () -> this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 2));

        assertSame(connectionFailure, exception);
        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesMalformedResponse() {
        this.transport.thenRespond("{\"success\":2,\"results\":[{\"message_id\":\"a\"},{\"message_id\":\"b\"}]}");

        assertThrows(IOException.class, () -> this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 2));
    }

    @Test
    void sendWithRetriesInterruptedBeforeResponse() {
        this.transport.thenHang();

        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class,
                () -> this.buildEngine().sendWithRetries(this.message, REGISTRATION_ID, 2));

        assertEquals(1, this.transport.getRequests().size());
    }

    @Test
    void sendWithRetriesInterruptedDuringBackoff() throws Exception {
        this.transport.thenRespond("{\"failure\":1,\"results\":[{\"error\":\"Unavailable\"}]}");

        Thread.currentThread().interrupt();

        final Result result = this.buildEngine(Duration.ofMinutes(1)).sendWithRetries(this.message, REGISTRATION_ID, 2);

        assertEquals(new DeviceResult(null, null, ErrorCode.UNAVAILABLE.getValue()), result);
        assertTrue(Thread.interrupted());
        assertEquals(1, this.transport.getRequests().size());
    }
}
