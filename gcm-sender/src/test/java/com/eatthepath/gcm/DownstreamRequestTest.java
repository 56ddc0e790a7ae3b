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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DownstreamRequestTest {

    @Test
    void toJsonRegistrationIds() {
        final DownstreamRequest request =
                DownstreamRequest.forRegistrationIds(new Message.Builder().build(), Arrays.asList("1", "2"));

        assertEquals("{\"registration_ids\":[\"1\",\"2\"]}", request.toJson());
        assertEquals(2, request.getRecipientCount());
    }

    @Test
    void toJsonTarget() {
        final DownstreamRequest request = DownstreamRequest.forTarget(new Message.Builder().build(), "/topics/news");

        assertEquals("{\"to\":\"/topics/news\"}", request.toJson());
        assertEquals(1, request.getRecipientCount());
    }

    @Test
    void toJsonPriority() {
        assertEquals("{\"priority\":\"normal\",\"to\":\"x\"}",
                DownstreamRequest.forTarget(new Message.Builder().setPriority(Priority.NORMAL).build(), "x").toJson());

        assertEquals("{\"priority\":\"high\",\"to\":\"x\"}",
                DownstreamRequest.forTarget(new Message.Builder().setPriority(Priority.HIGH).build(), "x").toJson());
    }

    @Test
    void toJsonData() {
        final Message message = new Message.Builder()
                .addData("k", "v")
                .addData("url", "https://example.com/?a=1&b=<2>")
                .build();

        assertEquals("{\"data\":{\"k\":\"v\",\"url\":\"https://example.com/?a=1&b=<2>\"},\"to\":\"x\"}",
                DownstreamRequest.forTarget(message, "x").toJson());
    }

    @Test
    void toJsonNotification() {
        final Message message = new Message.Builder()
                .setNotification(new Notification.Builder().setTitle("test").build())
                .build();

        assertEquals("{\"notification\":{\"title\":\"test\"},\"to\":\"x\"}",
                DownstreamRequest.forTarget(message, "x").toJson());
    }

    @Test
    void toJsonLocalizedNotification() {
        final Message message = new Message.Builder()
                .setNotification(new Notification.Builder()
                        .setLocalizedBody("body_key", "a", "b")
                        .setLocalizedTitle("title_key")
                        .setColor("#ff0000")
                        .build())
                .build();

        final JsonObject notification = JsonParser.parseString(DownstreamRequest.forTarget(message, "x").toJson())
                .getAsJsonObject()
                .getAsJsonObject("notification");

        assertEquals("body_key", notification.get("body_loc_key").getAsString());
        assertEquals(2, notification.getAsJsonArray("body_loc_args").size());
        assertEquals("b", notification.getAsJsonArray("body_loc_args").get(1).getAsString());
        assertEquals("title_key", notification.get("title_loc_key").getAsString());
        assertEquals("#ff0000", notification.get("color").getAsString());
        assertFalse(notification.has("title"));
    }

    @Test
    void toJsonOptions() {
        final Message message = new Message.Builder()
                .setCollapseKey("updates")
                .setDelayWhileIdle(true)
                .setTimeToLive(60)
                .setRestrictedPackageName("com.example.app")
                .setDryRun(true)
                .setContentAvailable(true)
                .build();

        final JsonObject json = JsonParser.parseString(DownstreamRequest.forTarget(message, "x").toJson()).getAsJsonObject();

        assertEquals("updates", json.get("collapse_key").getAsString());
        assertTrue(json.get("delay_while_idle").getAsBoolean());
        assertEquals(60, json.get("time_to_live").getAsInt());
        assertEquals("com.example.app", json.get("restricted_package_name").getAsString());
        assertTrue(json.get("dry_run").getAsBoolean());
        assertTrue(json.get("content_available").getAsBoolean());
    }

    @Test
    void toJsonZeroTimeToLive() {
        final Message message = new Message.Builder().setTimeToLive(0).build();

        assertEquals("{\"time_to_live\":0,\"to\":\"x\"}", DownstreamRequest.forTarget(message, "x").toJson());
    }

    @Test
    void toJsonOmitsDefaults() {
        final JsonObject json = JsonParser.parseString(
                DownstreamRequest.forTarget(new Message.Builder().build(), "x").toJson()).getAsJsonObject();

        assertEquals(1, json.size());
        assertFalse(json.has("time_to_live"));
        assertFalse(json.has("dry_run"));
        assertFalse(json.has("registration_ids"));
    }
}
