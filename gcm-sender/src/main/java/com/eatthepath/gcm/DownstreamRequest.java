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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A message addressed to its recipients, ready to be written to the GCM connection server as a JSON body. A request
 * is addressed either to a single target ({@code to}) or to a list of registration IDs, never both.
 */
class DownstreamRequest {

    private final Message message;
    private final String to;
    private final List<String> registrationIds;

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private DownstreamRequest(final Message message, final String to, final List<String> registrationIds) {
        this.message = Objects.requireNonNull(message, "Message must not be null.");
        this.to = to;
        this.registrationIds = registrationIds;
    }

    static DownstreamRequest forTarget(final Message message, final String to) {
        return new DownstreamRequest(message, Objects.requireNonNull(to, "Target must not be null."), null);
    }

    static DownstreamRequest forRegistrationIds(final Message message, final List<String> registrationIds) {
        return new DownstreamRequest(message, null, Collections.unmodifiableList(registrationIds));
    }

    Message getMessage() {
        return this.message;
    }

    String getTo() {
        return this.to;
    }

    /**
     * Returns the registration IDs to which this request is addressed.
     *
     * @return the registration IDs to which this request is addressed, or {@code null} if this request is addressed to
     * a single target
     */
    List<String> getRegistrationIds() {
        return this.registrationIds;
    }

    int getRecipientCount() {
        return this.registrationIds != null ? this.registrationIds.size() : 1;
    }

    String toJson() {
        final JsonObject json = new JsonObject();

        if (this.message.getCollapseKey() != null) {
            json.addProperty("collapse_key", this.message.getCollapseKey());
        }

        if (this.message.isDelayWhileIdle()) {
            json.addProperty("delay_while_idle", true);
        }

        if (this.message.getTimeToLive() != null) {
            json.addProperty("time_to_live", this.message.getTimeToLive());
        }

        if (this.message.getRestrictedPackageName() != null) {
            json.addProperty("restricted_package_name", this.message.getRestrictedPackageName());
        }

        if (this.message.isDryRun()) {
            json.addProperty("dry_run", true);
        }

        if (this.message.isContentAvailable()) {
            json.addProperty("content_available", true);
        }

        if (this.message.getPriority() != null) {
            json.addProperty("priority", this.message.getPriority().getValue());
        }

        if (!this.message.getData().isEmpty()) {
            final JsonObject data = new JsonObject();

            for (final Map.Entry<String, String> entry : this.message.getData().entrySet()) {
                data.addProperty(entry.getKey(), entry.getValue());
            }

            json.add("data", data);
        }

        if (this.message.getNotification() != null) {
            json.add("notification", toJsonObject(this.message.getNotification()));
        }

        if (this.to != null) {
            json.addProperty("to", this.to);
        }

        if (this.registrationIds != null) {
            json.add("registration_ids", toJsonArray(this.registrationIds));
        }

        return GSON.toJson(json);
    }

    private static JsonObject toJsonObject(final Notification notification) {
        final JsonObject json = new JsonObject();

        addIfPresent(json, "title", notification.getTitle());
        addIfPresent(json, "body", notification.getBody());
        addIfPresent(json, "sound", notification.getSound());
        addIfPresent(json, "click_action", notification.getClickAction());
        addIfPresent(json, "body_loc_key", notification.getBodyLocKey());

        if (notification.getBodyLocArgs() != null) {
            json.add("body_loc_args", toJsonArray(notification.getBodyLocArgs()));
        }

        addIfPresent(json, "title_loc_key", notification.getTitleLocKey());

        if (notification.getTitleLocArgs() != null) {
            json.add("title_loc_args", toJsonArray(notification.getTitleLocArgs()));
        }

        addIfPresent(json, "icon", notification.getIcon());
        addIfPresent(json, "tag", notification.getTag());
        addIfPresent(json, "color", notification.getColor());
        addIfPresent(json, "badge", notification.getBadge());

        return json;
    }

    private static void addIfPresent(final JsonObject json, final String key, final String value) {
        if (value != null) {
            json.addProperty(key, value);
        }
    }

    private static JsonArray toJsonArray(final Collection<String> strings) {
        final JsonArray array = new JsonArray(strings.size());

        for (final String string : strings) {
            array.add(string);
        }

        return array;
    }

    @Override
    public String toString() {
        return "DownstreamRequest{" +
                "message=" + message +
                ", to='" + to + '\'' +
                ", registrationIds=" + registrationIds +
                '}';
    }
}
