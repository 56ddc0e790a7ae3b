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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <p>The user-visible notification portion of a downstream message. All fields are optional; fields that are not set
 * are omitted from the serialized message. Notifications are immutable and are constructed with a
 * {@link Notification.Builder}.</p>
 *
 * <p>Some fields apply only to Android devices ({@code icon}, {@code tag}, {@code color}) and one only to iOS
 * devices ({@code badge}). Android devices require a title.</p>
 *
 * @see <a href="https://developers.google.com/cloud-messaging/http-server-ref#notification-payload-support">Notification
 * payload support</a>
 */
public class Notification {

    private final String title;
    private final String body;
    private final String sound;
    private final String clickAction;
    private final String bodyLocKey;
    private final List<String> bodyLocArgs;
    private final String titleLocKey;
    private final List<String> titleLocArgs;
    private final String icon;
    private final String tag;
    private final String color;
    private final String badge;

    /**
     * Constructs new {@link Notification} instances. Builders may be reused.
     */
    public static class Builder {
        private String title;
        private String body;
        private String sound;
        private String clickAction;
        private String bodyLocKey;
        private List<String> bodyLocArgs;
        private String titleLocKey;
        private List<String> titleLocArgs;
        private String icon;
        private String tag;
        private String color;
        private String badge;

        public Builder setTitle(final String title) {
            this.title = title;
            return this;
        }

        public Builder setBody(final String body) {
            this.body = body;
            return this;
        }

        public Builder setSound(final String sound) {
            this.sound = sound;
            return this;
        }

        public Builder setClickAction(final String clickAction) {
            this.clickAction = clickAction;
            return this;
        }

        /**
         * Sets the key of a localized body string in the receiving app's resources, along with the format arguments
         * to substitute into it.
         *
         * @param bodyLocKey the key of the localized body string
         * @param bodyLocArgs the arguments to substitute into the localized string; may be empty
         *
         * @return a reference to this builder
         */
        public Builder setLocalizedBody(final String bodyLocKey, final String... bodyLocArgs) {
            this.bodyLocKey = bodyLocKey;
            this.bodyLocArgs = bodyLocArgs != null && bodyLocArgs.length > 0 ? List.of(bodyLocArgs) : null;
            return this;
        }

        /**
         * Sets the key of a localized title string in the receiving app's resources, along with the format arguments
         * to substitute into it.
         *
         * @param titleLocKey the key of the localized title string
         * @param titleLocArgs the arguments to substitute into the localized string; may be empty
         *
         * @return a reference to this builder
         */
        public Builder setLocalizedTitle(final String titleLocKey, final String... titleLocArgs) {
            this.titleLocKey = titleLocKey;
            this.titleLocArgs = titleLocArgs != null && titleLocArgs.length > 0 ? List.of(titleLocArgs) : null;
            return this;
        }

        public Builder setIcon(final String icon) {
            this.icon = icon;
            return this;
        }

        public Builder setTag(final String tag) {
            this.tag = tag;
            return this;
        }

        public Builder setColor(final String color) {
            this.color = color;
            return this;
        }

        public Builder setBadge(final String badge) {
            this.badge = badge;
            return this;
        }

        public Notification build() {
            return new Notification(this);
        }
    }

    private Notification(final Builder builder) {
        this.title = builder.title;
        this.body = builder.body;
        this.sound = builder.sound;
        this.clickAction = builder.clickAction;
        this.bodyLocKey = builder.bodyLocKey;
        this.bodyLocArgs = builder.bodyLocArgs != null ? Collections.unmodifiableList(new ArrayList<>(builder.bodyLocArgs)) : null;
        this.titleLocKey = builder.titleLocKey;
        this.titleLocArgs = builder.titleLocArgs != null ? Collections.unmodifiableList(new ArrayList<>(builder.titleLocArgs)) : null;
        this.icon = builder.icon;
        this.tag = builder.tag;
        this.color = builder.color;
        this.badge = builder.badge;
    }

    public String getTitle() {
        return this.title;
    }

    public String getBody() {
        return this.body;
    }

    public String getSound() {
        return this.sound;
    }

    public String getClickAction() {
        return this.clickAction;
    }

    public String getBodyLocKey() {
        return this.bodyLocKey;
    }

    public List<String> getBodyLocArgs() {
        return this.bodyLocArgs;
    }

    public String getTitleLocKey() {
        return this.titleLocKey;
    }

    public List<String> getTitleLocArgs() {
        return this.titleLocArgs;
    }

    public String getIcon() {
        return this.icon;
    }

    public String getTag() {
        return this.tag;
    }

    public String getColor() {
        return this.color;
    }

    public String getBadge() {
        return this.badge;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Notification that = (Notification) o;

        return Objects.equals(title, that.title) &&
                Objects.equals(body, that.body) &&
                Objects.equals(sound, that.sound) &&
                Objects.equals(clickAction, that.clickAction) &&
                Objects.equals(bodyLocKey, that.bodyLocKey) &&
                Objects.equals(bodyLocArgs, that.bodyLocArgs) &&
                Objects.equals(titleLocKey, that.titleLocKey) &&
                Objects.equals(titleLocArgs, that.titleLocArgs) &&
                Objects.equals(icon, that.icon) &&
                Objects.equals(tag, that.tag) &&
                Objects.equals(color, that.color) &&
                Objects.equals(badge, that.badge);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, body, sound, clickAction, bodyLocKey, bodyLocArgs, titleLocKey, titleLocArgs, icon,
                tag, color, badge);
    }

    @Override
    public String toString() {
        return "Notification{" +
                "title='" + title + '\'' +
                ", body='" + body + '\'' +
                ", sound='" + sound + '\'' +
                ", clickAction='" + clickAction + '\'' +
                ", bodyLocKey='" + bodyLocKey + '\'' +
                ", bodyLocArgs=" + bodyLocArgs +
                ", titleLocKey='" + titleLocKey + '\'' +
                ", titleLocArgs=" + titleLocArgs +
                ", icon='" + icon + '\'' +
                ", tag='" + tag + '\'' +
                ", color='" + color + '\'' +
                ", badge='" + badge + '\'' +
                '}';
    }
}
