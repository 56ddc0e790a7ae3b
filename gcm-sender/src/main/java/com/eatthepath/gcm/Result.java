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

import java.util.Optional;

/**
 * <p>The outcome of sending a message to a single target. The GCM connection server answers with a differently-shaped
 * response depending on the kind of target, and each shape has its own implementation:</p>
 *
 * <ul>
 *     <li>{@link DeviceResult} for a single registration ID (and for each recipient of a multicast message)</li>
 *     <li>{@link TopicResult} for a topic (a target beginning with {@value GcmSender#TOPIC_PREFIX})</li>
 *     <li>{@link DeviceGroupResult} for a device group's notification key</li>
 * </ul>
 */
public interface Result {

    /**
     * Returns the application-level error code the server reported for this target, if any.
     *
     * @return the server's error code, or empty if the server did not report an error
     *
     * @see ErrorCode
     */
    Optional<String> getError();

    /**
     * Indicates whether the server accepted the message for delivery.
     *
     * @return {@code true} if the server accepted the message for at least one device or {@code false} otherwise
     */
    boolean isSuccessful();
}
