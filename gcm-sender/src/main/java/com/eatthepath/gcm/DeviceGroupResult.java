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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <p>The outcome of sending a message to a device group. The server reports how many devices in the group received
 * the message and, if some did not, which registration IDs failed.</p>
 *
 * <p>A partial success (some devices succeeded, some failed) is a final outcome; the sender never retries a device
 * group message that reached at least one device.</p>
 */
public class DeviceGroupResult implements Result {

    private final int success;
    private final int failure;
    private final List<String> failedRegistrationIds;

    DeviceGroupResult(final int success, final int failure, final List<String> failedRegistrationIds) {
        this.success = success;
        this.failure = failure;
        this.failedRegistrationIds = failedRegistrationIds != null ?
                Collections.unmodifiableList(failedRegistrationIds) : Collections.emptyList();
    }

    public int getSuccess() {
        return this.success;
    }

    public int getFailure() {
        return this.failure;
    }

    /**
     * Returns the registration IDs of the group members to which the message could not be delivered.
     *
     * @return the registration IDs that failed; empty if the message reached every device in the group
     */
    public List<String> getFailedRegistrationIds() {
        return this.failedRegistrationIds;
    }

    /**
     * Device group responses never carry an error code.
     *
     * @return an empty {@code Optional} in all cases
     */
    @Override
    public Optional<String> getError() {
        return Optional.empty();
    }

    @Override
    public boolean isSuccessful() {
        return this.success > 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DeviceGroupResult that = (DeviceGroupResult) o;

        return success == that.success &&
                failure == that.failure &&
                failedRegistrationIds.equals(that.failedRegistrationIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, failure, failedRegistrationIds);
    }

    @Override
    public String toString() {
        return "DeviceGroupResult{" +
                "success=" + success +
                ", failure=" + failure +
                ", failedRegistrationIds=" + failedRegistrationIds +
                '}';
    }
}
