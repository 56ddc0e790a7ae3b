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
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The body of a {@code 200 OK} response from the GCM connection server. The same structure carries three different
 * shapes of response (multicast/single registration ID, topic, device group); {@link #toResult(String)} decodes the
 * shape that applies to a given target once, at the transport boundary.
 *
 * @see <a href="https://developers.google.com/cloud-messaging/http-server-ref#interpret-downstream">Interpreting a
 * downstream message response</a>
 */
class GcmResponse {

    @SerializedName("multicast_id")
    private long multicastId;

    @SerializedName("success")
    private int success;

    @SerializedName("failure")
    private int failure;

    @SerializedName("canonical_ids")
    private int canonicalIds;

    @SerializedName("results")
    private List<RecipientResult> results;

    // Topic messages only
    @SerializedName("message_id")
    private long messageId;

    @SerializedName("error")
    private String error;

    // Device group messages only
    @SerializedName("failed_registration_ids")
    private List<String> failedRegistrationIds;

    private static final Gson GSON = new Gson();

    static class RecipientResult {

        @SerializedName("message_id")
        private String messageId;

        @SerializedName("registration_id")
        private String registrationId;

        @SerializedName("error")
        private String error;

        DeviceResult toDeviceResult() {
            return new DeviceResult(this.messageId, this.registrationId, this.error);
        }
    }

    GcmResponse() {
    }

    /**
     * Parses the body of a successful response.
     *
     * @param json the JSON body of a {@code 200 OK} response
     *
     * @return the parsed response
     *
     * @throws IOException if the body could not be parsed as a GCM response
     */
    static GcmResponse fromJson(final String json) throws IOException {
        final GcmResponse response;

        try {
            response = GSON.fromJson(json, GcmResponse.class);
        } catch (final JsonParseException e) {
            throw new IOException("Failed to parse response body: " + json, e);
        }

        if (response == null) {
            throw new IOException("Response body was empty.");
        }

        return response;
    }

    long getMulticastId() {
        return this.multicastId;
    }

    int getSuccess() {
        return this.success;
    }

    int getFailure() {
        return this.failure;
    }

    int getCanonicalIds() {
        return this.canonicalIds;
    }

    /**
     * Returns the per-recipient results of a multicast or single registration ID call, positionally aligned with the
     * registration IDs sent in that call.
     *
     * @return the per-recipient results; empty if the response carried none
     */
    List<DeviceResult> getResults() {
        if (this.results == null) {
            return Collections.emptyList();
        }

        final List<DeviceResult> deviceResults = new ArrayList<>(this.results.size());

        for (final RecipientResult recipientResult : this.results) {
            deviceResults.add(recipientResult != null ? recipientResult.toDeviceResult() : DeviceResult.UNKNOWN);
        }

        return deviceResults;
    }

    /**
     * Decodes this response as the outcome of a send to a single target.
     *
     * @param to the registration ID, topic or notification key to which the message was sent
     *
     * @return a {@link DeviceResult}, {@link TopicResult} or {@link DeviceGroupResult} depending on the shape of this
     * response
     *
     * @throws IOException if the response does not have the shape expected for the given target
     */
    Result toResult(final String to) throws IOException {
        final Result result;

        if (this.results != null) {
            if (this.results.size() != 1) {
                throw new IOException("Expected exactly one result for a single recipient, but found " + this.results.size());
            }

            result = this.getResults().get(0);
        } else if (to.startsWith(GcmSender.TOPIC_PREFIX)) {
            if (this.messageId != 0) {
                result = new TopicResult(String.valueOf(this.messageId), null);
            } else if (this.error != null) {
                result = new TopicResult(null, this.error);
            } else {
                throw new IOException("Expected a message ID or an error for a topic message, but found neither.");
            }
        } else {
            result = new DeviceGroupResult(this.success, this.failure,
                    this.failedRegistrationIds != null ? new ArrayList<>(this.failedRegistrationIds) : null);
        }

        return result;
    }

    /**
     * Decodes this response as the outcome of a single multicast call, without any reconciliation across calls.
     *
     * @return a multicast result that mirrors this response
     */
    MulticastResult toMulticastResult() {
        return new MulticastResult(this.success, this.failure, this.canonicalIds, this.multicastId,
                this.getResults(), Collections.emptyList());
    }

    @Override
    public String toString() {
        return "GcmResponse{" +
                "multicastId=" + multicastId +
                ", success=" + success +
                ", failure=" + failure +
                ", canonicalIds=" + canonicalIds +
                ", results=" + getResults() +
                ", messageId=" + messageId +
                ", error='" + error + '\'' +
                ", failedRegistrationIds=" + failedRegistrationIds +
                '}';
    }
}
