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
import java.util.List;
import java.util.Map;

/**
 * Folds the per-recipient outcomes gathered over several multicast calls back into the order of the caller's original
 * list of registration IDs.
 */
final class ResultReconciler {

    private ResultReconciler() {
    }

    /**
     * <p>Builds the final result of a multicast send. Each position in {@code registrationIds} receives the latest
     * outcome recorded for the registration ID at that position; positions whose registration ID never received an
     * outcome get an empty result and count as failures. Positions that share a registration ID share its
     * outcome.</p>
     *
     * <p>This method has no side effects; reconciling the same inputs twice produces equal results.</p>
     *
     * @param registrationIds the registration IDs to which the message was originally addressed, in the caller's order
     * @param outcomesByRegistrationId the latest outcome recorded for each registration ID across all calls
     * @param multicastId the multicast ID of the first call, or zero if the first call produced no response
     * @param retryMulticastIds the multicast IDs of subsequent calls, in call order
     *
     * @return a multicast result aligned index-for-index with {@code registrationIds}
     */
    static MulticastResult reconcile(final List<String> registrationIds,
                                     final Map<String, DeviceResult> outcomesByRegistrationId,
                                     final long multicastId,
                                     final List<Long> retryMulticastIds) {

        final List<DeviceResult> results = new ArrayList<>(registrationIds.size());

        int success = 0;
        int failure = 0;
        int canonicalIds = 0;

        for (final String registrationId : registrationIds) {
            final DeviceResult result = outcomesByRegistrationId.getOrDefault(registrationId, DeviceResult.UNKNOWN);
            results.add(result);

            if (result.isSuccessful()) {
                success++;

                if (result.getCanonicalRegistrationId().isPresent()) {
                    canonicalIds++;
                }
            } else {
                failure++;
            }
        }

        return new MulticastResult(success, failure, canonicalIds, multicastId, results, retryMulticastIds);
    }
}
