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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultReconcilerTest {

    @Test
    void reconcilePreservesCallerOrder() {
        final Map<String, DeviceResult> outcomes = new HashMap<>();
        outcomes.put("c", new DeviceResult("m3", null, null));
        outcomes.put("a", new DeviceResult("m1", null, null));
        outcomes.put("b", new DeviceResult(null, null, "NotRegistered"));

        final MulticastResult result =
                ResultReconciler.reconcile(Arrays.asList("a", "b", "c"), outcomes, 7, Collections.emptyList());

        assertEquals(Arrays.asList(
                new DeviceResult("m1", null, null),
                new DeviceResult(null, null, "NotRegistered"),
                new DeviceResult("m3", null, null)), result.getResults());

        assertEquals(2, result.getSuccess());
        assertEquals(1, result.getFailure());
        assertEquals(0, result.getCanonicalIds());
        assertEquals(7, result.getMulticastId());
        assertEquals(3, result.getTotal());
    }

    @Test
    void reconcileCountsCanonicalIds() {
        final Map<String, DeviceResult> outcomes = new HashMap<>();
        outcomes.put("a", new DeviceResult("m1", "a2", null));
        outcomes.put("b", new DeviceResult("m2", null, null));

        final MulticastResult result =
                ResultReconciler.reconcile(Arrays.asList("a", "b"), outcomes, 1, Collections.emptyList());

        assertEquals(2, result.getSuccess());
        assertEquals(0, result.getFailure());
        assertEquals(1, result.getCanonicalIds());
    }

    @Test
    void reconcileEmptyMessageIdIsNotSuccess() {
        final Map<String, DeviceResult> outcomes = new HashMap<>();
        outcomes.put("a", new DeviceResult("", null, null));
        outcomes.put("b", new DeviceResult("m2", null, null));

        final MulticastResult result =
                ResultReconciler.reconcile(Arrays.asList("a", "b"), outcomes, 1, Collections.emptyList());

        assertFalse(result.getResults().get(0).isSuccessful());
        assertEquals(1, result.getSuccess());
        assertEquals(1, result.getFailure());
    }

    @Test
    void reconcileMissingOutcome() {
        final Map<String, DeviceResult> outcomes =
                Collections.singletonMap("a", new DeviceResult("m1", null, null));

        final MulticastResult result =
                ResultReconciler.reconcile(Arrays.asList("a", "b"), outcomes, 0, Collections.emptyList());

        assertEquals(1, result.getSuccess());
        assertEquals(1, result.getFailure());
        assertEquals(DeviceResult.UNKNOWN, result.getResults().get(1));
        assertFalse(result.getResults().get(1).getError().isPresent());
        assertFalse(result.getResults().get(1).getMessageId().isPresent());
    }

    @Test
    void reconcileDuplicateRegistrationIds() {
        final Map<String, DeviceResult> outcomes = new HashMap<>();
        outcomes.put("a", new DeviceResult("m1", null, null));
        outcomes.put("b", new DeviceResult(null, null, "Unavailable"));

        final MulticastResult result =
                ResultReconciler.reconcile(Arrays.asList("a", "b", "a"), outcomes, 1, Collections.emptyList());

        assertEquals(3, result.getResults().size());
        assertEquals(result.getResults().get(0), result.getResults().get(2));
        assertEquals(2, result.getSuccess());
        assertEquals(1, result.getFailure());
        assertEquals(result.getTotal(), result.getResults().size());
    }

    @Test
    void reconcileIsRepeatable() {
        final List<String> registrationIds = Arrays.asList("a", "b");
        final Map<String, DeviceResult> outcomes = new HashMap<>();
        outcomes.put("a", new DeviceResult("m1", null, null));
        outcomes.put("b", new DeviceResult(null, null, "Unavailable"));

        final List<Long> retryMulticastIds = Arrays.asList(2L, 3L);

        final MulticastResult first = ResultReconciler.reconcile(registrationIds, outcomes, 1, retryMulticastIds);
        final MulticastResult second = ResultReconciler.reconcile(registrationIds, outcomes, 1, retryMulticastIds);

        assertEquals(first, second);
        assertEquals(retryMulticastIds, first.getRetryMulticastIds());
        assertEquals(2, outcomes.size());
    }
}
