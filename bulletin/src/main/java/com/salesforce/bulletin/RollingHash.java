/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.support.Commitment;
import com.salesforce.bulletin.support.CommitmentStore;
import com.salesforce.bulletin.utils.Hex;
import com.salesforce.bulletin.utils.SipHasher;

/**
 * The per member hash chain of views.
 *
 * <pre>
 * H(h) = hex(sip13(V(h-1) || H(h-1)))   if the member committed at h-1
 * H(h) = "None"                         otherwise
 * </pre>
 *
 * Only the member's own previous commitment is consulted.
 *
 * @author hal.hildebrand
 */
public final class RollingHash {
    public static final String NONE = "None";

    /**
     * @return the rolling hash the member must supply for a view at the height
     */
    public static String compute(CommitmentStore store, MemberId member, int height) {
        if (height == Integer.MIN_VALUE) {
            return NONE;
        }
        return following(store.get(member, height - 1));
    }

    /**
     * @return the rolling hash of the commitment that follows the previous one, {@link #NONE} if there is none
     */
    public static String following(Commitment previous) {
        return previous == null ? NONE : of(previous.view(), previous.rollingHash());
    }

    public static String of(String view, String rollingHash) {
        return Hex.hexUnsigned(SipHasher.hash13(view, rollingHash));
    }

    /**
     * Recompute the member's chain
     *
     * @return the first height whose stored rolling hash does not chain from its predecessor, or null if the whole
     *         chain verifies
     */
    public static Integer verify(CommitmentStore store, MemberId member) {
        for (var entry : store.chain(member).entrySet()) {
            if (!compute(store, member, entry.getKey()).equals(entry.getValue().rollingHash())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private RollingHash() {
    }
}
