/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 */
public class QuorumPolicyTest {

    @Test
    public void majority() {
        assertEquals(1, QuorumPolicy.MAJORITY.quorum(0));
        assertEquals(1, QuorumPolicy.MAJORITY.quorum(1));
        assertEquals(2, QuorumPolicy.MAJORITY.quorum(2));
        assertEquals(2, QuorumPolicy.MAJORITY.quorum(3));
        assertEquals(3, QuorumPolicy.MAJORITY.quorum(4));
        assertEquals(6, QuorumPolicy.MAJORITY.quorum(10));
    }

    @Test
    public void smallCommittee() {
        assertEquals(0, QuorumPolicy.SMALL_COMMITTEE.quorum(0));
        assertEquals(0, QuorumPolicy.SMALL_COMMITTEE.quorum(1));
        assertEquals(1, QuorumPolicy.SMALL_COMMITTEE.quorum(2));
        assertEquals(2, QuorumPolicy.SMALL_COMMITTEE.quorum(3));
        assertEquals(3, QuorumPolicy.SMALL_COMMITTEE.quorum(4));
        assertEquals(3, QuorumPolicy.SMALL_COMMITTEE.quorum(5));
    }
}
