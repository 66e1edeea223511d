/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

/**
 * The number of approving replies a novel view needs, given the committee size
 *
 * @author hal.hildebrand
 */
public enum QuorumPolicy {
    /** Simple majority: N/2 + 1 */
    MAJORITY {
        @Override
        public int quorum(int committeeSize) {
            return committeeSize / 2 + 1;
        }
    },
    /** N/2 for committees of at most two members, otherwise N/2 + 1 */
    SMALL_COMMITTEE {
        @Override
        public int quorum(int committeeSize) {
            int half = committeeSize / 2;
            return committeeSize <= 2 ? half : half + 1;
        }
    };

    public abstract int quorum(int committeeSize);
}
