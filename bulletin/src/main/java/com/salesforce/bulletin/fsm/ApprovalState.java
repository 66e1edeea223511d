/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.fsm;

/**
 * States of a quorum approval round
 *
 * @author hal.hildebrand
 */
public enum ApprovalState {
    /** No round exists at the coordinate */
    IDLE,
    /** Round suspended, waiting for replies or the clock */
    AWAITING_REPLIES,
    /** Quorum reached, no rejecting reply */
    APPROVED,
    /** Quorum reached with at least one rejecting reply */
    REJECTED,
    /** Clock reached the round's deadline before quorum */
    TIMED_OUT;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == TIMED_OUT;
    }
}
