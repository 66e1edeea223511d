/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.util.Objects;

/**
 * A suspended approval round for a proposed view. The round is advanced by incoming evaluations and by the clock;
 * {@code initialClock} is the clock value when the round was opened.
 *
 * @author hal.hildebrand
 */
public record Round(String view, String rollingHash, long initialClock) {

    public Round {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(rollingHash, "rollingHash");
    }

    public boolean expired(long clock, long timeout) {
        return clock - initialClock >= timeout;
    }
}
