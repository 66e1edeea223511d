/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import static com.google.common.base.Preconditions.checkArgument;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

/**
 * The host's notion of the current block height, used only to time out approval rounds, together with the round
 * timeout in clock ticks
 *
 * @author hal.hildebrand
 */
public class BlockClock {
    public static final String STATE = "STATE";

    private static final String CURRENT_HEIGHT = "current_height";
    private static final String TIMEOUT        = "timeout";

    private final MVMap<String, Long> state;

    public BlockClock(MVStore store, long initialTimeout) {
        checkArgument(initialTimeout >= 0, "timeout must be >= 0: %s", initialTimeout);
        state = store.openMap(STATE);
        state.putIfAbsent(CURRENT_HEIGHT, 0L);
        state.putIfAbsent(TIMEOUT, initialTimeout);
    }

    public long current() {
        return state.get(CURRENT_HEIGHT);
    }

    public boolean expired(Round round) {
        return round.expired(current(), timeout());
    }

    public long increment() {
        var next = current() + 1;
        state.put(CURRENT_HEIGHT, next);
        return next;
    }

    public void setTimeout(long timeout) {
        checkArgument(timeout >= 0, "timeout must be >= 0: %s", timeout);
        state.put(TIMEOUT, timeout);
    }

    public long timeout() {
        return state.get(TIMEOUT);
    }
}
