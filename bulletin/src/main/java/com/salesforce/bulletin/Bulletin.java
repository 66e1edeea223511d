/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import com.salesforce.bulletin.membership.MemberId;

/**
 * The operations a ledger host invokes on the bulletin. Each call carries the identity of its caller. Calls never
 * fail: unauthorized, redundant or rejected calls leave the state unchanged, and observers learn of the effects only
 * through the bulletin's events.
 *
 * @author hal.hildebrand
 */
public interface Bulletin {

    /**
     * Register a committee member. Privileged.
     */
    void addMember(MemberId caller, MemberId member);

    /**
     * Cast a verdict, {@code "OK"} or {@code "NOK"}, on the view the evaluated member proposed at the height
     */
    void evaluateView(MemberId caller, int height, MemberId evaluatedMember, String verdict);

    /**
     * Advance the clock by one block. Privileged.
     */
    void incrementClock(MemberId caller);

    /**
     * Publish the caller's view at the height, chained to its previous view by the rolling hash
     */
    void publishView(MemberId caller, int height, String view, String rollingHash);

    /**
     * Deregister a committee member, discarding its commitments and replies. Privileged.
     */
    void removeMember(MemberId caller, MemberId member);

    void reportConflict(MemberId caller, int height, String view, String rollingHash);

    /**
     * Set the number of clock ticks an approval round may wait. Privileged.
     */
    void setTimeout(MemberId caller, long timeout);
}
