/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

/**
 * The result of a bulletin operation. Outcomes are not visible to hosts through {@link Bulletin}, where every refusal
 * is silent.
 *
 * @author hal.hildebrand
 */
public enum Outcome {
    /** The operation changed the bulletin's state */
    APPLIED,
    /** The view was committed and announced */
    PUBLISHED,
    /** The view awaits the committee's replies */
    PENDING,
    /** The caller lacks the required privilege or membership */
    UNAUTHORIZED,
    /** The requested change is already in effect */
    REDUNDANT,
    /** A commitment already exists at the caller's coordinate */
    DUPLICATE_COORDINATE,
    /** The view matches a peer's, but the rolling hash does not chain; a conflict was reported */
    HASH_MISMATCH,
    /** The committee disapproved the view; a conflict was reported */
    QUORUM_REJECTED,
    /** No quorum was reached before the round's deadline */
    QUORUM_TIMEOUT,
    /** The committee approved the view, but its rolling hash does not chain */
    UNVERIFIED_AFTER_APPROVAL,
    /** The member named by the operation is not in the whitelist */
    NO_SUCH_MEMBER,
    /** The operation's argument is out of range */
    INVALID_ARGUMENT;
}
