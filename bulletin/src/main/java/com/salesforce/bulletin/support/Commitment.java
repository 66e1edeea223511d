/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.util.Objects;

/**
 * A published (view, rolling hash) pair. The view is an opaque snapshot of the external ledger; the rolling hash binds
 * it to the member's previous commitment.
 *
 * @author hal.hildebrand
 */
public record Commitment(String view, String rollingHash) {

    public Commitment {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(rollingHash, "rollingHash");
    }
}
