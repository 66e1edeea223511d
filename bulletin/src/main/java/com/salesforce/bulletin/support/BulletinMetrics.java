/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

/**
 * @author hal.hildebrand
 */
public interface BulletinMetrics {

    void approvalRequested();

    void conflict();

    void published();

    void rejected();

    void replyReceived();

    void timedOut();

    void unauthorized();

    void unverified();

}
