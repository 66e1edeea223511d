/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.events;

import com.salesforce.bulletin.membership.MemberId;

/**
 * Fire and forget notifications of the bulletin. Events are the only way observers learn of publications, approval
 * requests and conflicts.
 *
 * @author hal.hildebrand
 */
public interface BulletinEvent {

    /** Emitted when a view is published */
    record ViewPublished(int height, MemberId member, String view) implements BulletinEvent {
    }

    /** Emitted when there is no agreement on a view, or its rolling hash fails verification */
    record ViewConflict(int height, MemberId member, String view, String rollingHash) implements BulletinEvent {
    }

    /** Emitted when a view needs the approval of the committee */
    record ViewApprovalRequest(int height, MemberId member, String view, String rollingHash)
    implements BulletinEvent {
    }

    int height();

    MemberId member();

    String view();
}
