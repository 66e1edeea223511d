/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.fsm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.salesforce.bulletin.QuorumPolicy;
import com.salesforce.bulletin.events.BulletinEvent.ViewApprovalRequest;
import com.salesforce.bulletin.events.BulletinEvent.ViewConflict;
import com.salesforce.bulletin.events.EventNotifier;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.Whitelist;
import com.salesforce.bulletin.support.BlockClock;
import com.salesforce.bulletin.support.Coordinate;
import com.salesforce.bulletin.support.ReplyTracker;

/**
 * @author hal.hildebrand
 */
public class QuorumApprovalTest {
    private static final MemberId BOB = MemberId.filled((byte) 0x1);

    private QuorumApproval approval;
    private BlockClock     clock;
    private EventNotifier  notifier;
    private ReplyTracker   replies;
    private MVStore        store;

    @AfterEach
    public void after() {
        store.close();
    }

    @BeforeEach
    public void before() {
        store = new MVStore.Builder().autoCommitDisabled().open();
        var whitelist = new Whitelist(MemberId.DEFAULT, store);
        for (byte i = 1; i <= 4; i++) {
            whitelist.add(MemberId.DEFAULT, MemberId.filled(i));
        }
        replies = new ReplyTracker(store);
        clock = new BlockClock(store, 3);
        notifier = new EventNotifier(null);
        approval = new QuorumApproval(QuorumPolicy.SMALL_COMMITTEE, whitelist, replies, clock, notifier);
    }

    @Test
    public void idleWithoutRound() {
        var decision = approval.advance(new Coordinate(BOB, 1));
        assertEquals(ApprovalState.IDLE, decision.state());
        assertNull(decision.round());
        assertFalse(decision.state().isTerminal());
    }

    @Test
    public void approvesAtQuorum() {
        assertEquals(3, approval.quorum());
        var coordinate = new Coordinate(BOB, 1);
        assertEquals(ApprovalState.AWAITING_REPLIES, approval.open(BOB, 1, "View", "None").state());
        assertEquals(List.of(new ViewApprovalRequest(1, BOB, "View", "None")), notifier.drain());

        replies.append(coordinate, "OK");
        replies.append(coordinate, "OK");
        assertEquals(ApprovalState.AWAITING_REPLIES, approval.advance(coordinate).state());
        replies.append(coordinate, "OK");
        var decision = approval.advance(coordinate);
        assertEquals(ApprovalState.APPROVED, decision.state());
        assertTrue(decision.state().isTerminal());
        assertEquals("View", decision.round().view());
        assertNull(replies.round(coordinate));
        assertNull(replies.replies(coordinate));
        assertTrue(notifier.drain().isEmpty());
    }

    @Test
    public void singleRejectionVetoes() {
        var coordinate = new Coordinate(BOB, 1);
        replies.append(coordinate, "OK");
        replies.append(coordinate, "NOK");
        replies.append(coordinate, "OK");
        replies.append(coordinate, "OK");
        var decision = approval.open(BOB, 1, "View", "None");
        assertEquals(ApprovalState.REJECTED, decision.state());
        assertEquals(List.of(new ViewApprovalRequest(1, BOB, "View", "None"),
                             new ViewConflict(1, BOB, "View", "None")), notifier.drain());
        assertEquals(4, replies.replies(coordinate).size());
        assertNull(replies.round(coordinate));
    }

    @Test
    public void timesOut() {
        var coordinate = new Coordinate(BOB, 1);
        clock.increment();
        assertEquals(ApprovalState.AWAITING_REPLIES, approval.open(BOB, 1, "View", "None").state());
        assertEquals(1, replies.round(coordinate).initialClock());
        clock.increment();
        clock.increment();
        assertEquals(ApprovalState.AWAITING_REPLIES, approval.advance(coordinate).state());
        clock.increment();
        assertEquals(ApprovalState.TIMED_OUT, approval.advance(coordinate).state());
        assertNull(replies.replies(coordinate));
        assertEquals(ApprovalState.IDLE, approval.advance(coordinate).state());
    }

    @Test
    public void reopenAdvancesExistingRound() {
        var coordinate = new Coordinate(BOB, 1);
        approval.open(BOB, 1, "View", "None");
        notifier.drain();
        assertEquals(ApprovalState.AWAITING_REPLIES, approval.open(BOB, 1, "Other", "None").state());
        assertEquals("View", replies.round(coordinate).view());
        assertTrue(notifier.drain().isEmpty());
    }
}
