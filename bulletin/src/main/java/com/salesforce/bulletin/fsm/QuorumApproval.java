/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.fsm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.bulletin.QuorumPolicy;
import com.salesforce.bulletin.events.EventNotifier;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.Whitelist;
import com.salesforce.bulletin.support.BlockClock;
import com.salesforce.bulletin.support.Coordinate;
import com.salesforce.bulletin.support.ReplyTracker;
import com.salesforce.bulletin.support.Round;

/**
 * Decides whether a novel view is approved by the committee. A round is opened for the proposing member's coordinate
 * and suspended in the {@link ReplyTracker}; every call to {@link #advance(Coordinate)} re-checks the collected
 * replies against the quorum and the clock against the round's deadline.
 *
 * <pre>
 * IDLE -> AWAITING_REPLIES -> APPROVED | REJECTED | TIMED_OUT
 * </pre>
 *
 * @author hal.hildebrand
 */
public class QuorumApproval {

    /**
     * The state of a round after an attempt to advance it, along with the round itself
     */
    public record Decision(Coordinate coordinate, Round round, ApprovalState state) {
    }

    public static final String APPROVE = "OK";
    public static final String REJECT  = "NOK";

    private static final Logger log = LoggerFactory.getLogger(QuorumApproval.class);

    private final BlockClock    clock;
    private final EventNotifier notifier;
    private final QuorumPolicy  policy;
    private final ReplyTracker  replies;
    private final Whitelist     whitelist;

    public QuorumApproval(QuorumPolicy policy, Whitelist whitelist, ReplyTracker replies, BlockClock clock,
                          EventNotifier notifier) {
        this.policy = policy;
        this.whitelist = whitelist;
        this.replies = replies;
        this.clock = clock;
        this.notifier = notifier;
    }

    /**
     * Advance the round at the coordinate, if any. Terminal decisions close the round: approval and timeout discard
     * the replies, rejection keeps them and reports the conflict.
     */
    public Decision advance(Coordinate coordinate) {
        var round = replies.round(coordinate);
        if (round == null) {
            return new Decision(coordinate, null, ApprovalState.IDLE);
        }
        var collected = replies.repliesOrEmpty(coordinate);
        var quorum = quorum();
        if (collected.size() >= quorum) {
            replies.close(coordinate);
            if (collected.contains(REJECT)) {
                log.debug("Approval rejected: {} replies: {} quorum: {}", coordinate, collected, quorum);
                notifier.conflict(coordinate.height(), coordinate.member(), round.view(), round.rollingHash());
                return new Decision(coordinate, round, ApprovalState.REJECTED);
            }
            log.trace("Approved: {} replies: {} quorum: {}", coordinate, collected.size(), quorum);
            replies.discard(coordinate);
            return new Decision(coordinate, round, ApprovalState.APPROVED);
        }
        if (clock.expired(round)) {
            log.debug("Approval timed out: {} opened: {} clock: {} timeout: {} replies: {}/{}", coordinate,
                      round.initialClock(), clock.current(), clock.timeout(), collected.size(), quorum);
            replies.close(coordinate);
            replies.discard(coordinate);
            return new Decision(coordinate, round, ApprovalState.TIMED_OUT);
        }
        log.trace("Awaiting replies: {} have: {} quorum: {}", coordinate, collected.size(), quorum);
        return new Decision(coordinate, round, ApprovalState.AWAITING_REPLIES);
    }

    /**
     * Open an approval round for the member's proposed view and request the committee's evaluation. An existing reply
     * collection for the coordinate is reused. If a round is already open it is advanced instead.
     */
    public Decision open(MemberId member, int height, String view, String rollingHash) {
        var coordinate = new Coordinate(member, height);
        var existing = replies.round(coordinate);
        if (existing != null) {
            if (!existing.view().equals(view) || !existing.rollingHash().equals(rollingHash)) {
                log.debug("Round already open: {} for view: {}, ignoring view: {}", coordinate, existing.view(),
                          view);
            }
            return advance(coordinate);
        }
        replies.open(coordinate);
        replies.suspend(coordinate, new Round(view, rollingHash, clock.current()));
        notifier.approvalRequested(height, member, view, rollingHash);
        return advance(coordinate);
    }

    public int quorum() {
        return policy.quorum(whitelist.size());
    }
}
