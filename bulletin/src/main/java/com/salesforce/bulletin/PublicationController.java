/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.bulletin.events.EventNotifier;
import com.salesforce.bulletin.fsm.QuorumApproval;
import com.salesforce.bulletin.fsm.QuorumApproval.Decision;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.Whitelist;
import com.salesforce.bulletin.support.CommitmentStore;
import com.salesforce.bulletin.support.Coordinate;
import com.salesforce.bulletin.support.ReplyTracker;

/**
 * Decides the fate of each view a member publishes. A view that a peer already committed at the same height is
 * accepted on the spot if the rolling hash chains, and is a conflict otherwise. A novel view must be approved by a
 * quorum of the committee and its rolling hash must still chain when the round is decided.
 *
 * @author hal.hildebrand
 */
public class PublicationController {
    private static final Logger log = LoggerFactory.getLogger(PublicationController.class);

    private final QuorumApproval  approval;
    private final CommitmentStore commitments;
    private final EventNotifier   notifier;
    private final Parameters      params;
    private final ReplyTracker    replies;
    private final Whitelist       whitelist;

    public PublicationController(Parameters params, Whitelist whitelist, CommitmentStore commitments,
                                 ReplyTracker replies, QuorumApproval approval, EventNotifier notifier) {
        this.params = params;
        this.whitelist = whitelist;
        this.commitments = commitments;
        this.replies = replies;
        this.approval = approval;
        this.notifier = notifier;
    }

    /**
     * Record the evaluator's verdict on the evaluated member's view and advance the member's round, if one is open.
     * Verdicts on a view already published are dropped.
     */
    public Outcome evaluate(MemberId caller, int height, MemberId evaluated, String verdict) {
        if (!whitelist.contains(caller)) {
            log.debug("Evaluation refused, not a member: {}", caller);
            return Outcome.UNAUTHORIZED;
        }
        if (!whitelist.contains(evaluated)) {
            log.debug("Evaluation refused, evaluated: {} not a member, by: {}", evaluated, caller);
            return Outcome.NO_SUCH_MEMBER;
        }
        if (commitments.contains(evaluated, height)) {
            log.trace("Evaluation ignored, view at height: {} of: {} already published, by: {}", height, evaluated,
                      caller);
            return Outcome.REDUNDANT;
        }
        var coordinate = new Coordinate(evaluated, height);
        replies.append(coordinate, verdict);
        if (replies.round(coordinate) == null) {
            return Outcome.APPLIED;
        }
        return settle(approval.advance(coordinate));
    }

    /**
     * Advance every suspended round
     *
     * @return the outcomes of the rounds that were settled
     */
    public List<Outcome> expire() {
        var settled = new ArrayList<Outcome>();
        for (var coordinate : replies.openRounds()) {
            var outcome = settle(approval.advance(coordinate));
            if (outcome != Outcome.PENDING) {
                settled.add(outcome);
            }
        }
        return settled;
    }

    public Outcome publish(MemberId caller, int height, String view, String rollingHash) {
        if (!whitelist.contains(caller)) {
            log.debug("Publication refused, not a member: {}", caller);
            return Outcome.UNAUTHORIZED;
        }
        if (commitments.contains(caller, height)) {
            log.debug("Publication ignored, commitment exists at height: {} for: {}", height, caller);
            return Outcome.DUPLICATE_COORDINATE;
        }
        for (var peer : commitments.allAt(height).entrySet()) {
            if (peer.getValue().view().equals(view)) {
                var expected = RollingHash.compute(commitments, caller, height);
                if (expected.equals(rollingHash)) {
                    log.trace("View at height: {} already committed by: {}, publishing for: {}", height,
                              peer.getKey(), caller);
                    return commit(caller, height, view, rollingHash);
                }
                log.debug("View at height: {} committed by: {} but rolling hash: {} expected: {} from: {}", height,
                          peer.getKey(), rollingHash, expected, caller);
                notifier.conflict(height, caller, view, rollingHash);
                return Outcome.HASH_MISMATCH;
            }
        }
        return settle(approval.open(caller, height, view, rollingHash));
    }

    private Outcome commit(MemberId member, int height, String view, String rollingHash) {
        if (!commitments.tryInsert(member, height, view, rollingHash)) {
            return Outcome.DUPLICATE_COORDINATE;
        }
        var coordinate = new Coordinate(member, height);
        replies.close(coordinate);
        replies.discard(coordinate);
        notifier.published(height, member, view);
        return Outcome.PUBLISHED;
    }

    private Outcome settle(Decision decision) {
        var coordinate = decision.coordinate();
        var round = decision.round();
        switch (decision.state()) {
        case APPROVED: {
            var expected = RollingHash.compute(commitments, coordinate.member(), coordinate.height());
            if (expected.equals(round.rollingHash())) {
                return commit(coordinate.member(), coordinate.height(), round.view(), round.rollingHash());
            }
            log.warn("Approved view at: {} not published, rolling hash: {} expected: {}", coordinate,
                     round.rollingHash(), expected);
            if (params.reportUnverifiedApproval()) {
                notifier.conflict(coordinate.height(), coordinate.member(), round.view(), round.rollingHash());
            }
            return Outcome.UNVERIFIED_AFTER_APPROVAL;
        }
        case REJECTED:
            return Outcome.QUORUM_REJECTED;
        case TIMED_OUT:
            return Outcome.QUORUM_TIMEOUT;
        case AWAITING_REPLIES:
            return Outcome.PENDING;
        default:
            throw new IllegalStateException("No round to settle at: " + coordinate);
        }
    }
}
