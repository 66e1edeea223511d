/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.bulletin.events.BulletinEvent;
import com.salesforce.bulletin.events.EventNotifier;
import com.salesforce.bulletin.fsm.QuorumApproval;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.Whitelist;
import com.salesforce.bulletin.support.BlockClock;
import com.salesforce.bulletin.support.Commitment;
import com.salesforce.bulletin.support.CommitmentStore;
import com.salesforce.bulletin.support.Coordinate;
import com.salesforce.bulletin.support.ReplyTracker;
import com.salesforce.bulletin.support.Round;

/**
 * A shared ledger in which the members of a permissioned committee publish views of an external chain, each bound to
 * the member's previous view by a rolling hash.
 * <p>
 * Every operation runs alone and is transactional: its changes to the MVStore are committed when it completes and
 * rolled back if it fails, and the events it raised are delivered to listeners only after the commit. The
 * {@link Bulletin} operations report nothing to the caller; the corresponding methods returning an {@link Outcome}
 * give the precise reason a call had, or did not have, an effect.
 *
 * @author hal.hildebrand
 */
public class PublicBulletin implements Bulletin, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PublicBulletin.class);

    private final QuorumApproval        approval;
    private final BlockClock            clock;
    private final CommitmentStore       commitments;
    private final PublicationController controller;
    private final ReentrantLock         lock = new ReentrantLock();
    private final EventNotifier         notifier;
    private final Parameters            params;
    private final ReplyTracker          replies;
    private final MVStore               store;
    private final Whitelist             whitelist;

    public PublicBulletin(Parameters params) {
        this(params, params.mvBuilder().build());
    }

    public PublicBulletin(Parameters params, MVStore store) {
        this.params = params;
        this.store = store;
        whitelist = new Whitelist(params.owner(), store);
        commitments = new CommitmentStore(store, whitelist);
        replies = new ReplyTracker(store);
        clock = new BlockClock(store, params.timeout());
        notifier = new EventNotifier(params.metrics());
        approval = new QuorumApproval(params.quorum(), whitelist, replies, clock, notifier);
        controller = new PublicationController(params, whitelist, commitments, replies, approval, notifier);
        store.commit();
        log.info("Public bulletin owner: {} quorum: {} timeout: {} members: {}", params.owner(), params.quorum(),
                 clock.timeout(), whitelist.size());
    }

    /**
     * Register the member
     */
    public Outcome add(MemberId caller, MemberId member) {
        return transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            return whitelist.add(caller, member) ? Outcome.APPLIED : Outcome.REDUNDANT;
        });
    }

    /**
     * Insert a commitment for the member without running the publication protocol. Privileged. No event is emitted.
     */
    public Outcome addCommitment(MemberId caller, int height, MemberId member, String view, String rollingHash) {
        return transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            if (!whitelist.contains(member)) {
                return Outcome.NO_SUCH_MEMBER;
            }
            return commitments.tryInsert(member, height, view, rollingHash) ? Outcome.APPLIED
                                                                            : Outcome.DUPLICATE_COORDINATE;
        });
    }

    @Override
    public void addMember(MemberId caller, MemberId member) {
        add(caller, member);
    }

    /**
     * @return the member's commitments ordered by height
     */
    public NavigableMap<Integer, Commitment> chain(MemberId member) {
        return commitments.chain(member);
    }

    @Override
    public void close() {
        store.close();
    }

    public Commitment commitment(MemberId member, int height) {
        return commitments.get(member, height);
    }

    public Map<MemberId, Commitment> commitmentsAt(int height) {
        return commitments.allAt(height);
    }

    public long currentClock() {
        return clock.current();
    }

    public void deregister(UUID registration) {
        notifier.deregister(registration);
    }

    /**
     * Record the caller's verdict on the view the evaluated member proposed at the height
     */
    public Outcome evaluate(MemberId caller, int height, MemberId evaluatedMember, String verdict) {
        var outcome = transactionally(() -> controller.evaluate(caller, height, evaluatedMember, verdict));
        if (params.metrics() != null && outcome != Outcome.UNAUTHORIZED && outcome != Outcome.NO_SUCH_MEMBER
            && outcome != Outcome.REDUNDANT) {
            params.metrics().replyReceived();
        }
        return outcome;
    }

    @Override
    public void evaluateView(MemberId caller, int height, MemberId evaluatedMember, String verdict) {
        evaluate(caller, height, evaluatedMember, verdict);
    }

    @Override
    public void incrementClock(MemberId caller) {
        tick(caller);
    }

    /**
     * Initialize an empty reply collection for the member's coordinate. Privileged.
     */
    public Outcome openReplies(MemberId caller, int height, MemberId member) {
        return transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            if (!whitelist.contains(member)) {
                return Outcome.NO_SUCH_MEMBER;
            }
            return replies.open(new Coordinate(member, height)) ? Outcome.APPLIED : Outcome.REDUNDANT;
        });
    }

    public MemberId owner() {
        return whitelist.owner();
    }

    public Parameters params() {
        return params;
    }

    /**
     * Publish the caller's view at the height
     */
    public Outcome publish(MemberId caller, int height, String view, String rollingHash) {
        return transactionally(() -> controller.publish(caller, height, view, rollingHash));
    }

    @Override
    public void publishView(MemberId caller, int height, String view, String rollingHash) {
        publish(caller, height, view, rollingHash);
    }

    public int quorum() {
        return approval.quorum();
    }

    public UUID register(Consumer<BulletinEvent> listener) {
        return notifier.register(listener);
    }

    /**
     * Deregister the member, discarding its commitments, replies and rounds
     */
    public Outcome remove(MemberId caller, MemberId member) {
        return transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            if (!whitelist.remove(caller, member)) {
                return Outcome.REDUNDANT;
            }
            commitments.purge(member);
            replies.purge(member);
            return Outcome.APPLIED;
        });
    }

    @Override
    public void removeMember(MemberId caller, MemberId member) {
        remove(caller, member);
    }

    /**
     * @return the replies collected for the member's view at the height, or null if there is no reply collection
     */
    public List<String> replies(MemberId member, int height) {
        return replies.replies(new Coordinate(member, height));
    }

    /**
     * Announce a conflict on the view
     */
    public Outcome report(MemberId caller, int height, String view, String rollingHash) {
        return transactionally(() -> {
            if (params.gateConflictReports() && !whitelist.contains(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            notifier.conflict(height, caller, view, rollingHash);
            return Outcome.APPLIED;
        });
    }

    @Override
    public void reportConflict(MemberId caller, int height, String view, String rollingHash) {
        report(caller, height, view, rollingHash);
    }

    /**
     * @return the suspended approval round for the member's view at the height, or null
     */
    public Round round(MemberId member, int height) {
        return replies.round(new Coordinate(member, height));
    }

    @Override
    public void setTimeout(MemberId caller, long timeout) {
        timeout(caller, timeout);
    }

    /**
     * Advance the clock by one block, settling the rounds that time out
     */
    public Outcome tick(MemberId caller) {
        var settled = new ArrayList<Outcome>();
        var outcome = transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            var current = clock.increment();
            settled.addAll(controller.expire());
            log.debug("Clock: {} settled: {} rounds", current, settled.size());
            return Outcome.APPLIED;
        });
        settled.forEach(this::record);
        return outcome;
    }

    public long timeout() {
        return clock.timeout();
    }

    /**
     * Set the number of clock ticks an approval round may wait for its quorum
     */
    public Outcome timeout(MemberId caller, long timeout) {
        return transactionally(() -> {
            if (!whitelist.isOwner(caller)) {
                return Outcome.UNAUTHORIZED;
            }
            if (timeout < 0) {
                return Outcome.INVALID_ARGUMENT;
            }
            clock.setTimeout(timeout);
            log.info("Approval timeout: {}", timeout);
            return Outcome.APPLIED;
        });
    }

    public List<MemberId> whitelist() {
        return whitelist.members();
    }

    private void record(Outcome outcome) {
        var metrics = params.metrics();
        if (metrics == null) {
            return;
        }
        switch (outcome) {
        case UNAUTHORIZED -> metrics.unauthorized();
        case QUORUM_REJECTED -> metrics.rejected();
        case QUORUM_TIMEOUT -> metrics.timedOut();
        case UNVERIFIED_AFTER_APPROVAL -> metrics.unverified();
        default -> {
        }
        }
    }

    private Outcome transactionally(Supplier<Outcome> action) {
        final Outcome outcome;
        final List<BulletinEvent> events;
        lock.lock();
        try {
            outcome = action.get();
            store.commit();
            events = notifier.drain();
        } catch (RuntimeException e) {
            store.rollback();
            notifier.drain();
            log.error("Operation rolled back", e);
            throw e;
        } finally {
            lock.unlock();
        }
        record(outcome);
        notifier.deliver(events);
        return outcome;
    }
}
