/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.salesforce.bulletin.membership.MemberId;

/**
 * Tracks the verdicts cast on a member's proposed views, along with the suspended approval rounds waiting on those
 * verdicts. Reply collections are append only until they are discarded as a whole.
 *
 * @author hal.hildebrand
 */
public class ReplyTracker {
    public static final String REPLIES = "REPLIES";
    public static final String ROUNDS  = "ROUNDS";

    private static final Logger log = LoggerFactory.getLogger(ReplyTracker.class);

    private final MVMap<Coordinate, List<String>> replies;
    private final MVMap<Coordinate, Round>        rounds;

    public ReplyTracker(MVStore store) {
        replies = store.openMap(REPLIES, new MVMap.Builder<Coordinate, List<String>>().keyType(CoordinateType.INSTANCE)
                                                                                     .valueType(VerdictsType.INSTANCE));
        rounds = store.openMap(ROUNDS, new MVMap.Builder<Coordinate, Round>().keyType(CoordinateType.INSTANCE)
                                                                             .valueType(RoundType.INSTANCE));
    }

    /**
     * Append the verdict, creating the reply collection if need be
     *
     * @return the number of replies collected at the coordinate
     */
    public int append(Coordinate coordinate, String verdict) {
        var current = replies.get(coordinate);
        var updated = ImmutableList.<String>builder();
        if (current != null) {
            updated.addAll(current);
        }
        var appended = updated.add(verdict).build();
        replies.put(coordinate, appended);
        log.trace("Reply: {} for: {} count: {}", verdict, coordinate, appended.size());
        return appended.size();
    }

    public void close(Coordinate coordinate) {
        rounds.remove(coordinate);
    }

    public void discard(Coordinate coordinate) {
        var discarded = replies.remove(coordinate);
        if (discarded != null) {
            log.trace("Discarded: {} replies for: {}", discarded.size(), coordinate);
        }
    }

    /**
     * Initialize an empty reply collection for the coordinate, unless one already exists
     */
    public boolean open(Coordinate coordinate) {
        return replies.putIfAbsent(coordinate, ImmutableList.of()) == null;
    }

    /**
     * @return the coordinates of all suspended rounds
     */
    public List<Coordinate> openRounds() {
        return ImmutableList.copyOf(rounds.keySet());
    }

    /**
     * Discard the member's replies and rounds
     */
    public void purge(MemberId member) {
        var purged = new ArrayList<Coordinate>();
        var cursor = replies.cursor(Coordinate.first(member), Coordinate.last(member), false);
        while (cursor.hasNext()) {
            purged.add(cursor.next());
        }
        purged.forEach(replies::remove);

        var closed = new ArrayList<Coordinate>();
        var roundCursor = rounds.cursor(Coordinate.first(member), Coordinate.last(member), false);
        while (roundCursor.hasNext()) {
            closed.add(roundCursor.next());
        }
        closed.forEach(rounds::remove);
        log.trace("Purged: {} reply collections and: {} rounds of: {}", purged.size(), closed.size(), member);
    }

    /**
     * @return the replies collected at the coordinate, or null if no reply collection exists
     */
    public List<String> replies(Coordinate coordinate) {
        return replies.get(coordinate);
    }

    public List<String> repliesOrEmpty(Coordinate coordinate) {
        var current = replies.get(coordinate);
        return current == null ? Collections.emptyList() : current;
    }

    public Round round(Coordinate coordinate) {
        return rounds.get(coordinate);
    }

    public void suspend(Coordinate coordinate, Round round) {
        rounds.put(coordinate, round);
    }
}
