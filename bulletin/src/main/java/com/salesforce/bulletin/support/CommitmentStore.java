/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.Whitelist;

/**
 * Kind of a DAO for the per member, per height commitments of the bulletin, kept in the MVStore. A coordinate is
 * written at most once; the first write wins.
 *
 * @author hal.hildebrand
 */
public class CommitmentStore {
    public static final String COMMITMENTS = "COMMITMENTS";

    private static final Logger log = LoggerFactory.getLogger(CommitmentStore.class);

    private final MVMap<Coordinate, Commitment> commitments;
    private final Whitelist                     whitelist;

    public CommitmentStore(MVStore store, Whitelist whitelist) {
        this.whitelist = whitelist;
        commitments = store.openMap(COMMITMENTS,
                                    new MVMap.Builder<Coordinate, Commitment>().keyType(CoordinateType.INSTANCE)
                                                                               .valueType(CommitmentType.INSTANCE));
    }

    /**
     * @return the commitments of every current member at the height, in whitelist order
     */
    public Map<MemberId, Commitment> allAt(int height) {
        var result = new LinkedHashMap<MemberId, Commitment>();
        for (var member : whitelist.members()) {
            var commitment = commitments.get(new Coordinate(member, height));
            if (commitment != null) {
                result.put(member, commitment);
            }
        }
        return result;
    }

    /**
     * @return the member's commitments ordered by height
     */
    public NavigableMap<Integer, Commitment> chain(MemberId member) {
        var chain = new TreeMap<Integer, Commitment>();
        var cursor = commitments.cursor(Coordinate.first(member), Coordinate.last(member), false);
        while (cursor.hasNext()) {
            var coordinate = cursor.next();
            chain.put(coordinate.height(), cursor.getValue());
        }
        return Collections.unmodifiableNavigableMap(chain);
    }

    public boolean contains(MemberId member, int height) {
        return commitments.containsKey(new Coordinate(member, height));
    }

    public Commitment get(MemberId member, int height) {
        return commitments.get(new Coordinate(member, height));
    }

    /**
     * Discard all commitments of the member
     */
    public int purge(MemberId member) {
        var purged = new ArrayList<Coordinate>();
        var cursor = commitments.cursor(Coordinate.first(member), Coordinate.last(member), false);
        while (cursor.hasNext()) {
            purged.add(cursor.next());
        }
        purged.forEach(commitments::remove);
        log.trace("Purged: {} commitments of: {}", purged.size(), member);
        return purged.size();
    }

    /**
     * Insert the commitment if the coordinate is still vacant
     *
     * @return true if inserted, false if a commitment already exists at the coordinate
     */
    public boolean tryInsert(MemberId member, int height, String view, String rollingHash) {
        var coordinate = new Coordinate(member, height);
        if (commitments.putIfAbsent(coordinate, new Commitment(view, rollingHash)) != null) {
            log.trace("Commitment exists at: {}", coordinate);
            return false;
        }
        log.trace("insert: {} view: {} rolling hash: {}", coordinate, view, rollingHash);
        return true;
    }
}
