/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.membership;

import java.util.List;
import java.util.Objects;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * The authoritative set of committee members, kept in the {@value #WHITELIST} map of the bulletin's MVStore. Only the
 * owner identity may change the membership; unauthorized and redundant changes are refused by returning false.
 * Committing or rolling back the store is left to the caller.
 *
 * @author hal.hildebrand
 */
public class Whitelist {
    public static final String WHITELIST = "WHITELIST";

    private static final Logger log = LoggerFactory.getLogger(Whitelist.class);

    private final MVMap<MemberId, Long> members;
    private final MemberId              owner;

    public Whitelist(MemberId owner, MVStore store) {
        this.owner = Objects.requireNonNull(owner, "owner");
        members = store.openMap(WHITELIST, new MVMap.Builder<MemberId, Long>().keyType(MemberIdType.INSTANCE));
    }

    /**
     * Register the member. Answer true if the caller is the owner and the member was not yet registered
     */
    public boolean add(MemberId caller, MemberId member) {
        Objects.requireNonNull(member, "member");
        if (!isOwner(caller)) {
            log.debug("Refusing to add: {} unauthorized caller: {}", member, caller);
            return false;
        }
        if (members.putIfAbsent(member, joined()) != null) {
            log.debug("Refusing to add: {}, already a member", member);
            return false;
        }
        log.info("Added member: {} committee size: {}", member, members.size());
        return true;
    }

    public boolean contains(MemberId member) {
        return member != null && members.containsKey(member);
    }

    public boolean isOwner(MemberId caller) {
        return owner.equals(caller);
    }

    /**
     * @return the members in the order they joined
     */
    public List<MemberId> members() {
        return members.entrySet()
                      .stream()
                      .sorted((a, b) -> Long.compare(a.getValue(), b.getValue()))
                      .map(e -> e.getKey())
                      .collect(ImmutableList.toImmutableList());
    }

    public MemberId owner() {
        return owner;
    }

    /**
     * Deregister the member. Answer true if the caller is the owner and the member was registered
     */
    public boolean remove(MemberId caller, MemberId member) {
        Objects.requireNonNull(member, "member");
        if (!isOwner(caller)) {
            log.debug("Refusing to remove: {} unauthorized caller: {}", member, caller);
            return false;
        }
        if (members.remove(member) == null) {
            log.debug("Refusing to remove: {}, not a member", member);
            return false;
        }
        log.info("Removed member: {} committee size: {}", member, members.size());
        return true;
    }

    public int size() {
        return members.size();
    }

    private long joined() {
        return members.values().stream().mapToLong(l -> l).max().orElse(-1L) + 1;
    }
}
