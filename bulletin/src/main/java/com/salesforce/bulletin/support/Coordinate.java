/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.util.Objects;

import com.salesforce.bulletin.membership.MemberId;

/**
 * The (member, height) address of a commitment, a reply collection or an approval round
 *
 * @author hal.hildebrand
 */
public record Coordinate(MemberId member, int height) implements Comparable<Coordinate> {

    public static Coordinate first(MemberId member) {
        return new Coordinate(member, Integer.MIN_VALUE);
    }

    public static Coordinate last(MemberId member) {
        return new Coordinate(member, Integer.MAX_VALUE);
    }

    public Coordinate {
        Objects.requireNonNull(member, "member");
    }

    @Override
    public int compareTo(Coordinate o) {
        int compare = member.compareTo(o.member);
        return compare != 0 ? compare : Integer.compare(height, o.height);
    }

    @Override
    public String toString() {
        return member + "@" + height;
    }
}
