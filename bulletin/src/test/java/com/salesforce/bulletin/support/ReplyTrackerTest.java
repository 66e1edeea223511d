/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.salesforce.bulletin.membership.MemberId;

/**
 * @author hal.hildebrand
 */
public class ReplyTrackerTest {
    private static final MemberId BOB = MemberId.filled((byte) 0x1);

    private MVStore      store;
    private ReplyTracker tracker;

    @AfterEach
    public void after() {
        store.close();
    }

    @BeforeEach
    public void before() {
        store = new MVStore.Builder().autoCommitDisabled().open();
        tracker = new ReplyTracker(store);
    }

    @Test
    public void lazyCreation() {
        var coordinate = new Coordinate(BOB, 1);
        assertNull(tracker.replies(coordinate));
        assertEquals(List.of(), tracker.repliesOrEmpty(coordinate));
        assertEquals(1, tracker.append(coordinate, "OK"));
        assertEquals(2, tracker.append(coordinate, "OK"));
        assertFalse(tracker.open(coordinate));
        assertEquals(List.of("OK", "OK"), tracker.replies(coordinate));
        assertThrows(UnsupportedOperationException.class, () -> tracker.replies(coordinate).add("NOK"));
    }

    @Test
    public void openRounds() {
        var first = new Coordinate(BOB, 1);
        var second = new Coordinate(BOB, 2);
        var other = new Coordinate(MemberId.filled((byte) 0x2), 1);
        assertTrue(tracker.open(first));
        tracker.suspend(first, new Round("V1", "None", 0));
        tracker.suspend(second, new Round("V2", "h", 1));
        tracker.suspend(other, new Round("V1", "None", 0));
        tracker.append(other, "OK");
        assertEquals(List.of(first, second, other), tracker.openRounds());

        tracker.close(first);
        assertEquals(List.of(), tracker.replies(first));
        tracker.discard(first);
        assertNull(tracker.replies(first));

        tracker.purge(BOB);
        assertEquals(List.of(other), tracker.openRounds());
        assertEquals(List.of("OK"), tracker.replies(other));
    }

    @Test
    public void expiry() {
        var round = new Round("View", "None", 3);
        assertFalse(round.expired(4, 2));
        assertTrue(round.expired(5, 2));
        assertTrue(round.expired(3, 0));
        assertFalse(round.expired(Long.MAX_VALUE - 1, Long.MAX_VALUE));
        assertTrue(new Round("View", "None", 0).expired(Long.MAX_VALUE, Long.MAX_VALUE));

        var clock = new BlockClock(store, 2);
        assertEquals(0, clock.current());
        assertEquals(1, clock.increment());
        assertFalse(clock.expired(new Round("View", "None", 0)));
        clock.increment();
        assertTrue(clock.expired(new Round("View", "None", 0)));
        assertThrows(IllegalArgumentException.class, () -> clock.setTimeout(-1));
        assertEquals(2, new BlockClock(store, 9).timeout());
    }
}
