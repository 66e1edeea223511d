/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.membership;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.h2.mvstore.MVStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 *
 */
public class WhitelistTest {
    private static final MemberId ALICE = MemberId.filled((byte) 0x2);
    private static final MemberId BOB   = MemberId.filled((byte) 0x1);
    private static final MemberId JANE  = MemberId.filled((byte) 0x3);

    private MVStore   store;
    private Whitelist whitelist;

    @AfterEach
    public void after() {
        store.close();
    }

    @BeforeEach
    public void before() {
        store = new MVStore.Builder().open();
        whitelist = new Whitelist(MemberId.DEFAULT, store);
    }

    @Test
    public void ownerOnly() {
        assertFalse(whitelist.add(BOB, BOB));
        assertFalse(whitelist.contains(BOB));
        assertTrue(whitelist.add(MemberId.DEFAULT, BOB));
        assertFalse(whitelist.remove(BOB, BOB));
        assertTrue(whitelist.contains(BOB));
    }

    @Test
    public void redundantChanges() {
        assertTrue(whitelist.add(MemberId.DEFAULT, BOB));
        assertFalse(whitelist.add(MemberId.DEFAULT, BOB));
        assertEquals(1, whitelist.size());
        assertFalse(whitelist.remove(MemberId.DEFAULT, ALICE));
        assertTrue(whitelist.remove(MemberId.DEFAULT, BOB));
        assertFalse(whitelist.remove(MemberId.DEFAULT, BOB));
        assertEquals(0, whitelist.size());
    }

    @Test
    public void joinOrder() {
        whitelist.add(MemberId.DEFAULT, JANE);
        whitelist.add(MemberId.DEFAULT, BOB);
        whitelist.add(MemberId.DEFAULT, ALICE);
        assertEquals(List.of(JANE, BOB, ALICE), whitelist.members());
        whitelist.remove(MemberId.DEFAULT, BOB);
        whitelist.add(MemberId.DEFAULT, BOB);
        assertEquals(List.of(JANE, ALICE, BOB), whitelist.members());
    }

    @Test
    public void rollback() {
        whitelist.add(MemberId.DEFAULT, BOB);
        store.commit();
        whitelist.add(MemberId.DEFAULT, ALICE);
        whitelist.remove(MemberId.DEFAULT, BOB);
        store.rollback();
        assertEquals(List.of(BOB), whitelist.members());
    }
}
