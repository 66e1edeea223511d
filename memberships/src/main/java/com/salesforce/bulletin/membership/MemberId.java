/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.membership;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.salesforce.bulletin.utils.Hex;

/**
 * The fixed size identity of a committee member. Identities compare as unsigned big endian byte strings.
 *
 * @author hal.hildebrand
 */
public final class MemberId implements Comparable<MemberId> {
    public static final int      BYTES   = 32;
    /** The all zero identity, the privileged owner unless configured otherwise */
    public static final MemberId DEFAULT = new MemberId(new long[BYTES / Long.BYTES]);

    public static MemberId filled(byte b) {
        var bytes = new byte[BYTES];
        Arrays.fill(bytes, b);
        return new MemberId(bytes);
    }

    public static MemberId fromHex(String hex) {
        return new MemberId(Hex.unhex(hex));
    }

    private final long[]       hash;
    private volatile int       hashCode = 0;

    public MemberId(byte[] bytes) {
        checkArgument(bytes != null && bytes.length == BYTES, "Invalid bytes length.  Require: %s", BYTES);
        this.hash = new long[BYTES / Long.BYTES];
        var buff = ByteBuffer.wrap(bytes);
        for (int i = 0; i < hash.length; i++) {
            hash[i] = buff.getLong();
        }
    }

    public MemberId(ByteBuffer buff) {
        hash = new long[BYTES / Long.BYTES];
        for (int i = 0; i < hash.length; i++) {
            hash[i] = buff.getLong();
        }
    }

    private MemberId(long[] hash) {
        this.hash = hash;
    }

    @Override
    public int compareTo(MemberId id) {
        if (id == this) {
            return 0;
        }
        for (int i = 0; i < hash.length; i++) {
            int compare = Long.compareUnsigned(hash[i], id.hash[i]);
            if (compare != 0) {
                return compare;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof MemberId other && Arrays.equals(hash, other.hash);
    }

    public byte[] getBytes() {
        var buff = ByteBuffer.allocate(BYTES);
        for (long l : hash) {
            buff.putLong(l);
        }
        return buff.array();
    }

    public long[] getLongs() {
        return hash;
    }

    @Override
    public int hashCode() {
        final int current = hashCode;
        if (current != 0) {
            return current;
        }
        int proposed = Arrays.hashCode(hash);
        hashCode = proposed == 0 ? 31 : proposed;
        return hashCode;
    }

    public String toHex() {
        return Hex.hex(getBytes());
    }

    @Override
    public String toString() {
        return "[" + Hex.hex(getBytes()).substring(0, 12) + "]";
    }
}
