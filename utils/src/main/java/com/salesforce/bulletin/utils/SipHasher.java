/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.utils;

import java.nio.charset.StandardCharsets;

/**
 * Streaming SipHash. {@link #sip13()}, SipHash-1-3 with zero keys, is the stable 64 bit hash that chains bulletin
 * views. Bytes are absorbed raw, without length prefixes, so writing "ab" then "c" produces the same value as writing
 * "abc".
 *
 * @author hal.hildebrand
 */
public final class SipHasher {

    public static SipHasher sip13() {
        return new SipHasher(0L, 0L, 1, 3);
    }

    public static long hash13(String... segments) {
        var hasher = sip13();
        for (var s : segments) {
            hasher.write(s);
        }
        return hasher.finish();
    }

    private final int    compressionRounds;
    private final int    finalizationRounds;
    private final byte[] tail = new byte[8];
    private       int    tailLength;
    private       long   length;
    private       long   v0;
    private       long   v1;
    private       long   v2;
    private       long   v3;

    private SipHasher(long k0, long k1, int compressionRounds, int finalizationRounds) {
        this.compressionRounds = compressionRounds;
        this.finalizationRounds = finalizationRounds;
        v0 = k0 ^ 0x736f6d6570736575L;
        v1 = k1 ^ 0x646f72616e646f6dL;
        v2 = k0 ^ 0x6c7967656e657261L;
        v3 = k1 ^ 0x7465646279746573L;
    }

    /**
     * Compute the hash of everything written so far. The hasher state is not modified, so more bytes may be written
     * afterwards.
     */
    public long finish() {
        long b = (length & 0xffL) << 56;
        for (int i = 0; i < tailLength; i++) {
            b |= (tail[i] & 0xffL) << (8 * i);
        }
        long s0 = v0, s1 = v1, s2 = v2, s3 = v3;

        s3 ^= b;
        for (int i = 0; i < compressionRounds; i++) {
            long[] s = round(s0, s1, s2, s3);
            s0 = s[0];
            s1 = s[1];
            s2 = s[2];
            s3 = s[3];
        }
        s0 ^= b;

        s2 ^= 0xffL;
        for (int i = 0; i < finalizationRounds; i++) {
            long[] s = round(s0, s1, s2, s3);
            s0 = s[0];
            s1 = s[1];
            s2 = s[2];
            s3 = s[3];
        }
        return s0 ^ s1 ^ s2 ^ s3;
    }

    public SipHasher write(byte[] bytes) {
        for (byte b : bytes) {
            tail[tailLength++] = b;
            if (tailLength == 8) {
                compress(littleEndian(tail));
                tailLength = 0;
            }
        }
        length += bytes.length;
        return this;
    }

    public SipHasher write(String s) {
        return write(s.getBytes(StandardCharsets.UTF_8));
    }

    private void compress(long m) {
        v3 ^= m;
        for (int i = 0; i < compressionRounds; i++) {
            long[] s = round(v0, v1, v2, v3);
            v0 = s[0];
            v1 = s[1];
            v2 = s[2];
            v3 = s[3];
        }
        v0 ^= m;
    }

    private static long littleEndian(byte[] b) {
        long m = 0;
        for (int i = 7; i >= 0; i--) {
            m = (m << 8) | (b[i] & 0xffL);
        }
        return m;
    }

    private static long[] round(long v0, long v1, long v2, long v3) {
        v0 += v1;
        v1 = Long.rotateLeft(v1, 13);
        v1 ^= v0;
        v0 = Long.rotateLeft(v0, 32);

        v2 += v3;
        v3 = Long.rotateLeft(v3, 16);
        v3 ^= v2;

        v0 += v3;
        v3 = Long.rotateLeft(v3, 21);
        v3 ^= v0;

        v2 += v1;
        v1 = Long.rotateLeft(v1, 17);
        v1 ^= v2;
        v2 = Long.rotateLeft(v2, 32);
        return new long[] { v0, v1, v2, v3 };
    }
}
