/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.membership;

import java.nio.ByteBuffer;

import org.h2.mvstore.WriteBuffer;
import org.h2.mvstore.type.BasicDataType;

/**
 * @author hal.hildebrand
 */
public class MemberIdType extends BasicDataType<MemberId> {
    public static final MemberIdType INSTANCE = new MemberIdType();

    @Override
    public int compare(MemberId a, MemberId b) {
        return a.compareTo(b);
    }

    @Override
    public MemberId[] createStorage(int size) {
        return new MemberId[size];
    }

    @Override
    public int getMemory(MemberId obj) {
        return MemberId.BYTES;
    }

    @Override
    public MemberId read(ByteBuffer buff) {
        return new MemberId(buff);
    }

    @Override
    public void write(WriteBuffer buff, MemberId id) {
        for (long l : id.getLongs()) {
            buff.putLong(l);
        }
    }
}
