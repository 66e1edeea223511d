/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.nio.ByteBuffer;

import org.h2.mvstore.WriteBuffer;
import org.h2.mvstore.type.BasicDataType;
import org.h2.mvstore.type.StringDataType;

/**
 * @author hal.hildebrand
 */
public class RoundType extends BasicDataType<Round> {
    public static final RoundType INSTANCE = new RoundType();

    @Override
    public Round[] createStorage(int size) {
        return new Round[size];
    }

    @Override
    public int getMemory(Round obj) {
        return 32 + 2 * (obj.view().length() + obj.rollingHash().length());
    }

    @Override
    public Round read(ByteBuffer buff) {
        var view = StringDataType.INSTANCE.read(buff);
        var rollingHash = StringDataType.INSTANCE.read(buff);
        return new Round(view, rollingHash, buff.getLong());
    }

    @Override
    public void write(WriteBuffer buff, Round round) {
        StringDataType.INSTANCE.write(buff, round.view());
        StringDataType.INSTANCE.write(buff, round.rollingHash());
        buff.putLong(round.initialClock());
    }
}
