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

import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.membership.MemberIdType;

/**
 * @author hal.hildebrand
 */
public class CoordinateType extends BasicDataType<Coordinate> {
    public static final CoordinateType INSTANCE = new CoordinateType();

    @Override
    public int compare(Coordinate a, Coordinate b) {
        return a.compareTo(b);
    }

    @Override
    public Coordinate[] createStorage(int size) {
        return new Coordinate[size];
    }

    @Override
    public int getMemory(Coordinate obj) {
        return MemberId.BYTES + Integer.BYTES;
    }

    @Override
    public Coordinate read(ByteBuffer buff) {
        var member = MemberIdType.INSTANCE.read(buff);
        return new Coordinate(member, buff.getInt());
    }

    @Override
    public void write(WriteBuffer buff, Coordinate coordinate) {
        MemberIdType.INSTANCE.write(buff, coordinate.member());
        buff.putInt(coordinate.height());
    }
}
