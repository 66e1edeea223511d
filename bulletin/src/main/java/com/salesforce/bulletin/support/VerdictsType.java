/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import java.nio.ByteBuffer;
import java.util.List;

import org.h2.mvstore.DataUtils;
import org.h2.mvstore.WriteBuffer;
import org.h2.mvstore.type.BasicDataType;
import org.h2.mvstore.type.StringDataType;

import com.google.common.collect.ImmutableList;

/**
 * Serializes the ordered verdicts of a reply collection
 *
 * @author hal.hildebrand
 */
public class VerdictsType extends BasicDataType<List<String>> {
    public static final VerdictsType INSTANCE = new VerdictsType();

    @SuppressWarnings("unchecked")
    @Override
    public List<String>[] createStorage(int size) {
        return new List[size];
    }

    @Override
    public int getMemory(List<String> obj) {
        return 24 + obj.stream().mapToInt(s -> 24 + 2 * s.length()).sum();
    }

    @Override
    public List<String> read(ByteBuffer buff) {
        int count = DataUtils.readVarInt(buff);
        var builder = ImmutableList.<String>builderWithExpectedSize(count);
        for (int i = 0; i < count; i++) {
            builder.add(StringDataType.INSTANCE.read(buff));
        }
        return builder.build();
    }

    @Override
    public void write(WriteBuffer buff, List<String> verdicts) {
        buff.putVarInt(verdicts.size());
        for (var verdict : verdicts) {
            StringDataType.INSTANCE.write(buff, verdict);
        }
    }
}
