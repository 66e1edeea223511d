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
public class CommitmentType extends BasicDataType<Commitment> {
    public static final CommitmentType INSTANCE = new CommitmentType();

    @Override
    public Commitment[] createStorage(int size) {
        return new Commitment[size];
    }

    @Override
    public int getMemory(Commitment obj) {
        return 24 + 2 * (obj.view().length() + obj.rollingHash().length());
    }

    @Override
    public Commitment read(ByteBuffer buff) {
        var view = StringDataType.INSTANCE.read(buff);
        return new Commitment(view, StringDataType.INSTANCE.read(buff));
    }

    @Override
    public void write(WriteBuffer buff, Commitment commitment) {
        StringDataType.INSTANCE.write(buff, commitment.view());
        StringDataType.INSTANCE.write(buff, commitment.rollingHash());
    }
}
