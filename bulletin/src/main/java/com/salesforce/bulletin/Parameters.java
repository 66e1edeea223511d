/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.File;
import java.util.Objects;

import org.h2.mvstore.MVStore;

import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.support.BulletinMetrics;

/**
 * @author hal.hildebrand
 */
public record Parameters(MemberId owner, long timeout, QuorumPolicy quorum, boolean reportUnverifiedApproval,
                         boolean gateConflictReports, Parameters.MvStoreBuilder mvBuilder, BulletinMetrics metrics) {

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder implements Cloneable {
        private boolean         gateConflictReports      = true;
        private BulletinMetrics metrics;
        private MvStoreBuilder  mvBuilder                = new MvStoreBuilder();
        private MemberId        owner                    = MemberId.DEFAULT;
        private QuorumPolicy    quorum                   = QuorumPolicy.SMALL_COMMITTEE;
        private boolean         reportUnverifiedApproval = false;
        private long            timeout                  = 0;

        public Parameters build() {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(quorum, "quorum");
            checkArgument(timeout >= 0, "timeout must be >= 0: %s", timeout);
            return new Parameters(owner, timeout, quorum, reportUnverifiedApproval, gateConflictReports,
                                  mvBuilder.clone(), metrics);
        }

        @Override
        public Builder clone() {
            try {
                var clone = (Builder) super.clone();
                clone.mvBuilder = mvBuilder.clone();
                return clone;
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException("Clone not supported!", e);
            }
        }

        public BulletinMetrics getMetrics() {
            return metrics;
        }

        public MvStoreBuilder getMvBuilder() {
            return mvBuilder;
        }

        public MemberId getOwner() {
            return owner;
        }

        public QuorumPolicy getQuorum() {
            return quorum;
        }

        public long getTimeout() {
            return timeout;
        }

        public boolean isGateConflictReports() {
            return gateConflictReports;
        }

        public boolean isReportUnverifiedApproval() {
            return reportUnverifiedApproval;
        }

        public Builder setGateConflictReports(boolean gateConflictReports) {
            this.gateConflictReports = gateConflictReports;
            return this;
        }

        public Builder setMetrics(BulletinMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder setMvBuilder(MvStoreBuilder mvBuilder) {
            this.mvBuilder = mvBuilder;
            return this;
        }

        public Builder setOwner(MemberId owner) {
            this.owner = owner;
            return this;
        }

        public Builder setQuorum(QuorumPolicy quorum) {
            this.quorum = quorum;
            return this;
        }

        public Builder setReportUnverifiedApproval(boolean reportUnverifiedApproval) {
            this.reportUnverifiedApproval = reportUnverifiedApproval;
            return this;
        }

        public Builder setTimeout(long timeout) {
            this.timeout = timeout;
            return this;
        }
    }

    /**
     * Builds the MVStore holding the bulletin. The store is in memory unless a file name is set. Auto commit is always
     * disabled; the bulletin commits once per operation.
     */
    public static class MvStoreBuilder implements Cloneable {
        private int     cachSize    = -1;
        private boolean compress    = false;
        private File    fileName    = null;
        private int     keysPerPage = -1;

        public MVStore build() {
            var builder = new MVStore.Builder().autoCommitDisabled();
            if (fileName != null) {
                builder.fileName(fileName.getAbsolutePath());
            }
            if (keysPerPage > 0) {
                builder.keysPerPage(keysPerPage);
            }
            if (cachSize > 0) {
                builder.cacheSize(cachSize);
            }
            if (compress) {
                builder.compress();
            }
            return builder.open();
        }

        @Override
        public MvStoreBuilder clone() {
            Object clone;
            try {
                clone = super.clone();
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException("Clone not supported!", e);
            }
            return (MvStoreBuilder) clone;
        }

        public int getCachSize() {
            return cachSize;
        }

        public File getFileName() {
            return fileName;
        }

        public int getKeysPerPage() {
            return keysPerPage;
        }

        public boolean isCompress() {
            return compress;
        }

        public MvStoreBuilder setCachSize(int cachSize) {
            this.cachSize = cachSize;
            return this;
        }

        public MvStoreBuilder setCompress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public MvStoreBuilder setFileName(File fileName) {
            this.fileName = fileName;
            return this;
        }

        public MvStoreBuilder setKeysPerPage(int keysPerPage) {
            this.keysPerPage = keysPerPage;
            return this;
        }
    }
}
