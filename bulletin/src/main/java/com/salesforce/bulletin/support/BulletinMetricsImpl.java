/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.support;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

/**
 * @author hal.hildebrand
 */
public class BulletinMetricsImpl implements BulletinMetrics {

    private final Meter approvalRejected;
    private final Meter approvalRequested;
    private final Meter approvalTimeout;
    private final Meter approvalUnverified;
    private final Meter repliesReceived;
    private final Meter unauthorizedCalls;
    private final Meter viewsConflicted;
    private final Meter viewsPublished;

    public BulletinMetricsImpl(String prefix, MetricRegistry registry) {
        viewsPublished = registry.meter(name(prefix, "views.published"));
        viewsConflicted = registry.meter(name(prefix, "views.conflict"));
        approvalRequested = registry.meter(name(prefix, "approval.requested"));
        approvalRejected = registry.meter(name(prefix, "approval.rejected"));
        approvalTimeout = registry.meter(name(prefix, "approval.timeout"));
        approvalUnverified = registry.meter(name(prefix, "approval.unverified"));
        unauthorizedCalls = registry.meter(name(prefix, "calls.unauthorized"));
        repliesReceived = registry.meter(name(prefix, "replies.received"));
    }

    @Override
    public void approvalRequested() {
        approvalRequested.mark();
    }

    @Override
    public void conflict() {
        viewsConflicted.mark();
    }

    @Override
    public void published() {
        viewsPublished.mark();
    }

    @Override
    public void rejected() {
        approvalRejected.mark();
    }

    @Override
    public void replyReceived() {
        repliesReceived.mark();
    }

    @Override
    public void timedOut() {
        approvalTimeout.mark();
    }

    @Override
    public void unauthorized() {
        unauthorizedCalls.mark();
    }

    @Override
    public void unverified() {
        approvalUnverified.mark();
    }
}
