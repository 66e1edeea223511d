/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.events;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.bulletin.events.BulletinEvent.ViewApprovalRequest;
import com.salesforce.bulletin.events.BulletinEvent.ViewConflict;
import com.salesforce.bulletin.events.BulletinEvent.ViewPublished;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.support.BulletinMetrics;

/**
 * Collects the events raised while an operation executes. The owner of the operation {@link #drain() drains} them
 * once its changes are committed and {@link #deliver(List) delivers} them to the registered listeners; the events of
 * a rolled back operation are drained and dropped.
 *
 * @author hal.hildebrand
 */
public class EventNotifier {
    private static final Logger log = LoggerFactory.getLogger(EventNotifier.class);

    private final Map<UUID, Consumer<BulletinEvent>> listeners = new ConcurrentHashMap<>();
    private final BulletinMetrics                    metrics;
    private final List<BulletinEvent>                pending   = new ArrayList<>();

    public EventNotifier(BulletinMetrics metrics) {
        this.metrics = metrics;
    }

    public void approvalRequested(int height, MemberId member, String view, String rollingHash) {
        log.trace("Approval requested height: {} member: {} view: {}", height, member, view);
        pending.add(new ViewApprovalRequest(height, member, view, rollingHash));
    }

    public void conflict(int height, MemberId member, String view, String rollingHash) {
        log.debug("View conflict height: {} member: {} view: {} rolling hash: {}", height, member, view, rollingHash);
        pending.add(new ViewConflict(height, member, view, rollingHash));
    }

    public void deliver(List<BulletinEvent> events) {
        for (var event : events) {
            if (metrics != null) {
                if (event instanceof ViewPublished) {
                    metrics.published();
                } else if (event instanceof ViewConflict) {
                    metrics.conflict();
                } else if (event instanceof ViewApprovalRequest) {
                    metrics.approvalRequested();
                }
            }
            listeners.values().forEach(listener -> {
                try {
                    listener.accept(event);
                } catch (Throwable e) {
                    log.warn("Error in bulletin listener delivering: {}", event, e);
                }
            });
        }
    }

    public void deregister(UUID registration) {
        listeners.remove(registration);
    }

    public List<BulletinEvent> drain() {
        var drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    public void published(int height, MemberId member, String view) {
        log.trace("Published height: {} member: {} view: {}", height, member, view);
        pending.add(new ViewPublished(height, member, view));
    }

    public UUID register(Consumer<BulletinEvent> listener) {
        UUID reg = UUID.randomUUID();
        listeners.put(reg, listener);
        return reg;
    }
}
