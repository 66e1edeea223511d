/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.Test;

import com.salesforce.bulletin.events.BulletinEvent.ViewApprovalRequest;
import com.salesforce.bulletin.events.BulletinEvent.ViewConflict;
import com.salesforce.bulletin.events.BulletinEvent.ViewPublished;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.support.BulletinMetrics;

/**
 * @author hal.hildebrand
 */
public class EventNotifierTest {
    private static final MemberId BOB = MemberId.filled((byte) 0x1);

    @Test
    public void bufferedUntilDelivered() {
        var metrics = mock(BulletinMetrics.class);
        var notifier = new EventNotifier(metrics);
        var received = new ArrayList<BulletinEvent>();
        notifier.register(received::add);

        notifier.approvalRequested(1, BOB, "View", "None");
        notifier.conflict(1, BOB, "View", "None");
        notifier.published(2, BOB, "Next");
        assertTrue(received.isEmpty());
        verifyNoInteractions(metrics);

        var events = notifier.drain();
        assertTrue(notifier.drain().isEmpty());
        notifier.deliver(events);

        assertEquals(List.of(new ViewApprovalRequest(1, BOB, "View", "None"), new ViewConflict(1, BOB, "View", "None"),
                             new ViewPublished(2, BOB, "Next")),
                     received);
        verify(metrics).approvalRequested();
        verify(metrics).conflict();
        verify(metrics).published();
        assertEquals("Next", received.get(2).view());
        assertEquals(2, received.get(2).height());
    }

    @Test
    public void listenerFailureIsolated() {
        var notifier = new EventNotifier(null);
        @SuppressWarnings("unchecked")
        Consumer<BulletinEvent> failing = mock(Consumer.class);
        doThrow(new IllegalArgumentException("boom")).when(failing).accept(any());
        var received = new ArrayList<BulletinEvent>();
        notifier.register(failing);
        notifier.register(received::add);

        notifier.published(1, BOB, "View");
        notifier.published(2, BOB, "Next");
        notifier.deliver(notifier.drain());

        verify(failing, times(2)).accept(any());
        assertEquals(2, received.size());
    }
}
