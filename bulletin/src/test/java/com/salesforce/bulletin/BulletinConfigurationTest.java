/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.salesforce.bulletin.membership.MemberId;

/**
 * @author hal.hildebrand
 */
public class BulletinConfigurationTest {

    @Test
    public void defaults() throws Exception {
        var config = BulletinConfiguration.load(new ByteArrayInputStream("timeout: 1\n".getBytes(StandardCharsets.UTF_8)));
        var params = config.toParameters(null);
        assertEquals(MemberId.DEFAULT, params.owner());
        assertEquals(1, params.timeout());
        assertEquals(QuorumPolicy.SMALL_COMMITTEE, params.quorum());
        assertFalse(params.reportUnverifiedApproval());
        assertNull(params.metrics());
        assertNull(params.mvBuilder().getFileName());
    }

    @Test
    public void loadAndConstruct() throws Exception {
        var config = BulletinConfiguration.load(getClass().getResource("/bulletin.yml"));
        assertEquals(QuorumPolicy.MAJORITY, config.quorum);
        assertEquals("test", config.metricsPrefix);

        var registry = new MetricRegistry();
        try (var bulletin = config.construct(registry)) {
            assertEquals(MemberId.filled((byte) 0x7), bulletin.owner());
            assertEquals(List.of(MemberId.filled((byte) 0x1), MemberId.filled((byte) 0x2)), bulletin.whitelist());
            assertEquals(2, bulletin.quorum());
            assertEquals(3, bulletin.timeout());
            assertEquals(Outcome.PENDING, bulletin.publish(MemberId.filled((byte) 0x1), 1, "View", RollingHash.NONE));
            assertNotNull(registry.getMeters().get("test.approval.requested"));
            assertEquals(1, registry.meter("test.approval.requested").getCount());
        }
    }

    @Test
    public void unknownProperty() {
        assertThrows(UnrecognizedPropertyException.class,
                     () -> BulletinConfiguration.load(new ByteArrayInputStream("quorums: MAJORITY\n".getBytes(StandardCharsets.UTF_8))));
    }
}
