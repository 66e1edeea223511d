/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.bulletin;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.salesforce.bulletin.membership.MemberId;
import com.salesforce.bulletin.support.BulletinMetricsImpl;

/**
 * YAML configuration of a public bulletin. Member identities are hex encoded.
 *
 * <pre>
 * owner: 0000...0000
 * timeout: 5
 * quorum: MAJORITY
 * members:
 *   - 0101...0101
 * store:
 *   file: /var/bulletin/bulletin.mv
 * </pre>
 *
 * @author hal.hildebrand
 */
public class BulletinConfiguration {
    public static class StoreConfiguration {
        public int     cacheSize   = -1;
        public boolean compress    = false;
        public String  file;
        public int     keysPerPage = -1;
    }

    public static final String DEFAULT_METRICS_PREFIX = "bulletin";

    public static BulletinConfiguration load(InputStream yaml) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(yaml, BulletinConfiguration.class);
    }

    public static BulletinConfiguration load(URL yaml) throws IOException {
        try (var is = yaml.openStream()) {
            return load(is);
        }
    }

    public boolean            gateConflictReports      = true;
    public List<String>       members                  = new ArrayList<>();
    public String             metricsPrefix            = DEFAULT_METRICS_PREFIX;
    public String             owner                    = MemberId.DEFAULT.toHex();
    public QuorumPolicy       quorum                   = QuorumPolicy.SMALL_COMMITTEE;
    public boolean            reportUnverifiedApproval = false;
    public StoreConfiguration store                    = new StoreConfiguration();
    public long               timeout                  = 0;

    /**
     * Construct the bulletin and register the configured members on behalf of the owner
     */
    public PublicBulletin construct(MetricRegistry registry) {
        var bulletin = new PublicBulletin(toParameters(registry));
        for (var member : members) {
            bulletin.add(bulletin.owner(), MemberId.fromHex(member));
        }
        return bulletin;
    }

    public Parameters toParameters(MetricRegistry registry) {
        var mvBuilder = new Parameters.MvStoreBuilder().setCachSize(store.cacheSize)
                                                       .setCompress(store.compress)
                                                       .setKeysPerPage(store.keysPerPage);
        if (store.file != null) {
            mvBuilder.setFileName(new File(store.file));
        }
        return Parameters.newBuilder()
                         .setOwner(MemberId.fromHex(owner))
                         .setTimeout(timeout)
                         .setQuorum(quorum)
                         .setReportUnverifiedApproval(reportUnverifiedApproval)
                         .setGateConflictReports(gateConflictReports)
                         .setMvBuilder(mvBuilder)
                         .setMetrics(registry == null ? null : new BulletinMetricsImpl(metricsPrefix, registry))
                         .build();
    }
}
