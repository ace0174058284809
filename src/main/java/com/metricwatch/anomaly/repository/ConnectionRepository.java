package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ScanPolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of organizations and their database connections, maintained
 * by the account management side of the platform.
 */
@Repository
public class ConnectionRepository {

    private final AerospikeClient client;
    private final String namespace;

    public ConnectionRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    public List<String> findOrganizationIds() {
        List<String> ids = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ORGANIZATIONS,
                (key, record) -> {
                    String id = record.getString("id");
                    if (id != null) {
                        synchronized (ids) {
                            ids.add(id);
                        }
                    }
                }, "id");
        return ids;
    }

    public List<String> findConnectionIds(String organizationId) {
        List<String> ids = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_CONNECTIONS,
                (key, record) -> {
                    if (!organizationId.equals(record.getString("organizationId"))) return;
                    String id = record.getString("id");
                    if (id != null) {
                        synchronized (ids) {
                            ids.add(id);
                        }
                    }
                }, "id", "organizationId");
        return ids;
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }
}
