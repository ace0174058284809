package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.AnomalyEvent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Append-only log of published anomaly events, read by downstream notifiers.
 */
@Repository
public class AnomalyEventRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AnomalyEventRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void append(AnomalyEvent event) throws JsonProcessingException {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_EVENTS, event.getEventId());

        client.put(writePolicy, key,
                new Bin("eventId", event.getEventId()),
                new Bin("type", event.getType().getCode()),
                new Bin("organizationId", event.getOrganizationId()),
                new Bin("userId", event.getUserId()),
                new Bin("timestamp", event.getTimestamp()),
                new Bin("data", objectMapper.writeValueAsString(event.getData())));
    }
}
