package com.metricwatch.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_HISTORICAL_METRICS = "historical_metrics";
    public static final String SET_ANOMALY_CONFIGS = "anomaly_configs";
    public static final String SET_ANOMALY_RESULTS = "anomaly_results";
    public static final String SET_DETECTION_RUNS = "anomaly_runs";
    public static final String SET_AUTOMATION_JOBS = "automation_jobs";
    public static final String SET_ORGANIZATIONS = "organizations";
    public static final String SET_CONNECTIONS = "db_connections";
    public static final String SET_ANOMALY_EVENTS = "anomaly_events";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:metrics}")
    private String namespace;

    @Value("${aerospike.max-conns-per-node:100}")
    private int maxConnsPerNode;

    @Value("${aerospike.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    // Repositories pass the read and write policies below on every call
    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = maxConnsPerNode;
        clientPolicy.timeout = connectTimeoutMs;
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        return withTimeouts(new WritePolicy());
    }

    @Bean
    public Policy defaultReadPolicy() {
        return withTimeouts(new Policy());
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    private <P extends Policy> P withTimeouts(P policy) {
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }
}
