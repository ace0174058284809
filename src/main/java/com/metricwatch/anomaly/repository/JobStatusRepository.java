package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.AutomationJob;
import com.metricwatch.anomaly.model.JobStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Live status of automation jobs, the source of truth for whether a
 * deduplicated job is still running.
 */
@Repository
public class JobStatusRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public JobStatusRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(AutomationJob job) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_JOBS, job.getJobId());

        client.put(writePolicy, key,
                new Bin("jobId", job.getJobId()),
                new Bin("organizationId", job.getOrganizationId()),
                new Bin("connectionId", job.getConnectionId()),
                new Bin("jobType", job.getJobType()),
                new Bin("trigger", job.getTrigger()),
                new Bin("status", job.getStatus().getCode()),
                new Bin("createdAt", job.getCreatedAt()),
                new Bin("updatedAt", job.getUpdatedAt()));
    }

    /**
     * Current status of a job, empty when the job does not exist.
     */
    public Optional<JobStatus> findStatus(String jobId) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_JOBS, jobId);
        Record record = client.get(readPolicy, key, "status");
        if (record == null || record.getString("status") == null) {
            return Optional.empty();
        }
        return Optional.of(JobStatus.fromCode(record.getString("status")));
    }

    public void updateStatus(String jobId, JobStatus status) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_JOBS, jobId);
        client.put(writePolicy, key,
                new Bin("status", status.getCode()),
                new Bin("updatedAt", System.currentTimeMillis()));
    }
}
