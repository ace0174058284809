package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.config.AerospikeConfig;
import com.metricwatch.anomaly.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Time-series store of collected metric observations.
 * Timestamps are ISO-8601 UTC strings, so lexical order is chronological order.
 */
@Repository
public class MetricHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(MetricHistoryRepository.class);

    static final int WRITE_BATCH_SIZE = 50;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public MetricHistoryRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Record one metric observation stamped with the current time.
     *
     * @return the stored point, or null if the write failed
     */
    public MetricPoint trackMetric(String organizationId, String connectionId, String metricName,
                                   Double metricValue, String metricText,
                                   String tableName, String columnName,
                                   String metricType, String source) {
        MetricPoint point = MetricPoint.builder()
                .id(UUID.randomUUID().toString())
                .organizationId(organizationId)
                .connectionId(connectionId)
                .metricName(metricName)
                .tableName(tableName)
                .columnName(columnName)
                .metricType(metricType != null ? metricType : "system")
                .source(source != null ? source : "system")
                .timestamp(Instant.now().toString())
                .metricValue(metricValue)
                .metricText(metricValue == null ? metricText : null)
                .build();
        try {
            save(point);
            return point;
        } catch (AerospikeException e) {
            log.error("Error tracking metric {} for connection {}: {}", metricName, connectionId, e.getMessage(), e);
            return null;
        }
    }

    /**
     * Record several observations for one connection, writing in chunks of 50.
     * Values that do not parse as numbers are kept as text.
     */
    public boolean trackMetricsBatch(String organizationId, String connectionId, List<MetricPoint> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return true;
        }

        String now = Instant.now().toString();
        List<MetricPoint> records = new ArrayList<>(metrics.size());
        for (MetricPoint metric : metrics) {
            Double numeric = metric.getMetricValue();
            String text = metric.getMetricText();
            if (numeric == null && text != null) {
                numeric = parseNumber(text);
                if (numeric != null) {
                    text = null;
                }
            }
            records.add(metric.toBuilder()
                    .id(UUID.randomUUID().toString())
                    .organizationId(organizationId)
                    .connectionId(connectionId)
                    .timestamp(metric.getTimestamp() != null ? metric.getTimestamp() : now)
                    .metricValue(numeric)
                    .metricText(text)
                    .build());
        }

        try {
            for (int i = 0; i < records.size(); i += WRITE_BATCH_SIZE) {
                for (MetricPoint point : records.subList(i, Math.min(i + WRITE_BATCH_SIZE, records.size()))) {
                    save(point);
                }
            }
            return true;
        } catch (AerospikeException e) {
            log.error("Error tracking metrics batch for connection {}: {}", connectionId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * History of one metric over the last {@code days} days, oldest first.
     * Table and column filters apply only when given.
     */
    public List<MetricPoint> getMetricHistory(String organizationId, String connectionId, String metricName,
                                              String tableName, String columnName, int days, int limit) {
        String startDate = Instant.now().minus(days, ChronoUnit.DAYS).toString();
        List<MetricPoint> results = new ArrayList<>();

        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_HISTORICAL_METRICS,
                (key, record) -> {
                    if (!organizationId.equals(record.getString("organizationId"))) return;
                    if (!connectionId.equals(record.getString("connectionId"))) return;
                    if (!metricName.equals(record.getString("metricName"))) return;
                    if (tableName != null && !tableName.equals(record.getString("tableName"))) return;
                    if (columnName != null && !columnName.equals(record.getString("columnName"))) return;
                    String ts = record.getString("timestamp");
                    if (ts == null || ts.compareTo(startDate) < 0) return;

                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });

        results.sort(Comparator.comparing(MetricPoint::getTimestamp));
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Most recent observations for an organization, newest first.
     */
    public List<MetricPoint> getRecentMetrics(String organizationId, String connectionId, int limit) {
        List<MetricPoint> results = new ArrayList<>();

        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_HISTORICAL_METRICS,
                (key, record) -> {
                    if (!organizationId.equals(record.getString("organizationId"))) return;
                    if (connectionId != null && !connectionId.equals(record.getString("connectionId"))) return;
                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });

        results.sort(Comparator.comparing((MetricPoint m) -> m.getTimestamp() == null ? "" : m.getTimestamp())
                .reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private void save(MetricPoint point) {
        Key key = new Key(namespace, AerospikeConfig.SET_HISTORICAL_METRICS, point.getId());

        client.put(writePolicy, key,
                new Bin("id", point.getId()),
                new Bin("organizationId", point.getOrganizationId()),
                new Bin("connectionId", point.getConnectionId()),
                new Bin("tableName", point.getTableName()),
                new Bin("columnName", point.getColumnName()),
                new Bin("metricName", point.getMetricName()),
                new Bin("metricType", point.getMetricType()),
                new Bin("source", point.getSource()),
                new Bin("timestamp", point.getTimestamp()),
                new Bin("metricValue", Value.get(point.getMetricValue())),
                new Bin("metricText", point.getMetricText()));
    }

    private MetricPoint mapRecord(Record record) {
        Object value = record.getValue("metricValue");
        return MetricPoint.builder()
                .id(record.getString("id"))
                .organizationId(record.getString("organizationId"))
                .connectionId(record.getString("connectionId"))
                .tableName(record.getString("tableName"))
                .columnName(record.getString("columnName"))
                .metricName(record.getString("metricName"))
                .metricType(record.getString("metricType"))
                .source(record.getString("source"))
                .timestamp(record.getString("timestamp"))
                .metricValue(value instanceof Number number ? number.doubleValue() : null)
                .metricText(record.getString("metricText"))
                .build();
    }

    private static Double parseNumber(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;
        return scanPolicy;
    }
}
