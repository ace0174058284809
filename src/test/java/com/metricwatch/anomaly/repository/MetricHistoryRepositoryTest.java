package com.metricwatch.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.metricwatch.anomaly.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricHistoryRepositoryTest {

    @Mock private AerospikeClient client;

    private MetricHistoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new MetricHistoryRepository(client, "test", new WritePolicy());
    }

    private void stubScan(Record... records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record record : records) {
                callback.scanCallback(new Key("test", "historical_metrics", "k"), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("historical_metrics"), any(ScanCallback.class));
    }

    private static Record record(String org, String conn, String metric, String timestamp, Object value) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", metric + "-" + timestamp);
        bins.put("organizationId", org);
        bins.put("connectionId", conn);
        bins.put("metricName", metric);
        bins.put("tableName", "orders");
        bins.put("timestamp", timestamp);
        bins.put("metricValue", value);
        return new Record(bins, 1, 0);
    }

    private static Object binValue(Bin[] bins, String name) {
        return Arrays.stream(bins)
                .filter(b -> b.name.equals(name))
                .findFirst()
                .map(b -> b.value.getObject())
                .orElse(null);
    }

    @Test
    void trackMetricsBatch_writesEveryPointAndCoercesNumericText() {
        List<MetricPoint> metrics = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            metrics.add(MetricPoint.builder().metricName("row_count").metricValue((double) i).build());
        }
        metrics.set(0, MetricPoint.builder().metricName("row_count").metricText(" 42 ").build());

        boolean ok = repository.trackMetricsBatch("org-1", "conn-1", metrics);

        assertThat(ok).isTrue();
        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client, times(120)).put(any(WritePolicy.class), any(Key.class), bins.capture());
        Bin[] first = bins.getAllValues().get(0);
        assertThat(binValue(first, "metricValue")).isEqualTo(42.0);
        assertThat(binValue(first, "metricText")).isNull();
        assertThat(binValue(first, "organizationId")).isEqualTo("org-1");
        assertThat(binValue(first, "connectionId")).isEqualTo("conn-1");
    }

    @Test
    void trackMetricsBatch_keepsNonNumericTextAsText() {
        repository.trackMetricsBatch("org-1", "conn-1",
                List.of(MetricPoint.builder().metricName("status").metricText("healthy").build()));

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(any(WritePolicy.class), any(Key.class), bins.capture());
        assertThat(binValue(bins.getValue(), "metricText")).isEqualTo("healthy");
        assertThat(binValue(bins.getValue(), "metricValue")).isNull();
    }

    @Test
    void trackMetricsBatch_storeFailure_returnsFalse() {
        doThrow(new AerospikeException("cluster down"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        boolean ok = repository.trackMetricsBatch("org-1", "conn-1",
                List.of(MetricPoint.builder().metricName("row_count").metricValue(1.0).build()));

        assertThat(ok).isFalse();
    }

    @Test
    void trackMetricsBatch_emptyInput_isNoop() {
        assertThat(repository.trackMetricsBatch("org-1", "conn-1", List.of())).isTrue();
        verifyNoInteractions(client);
    }

    @Test
    void trackMetric_defaultsTypeAndSource() {
        MetricPoint point = repository.trackMetric("org-1", "conn-1", "row_count", 12.0, null,
                "orders", null, null, null);

        assertThat(point).isNotNull();
        assertThat(point.getMetricType()).isEqualTo("system");
        assertThat(point.getSource()).isEqualTo("system");
        assertThat(point.getTimestamp()).isNotBlank();
    }

    @Test
    void trackMetric_storeFailure_returnsNull() {
        doThrow(new AerospikeException("cluster down"))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThat(repository.trackMetric("org-1", "conn-1", "row_count", 12.0, null,
                null, null, null, null)).isNull();
    }

    @Test
    void getMetricHistory_filtersByScopeAndWindowOldestFirst() {
        String recent = Instant.now().minus(2, ChronoUnit.DAYS).toString();
        String older = Instant.now().minus(5, ChronoUnit.DAYS).toString();
        String expired = Instant.now().minus(40, ChronoUnit.DAYS).toString();
        stubScan(
                record("org-1", "conn-1", "row_count", recent, 2.0),
                record("org-1", "conn-1", "row_count", older, 1L),
                record("org-1", "conn-1", "row_count", expired, 9.0),
                record("org-1", "conn-1", "null_rate", recent, 0.5),
                record("org-2", "conn-1", "row_count", recent, 7.0));

        List<MetricPoint> history = repository.getMetricHistory("org-1", "conn-1", "row_count",
                "orders", null, 30, 1000);

        assertThat(history).extracting(MetricPoint::getTimestamp).containsExactly(older, recent);
        assertThat(history).extracting(MetricPoint::getMetricValue).containsExactly(1.0, 2.0);
    }

    @Test
    void getRecentMetrics_newestFirstWithLimit() {
        stubScan(
                record("org-1", "conn-1", "row_count", "2024-05-01T00:00:00Z", 1.0),
                record("org-1", "conn-2", "row_count", "2024-05-03T00:00:00Z", 3.0),
                record("org-1", "conn-1", "row_count", "2024-05-02T00:00:00Z", 2.0),
                record("org-2", "conn-1", "row_count", "2024-05-04T00:00:00Z", 4.0));

        List<MetricPoint> recent = repository.getRecentMetrics("org-1", null, 2);

        assertThat(recent).extracting(MetricPoint::getMetricValue).containsExactly(3.0, 2.0);
    }
}
