package com.metricwatch.anomaly.controller;

import com.metricwatch.anomaly.model.DetectionConfig;
import com.metricwatch.anomaly.service.DetectionConfigService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/connections/{connectionId}/anomalies/configs")
@Tag(name = "Detection Configs", description = "Manage per-metric anomaly detection configurations")
public class AnomalyConfigController {

    private final DetectionConfigService configService;

    public AnomalyConfigController(DetectionConfigService configService) {
        this.configService = configService;
    }

    @Operation(summary = "List detection configs for a connection",
            description = "Optionally filtered by table and metric name.")
    @GetMapping
    public ResponseEntity<List<DetectionConfig>> listConfigs(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestParam(required = false) String tableName,
            @RequestParam(required = false) String metricName) {
        return ResponseEntity.ok(configService.getConfigs(organizationId, connectionId, tableName, metricName));
    }

    @Operation(summary = "Get a detection config by ID")
    @GetMapping("/{configId}")
    public ResponseEntity<DetectionConfig> getConfig(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @Parameter(description = "Config ID", example = "cfg-1") @PathVariable String configId,
            @RequestHeader("X-Organization-Id") String organizationId) {
        DetectionConfig config = configService.getConfig(organizationId, configId);
        if (config == null) {
            return ResponseEntity.notFound().build();
        }
        if (!connectionId.equals(config.getConnectionId())) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        return ResponseEntity.ok(config);
    }

    @Operation(summary = "Create a detection config",
            description = "Unset fields are defaulted: zscore, sensitivity 1.0, 7 minimum points, 14 baseline days.")
    @PostMapping
    public ResponseEntity<DetectionConfig> createConfig(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestBody DetectionConfig config) {
        config.setConnectionId(connectionId);
        try {
            return ResponseEntity.ok(configService.createConfig(organizationId, userId, config));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Update a detection config",
            description = "Only the fields present in the body are changed.")
    @PutMapping("/{configId}")
    public ResponseEntity<DetectionConfig> updateConfig(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @Parameter(description = "Config ID", example = "cfg-1") @PathVariable String configId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestHeader(value = "X-User-Id", required = false) String userId,
            @RequestBody DetectionConfig patch) {
        ResponseEntity<DetectionConfig> check = getConfig(connectionId, configId, organizationId);
        if (!check.getStatusCode().is2xxSuccessful()) {
            return check;
        }
        try {
            DetectionConfig updated = configService.updateConfig(organizationId, userId, configId, patch);
            if (updated == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(updated);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Delete a detection config")
    @DeleteMapping("/{configId}")
    public ResponseEntity<Void> deleteConfig(
            @Parameter(description = "Connection ID", example = "conn-1") @PathVariable String connectionId,
            @Parameter(description = "Config ID", example = "cfg-1") @PathVariable String configId,
            @RequestHeader("X-Organization-Id") String organizationId,
            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        DetectionConfig config = configService.getConfig(organizationId, configId);
        if (config == null) {
            return ResponseEntity.notFound().build();
        }
        if (!connectionId.equals(config.getConnectionId())) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        if (!configService.deleteConfig(organizationId, userId, configId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
