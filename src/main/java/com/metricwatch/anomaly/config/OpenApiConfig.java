package com.metricwatch.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metric Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Statistical anomaly detection over time-ordered data quality metrics.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Load active detection configurations for an organization/connection\n" +
                                "2. Fetch each metric's history (at least 30 days) and sort it chronologically\n" +
                                "3. Score every point with the configured method\n" +
                                "4. Persist anomalous points and publish one `anomaly_detected` event per configuration\n\n" +
                                "**Detection Methods:**\n" +
                                "- `zscore`: distance from the mean in standard deviations (threshold 3.0 / sensitivity)\n" +
                                "- `iqr`: distance outside the interquartile fences (1.5 / sensitivity)\n" +
                                "- `moving_average`: deviation from a trailing moving average (2.0 / sensitivity)\n\n" +
                                "Runs are started daily, hourly for recently changed configurations, or manually.")
                        .contact(new Contact().name("Data Quality Team")));
    }
}
