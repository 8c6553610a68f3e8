package com.aiops.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI logAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Log Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Multi-source log anomaly detection.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit raw log lines via `POST /logs/stream` (formats: `json`, `key_value`, `regex`)\n" +
                                "2. Each line is normalized into a canonical record with numeric features\n" +
                                "3. Threshold rules (default + per-service overrides) are checked first; " +
                                "the first violated rule flags the line\n" +
                                "4. Remaining lines are scored in one batch by the Isolation Forest; a line is anomalous " +
                                "only if it is labelled an outlier **and** its score is below the configured cutoff\n" +
                                "5. Anomalies are stored in a bounded, persisted history\n" +
                                "6. Per-service rate rules turn bursts of anomalies into a single aggregate alert\n\n" +
                                "**Scores:** lower = more anomalous. Rule violations carry a fixed configured score.")
                        .contact(new Contact().name("Observability Team")));
    }
}
