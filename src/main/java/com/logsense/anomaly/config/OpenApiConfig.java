package com.logsense.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI logSenseOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LogSense API")
                        .version("0.1.0")
                        .description(
                                "Batch anomaly detection for host metrics.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive a batch via `POST /detect` (JSON) or `POST /detect/csv` (upload)\n" +
                                "2. Build the feature matrix: `cpu`, `ram`, `disk`, `latency_ms`\n" +
                                "3. Train an Isolation Forest on the batch itself (no model is kept between calls)\n" +
                                "4. Flag the `round(n * contamination)` highest scoring points\n" +
                                "5. Name the two fields that deviate most from the batch for each flagged point\n" +
                                "6. Record the run and its anomalies, browse them via `GET /runs`\n\n" +
                                "`contamination` must lie in [0.01, 0.30] and defaults to 0.05. " +
                                "Field explanations are a z-score heuristic, not a causal attribution.")
                        .contact(new Contact().name("LogSense Team")));
    }
}
