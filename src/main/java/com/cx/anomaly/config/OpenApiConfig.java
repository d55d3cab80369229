package com.cx.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cxAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CX Anomaly Detector API")
                        .version("1.0.0")
                        .description(
                                "Real-time anomaly detection for customer-service interactions.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Submit interactions via `POST /score?model=iforest|lof|both`\n" +
                                "2. Impute, scale and one-hot encode with the fitted feature pipeline\n" +
                                "3. Score with the isolation forest and/or the local outlier factor model\n" +
                                "4. Flag each model's score against its training-percentile threshold\n" +
                                "5. With `both`, fuse normalized scores into an ensemble score; " +
                                "the ensemble flag is the OR of the model flags\n\n" +
                                "**Models:**\n" +
                                "- `iforest`: isolation forest, path-length based\n" +
                                "- `lof`: local outlier factor, k-nearest-neighbor density ratio\n\n" +
                                "`POST /reload` swaps in freshly trained artifacts without interrupting in-flight requests.")
                        .contact(new Contact().name("CX Analytics Team")));
    }
}
