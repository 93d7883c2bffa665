package com.fincore.foresight.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for FORESIGHT service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI foresightOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FORESIGHT Metric Analytics API")
                        .description("""
                                FORESIGHT is the metric analytics engine of the FinCore platform.
                                
                                ## Features
                                
                                - **Forecasting**: Per-series recursive multi-step prediction with confidence bands
                                - **Anomaly Detection**: Per-series outlier scoring with severity levels
                                - **Health Scoring**: Aggregate system health from recent raw observations
                                - **Capacity Planning**: Compound-growth projection of resource needs
                                
                                ## Lifecycle
                                
                                Metrics are ingested into a bounded store. Models are trained in the
                                background on demand; forecast and anomaly requests are served from the
                                trained models only.
                                """)
                        .version("0.1.0")
                        .contact(new Contact()
                                .name("FinCore Platform Team"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://foresight-service:8090")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Metrics")
                                .description("Metric ingestion"),
                        new Tag()
                                .name("Models")
                                .description("Model training and status"),
                        new Tag()
                                .name("Predictions")
                                .description("Forecasting and anomaly detection"),
                        new Tag()
                                .name("Insights")
                                .description("Health, capacity and summary insights")
                ));
    }
}
