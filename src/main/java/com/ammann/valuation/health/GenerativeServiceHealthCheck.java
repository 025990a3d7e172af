/* (C)2026 */
package com.ammann.valuation.health;

import com.ammann.valuation.client.GenerativeTextClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the generative text service.
 *
 * <p>The service counts as available when credentials are configured and the client's circuit
 * breaker is closed. No request is sent. The service is optional by default: the application
 * stays UP and the pipeline simply records transient failures until it returns.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code valuation.generative.health.required} - report DOWN when unavailable (default: false)</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class GenerativeServiceHealthCheck implements HealthCheck {

    private static final String NAME = "generative-service";

    @Inject GenerativeTextClient client;

    @ConfigProperty(name = "valuation.generative.health.required", defaultValue = "false")
    boolean required;

    @Override
    public HealthCheckResponse call() {
        boolean available = client.isAvailable();

        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(NAME)
                        .withData("available", available)
                        .withData("required", required);

        if (available) {
            return builder.up().build();
        }
        if (required) {
            return builder.down().build();
        }
        builder.withData("status", "UNAVAILABLE");
        builder.withData("message", "Generative service unavailable - pipeline passes will not advance");
        return builder.up().build();
    }
}
