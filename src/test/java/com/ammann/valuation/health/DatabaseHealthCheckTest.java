/* (C)2026 */
package com.ammann.valuation.health;

import static org.assertj.core.api.Assertions.assertThat;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatabaseHealthCheck")
class DatabaseHealthCheckTest {

    @Test
    @DisplayName("should report DOWN when the datastore cannot be queried")
    void downWithoutDatastore() {
        HealthCheckResponse response = new DatabaseHealthCheck().call();

        assertThat(response.getName()).isEqualTo("database-health");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get()).containsEntry("database-accessible", false);
    }
}
