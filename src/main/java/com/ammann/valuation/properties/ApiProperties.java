/* (C)2026 */
package com.ammann.valuation.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Report lifecycle endpoints, relative to {@link #BASE}
     */
    public static final class Reports {
        private Reports() {}

        public static final String BASE = "/reports";
        public static final String BY_ID = "/{id}";
        public static final String ADVANCE = BY_ID + "/advance";
        public static final String STATUS = BY_ID + "/status";
        public static final String CANCEL = BY_ID + "/cancel";
        public static final String REGENERATE = BY_ID + "/regenerate";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
