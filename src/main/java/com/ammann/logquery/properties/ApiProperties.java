/* (C)2026 */
package com.ammann.logquery.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path and header constants.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Response header telling the caller whether the body was compressed. */
    public static final String COMPRESSION_HEADER = "X-Compression-Applied";

    /** Forwarded client address header set by reverse proxies. */
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    /**
     * Log query endpoints
     */
    public static final class Query {
        private Query() {}

        public static final String BASE = "/query";
        public static final String FACETED = "/faceted";
        public static final String FACETED_PATH = BASE + FACETED;
    }
}
