package com.flagship.settlement_engine.observability;

import java.util.UUID;

/**
 * Request headers and MDC keys shared by the filter, the controllers and
 * the services that enrich log lines.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Acting identity, set by the authenticating edge. */
    public static final String CALLER_HEADER = "X-Caller-Address";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_MDC_KEY = "caller";
    public static final String FINGERPRINT_MDC_KEY = "fingerprint";
    public static final String LISTING_ID_MDC_KEY = "listingId";

    private CorrelationContext() {
    }

    /**
     * Short form for readability in logs.
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
