package com.flagship.fund_ledger.config;

/**
 * Request headers shared by the REST controllers.
 */
public final class ApiHeaders {

    /** Verified owner id, set by the identity gateway in front of the service. */
    public static final String OWNER_ID = "X-Owner-Id";

    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ApiHeaders() {
    }
}
