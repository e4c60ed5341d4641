package com.storefront.identitysync.adapters.in.rest;

/**
 * Missing, unknown or under-scoped ingestion API key.
 */
public class ApiKeyRejectedException extends RuntimeException {

    private final int status;

    private ApiKeyRejectedException(String message, int status) {
        super(message);
        this.status = status;
    }

    public static ApiKeyRejectedException missing() {
        return new ApiKeyRejectedException("Missing API key", 401);
    }

    public static ApiKeyRejectedException invalid() {
        return new ApiKeyRejectedException("Invalid API key", 401);
    }

    public static ApiKeyRejectedException missingScope(String scope) {
        return new ApiKeyRejectedException("API key lacks scope: " + scope, 403);
    }

    public int getStatus() {
        return status;
    }
}
