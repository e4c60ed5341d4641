package com.storefront.identitysync.application.port.out;

/**
 * Failure of a destination API call.
 * <p>
 * {@code transientFailure} is true for timeouts, connection errors, 429 and
 * 5xx responses; credential rejections (401/403) are not transient.
 * </p>
 */
public class DestinationException extends RuntimeException {

    private final int statusCode;
    private final boolean transientFailure;

    public DestinationException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public static DestinationException timeout(String operation, Throwable cause) {
        return new DestinationException(operation + " timed out", 0, true, cause);
    }

    public static DestinationException forStatus(String operation, int statusCode, String body) {
        boolean transientStatus = statusCode == 429 || statusCode >= 500;
        return new DestinationException(
                operation + " failed with HTTP " + statusCode + ": " + truncate(body),
                statusCode, transientStatus, null);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    /** @return true if the destination rejected the credentials */
    public boolean isCredentialRejection() {
        return statusCode == 401 || statusCode == 403;
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) : body;
    }
}
