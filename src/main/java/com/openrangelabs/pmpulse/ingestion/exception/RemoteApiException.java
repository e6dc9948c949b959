package com.openrangelabs.pmpulse.ingestion.exception;

/**
 * Exception thrown when a request to the remote property-management API fails.
 *
 * <p>Rate limiting (429) and server errors (5xx) are retryable and handled inside the
 * client. Any other status, or a retryable status that outlived the configured retries,
 * reaches callers as a non-retryable instance and aborts the resource being fetched.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class RemoteApiException extends IngestionException {

    static final int MAX_BODY_LENGTH = 500;

    private final int statusCode;
    private final boolean retryable;
    private final long retryAfterSeconds;

    /**
     * Constructs a non-retryable exception for the given status.
     *
     * @param statusCode HTTP status, or 0 when no response was received
     * @param message the detail message
     */
    public RemoteApiException(int statusCode, String message) {
        this(statusCode, message, false, -1, null);
    }

    /**
     * Constructs an exception with full retry context.
     *
     * @param statusCode HTTP status, or 0 when no response was received
     * @param message the detail message
     * @param retryable whether the client may retry the request
     * @param retryAfterSeconds server-supplied retry hint in seconds, negative when absent
     * @param cause the underlying cause, may be null
     */
    public RemoteApiException(int statusCode, String message, boolean retryable, long retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RemoteApiException rateLimited(long retryAfterSeconds) {
        return new RemoteApiException(429, "Remote API rate limit exceeded", true, retryAfterSeconds, null);
    }

    public static RemoteApiException serverError(int statusCode, String body) {
        return new RemoteApiException(statusCode, "Remote API server error: " + statusCode + " - " + abbreviate(body), true, -1, null);
    }

    public static RemoteApiException clientError(int statusCode, String body) {
        return new RemoteApiException(statusCode, "Remote API error: " + statusCode + " - " + abbreviate(body));
    }

    public static RemoteApiException connectionFailure(Throwable cause) {
        return new RemoteApiException(0, "Remote API connection failed: " + cause.getMessage(), true, -1, cause);
    }

    public static RemoteApiException retriesExhausted(RemoteApiException last, int maxRetries) {
        return new RemoteApiException(last.getStatusCode(),
                "Remote API request failed after " + maxRetries + " retries (last status " + last.getStatusCode() + ")",
                false, -1, last);
    }

    static String abbreviate(String body) {
        if (body == null || body.length() <= MAX_BODY_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_BODY_LENGTH) + "... (" + body.length() + " chars)";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean hasRetryAfter() {
        return retryAfterSeconds >= 0;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
