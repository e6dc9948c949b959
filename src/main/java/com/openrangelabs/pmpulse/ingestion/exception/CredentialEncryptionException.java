package com.openrangelabs.pmpulse.ingestion.exception;

/**
 * Exception thrown when a connection secret cannot be encrypted or decrypted.
 *
 * <p>Usually means the configured encryption password or salt changed after the
 * secret was stored.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class CredentialEncryptionException extends IngestionException {

    private final String operation;

    /**
     * Constructs a new credential encryption exception with operation context and cause.
     *
     * @param operation the operation that failed ("encryption" or "decryption")
     * @param message the detail message
     * @param cause the underlying cause
     */
    public CredentialEncryptionException(String operation, String message, Throwable cause) {
        super(String.format("Credential %s failed: %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
