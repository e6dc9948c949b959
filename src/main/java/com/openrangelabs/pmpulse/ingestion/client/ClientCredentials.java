package com.openrangelabs.pmpulse.ingestion.client;

/**
 * Decrypted client credentials, held only for the lifetime of one request
 */
public record ClientCredentials(String clientId, String clientSecret) {

    @Override
    public String toString() {
        return "ClientCredentials{clientId='" + clientId + "', clientSecret='****'}";
    }
}
