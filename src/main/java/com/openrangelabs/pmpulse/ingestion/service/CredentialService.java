package com.openrangelabs.pmpulse.ingestion.service;

import com.openrangelabs.pmpulse.ingestion.client.ClientCredentials;
import com.openrangelabs.pmpulse.ingestion.client.CredentialProvider;
import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import com.openrangelabs.pmpulse.ingestion.entity.ApiConnection;
import com.openrangelabs.pmpulse.ingestion.exception.ConnectionNotConfiguredException;
import com.openrangelabs.pmpulse.ingestion.exception.CredentialEncryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Encrypts connection secrets at rest and decrypts them per request
 */
@Service
public class CredentialService implements CredentialProvider {

    private static final Logger logger = LoggerFactory.getLogger(CredentialService.class);

    private final TextEncryptor encryptor;

    @Autowired
    public CredentialService(IngestionProperties properties) {
        this(Encryptors.delux(properties.encryption().password(), properties.encryption().salt()));
    }

    CredentialService(TextEncryptor encryptor) {
        this.encryptor = encryptor;
    }

    /**
     * Encrypt a plain-text secret for storage
     */
    public String encryptSecret(String plainText) {
        try {
            return encryptor.encrypt(plainText);
        } catch (RuntimeException e) {
            throw new CredentialEncryptionException("encryption", e.getMessage(), e);
        }
    }

    /**
     * Decrypt a stored secret
     */
    public String decryptSecret(String encrypted) {
        try {
            return encryptor.decrypt(encrypted);
        } catch (RuntimeException e) {
            throw new CredentialEncryptionException("decryption", e.getMessage(), e);
        }
    }

    @Override
    public Mono<ClientCredentials> resolve(ApiConnection connection) {
        return Mono.fromCallable(() -> {
                    if (!connection.isConfigured()) {
                        throw new ConnectionNotConfiguredException(connection.getId());
                    }
                    return new ClientCredentials(connection.getClientId(),
                            decryptSecret(connection.getClientSecretEncrypted()));
                })
                .doOnError(error -> logger.error("Failed to resolve credentials for connection {}: {}",
                        connection.getId(), error.getMessage()));
    }
}
