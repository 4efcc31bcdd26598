package com.ironcage.gateway.vault;

import reactor.core.publisher.Mono;

/**
 * Holds encrypted provider credentials and decrypts them by provider id.
 */
public interface CredentialVault {

    /**
     * @return the decrypted credential, empty when no credential is registered for the provider,
     *         or an error of type {@link com.ironcage.gateway.exception.VaultUnavailableException}
     *         when the vault cannot decrypt it
     */
    Mono<ProviderCredential> credentialFor(String providerId);

    /**
     * Registers (or replaces) the encrypted credential for a provider.
     */
    void register(String providerId, EncryptedSecret secret);
}
