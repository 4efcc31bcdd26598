package com.ironcage.gateway.security;

import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.exception.GatewayException;
import com.ironcage.gateway.exception.NoProviderBindingException;
import com.ironcage.gateway.exception.VaultUnavailableException;
import com.ironcage.gateway.vault.CredentialVault;
import com.ironcage.gateway.vault.ProviderCredential;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Exchanges a validated agent identity for the credential of one provider.
 *
 * The credential goes straight to the outbound call. It is never logged, never part
 * of a response and never stored outside the vault.
 */
@Slf4j
public class TokenTranslator {

    private final AgentDirectory directory;
    private final CredentialVault vault;

    public TokenTranslator(AgentDirectory directory, CredentialVault vault) {
        this.directory = directory;
        this.vault = vault;
    }

    public Mono<ProviderCredential> translate(AgentIdentity identity, String providerId) {
        return translate(identity.agentId(), providerId);
    }

    public Mono<ProviderCredential> translate(String agentId, String providerId) {
        return directory.findAgent(agentId)
                .switchIfEmpty(Mono.error(new NoProviderBindingException("Unknown agent " + agentId)))
                .flatMap(agent -> {
                    if (!agent.isBoundTo(providerId)) {
                        log.warn("Agent {} has no binding to provider {}", agentId, providerId);
                        return Mono.error(new NoProviderBindingException(
                                "Agent " + agentId + " is not bound to provider " + providerId));
                    }
                    return vault.credentialFor(providerId)
                            .switchIfEmpty(Mono.error(new NoProviderBindingException(
                                    "No credential registered for provider " + providerId)));
                })
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new VaultUnavailableException(providerId, "Vault lookup failed for provider " + providerId, e));
    }
}
