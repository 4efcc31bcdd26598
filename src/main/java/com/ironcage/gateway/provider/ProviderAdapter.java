package com.ironcage.gateway.provider;

import com.ironcage.gateway.vault.ProviderCredential;
import reactor.core.publisher.Mono;

/**
 * Speaks one provider's wire protocol. Failures surface as {@link ProviderCallException}.
 */
public interface ProviderAdapter {

    ProviderType type();

    Mono<ProviderResponse> call(ProviderCall call, ProviderCredential credential);
}
