package com.ironcage.gateway.config;

import com.ironcage.gateway.vault.UnavailablePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential vault configuration.
 *
 * Credentials are normally registered already encrypted (base64 ciphertext + nonce).
 * A plaintext {@code api-key} is accepted for local development and is encrypted
 * with the master key at startup; it is never kept in plaintext afterwards.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.vault")
public class VaultConfig {

    /**
     * Base64 encoded 32-byte AES-256 master key.
     */
    private String masterKey = "";

    private UnavailablePolicy unavailablePolicy = UnavailablePolicy.FAIL_CLOSED;

    private Map<String, Credential> credentials = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Credential {
        private String ciphertext;
        private String nonce;
        private String apiKey;
    }
}
