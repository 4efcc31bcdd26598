package com.ironcage.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Agent token settings.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "gateway.auth")
public class AuthConfig {

    /**
     * HMAC secret for agent tokens. At least 32 bytes.
     */
    private String jwtSecret = "defaultSecretKeyForDevelopmentPurposesOnly123456";

    /**
     * Token lifetime. Zero means tokens do not expire and live until rotated or revoked.
     */
    private Duration tokenTtl = Duration.ZERO;

    /**
     * Where revoked token ids are kept: {@code memory} or {@code redis}.
     */
    private String revocationStore = "memory";

    /**
     * When the revocation store cannot be reached, admit the token anyway.
     */
    private boolean revocationFailOpen = false;

    /**
     * Key the provisioning service presents in {@code X-Admin-Api-Key}. Empty disables the admin endpoints.
     */
    private String adminApiKey = "";
}
