package com.ironcage.gateway.vault;

import com.ironcage.gateway.exception.VaultUnavailableException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential vault keeping AES-256-GCM encrypted secrets in memory.
 *
 * Only ciphertext is stored; every lookup decrypts on the worker scheduler and hands out
 * a fresh {@link ProviderCredential}.
 */
@Slf4j
public class AesGcmCredentialVault implements CredentialVault {

    public static final int KEY_SIZE = 32;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey masterKey;
    private final Scheduler scheduler;
    private final SecureRandom random = new SecureRandom();
    private final ConcurrentHashMap<String, EncryptedSecret> secrets = new ConcurrentHashMap<>();

    public AesGcmCredentialVault(byte[] masterKey, Scheduler scheduler) {
        if (masterKey.length != KEY_SIZE) {
            throw new IllegalArgumentException("Master key must be " + KEY_SIZE + " bytes");
        }
        this.masterKey = new SecretKeySpec(masterKey, "AES");
        this.scheduler = scheduler;
    }

    public static AesGcmCredentialVault fromBase64Key(String masterKeyBase64, Scheduler scheduler) {
        return new AesGcmCredentialVault(Base64.getDecoder().decode(masterKeyBase64), scheduler);
    }

    @Override
    public Mono<ProviderCredential> credentialFor(String providerId) {
        return Mono.fromCallable(() -> {
                    EncryptedSecret secret = secrets.get(providerId);
                    if (secret == null) {
                        return null;
                    }
                    return new ProviderCredential(providerId, decrypt(providerId, secret));
                })
                .subscribeOn(scheduler);
    }

    @Override
    public void register(String providerId, EncryptedSecret secret) {
        secrets.put(providerId, secret);
        log.info("Registered credential for provider {}", providerId);
    }

    public EncryptedSecret encrypt(String plaintext) {
        byte[] nonce = new byte[EncryptedSecret.NONCE_SIZE];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new EncryptedSecret(ciphertext, nonce);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    private String decrypt(String providerId, EncryptedSecret secret) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(TAG_BITS, secret.nonce()));
            return new String(cipher.doFinal(secret.ciphertext()), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            log.error("Credential decryption failed for provider {}", providerId);
            throw new VaultUnavailableException(providerId,
                    "Credential for provider " + providerId + " could not be decrypted", e);
        }
    }
}
