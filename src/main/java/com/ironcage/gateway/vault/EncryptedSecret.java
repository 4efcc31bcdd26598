package com.ironcage.gateway.vault;

import java.util.Arrays;
import java.util.Base64;

/**
 * AES-GCM ciphertext (including the authentication tag) with its 12-byte nonce.
 */
public final class EncryptedSecret {

    public static final int NONCE_SIZE = 12;

    private final byte[] ciphertext;
    private final byte[] nonce;

    public EncryptedSecret(byte[] ciphertext, byte[] nonce) {
        if (nonce.length != NONCE_SIZE) {
            throw new IllegalArgumentException("Nonce must be " + NONCE_SIZE + " bytes");
        }
        this.ciphertext = ciphertext.clone();
        this.nonce = nonce.clone();
    }

    public static EncryptedSecret fromBase64(String ciphertextBase64, String nonceBase64) {
        Base64.Decoder decoder = Base64.getDecoder();
        return new EncryptedSecret(decoder.decode(ciphertextBase64), decoder.decode(nonceBase64));
    }

    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public byte[] nonce() {
        return nonce.clone();
    }

    public String ciphertextBase64() {
        return Base64.getEncoder().encodeToString(ciphertext);
    }

    public String nonceBase64() {
        return Base64.getEncoder().encodeToString(nonce);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedSecret other)) {
            return false;
        }
        return Arrays.equals(ciphertext, other.ciphertext) && Arrays.equals(nonce, other.nonce);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(ciphertext) + Arrays.hashCode(nonce);
    }
}
