package com.collectivestrategist.aigateway.credential;

import com.collectivestrategist.aigateway.error.CredentialDecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

@Component
public class CredentialCodec {

    private static final Logger log = LoggerFactory.getLogger(CredentialCodec.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int IV_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final byte[] ASSOCIATED_DATA = "ai-provider-credentials".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KDF_SALT = "ai-gateway-credential-salt".getBytes(StandardCharsets.UTF_8);
    private static final int KDF_ITERATIONS = 100_000;
    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public CredentialCodec(@Value("${gateway.credentials.encryption-key:}") String encryptionKey) {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            throw new IllegalStateException(
                    "gateway.credentials.encryption-key is not set; provide ENCRYPTION_KEY");
        }
        this.key = new SecretKeySpec(keyMaterial(encryptionKey), "AES");
        log.info("Credential codec initialized");
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Cannot encrypt an empty credential");
        }
        try {
            var iv = new byte[IV_LENGTH_BYTES];
            random.nextBytes(iv);
            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(ASSOCIATED_DATA);
            var encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            var combined = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    /**
     * @throws CredentialDecryptionException if the blob is corrupt or was sealed under another key
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new CredentialDecryptionException("No ciphertext to decrypt", null);
        }
        try {
            var combined = Base64.getDecoder().decode(ciphertext);
            if (combined.length <= IV_LENGTH_BYTES + TAG_LENGTH_BITS / 8) {
                throw new CredentialDecryptionException("Ciphertext is truncated", null);
            }
            var cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, combined, 0, IV_LENGTH_BYTES));
            cipher.updateAAD(ASSOCIATED_DATA);
            var plain = cipher.doFinal(combined, IV_LENGTH_BYTES, combined.length - IV_LENGTH_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CredentialDecryptionException("Stored credential could not be decrypted", e);
        }
    }

    // 44-char Base64 or 64-char hex is raw key material, anything else is a passphrase.
    private static byte[] keyMaterial(String encryptionKey) {
        var trimmed = encryptionKey.trim();
        if (trimmed.length() == 44 && trimmed.endsWith("=")) {
            try {
                var decoded = Base64.getDecoder().decode(trimmed);
                if (decoded.length == KEY_LENGTH_BYTES) {
                    return decoded;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Encryption key is not Base64, deriving it as a passphrase");
            }
        }
        if (HEX_KEY.matcher(trimmed).matches()) {
            return HexFormat.of().parseHex(trimmed);
        }
        try {
            var spec = new PBEKeySpec(trimmed.toCharArray(), KDF_SALT, KDF_ITERATIONS, KEY_LENGTH_BYTES * 8);
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not derive credential encryption key", e);
        }
    }
}
