package ru.uzden.vpnpanel.security;

import org.springframework.stereotype.Component;
import ru.uzden.vpnpanel.config.PanelProperties;
import ru.uzden.vpnpanel.exceptions.CredentialVaultException;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Шифрование логинов/паролей панелей. Формат строки: "v1:" + base64url(iv || ciphertext+tag).
 * Ключ AES-256 выводится из panels.security.credential-key через PBKDF2.
 */
@Component
public class CredentialVault {

    private static final String PREFIX = "v1:";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BITS = 256;
    private static final int PBKDF2_ITERATIONS = 100_000;
    private static final String DEFAULT_SALT = "vpnpanel-credential-vault";

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public CredentialVault(PanelProperties props) {
        PanelProperties.Security security = props.security();
        String secret = security == null ? null : security.credentialKey();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("panels.security.credential-key is required");
        }
        String salt = security.credentialSalt() == null || security.credentialSalt().isBlank()
                ? DEFAULT_SALT
                : security.credentialSalt();
        this.key = deriveKey(secret, salt);
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Nothing to encrypt");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ct = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] out = ByteBuffer.allocate(iv.length + ct.length).put(iv).put(ct).array();
            return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(out);
        } catch (Exception e) {
            throw new CredentialVaultException("Failed to encrypt credential", e);
        }
    }

    public String decrypt(String cipherText) {
        if (cipherText == null || !cipherText.startsWith(PREFIX)) {
            throw new CredentialVaultException("Unsupported credential format", null);
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(cipherText.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new CredentialVaultException("Credential is not valid base64", e);
        }
        if (raw.length <= GCM_IV_BYTES) {
            throw new CredentialVaultException("Credential is too short", null);
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, raw, 0, GCM_IV_BYTES));
            byte[] plain = cipher.doFinal(raw, GCM_IV_BYTES, raw.length - GCM_IV_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (Exception e) {
            // неверный ключ или подменённый шифртекст
            throw new CredentialVaultException("Failed to decrypt credential", e);
        }
    }

    private static SecretKeySpec deriveKey(String secret, String salt) {
        try {
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), salt.getBytes(StandardCharsets.UTF_8),
                    PBKDF2_ITERATIONS, KEY_BITS);
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            spec.clearPassword();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (Exception e) {
            throw new CredentialVaultException("Failed to derive credential key", e);
        }
    }
}
