package defiautomation.signer.service.signing.local;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.regex.Pattern;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.web3j.utils.Numeric;

import defiautomation.signer.exception.ConfigurationException;
import defiautomation.signer.exception.SigningFailedException;

/**
 * AES-256-GCM envelope for private key material.
 *
 * <p>Records are stored as {@code base64(iv):base64(tag):base64(ciphertext)}
 * with a fresh 96-bit IV per record and a 128-bit authentication tag.
 */
public class KeyCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final int TAG_LENGTH_BITS = TAG_LENGTH * 8;
    private static final Pattern MASTER_KEY_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    private final SecretKeySpec secretKey;
    private final SecureRandom secureRandom;

    public KeyCipher(String masterKeyHex) {
        this(masterKeyHex, new SecureRandom());
    }

    public KeyCipher(String masterKeyHex, SecureRandom secureRandom) {
        if (masterKeyHex == null || masterKeyHex.isBlank()) {
            throw new ConfigurationException("signer.local.master-key is not configured");
        }
        String trimmed = Numeric.cleanHexPrefix(masterKeyHex.trim());
        if (!MASTER_KEY_PATTERN.matcher(trimmed).matches()) {
            throw new ConfigurationException("signer.local.master-key must be exactly 64 hex characters (32 bytes)");
        }
        this.secretKey = new SecretKeySpec(Numeric.hexStringToByteArray(trimmed), "AES");
        this.secureRandom = secureRandom;
    }

    public String encrypt(byte[] plaintext) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            // JCE appends the tag to the ciphertext
            byte[] sealed = cipher.doFinal(plaintext);
            byte[] cipherText = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv) + ":" + encoder.encodeToString(tag) + ":" + encoder.encodeToString(cipherText);
        } catch (GeneralSecurityException e) {
            throw new SigningFailedException("Unable to encrypt key material", e);
        }
    }

    public byte[] decrypt(String record) {
        if (record == null) {
            throw new SigningFailedException("Encrypted key record is missing");
        }
        String[] parts = record.split(":");
        if (parts.length != 3) {
            throw new SigningFailedException("Encrypted key record is malformed");
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[0]);
            byte[] tag = decoder.decode(parts[1]);
            byte[] cipherText = decoder.decode(parts[2]);
            if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
                throw new SigningFailedException("Encrypted key record is malformed");
            }

            byte[] sealed = new byte[cipherText.length + TAG_LENGTH];
            System.arraycopy(cipherText, 0, sealed, 0, cipherText.length);
            System.arraycopy(tag, 0, sealed, cipherText.length, TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher.doFinal(sealed);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SigningFailedException("Unable to decrypt key material", e);
        }
    }
}
