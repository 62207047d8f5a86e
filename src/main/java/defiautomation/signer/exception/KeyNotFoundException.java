package defiautomation.signer.exception;

/**
 * The backend has no key with the given id.
 */
public class KeyNotFoundException extends SignerException {

    private final String keyId;

    public KeyNotFoundException(String keyId) {
        super("KEY_NOT_FOUND", "Key not found: " + keyId);
        this.keyId = keyId;
    }

    public KeyNotFoundException(String keyId, Throwable cause) {
        super("KEY_NOT_FOUND", "Key not found: " + keyId, cause);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
