package defiautomation.signer.exception;

/**
 * An HSM signature could not be matched to the key's address with either
 * recovery id. Points at a backend bug or tampering; do not retry.
 */
public class RecoveryFailedException extends SignerException {

    public RecoveryFailedException(String message) {
        super("RECOVERY_FAILED", message);
    }
}
