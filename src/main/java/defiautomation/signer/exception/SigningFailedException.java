package defiautomation.signer.exception;

/**
 * Backend or network failure while computing a signature. Nothing was consumed,
 * so the operation is safe to retry with backoff.
 */
public class SigningFailedException extends SignerException {

    public SigningFailedException(String message) {
        super("SIGNING_FAILED", message);
    }

    public SigningFailedException(String message, Throwable cause) {
        super("SIGNING_FAILED", message, cause);
    }
}
