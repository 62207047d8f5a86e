package defiautomation.signer.exception;

/**
 * Base type for failures raised by the signing core. The error code is a
 * stable, upper-case identifier callers can branch on.
 */
public class SignerException extends RuntimeException {

    private final String errorCode;

    public SignerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SignerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
