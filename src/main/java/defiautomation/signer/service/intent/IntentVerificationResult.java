package defiautomation.signer.service.intent;

/**
 * Outcome of verifying a signed intent. Rejections carry a code; they are
 * never thrown.
 */
public record IntentVerificationResult<T>(
    boolean valid,
    String error,
    IntentErrorCode errorCode,
    T intent,
    String recoveredAddress
) {

    public static <T> IntentVerificationResult<T> accepted(T intent, String recoveredAddress) {
        return new IntentVerificationResult<>(true, null, null, intent, recoveredAddress);
    }

    public static <T> IntentVerificationResult<T> rejected(IntentErrorCode code, String error, T intent) {
        return new IntentVerificationResult<>(false, error, code, intent, null);
    }

    public static <T> IntentVerificationResult<T> rejected(IntentErrorCode code, String error, T intent, String recoveredAddress) {
        return new IntentVerificationResult<>(false, error, code, intent, recoveredAddress);
    }
}
