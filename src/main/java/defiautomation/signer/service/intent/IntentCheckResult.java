package defiautomation.signer.service.intent;

/**
 * Verified intent together with the owner's wallet that may act on it.
 */
public record IntentCheckResult<T>(
    boolean valid,
    String error,
    IntentErrorCode errorCode,
    T intent,
    String walletAddress,
    String keyId
) {

    static <T> IntentCheckResult<T> accepted(T intent, String walletAddress, String keyId) {
        return new IntentCheckResult<>(true, null, null, intent, walletAddress, keyId);
    }

    static <T> IntentCheckResult<T> rejected(IntentErrorCode code, String error, T intent) {
        return new IntentCheckResult<>(false, error, code, intent, null, null);
    }
}
