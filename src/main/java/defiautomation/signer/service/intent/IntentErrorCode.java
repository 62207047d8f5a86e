package defiautomation.signer.service.intent;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentErrorCode {
    INVALID_SCHEMA,
    UNKNOWN_INTENT_TYPE,
    INTENT_EXPIRED,
    INVALID_SIGNATURE,
    SIGNER_MISMATCH,
    NONCE_USED,
    INTENT_TYPE_MISMATCH,
    CHAIN_MISMATCH,
    WALLET_NOT_FOUND;

    @JsonValue
    public String getWireValue() {
        return name();
    }
}
