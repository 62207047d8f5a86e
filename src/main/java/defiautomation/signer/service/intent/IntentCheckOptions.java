package defiautomation.signer.service.intent;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IntentCheckOptions {
    String ownerRef;
    /** Chain the caller is about to act on; not checked when null. */
    Long chainId;
    /** Required intent type wire value; not checked when null. */
    String expectedIntentType;
    boolean skipNonceCheck;
}
