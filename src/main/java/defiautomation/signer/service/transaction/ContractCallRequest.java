package defiautomation.signer.service.transaction;

import java.math.BigInteger;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ContractCallRequest {
    String ownerRef;
    long chainId;
    String to;
    @Builder.Default
    String data = "0x";
    @Builder.Default
    BigInteger value = BigInteger.ZERO;
    BigInteger gasLimit;
    BigInteger gasPrice;
    /** Explicit nonce; allocated from the nonce store when null. */
    Long nonce;
}
