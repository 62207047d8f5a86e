package defiautomation.signer.service.transaction;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SignedTransaction {
    /** 0x-prefixed RLP of the signed transaction, ready for broadcast. */
    String rawTransaction;
    String transactionHash;
    long chainId;
    long nonce;
    long v;
    /** Sender address, when known to the caller. */
    String from;
}
