package defiautomation.signer.service.transaction;

import java.math.BigInteger;

import org.web3j.utils.Numeric;

import defiautomation.signer.util.EthereumAddressValidator;
import lombok.Builder;
import lombok.Value;

/**
 * Pre-EIP-1559 transaction as supplied by the caller. Gas values are never
 * estimated here.
 */
@Value
@Builder(toBuilder = true)
public class UnsignedLegacyTransaction {
    /** Recipient; null or empty for contract creation. */
    String to;
    @Builder.Default
    String data = "0x";
    @Builder.Default
    BigInteger value = BigInteger.ZERO;
    Long chainId;
    BigInteger nonce;
    BigInteger gasLimit;
    BigInteger gasPrice;

    /**
     * @throws IllegalArgumentException when a required field is missing or out of range
     */
    public void validate() {
        if (chainId == null || chainId <= 0) {
            throw new IllegalArgumentException("chainId is required and must be positive");
        }
        if (nonce == null || nonce.signum() < 0) {
            throw new IllegalArgumentException("nonce is required and must not be negative");
        }
        if (gasLimit == null || gasLimit.signum() <= 0) {
            throw new IllegalArgumentException("gasLimit is required and must be positive");
        }
        if (gasPrice == null || gasPrice.signum() < 0) {
            throw new IllegalArgumentException("gasPrice is required and must not be negative");
        }
        if (value != null && value.signum() < 0) {
            throw new IllegalArgumentException("value must not be negative");
        }
        if (to != null && !to.isEmpty() && !EthereumAddressValidator.isAddressShaped(to)) {
            throw new IllegalArgumentException("to is not a valid address");
        }
        if (data != null && !Numeric.containsHexPrefix(data)) {
            throw new IllegalArgumentException("data must be 0x-prefixed hex");
        }
    }

    public String toOrEmpty() {
        return to == null ? "" : to;
    }

    public String dataOrEmpty() {
        return data == null ? "0x" : data;
    }

    public BigInteger valueOrZero() {
        return value == null ? BigInteger.ZERO : value;
    }
}
