package defiautomation.signer.service.wallet;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import defiautomation.signer.service.signing.KeyProvider;

/**
 * Chain-family specific key reference stored with a wallet.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "chainFamily")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EvmWalletKeyConfig.class, name = EvmWalletKeyConfig.CHAIN_FAMILY)
})
public interface WalletKeyConfig {

    String walletAddress();

    String keyId();

    KeyProvider provider();

    /**
     * @throws IllegalStateException when the stored config is unusable
     */
    void validate();
}
