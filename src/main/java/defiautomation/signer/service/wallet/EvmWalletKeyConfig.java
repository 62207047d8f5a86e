package defiautomation.signer.service.wallet;

import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.signing.SigningKey;
import defiautomation.signer.util.EthereumAddressValidator;

public record EvmWalletKeyConfig(String walletAddress, String keyId, KeyProvider provider, String encryptedMaterial)
    implements WalletKeyConfig {

    public static final String CHAIN_FAMILY = "evm";

    public static EvmWalletKeyConfig from(SigningKey key) {
        return new EvmWalletKeyConfig(key.walletAddress(), key.keyId(), key.provider(), key.encryptedMaterial());
    }

    @Override
    public void validate() {
        if (!EthereumAddressValidator.isAddressShaped(walletAddress)) {
            throw new IllegalStateException("Wallet key config has an invalid address");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalStateException("Wallet key config has no key id");
        }
        if (provider == null) {
            throw new IllegalStateException("Wallet key config has no provider");
        }
        if (provider == KeyProvider.LOCAL && (encryptedMaterial == null || encryptedMaterial.isBlank())) {
            throw new IllegalStateException("Local wallet key config is missing its encrypted key");
        }
        if (provider == KeyProvider.MANAGED_HSM && encryptedMaterial != null) {
            throw new IllegalStateException("Managed HSM wallet key config must not carry key material");
        }
    }

    @Override
    public String toString() {
        return "EvmWalletKeyConfig[walletAddress=" + walletAddress + ", keyId=" + keyId + ", provider=" + provider + "]";
    }
}
