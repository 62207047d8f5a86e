package defiautomation.signer.service.wallet;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationWallet {
    private String id;
    private String ownerRef;
    private WalletPurpose purpose;
    private String label;
    private WalletKeyConfig keyConfig;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsedAt;

    public String getWalletAddress() {
        return keyConfig != null ? keyConfig.walletAddress() : null;
    }

    public String getKeyId() {
        return keyConfig != null ? keyConfig.keyId() : null;
    }

    public String getWalletHash() {
        return purpose.walletHash(getWalletAddress());
    }
}
