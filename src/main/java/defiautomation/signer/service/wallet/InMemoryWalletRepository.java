package defiautomation.signer.service.wallet;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import defiautomation.signer.exception.WalletExistsException;
import defiautomation.signer.util.EthereumAddressValidator;

@Repository
@ConditionalOnProperty(name = "signer.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryWalletRepository implements WalletRepository {

    private final Map<String, AutomationWallet> wallets = new ConcurrentHashMap<>();

    @Override
    public synchronized void insert(AutomationWallet wallet) {
        for (AutomationWallet existing : wallets.values()) {
            if (existing.isActive() && wallet.isActive()
                && existing.getPurpose() == wallet.getPurpose()
                && existing.getOwnerRef().equals(wallet.getOwnerRef())) {
                throw new WalletExistsException("Active wallet already exists for owner");
            }
            if (existing.getWalletHash().equals(wallet.getWalletHash())) {
                throw new WalletExistsException("Wallet address already registered");
            }
        }
        wallets.put(wallet.getId(), copy(wallet));
    }

    @Override
    public Optional<AutomationWallet> findById(String walletId) {
        if (walletId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(wallets.get(walletId)).map(this::copy);
    }

    @Override
    public Optional<AutomationWallet> findActiveByOwner(String ownerRef, WalletPurpose purpose) {
        return wallets.values().stream()
            .filter(AutomationWallet::isActive)
            .filter(wallet -> wallet.getPurpose() == purpose && wallet.getOwnerRef().equals(ownerRef))
            .findFirst()
            .map(this::copy);
    }

    @Override
    public Optional<AutomationWallet> findByAddress(String walletAddress) {
        return wallets.values().stream()
            .filter(wallet -> EthereumAddressValidator.sameAddress(wallet.getWalletAddress(), walletAddress))
            .findFirst()
            .map(this::copy);
    }

    @Override
    public synchronized boolean deactivate(String walletId, Instant at) {
        AutomationWallet wallet = wallets.get(walletId);
        if (wallet == null || !wallet.isActive()) {
            return false;
        }
        wallets.put(walletId, wallet.toBuilder().active(false).updatedAt(at).build());
        return true;
    }

    @Override
    public void touchLastUsed(String walletId, Instant at) {
        wallets.computeIfPresent(walletId, (id, wallet) -> wallet.toBuilder().lastUsedAt(at).updatedAt(at).build());
    }

    private AutomationWallet copy(AutomationWallet wallet) {
        return wallet.toBuilder().build();
    }
}
