package defiautomation.signer.service.wallet;

import java.time.Instant;
import java.util.Optional;

public interface WalletRepository {

    /**
     * @throws defiautomation.signer.exception.WalletExistsException when the
     *         owner already has an active wallet for the purpose, or the
     *         address is already registered
     */
    void insert(AutomationWallet wallet);

    Optional<AutomationWallet> findById(String walletId);

    Optional<AutomationWallet> findActiveByOwner(String ownerRef, WalletPurpose purpose);

    /**
     * Case-insensitive lookup over active and inactive wallets.
     */
    Optional<AutomationWallet> findByAddress(String walletAddress);

    /**
     * @return true when an active wallet was deactivated
     */
    boolean deactivate(String walletId, Instant at);

    void touchLastUsed(String walletId, Instant at);
}
