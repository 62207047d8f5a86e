package defiautomation.signer.service.wallet;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import defiautomation.signer.exception.WalletExistsException;
import defiautomation.signer.exception.WalletNotFoundException;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.signing.SigningKey;
import defiautomation.signer.util.EthereumAddressValidator;
import defiautomation.signer.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the lifecycle of automation wallets: one active wallet per owner and
 * purpose, keys created through the configured {@link SigningBackend}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalletRegistry {

    private final WalletRepository walletRepository;
    private final SigningBackend signingBackend;
    private final Clock clock;

    public AutomationWallet create(String ownerRef, String label) {
        return create(ownerRef, label, WalletPurpose.AUTOMATION);
    }

    public AutomationWallet create(String ownerRef, String label, WalletPurpose purpose) {
        requireOwner(ownerRef);
        if (walletRepository.findActiveByOwner(ownerRef, purpose).isPresent()) {
            throw new WalletExistsException("Active " + purpose.getWireValue() + " wallet already exists for owner");
        }

        SigningKey key = signingBackend.createKey(label);
        Instant now = clock.instant();
        AutomationWallet wallet = AutomationWallet.builder()
            .id(UUID.randomUUID().toString())
            .ownerRef(ownerRef)
            .purpose(purpose)
            .label(label)
            .keyConfig(EvmWalletKeyConfig.from(key))
            .active(true)
            .createdAt(now)
            .updatedAt(now)
            .build();
        // a concurrent create for the same owner surfaces here as WalletExistsException
        try {
            walletRepository.insert(wallet);
        } catch (RuntimeException e) {
            discardUnusedKey(key.keyId(), e);
            throw e;
        }

        log.info("Created {} wallet {} for owner {}", purpose.getWireValue(),
            LogSanitizer.maskIdentifier(wallet.getWalletAddress()), LogSanitizer.maskIdentifier(ownerRef));
        return wallet;
    }

    public Optional<AutomationWallet> getByOwner(String ownerRef) {
        return getByOwner(ownerRef, WalletPurpose.AUTOMATION);
    }

    public Optional<AutomationWallet> getByOwner(String ownerRef, WalletPurpose purpose) {
        if (ownerRef == null || ownerRef.isBlank()) {
            return Optional.empty();
        }
        return walletRepository.findActiveByOwner(ownerRef, purpose);
    }

    public Optional<AutomationWallet> getByAddress(String walletAddress) {
        if (!EthereumAddressValidator.isAddressShaped(walletAddress)) {
            return Optional.empty();
        }
        return walletRepository.findByAddress(walletAddress);
    }

    public Optional<AutomationWallet> getById(String walletId) {
        return walletRepository.findById(walletId);
    }

    public AutomationWallet getOrCreate(String ownerRef, String label) {
        Optional<AutomationWallet> existing = getByOwner(ownerRef);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return create(ownerRef, label);
        } catch (WalletExistsException e) {
            // lost a race with another create for the same owner
            return getByOwner(ownerRef).orElseThrow(() -> e);
        }
    }

    /**
     * @throws WalletNotFoundException when the owner has no active wallet
     */
    public AutomationWallet requireActive(String ownerRef) {
        return requireActive(ownerRef, WalletPurpose.AUTOMATION);
    }

    public AutomationWallet requireActive(String ownerRef, WalletPurpose purpose) {
        return getByOwner(ownerRef, purpose)
            .orElseThrow(() -> new WalletNotFoundException("No active " + purpose.getWireValue() + " wallet for owner"));
    }

    /**
     * Deactivates the owner's active wallet. The record is kept.
     *
     * @return false when the owner had no active wallet
     */
    public boolean deactivate(String ownerRef) {
        return deactivate(ownerRef, WalletPurpose.AUTOMATION);
    }

    public boolean deactivate(String ownerRef, WalletPurpose purpose) {
        Optional<AutomationWallet> wallet = getByOwner(ownerRef, purpose);
        if (wallet.isEmpty()) {
            return false;
        }
        boolean deactivated = walletRepository.deactivate(wallet.get().getId(), clock.instant());
        if (deactivated) {
            log.info("Deactivated wallet {} for owner {}",
                LogSanitizer.maskIdentifier(wallet.get().getWalletAddress()), LogSanitizer.maskIdentifier(ownerRef));
        }
        return deactivated;
    }

    /**
     * Best-effort update of {@code lastUsedAt}; failures are logged only.
     */
    public void recordUsage(String walletId) {
        try {
            walletRepository.touchLastUsed(walletId, clock.instant());
        } catch (RuntimeException e) {
            log.warn("Wallet usage update skipped for {}: {}", LogSanitizer.maskIdentifier(walletId), LogSanitizer.describe(e));
        }
    }

    private void discardUnusedKey(String keyId, RuntimeException cause) {
        try {
            signingBackend.discardKey(keyId);
        } catch (RuntimeException e) {
            log.error("Key {} is left without a wallet: {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.describe(e));
            cause.addSuppressed(e);
        }
    }

    private static void requireOwner(String ownerRef) {
        if (ownerRef == null || ownerRef.isBlank()) {
            throw new IllegalArgumentException("Owner reference is required");
        }
    }
}
