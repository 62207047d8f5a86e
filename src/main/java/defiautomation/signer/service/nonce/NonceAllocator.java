package defiautomation.signer.service.nonce;

import org.springframework.stereotype.Service;

import defiautomation.signer.exception.NoWalletException;
import defiautomation.signer.service.wallet.WalletRepository;
import defiautomation.signer.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands out transaction nonces per wallet and chain. The first allocation for
 * a pair returns 0.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NonceAllocator {

    private final NonceStore nonceStore;
    private final WalletRepository walletRepository;

    public long allocateAndIncrement(String walletId, long chainId) {
        requireWallet(walletId);
        long nonce = nonceStore.allocate(walletId, chainId);
        log.debug("Allocated nonce {} for wallet {} on chain {}", nonce, LogSanitizer.maskIdentifier(walletId), chainId);
        return nonce;
    }

    public long peek(String walletId, long chainId) {
        requireWallet(walletId);
        return nonceStore.current(walletId, chainId);
    }

    /**
     * Overwrites the next nonce. Used after a signed transaction was never
     * broadcast, so its nonce can be handed out again.
     */
    public void reset(String walletId, long chainId, long nextNonce) {
        if (nextNonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        requireWallet(walletId);
        nonceStore.overwrite(walletId, chainId, nextNonce);
        log.info("Reset nonce for wallet {} on chain {} to {}", LogSanitizer.maskIdentifier(walletId), chainId, nextNonce);
    }

    /**
     * Returns an allocated nonce that produced no transaction. Only the most
     * recent allocation can be released; otherwise the counter is left alone
     * and a gap remains for {@link #reset} to close.
     */
    public boolean release(String walletId, long chainId, long nonce) {
        boolean released = nonceStore.release(walletId, chainId, nonce);
        if (released) {
            log.info("Released nonce {} for wallet {} on chain {}", nonce, LogSanitizer.maskIdentifier(walletId), chainId);
        } else {
            log.warn("Nonce {} for wallet {} on chain {} could not be released, later nonces were allocated",
                nonce, LogSanitizer.maskIdentifier(walletId), chainId);
        }
        return released;
    }

    private void requireWallet(String walletId) {
        if (walletId == null || walletRepository.findById(walletId).isEmpty()) {
            throw new NoWalletException(walletId);
        }
    }
}
