package defiautomation.signer.service.transaction;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import defiautomation.signer.config.SignerProperties;
import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.service.nonce.NonceAllocator;
import defiautomation.signer.service.signing.SignatureResult;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.wallet.AutomationWallet;
import defiautomation.signer.service.wallet.WalletRegistry;
import defiautomation.signer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Signs on behalf of an owner's automation wallet: resolves the wallet,
 * supplies a nonce and bounds the backend call with a timeout.
 *
 * <p>A nonce this service allocated is released again when signing fails or
 * times out. Caller-supplied nonces are never touched.
 */
@Service
@Slf4j
public class AutomationSigningService {

    private final WalletRegistry walletRegistry;
    private final NonceAllocator nonceAllocator;
    private final TransactionSigner transactionSigner;
    private final SigningBackend signingBackend;
    private final ExecutorService signingExecutor;
    private final SignerProperties properties;

    public AutomationSigningService(
        WalletRegistry walletRegistry,
        NonceAllocator nonceAllocator,
        TransactionSigner transactionSigner,
        SigningBackend signingBackend,
        @Qualifier("signingExecutor") ExecutorService signingExecutor,
        SignerProperties properties
    ) {
        this.walletRegistry = walletRegistry;
        this.nonceAllocator = nonceAllocator;
        this.transactionSigner = transactionSigner;
        this.signingBackend = signingBackend;
        this.signingExecutor = signingExecutor;
        this.properties = properties;
    }

    public SignedTransaction signContractCall(ContractCallRequest request) {
        AutomationWallet wallet = walletRegistry.requireActive(request.getOwnerRef());
        boolean allocated = request.getNonce() == null;
        long nonce = allocated
            ? nonceAllocator.allocateAndIncrement(wallet.getId(), request.getChainId())
            : request.getNonce();

        UnsignedLegacyTransaction tx = UnsignedLegacyTransaction.builder()
            .to(request.getTo())
            .data(request.getData())
            .value(request.getValue())
            .chainId(request.getChainId())
            .nonce(BigInteger.valueOf(nonce))
            .gasLimit(request.getGasLimit())
            .gasPrice(request.getGasPrice())
            .build();

        SignedTransaction signed;
        try {
            signed = runWithTimeout(
                () -> transactionSigner.signLegacyTransaction(tx, signingBackend, wallet.getKeyId()),
                "transaction with nonce " + nonce
            );
        } catch (RuntimeException e) {
            if (allocated) {
                nonceAllocator.release(wallet.getId(), request.getChainId(), nonce);
            }
            throw e;
        }
        walletRegistry.recordUsage(wallet.getId());

        log.info("Signed contract call for wallet {} on chain {} (nonce {})",
            LogSanitizer.maskIdentifier(wallet.getWalletAddress()), request.getChainId(), nonce);
        return signed.toBuilder().from(wallet.getWalletAddress()).build();
    }

    /**
     * Signs a precomputed typed-data digest with the owner's wallet.
     */
    public SignatureResult signDigest(String ownerRef, byte[] digest) {
        AutomationWallet wallet = walletRegistry.requireActive(ownerRef);
        SignatureResult result = runWithTimeout(
            () -> signingBackend.signTypedDataHash(wallet.getKeyId(), digest),
            "typed data digest"
        );
        walletRegistry.recordUsage(wallet.getId());
        return result;
    }

    private <T> T runWithTimeout(Supplier<T> task, String description) {
        long timeoutMillis = properties.getSigningTimeout().toMillis();
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(task, signingExecutor);
        } catch (RejectedExecutionException e) {
            throw new SigningFailedException("Signing queue is full, rejected " + description, e);
        }
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Signing timed out after {} ms for {}", timeoutMillis, description);
            throw new SigningFailedException("Signing timed out for " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SigningFailedException("Interrupted while signing " + description, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SigningFailedException("Signing failed for " + description, cause);
        }
    }
}
