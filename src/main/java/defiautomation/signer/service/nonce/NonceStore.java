package defiautomation.signer.service.nonce;

/**
 * Per (wallet, chain) transaction nonce counter. Implementations make
 * {@link #allocate} atomic with respect to concurrent callers.
 */
public interface NonceStore {

    /**
     * Returns the stored next nonce and stores it plus one. A missing record
     * counts as 0.
     */
    long allocate(String walletId, long chainId);

    /**
     * @return the next nonce without consuming it, 0 when absent
     */
    long current(String walletId, long chainId);

    void overwrite(String walletId, long chainId, long nextNonce);

    /**
     * Hands {@code nonce} back when it is still the most recent allocation,
     * i.e. the stored next nonce is {@code nonce + 1}.
     *
     * @return false when another allocation or a reset happened in between
     */
    boolean release(String walletId, long chainId, long nonce);
}
