package defiautomation.signer.exception;

/**
 * Nonce operation against a wallet id that does not exist.
 */
public class NoWalletException extends SignerException {

    private final String walletId;

    public NoWalletException(String walletId) {
        super("NO_WALLET", "No wallet with id " + walletId);
        this.walletId = walletId;
    }

    public String getWalletId() {
        return walletId;
    }
}
