package defiautomation.signer.exception;

public class WalletExistsException extends SignerException {

    public WalletExistsException(String message) {
        super("WALLET_EXISTS", message);
    }

    public WalletExistsException(String message, Throwable cause) {
        super("WALLET_EXISTS", message, cause);
    }
}
