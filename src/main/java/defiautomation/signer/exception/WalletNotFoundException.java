package defiautomation.signer.exception;

public class WalletNotFoundException extends SignerException {

    public WalletNotFoundException(String message) {
        super("WALLET_NOT_FOUND", message);
    }
}
