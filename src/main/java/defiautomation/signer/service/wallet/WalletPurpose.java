package defiautomation.signer.service.wallet;

import java.util.Locale;

public enum WalletPurpose {
    AUTOMATION("automation"),
    STRATEGY("strategy");

    private final String wireValue;

    WalletPurpose(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Unique lookup key {@code evm/{purpose}/{lowercase address}}.
     */
    public String walletHash(String walletAddress) {
        return "evm/" + wireValue + "/" + walletAddress.toLowerCase(Locale.ROOT);
    }

    /**
     * Key that is unique among active wallets, {@code {purpose}/{owner}}.
     */
    public String activeOwnerKey(String ownerRef) {
        return wireValue + "/" + ownerRef;
    }

    public static WalletPurpose fromWireValue(String value) {
        for (WalletPurpose purpose : values()) {
            if (purpose.wireValue.equalsIgnoreCase(value)) {
                return purpose;
            }
        }
        throw new IllegalArgumentException("Unknown wallet purpose: " + value);
    }
}
