package defiautomation.signer.service.signing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum KeyProvider {
    LOCAL("local"),
    MANAGED_HSM("managed-hsm");

    private final String wireValue;

    KeyProvider(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static KeyProvider fromWireValue(String value) {
        for (KeyProvider provider : values()) {
            if (provider.wireValue.equalsIgnoreCase(value) || provider.name().equalsIgnoreCase(value)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown key provider: " + value);
    }
}
