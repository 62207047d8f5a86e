package defiautomation.signer.service.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import defiautomation.signer.service.intent.typeddata.Eip712Field;
import defiautomation.signer.service.intent.typeddata.Eip712StructType;
import defiautomation.signer.util.EthereumAddressValidator;

/**
 * Registered single-use intent kinds. Every struct starts with the common
 * fields, followed by the type's own payload fields.
 */
public enum IntentType {
    TEST_WALLET("test-wallet", "TestWalletIntent",
        List.of(new Eip712Field("message", "string"))),
    ERC20_APPROVE("erc20-approve", "Erc20ApproveIntent",
        List.of(
            new Eip712Field("tokenAddress", "address"),
            new Eip712Field("spenderAddress", "address"),
            new Eip712Field("amount", "uint256"))),
    ERC20_TRANSFER("erc20-transfer", "Erc20TransferIntent",
        List.of(
            new Eip712Field("tokenAddress", "address"),
            new Eip712Field("recipient", "address"),
            new Eip712Field("amount", "uint256")));

    private final String wireValue;
    private final List<Eip712Field> payloadFields;
    private final Eip712StructType structType;

    IntentType(String wireValue, String structName, List<Eip712Field> payloadFields) {
        this.wireValue = wireValue;
        this.payloadFields = payloadFields;
        List<Eip712Field> all = new ArrayList<>(commonFields());
        all.addAll(payloadFields);
        this.structType = new Eip712StructType(structName, all);
    }

    // enum constructors run before static fields are assigned, so this cannot be a constant
    public static List<Eip712Field> commonFields() {
        return List.of(
            new Eip712Field("intentType", "string"),
            new Eip712Field("signer", "address"),
            new Eip712Field("chainId", "uint256"),
            new Eip712Field("nonce", "uint256"),
            new Eip712Field("expiresAt", "uint64")
        );
    }

    public String getWireValue() {
        return wireValue;
    }

    public Eip712StructType getStructType() {
        return structType;
    }

    public static Optional<IntentType> fromWireValue(String value) {
        for (IntentType type : values()) {
            if (type.wireValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * @return description of the first problem, or empty when the payload matches
     */
    public Optional<String> validatePayload(Map<String, String> fields) {
        Map<String, String> payload = fields == null ? Map.of() : fields;
        for (String key : payload.keySet()) {
            if (payloadFields.stream().noneMatch(field -> field.name().equals(key))) {
                return Optional.of("Unexpected field '" + key + "' for " + wireValue);
            }
        }
        for (Eip712Field field : payloadFields) {
            String value = payload.get(field.name());
            if (value == null) {
                return Optional.of("Missing field '" + field.name() + "' for " + wireValue);
            }
            boolean ok = switch (field.type()) {
                case "address" -> EthereumAddressValidator.isAddressShaped(value);
                case "uint256" -> EthereumAddressValidator.isUint256(value);
                default -> true;
            };
            if (!ok) {
                return Optional.of("Field '" + field.name() + "' is not a valid " + field.type());
            }
        }
        return Optional.empty();
    }
}
