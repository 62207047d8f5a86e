package defiautomation.signer.service.intent.typeddata;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import defiautomation.signer.util.EthereumAddressValidator;

/**
 * {@code hashStruct} and digest computation for EIP-712 messages.
 *
 * <p>Values are supplied as plain Java objects: strings for {@code string},
 * {@code address}, {@code bytes} and {@code bytes32}; {@link BigInteger},
 * {@link Number} or decimal strings for integers; {@link Boolean} for
 * {@code bool}; maps for nested structs and lists for arrays. Arrays hash to
 * the keccak of their concatenated element encodings.
 */
public final class Eip712Encoder {

    private Eip712Encoder() {
        // Utility class
    }

    /**
     * Final signing digest {@code keccak256(0x1901 || domainSeparator || hashStruct(message))}.
     */
    public static byte[] digest(Eip712Domain domain, Eip712StructType primaryType, Map<String, ?> message) {
        byte[] domainSeparator = domain.separator();
        byte[] structHash = hashStruct(primaryType, message);

        byte[] digestInput = new byte[2 + domainSeparator.length + structHash.length];
        digestInput[0] = 0x19;
        digestInput[1] = 0x01;
        System.arraycopy(domainSeparator, 0, digestInput, 2, domainSeparator.length);
        System.arraycopy(structHash, 0, digestInput, 2 + domainSeparator.length, structHash.length);
        return Hash.sha3(digestInput);
    }

    public static byte[] hashStruct(Eip712StructType type, Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("Missing value for struct " + type.getName());
        }
        ByteArrayOutputStream encoded = new ByteArrayOutputStream();
        encoded.writeBytes(type.typeHash());
        for (Eip712Field field : type.getFields()) {
            if (!values.containsKey(field.name()) || values.get(field.name()) == null) {
                throw new IllegalArgumentException("Missing value for " + type.getName() + "." + field.name());
            }
            encoded.writeBytes(encodeValue(type, field.type(), values.get(field.name())));
        }
        return Hash.sha3(encoded.toByteArray());
    }

    @SuppressWarnings("rawtypes")
    static String encodeTypes(Type... types) {
        StringBuilder sb = new StringBuilder();
        for (Type type : types) {
            sb.append(TypeEncoder.encode(type));
        }
        return sb.toString();
    }

    private static byte[] encodeValue(Eip712StructType context, String type, Object value) {
        if (type.endsWith("[]")) {
            if (!(value instanceof List<?> items)) {
                throw new IllegalArgumentException("Expected a list for " + type);
            }
            String elementType = type.substring(0, type.length() - 2);
            ByteArrayOutputStream concatenated = new ByteArrayOutputStream();
            for (Object item : items) {
                concatenated.writeBytes(encodeValue(context, elementType, item));
            }
            return Hash.sha3(concatenated.toByteArray());
        }
        switch (type) {
            case "string":
                return Hash.sha3(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
            case "bytes":
                return Hash.sha3(Numeric.hexStringToByteArray(String.valueOf(value)));
            case "address":
                return encode(new Address(requireAddress(String.valueOf(value))));
            case "bool":
                return encode(new Bool(toBoolean(value)));
            case "bytes32":
                return encode(new Bytes32(toBytes32(String.valueOf(value))));
            default:
                break;
        }
        if (type.startsWith("uint")) {
            BigInteger number = toBigInteger(value);
            int bits = type.length() == 4 ? 256 : Integer.parseInt(type.substring(4));
            if (number.signum() < 0 || number.bitLength() > bits) {
                throw new IllegalArgumentException("Value out of range for " + type);
            }
            return encode(new Uint256(number));
        }
        if (type.startsWith("int")) {
            return encode(new Int256(toBigInteger(value)));
        }
        Eip712StructType nested = context.getName().equals(type)
            ? context
            : context.dependency(type).orElseThrow(() -> new IllegalArgumentException("Unknown EIP-712 type " + type));
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected an object for struct " + type);
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> members = (Map<String, ?>) map;
        return hashStruct(nested, members);
    }

    @SuppressWarnings("rawtypes")
    private static byte[] encode(Type type) {
        return Numeric.hexStringToByteArray(TypeEncoder.encode(type));
    }

    private static String requireAddress(String value) {
        if (!EthereumAddressValidator.isAddressShaped(value)) {
            throw new IllegalArgumentException("Invalid address value");
        }
        return value;
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value);
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException("Invalid bool value");
    }

    private static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        return EthereumAddressValidator.parseBigInteger(String.valueOf(value), "integer");
    }

    private static byte[] toBytes32(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(hex);
        if (raw.length != 32) {
            throw new IllegalArgumentException("bytes32 value must be 32 bytes");
        }
        return raw;
    }
}
