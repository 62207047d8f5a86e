package defiautomation.signer.util;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

import org.web3j.crypto.Keys;

/**
 * Validation and normalization helpers for EVM addresses and numeric strings.
 */
public final class EthereumAddressValidator {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern UINT_PATTERN = Pattern.compile("^[0-9]{1,78}$");
    private static final BigInteger UINT256_MAX = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private EthereumAddressValidator() {
        // Utility class
    }

    /**
     * Checks the shape of an address without enforcing the checksum.
     */
    public static boolean isAddressShaped(String address) {
        return address != null && ADDRESS_PATTERN.matcher(address).matches();
    }

    /**
     * Normalizes an address to its EIP-55 checksum form.
     *
     * @throws IllegalArgumentException if the address is malformed
     */
    public static String toChecksumAddress(String address) {
        if (!isAddressShaped(address)) {
            throw new IllegalArgumentException("Invalid Ethereum address: " + LogSanitizer.sanitize(address));
        }
        return Keys.toChecksumAddress(address.toLowerCase(Locale.ROOT));
    }

    /**
     * Case-insensitive address comparison; null never matches.
     */
    public static boolean sameAddress(String left, String right) {
        return left != null && right != null && left.equalsIgnoreCase(right);
    }

    public static boolean isZeroAddress(String address) {
        return ZERO_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * True when the value is a non-negative decimal integer that fits in a uint256.
     */
    public static boolean isUint256(String value) {
        if (value == null || !UINT_PATTERN.matcher(value).matches()) {
            return false;
        }
        return new BigInteger(value).compareTo(UINT256_MAX) <= 0;
    }

    public static BigInteger parseBigInteger(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " cannot be null or empty");
        }
        try {
            return new BigInteger(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " must be a valid number: " + LogSanitizer.sanitize(value), ex);
        }
    }
}
