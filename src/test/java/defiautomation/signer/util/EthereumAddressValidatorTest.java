package defiautomation.signer.util;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EthereumAddressValidator Tests")
class EthereumAddressValidatorTest {

    private static final String CHECKSUMMED = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";

    @Nested
    @DisplayName("isAddressShaped Tests")
    class IsAddressShapedTests {

        @Test
        @DisplayName("Should reject null, short and non-hex input")
        void shouldRejectMalformed() {
            assertFalse(EthereumAddressValidator.isAddressShaped(null));
            assertFalse(EthereumAddressValidator.isAddressShaped("0x1234"));
            assertFalse(EthereumAddressValidator.isAddressShaped("f39fd6e51aad88f6f4ce6ab8827279cfffb92266"));
            assertFalse(EthereumAddressValidator.isAddressShaped("0xGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGGG"));
        }

        @Test
        @DisplayName("Should accept any letter case")
        void shouldAcceptAnyCase() {
            assertTrue(EthereumAddressValidator.isAddressShaped(CHECKSUMMED));
            assertTrue(EthereumAddressValidator.isAddressShaped(CHECKSUMMED.toLowerCase()));
        }
    }

    @Nested
    @DisplayName("Normalization Tests")
    class NormalizationTests {

        @Test
        @DisplayName("Should produce the EIP-55 form")
        void shouldChecksum() {
            assertEquals(CHECKSUMMED, EthereumAddressValidator.toChecksumAddress(CHECKSUMMED.toUpperCase().replace("0X", "0x")));
        }

        @Test
        @DisplayName("Should throw for a malformed address")
        void shouldThrowForMalformed() {
            assertThrows(IllegalArgumentException.class, () -> EthereumAddressValidator.toChecksumAddress("0xabc"));
        }

        @Test
        @DisplayName("Should compare addresses ignoring case")
        void shouldCompareAddresses() {
            assertTrue(EthereumAddressValidator.sameAddress(CHECKSUMMED, CHECKSUMMED.toLowerCase()));
            assertFalse(EthereumAddressValidator.sameAddress(CHECKSUMMED, null));
            assertTrue(EthereumAddressValidator.isZeroAddress(EthereumAddressValidator.ZERO_ADDRESS));
        }
    }

    @Nested
    @DisplayName("Numeric Tests")
    class NumericTests {

        @Test
        @DisplayName("Should bound uint256 values")
        void shouldCheckUint256() {
            String max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE).toString();
            assertTrue(EthereumAddressValidator.isUint256("0"));
            assertTrue(EthereumAddressValidator.isUint256(max));
            assertFalse(EthereumAddressValidator.isUint256(BigInteger.TWO.pow(256).toString()));
            assertFalse(EthereumAddressValidator.isUint256("-1"));
            assertFalse(EthereumAddressValidator.isUint256("0x10"));
            assertFalse(EthereumAddressValidator.isUint256(null));
        }

        @Test
        @DisplayName("Should name the field when parsing fails")
        void shouldParseBigInteger() {
            assertEquals(BigInteger.valueOf(42), EthereumAddressValidator.parseBigInteger("42", "nonce"));
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EthereumAddressValidator.parseBigInteger("abc", "nonce"));
            assertTrue(ex.getMessage().startsWith("nonce"));
        }
    }
}
