package defiautomation.signer.service.signing;

import java.math.BigInteger;
import java.util.Arrays;

import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import defiautomation.signer.exception.SigningFailedException;

/**
 * Helpers for the DER and SPKI encodings returned by managed key services.
 */
public final class DerSignatures {

    private static final BigInteger CURVE_ORDER = Sign.CURVE_PARAMS.getN();
    private static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);
    private static final int UNCOMPRESSED_POINT_LENGTH = 65;
    private static final byte UNCOMPRESSED_POINT_PREFIX = 0x04;
    private static final byte SEQUENCE_TAG = 0x30;
    private static final byte INTEGER_TAG = 0x02;

    private DerSignatures() {
        // Utility class
    }

    /**
     * Parses a DER {@code SEQUENCE { INTEGER r, INTEGER s }}. A leading
     * {@code 0x00} sign pad on either integer is stripped.
     *
     * @return two-element array holding r then s
     */
    public static BigInteger[] parse(byte[] der) {
        if (der == null || der.length < 8 || der[0] != SEQUENCE_TAG) {
            throw new SigningFailedException("Malformed DER signature: missing sequence");
        }
        int offset = 2;
        if ((der[1] & 0x80) != 0) {
            // long-form length, only one length byte is meaningful for a 72-byte signature
            offset += der[1] & 0x7f;
        }
        int[] cursor = {offset};
        BigInteger r = readInteger(der, cursor);
        BigInteger s = readInteger(der, cursor);
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(CURVE_ORDER) >= 0 || s.compareTo(CURVE_ORDER) >= 0) {
            throw new SigningFailedException("DER signature component out of range");
        }
        return new BigInteger[] {r, s};
    }

    private static BigInteger readInteger(byte[] der, int[] cursor) {
        int position = cursor[0];
        if (position + 2 > der.length || der[position] != INTEGER_TAG) {
            throw new SigningFailedException("Malformed DER signature: expected integer");
        }
        int length = der[position + 1] & 0xff;
        int start = position + 2;
        if (length == 0 || start + length > der.length) {
            throw new SigningFailedException("Malformed DER signature: bad integer length");
        }
        byte[] value = Arrays.copyOfRange(der, start, start + length);
        if (value.length > 1 && value[0] == 0x00) {
            value = Arrays.copyOfRange(value, 1, value.length);
        }
        if (value.length > SignatureResult.COMPONENT_LENGTH) {
            throw new SigningFailedException("Malformed DER signature: integer longer than 32 bytes");
        }
        cursor[0] = start + length;
        return new BigInteger(1, value);
    }

    /**
     * Returns {@code n - s} when s is in the upper half of the curve order.
     */
    public static BigInteger normalizeLowS(BigInteger s) {
        return s.compareTo(HALF_CURVE_ORDER) > 0 ? CURVE_ORDER.subtract(s) : s;
    }

    public static boolean isLowS(BigInteger s) {
        return s.compareTo(HALF_CURVE_ORDER) <= 0;
    }

    /**
     * Extracts the uncompressed secp256k1 point from a SubjectPublicKeyInfo
     * structure and derives the checksummed address.
     */
    public static String addressFromSpki(byte[] spki) {
        if (spki == null || spki.length < UNCOMPRESSED_POINT_LENGTH) {
            throw new SigningFailedException("Public key too short");
        }
        for (int offset = spki.length - UNCOMPRESSED_POINT_LENGTH; offset >= 0; offset--) {
            if (spki[offset] == UNCOMPRESSED_POINT_PREFIX) {
                byte[] point = Arrays.copyOfRange(spki, offset + 1, offset + UNCOMPRESSED_POINT_LENGTH);
                return Keys.toChecksumAddress(Keys.getAddress(new BigInteger(1, point)));
            }
        }
        throw new SigningFailedException("No uncompressed public key point found");
    }
}
