package defiautomation.signer.service.signing;

import java.math.BigInteger;
import java.security.SignatureException;

import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * Recovers signer addresses from raw digests.
 */
public final class SignatureRecovery {

    private SignatureRecovery() {
        // Utility class
    }

    /**
     * @return checksummed address, or {@code null} when recovery fails
     */
    public static String recoverAddress(byte[] digest, Sign.SignatureData signature) {
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(digest, signature);
            return Keys.toChecksumAddress(Keys.getAddress(publicKey));
        } catch (SignatureException | IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * Parses a 65-byte hex signature ({@code r || s || v}). A v of 0 or 1 is
     * lifted to 27 or 28.
     *
     * @throws IllegalArgumentException if the signature is malformed
     */
    public static Sign.SignatureData fromHex(String signatureHex) {
        byte[] bytes;
        try {
            bytes = Numeric.hexStringToByteArray(signatureHex);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Signature is not valid hex", ex);
        }
        if (bytes.length != SignatureResult.SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature must be 65 bytes");
        }
        byte v = bytes[64];
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new IllegalArgumentException("Signature recovery byte must be 27 or 28");
        }
        byte[] r = new byte[32];
        byte[] s = new byte[32];
        System.arraycopy(bytes, 0, r, 0, 32);
        System.arraycopy(bytes, 32, s, 0, 32);
        return new Sign.SignatureData(v, r, s);
    }
}
