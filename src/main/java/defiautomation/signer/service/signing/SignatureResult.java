package defiautomation.signer.service.signing;

import java.math.BigInteger;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * Raw ECDSA signature over a 32-byte digest.
 *
 * @param r         32-byte big-endian r
 * @param s         32-byte big-endian s, always in low-s form
 * @param v         27 or 28
 * @param signature 65-byte concatenation r || s || v
 */
public record SignatureResult(byte[] r, byte[] s, int v, byte[] signature) {

    public static final int COMPONENT_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 65;

    public SignatureResult {
        if (r == null || r.length != COMPONENT_LENGTH || s == null || s.length != COMPONENT_LENGTH) {
            throw new IllegalArgumentException("r and s must be 32 bytes");
        }
        if (v != 27 && v != 28) {
            throw new IllegalArgumentException("v must be 27 or 28, got " + v);
        }
        r = r.clone();
        s = s.clone();
        signature = signature == null ? concat(r, s, v) : signature.clone();
    }

    public static SignatureResult of(BigInteger r, BigInteger s, int v) {
        return new SignatureResult(
            Numeric.toBytesPadded(r, COMPONENT_LENGTH),
            Numeric.toBytesPadded(s, COMPONENT_LENGTH),
            v,
            null
        );
    }

    public static SignatureResult fromSignatureData(Sign.SignatureData data) {
        return new SignatureResult(data.getR(), data.getS(), Byte.toUnsignedInt(data.getV()[0]), null);
    }

    public BigInteger sValue() {
        return new BigInteger(1, s);
    }

    public Sign.SignatureData toSignatureData() {
        return new Sign.SignatureData((byte) v, r.clone(), s.clone());
    }

    public String signatureHex() {
        return Numeric.toHexString(signature);
    }

    private static byte[] concat(byte[] r, byte[] s, int v) {
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(r, 0, out, 0, COMPONENT_LENGTH);
        System.arraycopy(s, 0, out, COMPONENT_LENGTH, COMPONENT_LENGTH);
        out[64] = (byte) v;
        return out;
    }
}
