package defiautomation.signer.support;

import java.math.BigInteger;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import defiautomation.signer.service.signing.local.InMemoryKeyMaterialRepository;
import defiautomation.signer.service.signing.local.LocalSigner;

/**
 * Well-known development keys and signing helpers shared by tests.
 */
public final class TestKeys {

    public static final String MASTER_KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    /** First Hardhat/Anvil development account. */
    public static final String PRIVATE_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    public static final String ADDRESS = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";

    /** Second Hardhat/Anvil development account. */
    public static final String OTHER_PRIVATE_KEY = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";
    public static final String OTHER_ADDRESS = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";

    private TestKeys() {
    }

    public static LocalSigner localSigner() {
        return new LocalSigner(new InMemoryKeyMaterialRepository(), MASTER_KEY);
    }

    public static ECKeyPair keyPair(String privateKeyHex) {
        return ECKeyPair.create(Numeric.toBigInt(privateKeyHex));
    }

    /**
     * Signs a raw digest and returns the 65-byte {@code r || s || v} hex string.
     */
    public static String signDigest(byte[] digest, String privateKeyHex) {
        Sign.SignatureData data = Sign.signMessage(digest, keyPair(privateKeyHex), false);
        byte[] out = new byte[65];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return Numeric.toHexString(out);
    }

    public static BigInteger curveOrder() {
        return Sign.CURVE_PARAMS.getN();
    }
}
