package defiautomation.signer.service.intent.typeddata;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

/**
 * EIP-712 domain with a name, a version and an optional chain id. Without a
 * chain id the domain type is {@code EIP712Domain(string name,string version)}.
 */
public record Eip712Domain(String name, String version, Long chainId) {

    public static final String DOMAIN_TYPE_WITH_CHAIN = "EIP712Domain(string name,string version,uint256 chainId)";
    public static final String DOMAIN_TYPE_WITHOUT_CHAIN = "EIP712Domain(string name,string version)";

    public static Eip712Domain withoutChain(String name, String version) {
        return new Eip712Domain(name, version, null);
    }

    public String domainType() {
        return chainId == null ? DOMAIN_TYPE_WITHOUT_CHAIN : DOMAIN_TYPE_WITH_CHAIN;
    }

    public byte[] separator() {
        byte[] typeHash = Hash.sha3(domainType().getBytes(StandardCharsets.UTF_8));
        String encodedHex = chainId == null
            ? Eip712Encoder.encodeTypes(
                new Bytes32(typeHash),
                new Bytes32(Hash.sha3(name.getBytes(StandardCharsets.UTF_8))),
                new Bytes32(Hash.sha3(version.getBytes(StandardCharsets.UTF_8))))
            : Eip712Encoder.encodeTypes(
                new Bytes32(typeHash),
                new Bytes32(Hash.sha3(name.getBytes(StandardCharsets.UTF_8))),
                new Bytes32(Hash.sha3(version.getBytes(StandardCharsets.UTF_8))),
                new Uint256(BigInteger.valueOf(chainId)));
        return Hash.sha3(Numeric.hexStringToByteArray(encodedHex));
    }
}
