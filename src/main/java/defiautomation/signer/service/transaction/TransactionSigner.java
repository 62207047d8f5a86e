package defiautomation.signer.service.transaction;

import java.math.BigInteger;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.Sign;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import defiautomation.signer.exception.SignerException;
import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.service.signing.SignatureResult;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds, signs and serializes EIP-155 legacy transactions. The private key
 * stays inside the backend; only the 32-byte signing digest crosses over.
 */
@Component
@Slf4j
public class TransactionSigner {

    private static final long EIP155_OFFSET = 35;

    public SignedTransaction signLegacyTransaction(UnsignedLegacyTransaction tx, SigningBackend backend, String keyId) {
        tx.validate();
        long chainId = tx.getChainId();

        RawTransaction raw = RawTransaction.createTransaction(
            tx.getNonce(),
            tx.getGasPrice(),
            tx.getGasLimit(),
            tx.toOrEmpty(),
            tx.valueOrZero(),
            tx.dataOrEmpty()
        );
        byte[] digest = Hash.sha3(TransactionEncoder.encode(raw, chainId));

        SignatureResult signature;
        try {
            signature = backend.signTransaction(keyId, digest);
        } catch (SignerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("Transaction signing failed: " + LogSanitizer.describe(e), e);
        }

        BigInteger v = eip155V(chainId, signature.v());
        Sign.SignatureData eip155Signature = new Sign.SignatureData(
            Numeric.hexStringToByteArray(Numeric.toHexStringWithPrefix(v)),
            signature.r(),
            signature.s()
        );
        byte[] signed = TransactionEncoder.encode(raw, eip155Signature);

        SignedTransaction result = SignedTransaction.builder()
            .rawTransaction(Numeric.toHexString(signed))
            .transactionHash(Numeric.toHexString(Hash.sha3(signed)))
            .chainId(chainId)
            .nonce(tx.getNonce().longValueExact())
            .v(v.longValueExact())
            .build();
        log.debug("Signed legacy transaction {} on chain {} with nonce {}",
            result.getTransactionHash(), chainId, result.getNonce());
        return result;
    }

    /**
     * {@code chainId * 2 + 35 + recoveryId} where the raw v is 27 or 28.
     */
    public static BigInteger eip155V(long chainId, int rawV) {
        if (rawV != 27 && rawV != 28) {
            throw new IllegalArgumentException("Raw v must be 27 or 28");
        }
        return BigInteger.valueOf(chainId)
            .multiply(BigInteger.TWO)
            .add(BigInteger.valueOf(EIP155_OFFSET))
            .add(BigInteger.valueOf(rawV - 27L));
    }
}
