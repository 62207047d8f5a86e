package defiautomation.signer.service.signing.hsm;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import defiautomation.signer.exception.ConfigurationException;
import defiautomation.signer.exception.KeyNotFoundException;
import defiautomation.signer.exception.RecoveryFailedException;
import defiautomation.signer.exception.SignerException;
import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.service.signing.DerSignatures;
import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.signing.SignatureRecovery;
import defiautomation.signer.service.signing.SignatureResult;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.signing.SigningKey;
import defiautomation.signer.util.EthereumAddressValidator;
import defiautomation.signer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Production signer. Private keys never leave the HSM; this class turns the
 * DER signatures it returns into Ethereum {@code (r, s, v)} form.
 *
 * <ul>
 *   <li>s is folded into the lower half of the curve order</li>
 *   <li>v is found by recovering with 27 and 28 and keeping the one that
 *       yields the key's address</li>
 * </ul>
 */
@Slf4j
public class ManagedHsmSigner implements SigningBackend {

    private static final int[] RECOVERY_CANDIDATES = {27, 28};

    private final HsmClient hsmClient;
    private final Map<String, String> addressCache = new ConcurrentHashMap<>();

    public ManagedHsmSigner(HsmClient hsmClient) {
        this.hsmClient = hsmClient;
    }

    @Override
    public SigningKey createKey(String label) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("Purpose", "automation-wallet");
        if (label != null && !label.isBlank()) {
            tags.put("Label", LogSanitizer.sanitize(label));
        }
        String keyId = hsmClient.createKey("Automation wallet signing key", tags);
        String address = getAddress(keyId);
        log.info("Created HSM key {} for {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.maskIdentifier(address));
        return SigningKey.managed(keyId, address);
    }

    @Override
    public String getAddress(String keyId) {
        String cached = addressCache.get(keyId);
        if (cached != null) {
            return cached;
        }
        String address = DerSignatures.addressFromSpki(hsmClient.getPublicKey(keyId));
        addressCache.put(keyId, address);
        return address;
    }

    @Override
    public SignatureResult signHash(String keyId, byte[] hash) {
        if (hash == null || hash.length != 32) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        long started = System.nanoTime();
        String expectedAddress = getAddress(keyId);
        byte[] der;
        try {
            der = hsmClient.sign(keyId, hash);
        } catch (SignerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningFailedException("HSM signing failed for key " + LogSanitizer.maskIdentifier(keyId), e);
        }

        BigInteger[] rs = DerSignatures.parse(der);
        BigInteger r = rs[0];
        BigInteger s = DerSignatures.normalizeLowS(rs[1]);
        byte[] rBytes = Numeric.toBytesPadded(r, SignatureResult.COMPONENT_LENGTH);
        byte[] sBytes = Numeric.toBytesPadded(s, SignatureResult.COMPONENT_LENGTH);

        for (int v : RECOVERY_CANDIDATES) {
            String recovered = SignatureRecovery.recoverAddress(hash, new Sign.SignatureData((byte) v, rBytes, sBytes));
            if (EthereumAddressValidator.sameAddress(recovered, expectedAddress)) {
                log.debug("HSM signature produced for key {} in {} ms",
                    LogSanitizer.maskIdentifier(keyId), (System.nanoTime() - started) / 1_000_000);
                return SignatureResult.of(r, s, v);
            }
        }
        log.error("No recovery id matches the address of key {}", LogSanitizer.maskIdentifier(keyId));
        throw new RecoveryFailedException("Could not determine recovery id for key " + LogSanitizer.maskIdentifier(keyId));
    }

    @Override
    public void discardKey(String keyId) {
        hsmClient.scheduleKeyDeletion(keyId);
        addressCache.remove(keyId);
    }

    @Override
    public KeyProvider provider() {
        return KeyProvider.MANAGED_HSM;
    }

    @Override
    public void validateConfig() {
        try {
            hsmClient.verifyAccess();
        } catch (KeyNotFoundException | SigningFailedException e) {
            throw new ConfigurationException("Managed HSM is not usable: " + LogSanitizer.describe(e), e);
        }
        log.info("Managed HSM signer ready");
    }
}
