package defiautomation.signer.service.intent;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Sign;

import defiautomation.signer.dto.intent.GenericIntent;
import defiautomation.signer.dto.intent.SignedIntent;
import defiautomation.signer.service.intent.typeddata.Eip712Domain;
import defiautomation.signer.service.intent.typeddata.Eip712Encoder;
import defiautomation.signer.service.signing.SignatureRecovery;
import defiautomation.signer.util.EthereumAddressValidator;
import defiautomation.signer.util.LogSanitizer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies single-use EIP-712 intents. Verification itself has no side
 * effects; consumption is recorded separately with {@link #recordNonceUsed}.
 */
@Component
@Slf4j
public class IntentVerifier {

    private final String domainName;
    private final String domainVersion;
    private final Validator validator;
    private final Clock clock;
    private final IntentNonceRepository nonceRepository;

    public IntentVerifier(
        @Value("${intent.domain.name:DefiAutomation}") String domainName,
        @Value("${intent.domain.version:1}") String domainVersion,
        Validator validator,
        Clock clock,
        IntentNonceRepository nonceRepository
    ) {
        this.domainName = domainName;
        this.domainVersion = domainVersion;
        this.validator = validator;
        this.clock = clock;
        this.nonceRepository = nonceRepository;
    }

    public IntentVerificationResult<GenericIntent> verify(SignedIntent signedIntent) {
        return verify(signedIntent, false);
    }

    public IntentVerificationResult<GenericIntent> verify(SignedIntent signedIntent, boolean skipNonceCheck) {
        if (signedIntent == null) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, "Signed intent is required", null);
        }
        GenericIntent intent = signedIntent.getIntent();
        Set<ConstraintViolation<SignedIntent>> violations = validator.validate(signedIntent);
        if (!violations.isEmpty()) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, describe(violations), intent);
        }
        if (!EthereumAddressValidator.isUint256(intent.getNonce())) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, "intent.nonce must fit in uint256", intent);
        }

        Optional<IntentType> type = IntentType.fromWireValue(intent.getIntentType());
        if (type.isEmpty()) {
            return IntentVerificationResult.rejected(IntentErrorCode.UNKNOWN_INTENT_TYPE,
                "Unknown intent type: " + LogSanitizer.sanitize(intent.getIntentType()), intent);
        }
        Optional<String> payloadProblem = type.get().validatePayload(intent.getFields());
        if (payloadProblem.isPresent()) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, payloadProblem.get(), intent);
        }

        if (isExpired(intent)) {
            return IntentVerificationResult.rejected(IntentErrorCode.INTENT_EXPIRED, "Intent has expired", intent);
        }

        String recovered;
        try {
            Sign.SignatureData signature = SignatureRecovery.fromHex(signedIntent.getSignature());
            recovered = SignatureRecovery.recoverAddress(digest(type.get(), intent), signature);
        } catch (Exception ex) {
            log.warn("Intent signature recovery failed for signer {}: {}",
                LogSanitizer.maskIdentifier(intent.getSigner()), LogSanitizer.describe(ex));
            recovered = null;
        }
        if (recovered == null) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SIGNATURE, "Signature could not be recovered", intent);
        }
        if (!EthereumAddressValidator.sameAddress(recovered, intent.getSigner())) {
            return IntentVerificationResult.rejected(IntentErrorCode.SIGNER_MISMATCH,
                "Recovered signer does not match intent signer", intent, recovered);
        }

        BigInteger nonce = new BigInteger(intent.getNonce());
        if (!skipNonceCheck && nonceRepository.isUsed(intent.getSigner(), intent.getChainId(), nonce)) {
            return IntentVerificationResult.rejected(IntentErrorCode.NONCE_USED, "Intent nonce already used", intent, recovered);
        }
        return IntentVerificationResult.accepted(intent, recovered);
    }

    /**
     * Marks the intent's nonce as consumed. The nonce is recorded by numeric
     * value, so "1" and "01" name the same slot.
     *
     * @return false when it was already consumed
     */
    public boolean recordNonceUsed(GenericIntent intent) {
        boolean recorded = nonceRepository.markUsed(
            intent.getSigner(), intent.getChainId(), new BigInteger(intent.getNonce()), intent.getIntentType(), clock.instant());
        if (!recorded) {
            log.warn("Intent nonce {} for signer {} on chain {} was already consumed",
                LogSanitizer.sanitize(intent.getNonce()), LogSanitizer.maskIdentifier(intent.getSigner()), intent.getChainId());
        }
        return recorded;
    }

    public Eip712Domain domain(long chainId) {
        return new Eip712Domain(domainName, domainVersion, chainId);
    }

    /**
     * EIP-712 digest the signer is expected to have signed.
     *
     * @throws IllegalArgumentException for unknown types or malformed payloads
     */
    public byte[] digest(GenericIntent intent) {
        IntentType type = IntentType.fromWireValue(intent.getIntentType())
            .orElseThrow(() -> new IllegalArgumentException("Unknown intent type"));
        return digest(type, intent);
    }

    private byte[] digest(IntentType type, GenericIntent intent) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("intentType", intent.getIntentType());
        message.put("signer", intent.getSigner());
        message.put("chainId", BigInteger.valueOf(intent.getChainId()));
        message.put("nonce", new BigInteger(intent.getNonce()));
        message.put("expiresAt", BigInteger.valueOf(intent.getExpiresAt() == null ? 0L : intent.getExpiresAt()));
        if (intent.getFields() != null) {
            message.putAll(intent.getFields());
        }
        return Eip712Encoder.digest(domain(intent.getChainId()), type.getStructType(), message);
    }

    private boolean isExpired(GenericIntent intent) {
        Long expiresAt = intent.getExpiresAt();
        if (expiresAt == null || expiresAt == 0L) {
            return false;
        }
        return clock.instant().getEpochSecond() > expiresAt;
    }

    private static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
            .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
            .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
            .collect(Collectors.joining("; "));
    }
}
