package defiautomation.signer.service.intent.permission;

import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Sign;

import defiautomation.signer.dto.intent.PermissionIntent;
import defiautomation.signer.dto.intent.SignedPermissionIntent;
import defiautomation.signer.service.intent.IntentErrorCode;
import defiautomation.signer.service.intent.IntentVerificationResult;
import defiautomation.signer.service.signing.SignatureRecovery;
import defiautomation.signer.util.EthereumAddressValidator;
import defiautomation.signer.util.LogSanitizer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies signed permission grants. Grants are not single-use, so there is
 * no nonce, expiry or persistence on this path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PermissionIntentVerifier {

    private final PermissionIntentCodec codec;
    private final Validator validator;

    public IntentVerificationResult<PermissionIntent> verify(SignedPermissionIntent signedIntent) {
        if (signedIntent == null) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, "Signed permission intent is required", null);
        }
        PermissionIntent intent = signedIntent.getIntent();
        Set<ConstraintViolation<SignedPermissionIntent>> violations = validator.validate(signedIntent);
        if (!violations.isEmpty()) {
            String error = violations.stream()
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, error, intent);
        }

        byte[] digest;
        try {
            digest = codec.digest(intent);
        } catch (IllegalArgumentException ex) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SCHEMA, LogSanitizer.describe(ex), intent);
        }

        String recovered;
        try {
            Sign.SignatureData signature = SignatureRecovery.fromHex(signedIntent.getSignature());
            recovered = SignatureRecovery.recoverAddress(digest, signature);
        } catch (Exception ex) {
            log.warn("Permission signature recovery failed for intent {}: {}",
                LogSanitizer.sanitize(intent.getId()), LogSanitizer.describe(ex));
            recovered = null;
        }
        if (recovered == null) {
            return IntentVerificationResult.rejected(IntentErrorCode.INVALID_SIGNATURE, "Signature could not be recovered", intent);
        }
        if (!EthereumAddressValidator.sameAddress(recovered, intent.getSigner())) {
            return IntentVerificationResult.rejected(IntentErrorCode.SIGNER_MISMATCH,
                "Recovered signer does not match intent signer", intent, recovered);
        }
        return IntentVerificationResult.accepted(intent, recovered);
    }
}
