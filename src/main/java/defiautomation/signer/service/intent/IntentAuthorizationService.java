package defiautomation.signer.service.intent;

import java.util.Optional;

import org.springframework.stereotype.Service;

import defiautomation.signer.dto.intent.GenericIntent;
import defiautomation.signer.dto.intent.PermissionIntent;
import defiautomation.signer.dto.intent.SignedIntent;
import defiautomation.signer.dto.intent.SignedPermissionIntent;
import defiautomation.signer.service.intent.permission.PermissionIntentVerifier;
import defiautomation.signer.service.wallet.AutomationWallet;
import defiautomation.signer.service.wallet.WalletRegistry;
import defiautomation.signer.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines signature verification with the caller's expectations and
 * resolves the owner's automation wallet.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntentAuthorizationService {

    private final IntentVerifier intentVerifier;
    private final PermissionIntentVerifier permissionIntentVerifier;
    private final WalletRegistry walletRegistry;

    public IntentCheckResult<GenericIntent> checkIntent(SignedIntent signedIntent, IntentCheckOptions options) {
        IntentVerificationResult<GenericIntent> verification = intentVerifier.verify(signedIntent, options.isSkipNonceCheck());
        if (!verification.valid()) {
            log.info("Intent rejected for owner {}: {}", LogSanitizer.maskIdentifier(options.getOwnerRef()), verification.errorCode());
            return IntentCheckResult.rejected(verification.errorCode(), verification.error(), verification.intent());
        }
        GenericIntent intent = verification.intent();

        if (options.getExpectedIntentType() != null && !options.getExpectedIntentType().equals(intent.getIntentType())) {
            return IntentCheckResult.rejected(IntentErrorCode.INTENT_TYPE_MISMATCH,
                "Expected intent type " + options.getExpectedIntentType(), intent);
        }
        if (options.getChainId() != null && !options.getChainId().equals(intent.getChainId())) {
            return IntentCheckResult.rejected(IntentErrorCode.CHAIN_MISMATCH,
                "Intent was signed for chain " + intent.getChainId(), intent);
        }
        return withWallet(options.getOwnerRef(), intent);
    }

    public IntentCheckResult<PermissionIntent> checkPermission(SignedPermissionIntent signedIntent, String ownerRef) {
        IntentVerificationResult<PermissionIntent> verification = permissionIntentVerifier.verify(signedIntent);
        if (!verification.valid()) {
            log.info("Permission intent rejected for owner {}: {}", LogSanitizer.maskIdentifier(ownerRef), verification.errorCode());
            return IntentCheckResult.rejected(verification.errorCode(), verification.error(), verification.intent());
        }
        return withWallet(ownerRef, verification.intent());
    }

    private <T> IntentCheckResult<T> withWallet(String ownerRef, T intent) {
        Optional<AutomationWallet> wallet = walletRegistry.getByOwner(ownerRef);
        if (wallet.isEmpty()) {
            return IntentCheckResult.rejected(IntentErrorCode.WALLET_NOT_FOUND, "No active automation wallet for owner", intent);
        }
        return IntentCheckResult.accepted(intent, wallet.get().getWalletAddress(), wallet.get().getKeyId());
    }
}
