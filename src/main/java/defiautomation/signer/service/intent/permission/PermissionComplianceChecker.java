package defiautomation.signer.service.intent.permission;

import org.springframework.stereotype.Component;

import defiautomation.signer.dto.intent.AllowedEffect;
import defiautomation.signer.dto.intent.CurrencySpec;
import defiautomation.signer.dto.intent.PermissionIntent;
import defiautomation.signer.util.EthereumAddressValidator;

/**
 * Checks a concrete token action against a verified permission grant.
 */
@Component
public class PermissionComplianceChecker {

    /**
     * An action is allowed when the token is an allowed ERC-20 on the chain and
     * an allowed effect of the same type covers the chain. An effect naming a
     * contract only covers that contract.
     */
    public ComplianceResult checkTokenEffect(PermissionIntent intent, long chainId, String tokenAddress, String effectType) {
        boolean currencyAllowed = intent.getAllowedCurrencies().stream()
            .filter(CurrencySpec.Erc20Currency.class::isInstance)
            .map(CurrencySpec.Erc20Currency.class::cast)
            .anyMatch(currency -> currency.chainId() == chainId
                && EthereumAddressValidator.sameAddress(currency.address(), tokenAddress));
        if (!currencyAllowed) {
            return ComplianceResult.deny(ComplianceResult.Code.CURRENCY_NOT_ALLOWED,
                "Token is not an allowed currency on chain " + chainId);
        }

        boolean effectAllowed = intent.getAllowedEffects().stream()
            .anyMatch(effect -> covers(effect, chainId, tokenAddress, effectType));
        if (!effectAllowed) {
            return ComplianceResult.deny(ComplianceResult.Code.EFFECT_NOT_ALLOWED,
                "Effect " + effectType + " is not allowed on chain " + chainId);
        }
        return ComplianceResult.allow();
    }

    private static boolean covers(AllowedEffect effect, long chainId, String tokenAddress, String effectType) {
        if (!effect.effectType().equals(effectType) || effect.chainId() != chainId) {
            return false;
        }
        String contract = effect.contractAddress();
        return contract == null
            || contract.isBlank()
            || EthereumAddressValidator.isZeroAddress(contract)
            || EthereumAddressValidator.sameAddress(contract, tokenAddress);
    }
}
