package defiautomation.signer.dto.intent;

/**
 * Kind of on-chain action a permission grant allows.
 *
 * @param contractAddress optional; when set, only this contract is covered
 */
public record AllowedEffect(String effectType, long chainId, String contractAddress) {
}
