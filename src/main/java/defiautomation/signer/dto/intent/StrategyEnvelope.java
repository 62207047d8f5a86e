package defiautomation.signer.dto.intent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Strategy selection with its free-form configuration. Only a hash of the
 * canonical configuration is signed.
 */
public record StrategyEnvelope(String strategyType, JsonNode config) {
}
