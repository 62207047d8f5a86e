package defiautomation.signer.service.intent.permission;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import defiautomation.signer.dto.intent.AllowedEffect;
import defiautomation.signer.dto.intent.PermissionIntent;
import defiautomation.signer.dto.intent.StrategyEnvelope;
import defiautomation.signer.service.intent.typeddata.Eip712Domain;
import defiautomation.signer.service.intent.typeddata.Eip712Encoder;
import defiautomation.signer.service.intent.typeddata.Eip712StructType;
import defiautomation.signer.util.EthereumAddressValidator;

/**
 * Maps permission grants onto their EIP-712 structs and computes the signing digest.
 */
@Component
public class PermissionIntentCodec {

    public static final Eip712StructType CURRENCY_TYPE = Eip712StructType.parse(
        "Currency(string currencyType,uint256 chainId,address tokenAddress,string symbol)");
    public static final Eip712StructType EFFECT_TYPE = Eip712StructType.parse(
        "Effect(string effectType,uint256 chainId,address contractAddress)");
    public static final Eip712StructType STRATEGY_TYPE = Eip712StructType.parse(
        "Strategy(string strategyType,bytes32 configHash)");
    public static final Eip712StructType PERMISSION_TYPE = Eip712StructType.parse(
        "PermissionIntent(string id,string name,string description,address signer,"
            + "Currency[] allowedCurrencies,Effect[] allowedEffects,Strategy strategyEnvelope)",
        CURRENCY_TYPE, EFFECT_TYPE, STRATEGY_TYPE);

    private final ObjectWriter canonicalWriter;
    private final Eip712Domain domain;

    public PermissionIntentCodec(
        ObjectMapper objectMapper,
        @Value("${intent.permission.domain.name:DefiAutomation Permissions}") String domainName,
        @Value("${intent.permission.domain.version:1}") String domainVersion
    ) {
        this.canonicalWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.domain = Eip712Domain.withoutChain(domainName, domainVersion);
    }

    public byte[] digest(PermissionIntent intent) {
        return Eip712Encoder.digest(domain, PERMISSION_TYPE, toMessage(intent));
    }

    public Map<String, Object> toMessage(PermissionIntent intent) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", intent.getId());
        message.put("name", intent.getName());
        message.put("description", intent.getDescription());
        message.put("signer", intent.getSigner());
        message.put("allowedCurrencies", intent.getAllowedCurrencies().stream()
            .map(FlatCurrency::flatten)
            .map(FlatCurrency::toMessage)
            .collect(Collectors.toList()));
        message.put("allowedEffects", intent.getAllowedEffects().stream()
            .map(this::effectMessage)
            .collect(Collectors.toList()));
        message.put("strategyEnvelope", strategyMessage(intent.getStrategyEnvelope()));
        return message;
    }

    /**
     * keccak256 of the configuration serialized with object keys sorted at every level.
     */
    public String configHash(JsonNode config) {
        return Numeric.toHexString(Hash.sha3(canonicalJson(config).getBytes(StandardCharsets.UTF_8)));
    }

    public String canonicalJson(JsonNode config) {
        try {
            return canonicalWriter.writeValueAsString(sortKeys(config == null ? NullNode.getInstance() : config));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Strategy config is not serializable", e);
        }
    }

    private Map<String, Object> effectMessage(AllowedEffect effect) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("effectType", effect.effectType());
        message.put("chainId", effect.chainId());
        message.put("contractAddress", effect.contractAddress() == null || effect.contractAddress().isBlank()
            ? EthereumAddressValidator.ZERO_ADDRESS
            : effect.contractAddress());
        return message;
    }

    private Map<String, Object> strategyMessage(StrategyEnvelope envelope) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("strategyType", envelope.strategyType());
        message.put("configHash", configHash(envelope.config()));
        return message;
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), sortKeys(field.getValue()));
            }
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            sorted.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            node.forEach(item -> out.add(sortKeys(item)));
            return out;
        }
        return node;
    }
}
