package defiautomation.signer.service.intent.permission;

import java.util.LinkedHashMap;
import java.util.Map;

import defiautomation.signer.dto.intent.CurrencySpec;
import defiautomation.signer.util.EthereumAddressValidator;

/**
 * Fixed-shape encoding of a {@link CurrencySpec}, as hashed in the
 * {@code Currency} struct. Variants without a chain or a token use 0 and the
 * zero address.
 */
public record FlatCurrency(String currencyType, long chainId, String tokenAddress, String symbol) {

    public static FlatCurrency flatten(CurrencySpec currency) {
        if (currency instanceof CurrencySpec.NativeCurrency nativeCurrency) {
            return new FlatCurrency(CurrencySpec.NATIVE, nativeCurrency.chainId(),
                EthereumAddressValidator.ZERO_ADDRESS, nativeCurrency.symbol());
        }
        if (currency instanceof CurrencySpec.Erc20Currency erc20) {
            return new FlatCurrency(CurrencySpec.ERC20, erc20.chainId(), erc20.address(), erc20.symbol());
        }
        if (currency instanceof CurrencySpec.BasicCurrency basic) {
            return new FlatCurrency(CurrencySpec.BASIC, 0L, EthereumAddressValidator.ZERO_ADDRESS, basic.symbol());
        }
        throw new IllegalArgumentException("Unsupported currency variant: " + (currency == null ? "null" : currency.getClass().getSimpleName()));
    }

    public CurrencySpec unflatten() {
        return switch (currencyType) {
            case CurrencySpec.NATIVE -> new CurrencySpec.NativeCurrency(chainId, symbol);
            case CurrencySpec.ERC20 -> new CurrencySpec.Erc20Currency(chainId, tokenAddress, symbol);
            case CurrencySpec.BASIC -> new CurrencySpec.BasicCurrency(symbol);
            default -> throw new IllegalArgumentException("Unknown currency type: " + currencyType);
        };
    }

    Map<String, Object> toMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("currencyType", currencyType);
        message.put("chainId", chainId);
        message.put("tokenAddress", tokenAddress);
        message.put("symbol", symbol == null ? "" : symbol);
        return message;
    }
}
