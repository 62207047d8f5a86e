package defiautomation.signer.dto.intent;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Currency a permission grant allows the automation to touch.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "currencyType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CurrencySpec.NativeCurrency.class, name = CurrencySpec.NATIVE),
    @JsonSubTypes.Type(value = CurrencySpec.Erc20Currency.class, name = CurrencySpec.ERC20),
    @JsonSubTypes.Type(value = CurrencySpec.BasicCurrency.class, name = CurrencySpec.BASIC)
})
public interface CurrencySpec {

    String NATIVE = "native";
    String ERC20 = "erc20";
    String BASIC = "basic";

    String currencyType();

    String symbol();

    /** Gas token of a chain. */
    record NativeCurrency(long chainId, String symbol) implements CurrencySpec {
        @Override
        public String currencyType() {
            return NATIVE;
        }
    }

    record Erc20Currency(long chainId, String address, String symbol) implements CurrencySpec {
        @Override
        public String currencyType() {
            return ERC20;
        }
    }

    /** Chain-independent unit such as a fiat quote currency. */
    record BasicCurrency(String symbol) implements CurrencySpec {
        @Override
        public String currencyType() {
            return BASIC;
        }
    }
}
