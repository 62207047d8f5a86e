package defiautomation.signer.dto.intent;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Long-lived grant describing which currencies and effects a strategy may use.
 * Carries no nonce and no expiry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermissionIntent {

    @NotBlank
    private String id;

    @NotNull
    private String name;

    @NotNull
    private String description;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "must be a 20-byte hex address")
    private String signer;

    @NotNull
    @Builder.Default
    private List<@NotNull CurrencySpec> allowedCurrencies = new ArrayList<>();

    @NotNull
    @Builder.Default
    private List<@NotNull AllowedEffect> allowedEffects = new ArrayList<>();

    @Valid
    @NotNull
    private StrategyEnvelope strategyEnvelope;
}
