package defiautomation.signer.dto.intent;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-use authorization signed by a user: common fields plus a payload
 * whose shape depends on {@link #intentType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenericIntent {

    @NotBlank
    private String intentType;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "must be a 20-byte hex address")
    private String signer;

    @NotNull
    @Positive
    private Long chainId;

    /** Decimal uint256 without leading zeros; unique per (signer, chainId). */
    @NotBlank
    @Pattern(regexp = "^(0|[1-9][0-9]{0,77})$", message = "must be a decimal integer without leading zeros")
    private String nonce;

    /** Epoch seconds; absent means no expiry. */
    @PositiveOrZero
    private Long expiresAt;

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();
}
