package defiautomation.signer.dto.intent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignedIntent {

    @Valid
    @NotNull
    private GenericIntent intent;

    /** 65-byte r || s || v. */
    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{130}$", message = "must be a 65-byte hex signature")
    private String signature;
}
