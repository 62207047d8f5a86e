package defiautomation.signer.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "signer")
public class SignerProperties {

    /** Key custody backend, {@code local} or {@code managed-hsm}. */
    private Backend backend = Backend.LOCAL;

    /** Upper bound on a single backend signature call. */
    private Duration signingTimeout = Duration.ofSeconds(10);

    /** Threads available for backend signature calls. */
    private int signingThreads = 4;

    private Local local = new Local();

    private Hsm hsm = new Hsm();

    private Persistence persistence = new Persistence();

    public enum Backend {
        LOCAL,
        MANAGED_HSM
    }

    @Data
    public static class Local {
        /** 64 hex characters. Can be set via env SIGNER_LOCAL_ENCRYPTION_KEY. */
        private String masterKey;
    }

    @Data
    public static class Hsm {
        private String region;
        /** Falls back to the default AWS credentials chain when blank. */
        private String accessKeyId;
        private String secretAccessKey;
        /** Optional endpoint override, e.g. a local KMS emulator. */
        private String endpoint;
    }

    @Data
    public static class Persistence {
        /** {@code memory} or {@code jdbc}. */
        private String mode = "memory";
    }
}
