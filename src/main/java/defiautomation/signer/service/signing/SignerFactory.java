package defiautomation.signer.service.signing;

import java.net.URI;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import defiautomation.signer.config.SignerProperties;
import defiautomation.signer.exception.ConfigurationException;
import defiautomation.signer.service.signing.hsm.AwsKmsHsmClient;
import defiautomation.signer.service.signing.hsm.HsmClient;
import defiautomation.signer.service.signing.hsm.ManagedHsmSigner;
import defiautomation.signer.service.signing.local.KeyMaterialRepository;
import defiautomation.signer.service.signing.local.LocalSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;

/**
 * Builds the configured {@link SigningBackend}. Called once at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignerFactory {

    private final SignerProperties properties;
    private final ObjectProvider<KeyMaterialRepository> keyMaterialRepository;
    private final ObjectProvider<HsmClient> hsmClient;

    public SigningBackend create() {
        SignerProperties.Backend backend = properties.getBackend() != null
            ? properties.getBackend()
            : SignerProperties.Backend.LOCAL;
        return switch (backend) {
            case LOCAL -> {
                log.warn("Using local signer. Keys are encrypted in the application database; do not use in production.");
                KeyMaterialRepository repository = keyMaterialRepository.getIfAvailable();
                if (repository == null) {
                    throw new ConfigurationException("No key material repository available for the local signer");
                }
                yield new LocalSigner(repository, properties.getLocal().getMasterKey());
            }
            case MANAGED_HSM -> new ManagedHsmSigner(hsmClient.getIfAvailable(() -> new AwsKmsHsmClient(buildKmsClient())));
        };
    }

    KmsClient buildKmsClient() {
        SignerProperties.Hsm hsm = properties.getHsm();
        if (isBlank(hsm.getRegion())) {
            throw new ConfigurationException("signer.hsm.region is required for the managed-hsm backend");
        }
        KmsClientBuilder builder = KmsClient.builder()
            .region(Region.of(hsm.getRegion()))
            .credentialsProvider(credentialsProvider(hsm));
        if (!isBlank(hsm.getEndpoint())) {
            try {
                builder.endpointOverride(URI.create(hsm.getEndpoint()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("signer.hsm.endpoint is not a valid URI", e);
            }
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider(SignerProperties.Hsm hsm) {
        boolean hasKeyId = !isBlank(hsm.getAccessKeyId());
        boolean hasSecret = !isBlank(hsm.getSecretAccessKey());
        if (hasKeyId != hasSecret) {
            throw new ConfigurationException("signer.hsm.access-key-id and signer.hsm.secret-access-key must be set together");
        }
        if (hasKeyId) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(hsm.getAccessKeyId(), hsm.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
