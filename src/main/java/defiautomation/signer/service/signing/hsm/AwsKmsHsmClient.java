package defiautomation.signer.service.signing.hsm;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import defiautomation.signer.exception.KeyNotFoundException;
import defiautomation.signer.exception.SigningFailedException;
import defiautomation.signer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.CreateKeyRequest;
import software.amazon.awssdk.services.kms.model.CreateKeyResponse;
import software.amazon.awssdk.services.kms.model.GetPublicKeyRequest;
import software.amazon.awssdk.services.kms.model.KeySpec;
import software.amazon.awssdk.services.kms.model.KeyUsageType;
import software.amazon.awssdk.services.kms.model.ListKeysRequest;
import software.amazon.awssdk.services.kms.model.MessageType;
import software.amazon.awssdk.services.kms.model.NotFoundException;
import software.amazon.awssdk.services.kms.model.ScheduleKeyDeletionRequest;
import software.amazon.awssdk.services.kms.model.SignRequest;
import software.amazon.awssdk.services.kms.model.SigningAlgorithmSpec;
import software.amazon.awssdk.services.kms.model.Tag;

/**
 * {@link HsmClient} backed by AWS KMS asymmetric {@code ECC_SECG_P256K1} keys.
 */
@Slf4j
public class AwsKmsHsmClient implements HsmClient {

    private static final int DELETION_WINDOW_DAYS = 7;

    private final KmsClient kmsClient;

    public AwsKmsHsmClient(KmsClient kmsClient) {
        this.kmsClient = kmsClient;
    }

    @Override
    public String createKey(String description, Map<String, String> tags) {
        List<Tag> kmsTags = tags == null ? List.of() : tags.entrySet().stream()
            .map(entry -> Tag.builder().tagKey(entry.getKey()).tagValue(entry.getValue()).build())
            .collect(Collectors.toList());
        try {
            CreateKeyResponse response = kmsClient.createKey(CreateKeyRequest.builder()
                .description(description)
                .keySpec(KeySpec.ECC_SECG_P256_K1)
                .keyUsage(KeyUsageType.SIGN_VERIFY)
                .tags(kmsTags)
                .build());
            String keyId = response.keyMetadata().keyId();
            log.info("Created KMS key {}", LogSanitizer.maskIdentifier(keyId));
            return keyId;
        } catch (SdkException e) {
            log.error("KMS key creation failed: {}", LogSanitizer.describe(e));
            throw new SigningFailedException("KMS key creation failed", e);
        }
    }

    @Override
    public byte[] getPublicKey(String keyId) {
        try {
            return kmsClient.getPublicKey(GetPublicKeyRequest.builder().keyId(keyId).build())
                .publicKey()
                .asByteArray();
        } catch (NotFoundException e) {
            throw new KeyNotFoundException(keyId, e);
        } catch (SdkException e) {
            log.error("KMS public key lookup failed for {}: {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.describe(e));
            throw new SigningFailedException("KMS public key lookup failed", e);
        }
    }

    @Override
    public byte[] sign(String keyId, byte[] digest) {
        try {
            return kmsClient.sign(SignRequest.builder()
                    .keyId(keyId)
                    .message(SdkBytes.fromByteArray(digest))
                    .messageType(MessageType.DIGEST)
                    .signingAlgorithm(SigningAlgorithmSpec.ECDSA_SHA_256)
                    .build())
                .signature()
                .asByteArray();
        } catch (NotFoundException e) {
            throw new KeyNotFoundException(keyId, e);
        } catch (SdkException e) {
            log.error("KMS sign failed for {}: {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.describe(e));
            throw new SigningFailedException("KMS sign failed", e);
        }
    }

    @Override
    public void scheduleKeyDeletion(String keyId) {
        try {
            kmsClient.scheduleKeyDeletion(ScheduleKeyDeletionRequest.builder()
                .keyId(keyId)
                .pendingWindowInDays(DELETION_WINDOW_DAYS)
                .build());
            log.info("Scheduled KMS key {} for deletion in {} days", LogSanitizer.maskIdentifier(keyId), DELETION_WINDOW_DAYS);
        } catch (NotFoundException e) {
            throw new KeyNotFoundException(keyId, e);
        } catch (SdkException e) {
            log.error("KMS key deletion failed for {}: {}", LogSanitizer.maskIdentifier(keyId), LogSanitizer.describe(e));
            throw new SigningFailedException("KMS key deletion failed", e);
        }
    }

    @Override
    public void verifyAccess() {
        try {
            kmsClient.listKeys(ListKeysRequest.builder().limit(1).build());
        } catch (SdkException e) {
            throw new SigningFailedException("KMS is not reachable with the configured credentials", e);
        }
    }
}
