package defiautomation.signer.service.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import defiautomation.signer.config.SignerProperties;
import defiautomation.signer.exception.ConfigurationException;
import defiautomation.signer.service.signing.hsm.HsmClient;
import defiautomation.signer.service.signing.hsm.ManagedHsmSigner;
import defiautomation.signer.service.signing.local.InMemoryKeyMaterialRepository;
import defiautomation.signer.service.signing.local.KeyMaterialRepository;
import defiautomation.signer.service.signing.local.LocalSigner;
import defiautomation.signer.support.FakeHsmClient;
import defiautomation.signer.support.TestKeys;

@DisplayName("SignerFactory Tests")
class SignerFactoryTest {

    private SignerProperties properties;
    private StaticListableBeanFactory beans;

    @BeforeEach
    void setUp() {
        properties = new SignerProperties();
        beans = new StaticListableBeanFactory(new HashMap<>(Map.of("keyMaterialRepository", new InMemoryKeyMaterialRepository())));
    }

    private SignerFactory factory() {
        return new SignerFactory(properties, beans.getBeanProvider(KeyMaterialRepository.class), beans.getBeanProvider(HsmClient.class));
    }

    @Nested
    @DisplayName("Local Backend")
    class LocalBackendTests {

        @Test
        @DisplayName("Should build the local signer by default")
        void shouldBuildLocalSignerByDefault() {
            properties.getLocal().setMasterKey(TestKeys.MASTER_KEY);

            SigningBackend backend = factory().create();

            assertThat(backend).isInstanceOf(LocalSigner.class);
            assertThat(backend.provider()).isEqualTo(KeyProvider.LOCAL);
        }

        @Test
        @DisplayName("Should fail fast without a master key")
        void shouldFailWithoutMasterKey() {
            assertThatThrownBy(() -> factory().create())
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("Should fail when no key repository is available")
        void shouldFailWithoutRepository() {
            beans = new StaticListableBeanFactory();
            properties.getLocal().setMasterKey(TestKeys.MASTER_KEY);

            assertThatThrownBy(() -> factory().create())
                .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Managed HSM Backend")
    class ManagedHsmBackendTests {

        @Test
        @DisplayName("Should use a provided HSM client")
        void shouldUseProvidedClient() {
            FakeHsmClient hsm = new FakeHsmClient();
            beans.addBean("hsmClient", hsm);
            properties.setBackend(SignerProperties.Backend.MANAGED_HSM);

            SigningBackend backend = factory().create();

            assertThat(backend).isInstanceOf(ManagedHsmSigner.class);
            String keyId = backend.createKey("bot").keyId();
            assertThat(hsm.tagsOf(keyId)).containsEntry("Purpose", "automation-wallet");
        }

        @Test
        @DisplayName("Should require a region when building the KMS client")
        void shouldRequireRegion() {
            properties.setBackend(SignerProperties.Backend.MANAGED_HSM);

            assertThatThrownBy(() -> factory().create())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("region");
        }

        @Test
        @DisplayName("Should reject half-configured static credentials")
        void shouldRejectPartialCredentials() {
            properties.setBackend(SignerProperties.Backend.MANAGED_HSM);
            properties.getHsm().setRegion("us-east-1");
            properties.getHsm().setAccessKeyId("AKIAEXAMPLE");

            assertThatThrownBy(() -> factory().create())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must be set together");
        }
    }
}
