package defiautomation.signer;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;

import defiautomation.signer.dto.intent.GenericIntent;
import defiautomation.signer.dto.intent.SignedIntent;
import defiautomation.signer.service.intent.IntentAuthorizationService;
import defiautomation.signer.service.intent.IntentCheckOptions;
import defiautomation.signer.service.intent.IntentCheckResult;
import defiautomation.signer.service.intent.IntentVerifier;
import defiautomation.signer.service.signing.KeyProvider;
import defiautomation.signer.service.signing.SigningBackend;
import defiautomation.signer.service.transaction.AutomationSigningService;
import defiautomation.signer.service.transaction.ContractCallRequest;
import defiautomation.signer.service.transaction.SignedTransaction;
import defiautomation.signer.service.wallet.AutomationWallet;
import defiautomation.signer.service.wallet.WalletRegistry;
import defiautomation.signer.support.TestKeys;

@SpringBootTest(properties = {
    "signer.backend=local",
    "signer.local.master-key=" + TestKeys.MASTER_KEY
})
class SignerApplicationTest {

    @Autowired
    private SigningBackend signingBackend;

    @Autowired
    private WalletRegistry walletRegistry;

    @Autowired
    private AutomationSigningService signingService;

    @Autowired
    private IntentVerifier intentVerifier;

    @Autowired
    private IntentAuthorizationService authorizationService;

    @Test
    void shouldSignForAWalletAuthorizedByAnIntent() throws Exception {
        assertThat(signingBackend.provider()).isEqualTo(KeyProvider.LOCAL);
        AutomationWallet wallet = walletRegistry.getOrCreate("context-user", "Context wallet");

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("tokenAddress", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
        fields.put("recipient", TestKeys.OTHER_ADDRESS);
        fields.put("amount", "5000000");
        GenericIntent intent = GenericIntent.builder()
            .intentType("erc20-transfer")
            .signer(TestKeys.ADDRESS)
            .chainId(1L)
            .nonce("77")
            .expiresAt(0L)
            .fields(fields)
            .build();
        SignedIntent signed = new SignedIntent(intent, TestKeys.signDigest(intentVerifier.digest(intent), TestKeys.PRIVATE_KEY));

        IntentCheckResult<GenericIntent> check = authorizationService.checkIntent(signed, IntentCheckOptions.builder()
            .ownerRef("context-user")
            .chainId(1L)
            .expectedIntentType("erc20-transfer")
            .build());
        assertThat(check.valid()).isTrue();
        assertThat(check.walletAddress()).isEqualTo(wallet.getWalletAddress());
        assertThat(intentVerifier.recordNonceUsed(intent)).isTrue();

        SignedTransaction tx = signingService.signContractCall(ContractCallRequest.builder()
            .ownerRef("context-user")
            .chainId(1L)
            .to("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48")
            .data("0xa9059cbb")
            .gasLimit(BigInteger.valueOf(80_000))
            .gasPrice(BigInteger.valueOf(2_000_000_000L))
            .build());

        SignedRawTransaction decoded = (SignedRawTransaction) TransactionDecoder.decode(tx.getRawTransaction());
        assertThat(decoded.getFrom()).isEqualToIgnoringCase(wallet.getWalletAddress());
        assertThat(tx.getFrom()).isEqualTo(wallet.getWalletAddress());
    }
}
