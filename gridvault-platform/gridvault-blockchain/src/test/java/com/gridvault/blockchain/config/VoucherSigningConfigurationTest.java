package com.gridvault.blockchain.config;

import com.gridvault.blockchain.service.VoucherIssuer;
import com.gridvault.blockchain.signature.SignIdAllocator;
import com.gridvault.blockchain.signature.VoucherSigner;
import com.gridvault.blockchain.signature.Web3jSignatureAuthority;
import com.gridvault.core.model.Address;
import com.gridvault.core.signature.SignatureAuthority;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.web3j.crypto.Credentials;

import static org.assertj.core.api.Assertions.*;

class VoucherSigningConfigurationTest {

    private static final String SIGNER_KEY = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(VoucherSigningConfiguration.class, VoucherIssuer.class);

    @Test
    void disabledByDefault() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(SignatureAuthority.class);
            assertThat(context).hasSingleBean(SignIdAllocator.class);
            assertThat(context).doesNotHaveBean(VoucherSigner.class);
            assertThat(context.getBean(SignatureAuthority.class)).isInstanceOf(Web3jSignatureAuthority.class);
            assertThat(context.getBean(VoucherIssuer.class).isEnabled()).isFalse();
        });
    }

    @Test
    void enabledSignerUsesConfiguredKey() {
        runner.withPropertyValues(
                        "gridvault.signer.enabled=true",
                        "gridvault.signer.private-key=" + SIGNER_KEY,
                        "gridvault.signer.chain-id=31337",
                        "gridvault.signer.default-ttl-seconds=120")
                .run(context -> {
                    SignerProperties properties = context.getBean(SignerProperties.class);
                    assertThat(properties.getChainId()).isEqualTo(31337L);
                    assertThat(properties.getDefaultTtlSeconds()).isEqualTo(120L);
                    assertThat(context.getBean(VoucherSigner.class).address())
                            .isEqualTo(Address.of(Credentials.create(SIGNER_KEY).getAddress()));
                    assertThat(context.getBean(VoucherIssuer.class).isEnabled()).isTrue();
                });
    }

    @Test
    void enabledWithoutKeyFailsStartup() {
        runner.withPropertyValues("gridvault.signer.enabled=true")
                .run(context -> assertThat(context).hasFailed());
    }
}
