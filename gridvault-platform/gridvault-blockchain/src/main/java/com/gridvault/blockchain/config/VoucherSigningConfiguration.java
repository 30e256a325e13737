package com.gridvault.blockchain.config;

import com.gridvault.blockchain.signature.SignIdAllocator;
import com.gridvault.blockchain.signature.VoucherSigner;
import com.gridvault.blockchain.signature.Web3jSignatureAuthority;
import com.gridvault.core.signature.SignatureAuthority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans for voucher signing and recovery.
 */
@Configuration
@EnableConfigurationProperties(SignerProperties.class)
public class VoucherSigningConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VoucherSigningConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(SignatureAuthority.class)
    public SignatureAuthority signatureAuthority() {
        return new Web3jSignatureAuthority();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gridvault.signer", name = "enabled", havingValue = "true")
    public VoucherSigner voucherSigner(SignerProperties properties) {
        VoucherSigner signer = VoucherSigner.fromPrivateKey(properties.getPrivateKey());
        log.info("Voucher signer {} enabled for chain {}", signer.address(), properties.getChainId());
        return signer;
    }

    @Bean
    @ConditionalOnMissingBean
    public SignIdAllocator signIdAllocator() {
        return new SignIdAllocator();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
