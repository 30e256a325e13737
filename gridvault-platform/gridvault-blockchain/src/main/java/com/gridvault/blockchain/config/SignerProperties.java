package com.gridvault.blockchain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for off-chain voucher signing.
 */
@ConfigurationProperties(prefix = "gridvault.signer")
public class SignerProperties {

    private boolean enabled = false;
    private String privateKey;
    private long chainId = 1L;
    private long defaultTtlSeconds = 3_600L; // 1 hour

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getChainId() { return chainId; }
    public void setChainId(long chainId) { this.chainId = chainId; }
    public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
    public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }
}
