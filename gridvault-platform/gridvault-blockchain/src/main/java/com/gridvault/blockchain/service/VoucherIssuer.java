package com.gridvault.blockchain.service;

import com.gridvault.blockchain.config.SignerProperties;
import com.gridvault.blockchain.signature.SignIdAllocator;
import com.gridvault.blockchain.signature.VoucherSigner;
import com.gridvault.core.model.Address;
import com.gridvault.core.signature.VoucherMessage;
import com.gridvault.core.signature.VoucherMessages;
import com.gridvault.core.signature.VoucherSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Issues signed vouchers for every vault kind.
 * Each voucher gets a fresh signId from the allocator and, where its layout carries one,
 * a deadline of now plus the configured time-to-live.
 */
@Service
public class VoucherIssuer {

    private static final Logger log = LoggerFactory.getLogger(VoucherIssuer.class);

    private final SignerProperties properties;
    private final Optional<VoucherSigner> signer;
    private final SignIdAllocator allocator;
    private final Clock clock;

    public VoucherIssuer(SignerProperties properties, Optional<VoucherSigner> signer,
                         SignIdAllocator allocator, Clock clock) {
        this.properties = properties;
        this.signer = signer;
        this.allocator = allocator;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.isEnabled() && signer.isPresent();
    }

    public Optional<Address> signerAddress() {
        return signer.map(VoucherSigner::address);
    }

    // ==================== Grid and GridleToken ====================

    public IssuedVoucher gridDepositEth(Address grid, Address account, BigInteger value, BigInteger systemBalance) {
        BigInteger orderId = allocator.allocate(scope(grid, Address.NATIVE));
        BigInteger deadline = deadline();
        return issue(orderId, deadline,
                VoucherMessages.gridDepositEth(orderId, account, value, deadline, systemBalance, grid));
    }

    public IssuedVoucher gridClaimEth(Address grid, Address recipient, BigInteger value) {
        BigInteger orderId = allocator.allocate(scope(grid, Address.NATIVE));
        return issue(orderId, BigInteger.ZERO, VoucherMessages.gridClaimEth(orderId, recipient, value, grid));
    }

    public IssuedVoucher gridDepositToken(Address vault, Address account, Address token, BigInteger value,
                                          BigInteger systemBalance) {
        BigInteger orderId = allocator.allocate(scope(vault, token));
        BigInteger deadline = deadline();
        return issue(orderId, deadline,
                VoucherMessages.gridDepositToken(orderId, account, token, value, deadline, systemBalance, vault));
    }

    public IssuedVoucher gridClaimToken(Address vault, Address recipient, Address token, BigInteger value) {
        BigInteger orderId = allocator.allocate(scope(vault, token));
        return issue(orderId, BigInteger.ZERO,
                VoucherMessages.gridClaimToken(orderId, recipient, token, value, vault));
    }

    // ==================== Bank ====================

    public IssuedVoucher bankUse(Address bank, Address account, Address token, BigInteger value, BigInteger param) {
        BigInteger signId = allocator.allocate(scope(bank));
        BigInteger deadline = deadline();
        return issue(signId, deadline,
                VoucherMessages.bankUse(signId, value, token, account, param, deadline, bank));
    }

    public IssuedVoucher bankClaim(Address bank, Address account, Address token, BigInteger value) {
        BigInteger signId = allocator.allocate(scope(bank));
        BigInteger deadline = deadline();
        return issue(signId, deadline, VoucherMessages.bankClaim(signId, account, token, value, deadline, bank));
    }

    public IssuedVoucher bankV2Use(Address bank, Address account, Address token, BigInteger value,
                                   BigInteger param, BigInteger fee) {
        BigInteger signId = allocator.allocate(scope(bank));
        BigInteger deadline = deadline();
        return issue(signId, deadline,
                VoucherMessages.bankV2Use(signId, value, token, account, param, fee, deadline, bank));
    }

    public IssuedVoucher bankV2Claim(Address bank, Address account, Address token, BigInteger value,
                                     BigInteger fee) {
        BigInteger signId = allocator.allocate(scope(bank));
        BigInteger deadline = deadline();
        return issue(signId, deadline,
                VoucherMessages.bankV2Claim(signId, account, token, value, fee, deadline, bank));
    }

    // ==================== Claimer, RetroDrop, Inventory ====================

    public IssuedVoucher claimerClaim(Address claimer, Address account, Address token, BigInteger value,
                                      BigInteger fee) {
        BigInteger signId = allocator.allocate(scope(claimer));
        BigInteger deadline = deadline();
        return issue(signId, deadline,
                VoucherMessages.claimerClaim(signId, account, token, value, fee, deadline, claimer));
    }

    public IssuedVoucher claimerClaimEth(Address claimer, Address account, BigInteger value) {
        BigInteger signId = allocator.allocate(scope(claimer));
        BigInteger deadline = deadline();
        return issue(signId, deadline, VoucherMessages.claimerClaimEth(signId, account, value, deadline, claimer));
    }

    public IssuedVoucher retroDropClaim(Address drop, Address account, BigInteger roachMax) {
        BigInteger signId = allocator.allocate(scope(drop));
        BigInteger deadline = deadline();
        return issue(signId, deadline, VoucherMessages.retroDropClaim(
                signId, account, roachMax, deadline, properties.getChainId(), drop));
    }

    public IssuedVoucher inventory(String tag, Address inventory, Address account, BigInteger id,
                                   BigInteger amount, BigInteger fee, byte[] data) {
        BigInteger signId = allocator.allocate(scope(inventory));
        BigInteger deadline = deadline();
        return issue(signId, deadline, VoucherMessages.inventory(
                tag, signId, account, id, amount, fee, deadline, data, inventory));
    }

    private IssuedVoucher issue(BigInteger signId, BigInteger deadline, VoucherMessage message) {
        if (!isEnabled()) {
            throw new IssuanceException("Voucher signing is disabled");
        }
        VoucherSignature signature = signer.get().sign(message);
        log.debug("Issued {} voucher {} for {}", message.layout(), signId, message.verifyingContract());
        return new IssuedVoucher(message, signature, signId, deadline);
    }

    private BigInteger deadline() {
        return BigInteger.valueOf(clock.instant().getEpochSecond() + properties.getDefaultTtlSeconds());
    }

    private static String scope(Address vault) {
        return vault.value();
    }

    private static String scope(Address vault, Address token) {
        return vault.value() + "/" + token.value();
    }

    /**
     * A signed voucher ready to hand to the account that redeems it.
     *
     * @param deadline zero for layouts without a deadline
     */
    public record IssuedVoucher(VoucherMessage message, VoucherSignature signature,
                                BigInteger signId, BigInteger deadline) {}

    public static class IssuanceException extends RuntimeException {
        public IssuanceException(String message) {
            super(message);
        }
    }
}
