package com.flagship.settlement_engine.config;

import com.flagship.settlement_engine.authorization.SigningDomain;
import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.transfer.EscrowAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Signing domain, escrow account and ledger clock.
 *
 * The verifying-contract identity plays three roles: it is part of every
 * signature's domain, it is the operator that pulls swap legs under the
 * holders' allowances, and it holds pooled marketplace proceeds.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SettlementConfig {

    @Bean
    public SigningDomain signingDomain(
            @Value("${settlement.domain.name:OTCSwap}") String name,
            @Value("${settlement.domain.version:1}") String version,
            @Value("${settlement.domain.chain-id:1}") BigInteger chainId,
            @Value("${settlement.domain.verifying-contract}") String verifyingContract) {
        SigningDomain domain = new SigningDomain(name, version, chainId, verifyingContract);
        log.info("Signing domain: name={}, version={}, chainId={}, verifyingContract={}",
                name, version, chainId, domain.getVerifyingContract());
        return domain;
    }

    @Bean
    public EscrowAccount escrowAccount(
            SigningDomain signingDomain,
            @Value("${settlement.escrow.native-asset:" + Addresses.ZERO + "}") String nativeAsset) {
        return new EscrowAccount(signingDomain.getVerifyingContract(), nativeAsset);
    }

    /**
     * Ledger time. Expiry checks compare against this clock's epoch seconds.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
