package com.slb.chaos_engine.config;

import com.slb.chaos_engine.common.ledger.EntropySource;
import com.slb.chaos_engine.common.ledger.ManualBlockClock;
import com.slb.chaos_engine.common.ledger.SeededEntropySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 账本配置 / Host ledger bindings: a manually advanced block clock and a secret-seeded entropy source.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public ManualBlockClock blockClock(@Value("${app.ledger.genesis-block:0}") long genesisBlock) {
        log.info("Using manual block clock, genesisBlock={}", genesisBlock);
        return new ManualBlockClock(genesisBlock);
    }

    @Bean
    public EntropySource entropySource(@Value("${app.ledger.entropy-secret:chaos-engine}") String secret) {
        return new SeededEntropySource(secret);
    }
}
