package com.pumpfun.indexer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;

/**
 * Ledger client and time source beans.
 */
@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(IndexerProperties properties) {
        properties.validate();
        log.info("Starting ledger client, RPC_URL={}, PUMP_FUN_CONTRACT_ADDRESS={}, PUMP_FUN_INITIAL_BLOCK_NUMBER={}",
                properties.getRpcUrl(), properties.getContractAddress(), properties.getInitialBlockNumber());
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
