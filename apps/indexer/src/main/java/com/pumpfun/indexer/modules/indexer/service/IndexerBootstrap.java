package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.entity.UserAccount;
import com.pumpfun.indexer.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Startup seeding: validates configuration, creates the checkpoint row and the bootstrap
 * user accounts. Any failure aborts application startup before the loop is started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexerBootstrap implements ApplicationRunner {

    private final IndexerProperties properties;
    private final CheckpointStore checkpointStore;
    private final UserAccountRepository userAccountRepository;

    @Override
    public void run(ApplicationArguments args) {
        try {
            properties.validate();
            long height = checkpointStore.getHeight();
            int seeded = seedUsers();
            log.info("Bootstrap completed: checkpoint={}, seeded users={}", height, seeded);
        } catch (RuntimeException e) {
            log.error("Failed to bootstrap, exit", e);
            throw new IllegalStateException("Indexer bootstrap failed", e);
        }
    }

    int seedUsers() {
        int seeded = 0;
        for (String address : properties.getBootstrapUsers()) {
            if (address == null || address.isBlank()) {
                continue;
            }
            String normalized = address.trim().toLowerCase();
            if (userAccountRepository.findByAddressIgnoreCase(normalized).isPresent()) {
                continue;
            }
            UserAccount user = new UserAccount();
            user.setAddress(normalized);
            userAccountRepository.save(user);
            seeded++;
            log.info("Seeded bootstrap user: address={}", normalized);
        }
        return seeded;
    }
}
