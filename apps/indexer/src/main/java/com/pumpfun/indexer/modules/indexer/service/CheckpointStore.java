package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.entity.IndexerState;
import com.pumpfun.indexer.repository.IndexerStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Durable cursor recording the last fully indexed block height.
 */
@Slf4j
@Service
@Transactional
public class CheckpointStore {

    private final IndexerStateRepository indexerStateRepository;
    private final IndexerProperties properties;

    public CheckpointStore(IndexerStateRepository indexerStateRepository, IndexerProperties properties) {
        this.indexerStateRepository = indexerStateRepository;
        this.properties = properties;
    }

    /**
     * Current checkpoint height. Seeds the row from {@code pumpfun.initial-block-number}
     * when none exists yet.
     *
     * @throws CheckpointException if no row exists and it cannot be seeded
     */
    public long getHeight() {
        Optional<IndexerState> state = indexerStateRepository.findFirstByOrderByIdAsc();
        if (state.isPresent()) {
            return state.get().getBlockNumber();
        }

        Long initialBlockNumber = properties.getInitialBlockNumber();
        if (initialBlockNumber == null || initialBlockNumber < 0) {
            throw new CheckpointException("[pumpfun.initial-block-number] is empty but required");
        }
        try {
            indexerStateRepository.saveAndFlush(IndexerState.builder().blockNumber(initialBlockNumber).build());
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to seed checkpoint at blockNumber=" + initialBlockNumber, e);
        }
        log.info("Set initial blockNumber={}", initialBlockNumber);
        return initialBlockNumber;
    }

    /**
     * Checkpoint height without seeding.
     */
    @Transactional(readOnly = true)
    public Optional<Long> peekHeight() {
        return indexerStateRepository.findFirstByOrderByIdAsc().map(IndexerState::getBlockNumber);
    }

    /**
     * Move the checkpoint to {@code newHeight}. Joins the caller's transaction so the move
     * commits together with the records of the covered range.
     *
     * @throws CheckpointException if the row is missing, the height would decrease, or the write fails
     */
    public void advance(long newHeight) {
        IndexerState state = indexerStateRepository.findFirstByOrderByIdAsc()
                .orElseThrow(() -> new CheckpointException("Checkpoint row is missing"));
        if (newHeight < state.getBlockNumber()) {
            throw new CheckpointException("Refusing to move checkpoint backwards from "
                    + state.getBlockNumber() + " to " + newHeight);
        }
        state.setBlockNumber(newHeight);
        try {
            indexerStateRepository.saveAndFlush(state);
        } catch (DataAccessException e) {
            throw new CheckpointException("Failed to update last blockNumber=" + newHeight, e);
        }
    }
}
