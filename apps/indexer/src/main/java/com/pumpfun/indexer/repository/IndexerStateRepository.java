package com.pumpfun.indexer.repository;

import com.pumpfun.indexer.entity.IndexerState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the checkpoint row
 */
@Repository
public interface IndexerStateRepository extends JpaRepository<IndexerState, Long> {

    /**
     * The checkpoint table holds a single row; the lowest id wins if it ever holds more.
     */
    Optional<IndexerState> findFirstByOrderByIdAsc();
}
