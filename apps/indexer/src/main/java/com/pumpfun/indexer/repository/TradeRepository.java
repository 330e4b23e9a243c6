package com.pumpfun.indexer.repository;

import com.pumpfun.indexer.entity.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TradeRepository extends JpaRepository<Trade, Long> {

    /**
     * Natural key check used to keep range replays idempotent.
     */
    boolean existsByTxnHashAndLogIndex(String txnHash, Long logIndex);

    /**
     * Outbound amounts of a token's trades persisted in {@code [start, end)}.
     */
    @Query("SELECT t.amountOut FROM Trade t WHERE t.token.id = :tokenId "
            + "AND t.createdAt >= :start AND t.createdAt < :end")
    List<BigDecimal> findAmountOutByTokenIdAndCreatedAtInWindow(@Param("tokenId") Long tokenId,
                                                                @Param("start") LocalDateTime start,
                                                                @Param("end") LocalDateTime end);
}
