package com.pumpfun.indexer.repository;

import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.entity.Trade;
import com.pumpfun.indexer.entity.TradeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class TradeRepositoryTest {

    private static final LocalDateTime DAY_START = LocalDateTime.of(2024, 1, 31, 0, 0);
    private static final LocalDateTime DAY_END = DAY_START.plusDays(1);

    @Autowired
    private TokenRepository tokenRepository;

    @Autowired
    private TradeRepository tradeRepository;

    private Token token;

    @BeforeEach
    void setUp() {
        token = new Token();
        token.setAddress("0x00000000000000000000000000000000000000aa");
        token.setName("Alpha");
        token.setSymbol("ALP");
        token.setTxnHash("0xcreate");
        token.setLogIndex(0L);
        token.setBlockNumber(101L);
        token.setTimestamp(1_706_659_200L);
        token = tokenRepository.save(token);
    }

    private Trade trade(String txnHash, long logIndex, String amountOut, LocalDateTime createdAt) {
        Trade trade = new Trade();
        trade.setType(TradeType.BUY);
        trade.setTxnHash(txnHash);
        trade.setLogIndex(logIndex);
        trade.setBlockNumber(102L);
        trade.setToken(token);
        trade.setAmountIn(BigDecimal.ONE);
        trade.setAmountOut(new BigDecimal(amountOut));
        trade.setFee(BigDecimal.ZERO);
        trade.setTimestamp(1_706_659_300L);
        trade.setCreatedAt(createdAt);
        return tradeRepository.save(trade);
    }

    @Test
    void tokenLookupIgnoresAddressCase() {
        assertTrue(tokenRepository.findByAddressIgnoreCase("0x00000000000000000000000000000000000000AA").isPresent());
        assertTrue(tokenRepository.existsByAddressIgnoreCase("0x00000000000000000000000000000000000000Aa"));
    }

    @Test
    void tradeNaturalKeyIsTxnHashAndLogIndex() {
        trade("0xswap", 3L, "1", DAY_START.plusHours(1));

        assertTrue(tradeRepository.existsByTxnHashAndLogIndex("0xswap", 3L));
        assertFalse(tradeRepository.existsByTxnHashAndLogIndex("0xswap", 4L));
    }

    @Test
    void windowIncludesStartAndExcludesEnd() {
        trade("0x1", 0L, "10", DAY_START);
        trade("0x2", 0L, "1000000000000000000000000000", DAY_END.minusNanos(1000));
        trade("0x3", 0L, "7", DAY_END);
        trade("0x4", 0L, "5", DAY_START.minusSeconds(1));

        List<BigDecimal> amounts = tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(
                token.getId(), DAY_START, DAY_END);

        assertEquals(2, amounts.size());
        assertEquals(new BigDecimal("1000000000000000000000000010"),
                amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }
}
