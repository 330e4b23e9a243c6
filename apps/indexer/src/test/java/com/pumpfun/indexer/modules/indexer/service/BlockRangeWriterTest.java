package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.entity.Trade;
import com.pumpfun.indexer.entity.TradeType;
import com.pumpfun.indexer.modules.chains.events.EventClassifier;
import com.pumpfun.indexer.modules.chains.events.TestLogs;
import com.pumpfun.indexer.modules.chains.events.UnknownTokenException;
import com.pumpfun.indexer.modules.indexer.model.BatchSummary;
import com.pumpfun.indexer.modules.indexer.model.BlockRange;
import com.pumpfun.indexer.repository.TokenRepository;
import com.pumpfun.indexer.repository.TradeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockRangeWriterTest {

    private static final String TOKEN = "0x00000000000000000000000000000000000000ab";
    private static final BlockRange RANGE = new BlockRange(101, 150);

    @Mock private TokenRepository tokenRepository;
    @Mock private TradeRepository tradeRepository;
    @Mock private EventClassifier eventClassifier;
    @Mock private CheckpointStore checkpointStore;

    private BlockRangeWriter writer;

    @BeforeEach
    void setUp() {
        writer = new BlockRangeWriter(tokenRepository, tradeRepository, eventClassifier, checkpointStore);
    }

    @Test
    void persistsTokensBeforeTradesAndAdvancesCheckpointLast() {
        Token token = token();
        Log buyLog = TestLogs.buy(TOKEN, BigInteger.ONE, BigInteger.TEN, BigInteger.ZERO, 1L, "0xb1", 120, 0);
        Log sellLog = TestLogs.sell(TOKEN, BigInteger.TEN, BigInteger.ONE, BigInteger.ZERO, 1L, "0xs1", 130, 0);
        Trade buy = trade(TradeType.BUY, token, "0xb1");
        Trade sell = trade(TradeType.SELL, token, "0xs1");
        when(tokenRepository.existsByAddressIgnoreCase(TOKEN)).thenReturn(false);
        when(tradeRepository.existsByTxnHashAndLogIndex(anyString(), anyLong())).thenReturn(false);
        when(eventClassifier.toTrade(buyLog, TradeType.BUY)).thenReturn(buy);
        when(eventClassifier.toTrade(sellLog, TradeType.SELL)).thenReturn(sell);

        BatchSummary summary = writer.commit(RANGE, List.of(token), List.of(buyLog), List.of(sellLog));

        InOrder order = inOrder(tokenRepository, eventClassifier, tradeRepository, checkpointStore);
        order.verify(tokenRepository).save(token);
        order.verify(eventClassifier).toTrade(buyLog, TradeType.BUY);
        order.verify(tradeRepository).save(buy);
        order.verify(eventClassifier).toTrade(sellLog, TradeType.SELL);
        order.verify(tradeRepository).save(sell);
        order.verify(checkpointStore).advance(150L);

        assertEquals(1, summary.getTokensCreated());
        assertEquals(1, summary.getBuys());
        assertEquals(1, summary.getSells());
        assertEquals(2, summary.trades());
        assertEquals(0, summary.getDuplicatesSkipped());
    }

    @Test
    void emptyRangeStillAdvancesCheckpoint() {
        BatchSummary summary = writer.commit(RANGE, List.of(), List.of(), List.of());

        verify(checkpointStore).advance(150L);
        assertEquals(0, summary.getTokensCreated());
        assertEquals(0, summary.trades());
    }

    @Test
    void replayedRecordsAreSkippedNotDuplicated() {
        Token token = token();
        Log buyLog = TestLogs.buy(TOKEN, BigInteger.ONE, BigInteger.TEN, BigInteger.ZERO, 1L, "0xb1", 120, 5);
        when(tokenRepository.existsByAddressIgnoreCase(TOKEN)).thenReturn(true);
        when(tradeRepository.existsByTxnHashAndLogIndex("0xb1", 5L)).thenReturn(true);

        BatchSummary summary = writer.commit(RANGE, List.of(token), List.of(buyLog), List.of());

        verify(tokenRepository, never()).save(any());
        verify(tradeRepository, never()).save(any());
        verify(eventClassifier, never()).toTrade(any(), any());
        verify(checkpointStore).advance(150L);
        assertEquals(2, summary.getDuplicatesSkipped());
        assertEquals(0, summary.getTokensCreated());
    }

    @Test
    void unknownTokenAbortsBeforeCheckpointAdvance() {
        Log buyLog = TestLogs.buy(TOKEN, BigInteger.ONE, BigInteger.TEN, BigInteger.ZERO, 1L, "0xb1", 120, 0);
        when(tradeRepository.existsByTxnHashAndLogIndex("0xb1", 0L)).thenReturn(false);
        when(eventClassifier.toTrade(buyLog, TradeType.BUY)).thenThrow(new UnknownTokenException(TOKEN, "0xb1"));

        assertThrows(UnknownTokenException.class,
                () -> writer.commit(RANGE, List.of(), List.of(buyLog), List.of()));

        verify(tradeRepository, never()).save(any());
        verify(checkpointStore, never()).advance(anyLong());
    }

    private Token token() {
        Token token = new Token();
        token.setAddress(TOKEN);
        token.setName("Frog");
        token.setSymbol("FRG");
        token.setTxnHash("0xt1");
        return token;
    }

    private Trade trade(TradeType type, Token token, String txnHash) {
        Trade trade = new Trade();
        trade.setType(type);
        trade.setToken(token);
        trade.setTxnHash(txnHash);
        trade.setAmountIn(BigDecimal.ONE);
        trade.setAmountOut(BigDecimal.TEN);
        trade.setFee(BigDecimal.ZERO);
        return trade;
    }
}
