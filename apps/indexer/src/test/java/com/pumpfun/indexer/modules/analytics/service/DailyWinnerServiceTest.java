package com.pumpfun.indexer.modules.analytics.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.entity.DailyWinner;
import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.modules.analytics.dto.DailyWinnerResult;
import com.pumpfun.indexer.repository.DailyWinnerRepository;
import com.pumpfun.indexer.repository.TokenRepository;
import com.pumpfun.indexer.repository.TradeRepository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DailyWinnerServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 31);
    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 31, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 2, 1, 0, 0);

    private TokenRepository tokenRepository;
    private TradeRepository tradeRepository;
    private DailyWinnerRepository dailyWinnerRepository;
    private IndexerProperties properties;
    private DailyWinnerService service;

    @BeforeEach
    void setUp() {
        tokenRepository = mock(TokenRepository.class);
        tradeRepository = mock(TradeRepository.class);
        dailyWinnerRepository = mock(DailyWinnerRepository.class);
        properties = new IndexerProperties();
        properties.getDailyWinner().setRetryDelayMs(0);
        when(dailyWinnerRepository.findByDay(any())).thenReturn(Optional.empty());
        service = newService(Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private DailyWinnerService newService(Clock clock) {
        return new DailyWinnerService(tokenRepository, tradeRepository, dailyWinnerRepository,
                properties, clock, OpenTelemetry.noop().getTracer("test"));
    }

    private static Token token(long id, String address) {
        Token token = new Token();
        token.setId(id);
        token.setAddress(address);
        return token;
    }

    private void tokens(Token... tokens) {
        when(tokenRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(tokens), PageRequest.of(0, 1000), tokens.length));
    }

    private void amounts(long tokenId, long... values) {
        List<BigDecimal> list = new ArrayList<>();
        for (long value : values) {
            list.add(BigDecimal.valueOf(value));
        }
        when(tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(tokenId, START, END)).thenReturn(list);
    }

    @Test
    void largestSummedAmountOutWins() {
        tokens(token(1, "0xaaa"), token(2, "0xbbb"));
        amounts(1, 5, 5);
        amounts(2, 7);

        DailyWinnerResult winner = service.computeDailyWinner(DAY).orElseThrow();

        assertEquals(1L, winner.getTokenId());
        assertEquals("0xaaa", winner.getTokenAddress());
        assertEquals(BigInteger.TEN, winner.getVolume());
        assertEquals(2, winner.getTradeCount());
    }

    @Test
    void tieGoesToLowerTokenId() {
        tokens(token(2, "0xbbb"), token(1, "0xaaa"));
        amounts(1, 10);
        amounts(2, 10);

        assertEquals(1L, service.computeDailyWinner(DAY).orElseThrow().getTokenId());
    }

    @Test
    void noTradesMeansNoWinner() {
        tokens(token(1, "0xaaa"));
        when(tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(anyLong(), any(), any()))
                .thenReturn(Collections.emptyList());

        assertFalse(service.computeDailyWinner(DAY).isPresent());
    }

    @Test
    void volumesBeyondLongRangeAreSummedExactly() {
        tokens(token(1, "0xaaa"));
        BigDecimal large = new BigDecimal("1000000000000000000000000");
        when(tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(1L, START, END))
                .thenReturn(List.of(large, large));

        assertEquals(new BigInteger("2000000000000000000000000"),
                service.computeDailyWinner(DAY).orElseThrow().getVolume());
    }

    @Test
    void everyTokenPageIsScanned() {
        properties.getDailyWinner().setTokenPageSize(2);
        PageRequest first = PageRequest.of(0, 2);
        when(tokenRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(token(1, "0xaaa"), token(2, "0xbbb")), first, 3))
                .thenReturn(new PageImpl<>(List.of(token(3, "0xccc")), first.next(), 3));
        when(tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(anyLong(), any(), any()))
                .thenReturn(Collections.emptyList());
        amounts(3, 1);

        DailyWinnerResult winner = service.computeDailyWinner(DAY).orElseThrow();

        assertEquals(3L, winner.getTokenId());
        verify(tokenRepository, times(2)).findAll(any(Pageable.class));
    }

    @Test
    void runForDayStoresWinner() {
        tokens(token(1, "0xaaa"));
        amounts(1, 42);

        Optional<DailyWinnerResult> winner = service.runForDay(DAY);

        assertTrue(winner.isPresent());
        ArgumentCaptor<DailyWinner> captor = ArgumentCaptor.forClass(DailyWinner.class);
        verify(dailyWinnerRepository).save(captor.capture());
        assertEquals(DAY, captor.getValue().getDay());
        assertEquals(new BigDecimal(42), captor.getValue().getVolume());
        assertEquals(1L, captor.getValue().getTradeCount());
    }

    @Test
    void rerunOverwritesExistingRowForDay() {
        DailyWinner existing = new DailyWinner();
        existing.setId(7L);
        existing.setDay(DAY);
        when(dailyWinnerRepository.findByDay(DAY)).thenReturn(Optional.of(existing));
        tokens(token(1, "0xaaa"));
        amounts(1, 3);

        service.runForDay(DAY);

        ArgumentCaptor<DailyWinner> captor = ArgumentCaptor.forClass(DailyWinner.class);
        verify(dailyWinnerRepository).save(captor.capture());
        assertEquals(7L, captor.getValue().getId());
    }

    @Test
    void transientFailureIsRetried() {
        when(tokenRepository.findAll(any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenReturn(new PageImpl<>(List.of(token(1, "0xaaa")), PageRequest.of(0, 1000), 1));
        amounts(1, 9);

        assertTrue(service.runForDay(DAY).isPresent());
        verify(tokenRepository, times(2)).findAll(any(Pageable.class));
    }

    @Test
    void exhaustedAttemptsRaiseDailyWinnerException() {
        when(tokenRepository.findAll(any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        DailyWinnerException e = assertThrows(DailyWinnerException.class, () -> service.runForDay(DAY));

        assertTrue(e.getMessage().contains("2024-01-31"));
        verify(tokenRepository, times(3)).findAll(any(Pageable.class));
        verify(dailyWinnerRepository, never()).save(any());
    }

    @Test
    void cronRunsForPreviousUtcDay() {
        service = newService(Clock.fixed(Instant.parse("2024-02-01T00:00:03Z"), ZoneOffset.UTC));
        tokens(token(1, "0xaaa"));
        amounts(1, 1);

        service.handleCron();

        verify(tradeRepository).findAmountOutByTokenIdAndCreatedAtInWindow(eq(1L), eq(START), eq(END));
        verify(dailyWinnerRepository).save(any(DailyWinner.class));
    }

    @Test
    void cronFailureIsLoggedNotPropagated() {
        when(tokenRepository.findAll(any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        service.handleCron();

        verify(dailyWinnerRepository, never()).save(any());
    }
}
