package com.pumpfun.indexer.modules.analytics.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.entity.DailyWinner;
import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.modules.analytics.dto.DailyWinnerResult;
import com.pumpfun.indexer.repository.DailyWinnerRepository;
import com.pumpfun.indexer.repository.TokenRepository;
import com.pumpfun.indexer.repository.TradeRepository;
import com.pumpfun.indexer.util.RetryUtils;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks tokens by outbound trade volume over one UTC calendar day and records the winner.
 *
 * <p>Volume is the sum of {@code amountOut} of every trade persisted during the day, accumulated
 * as {@link BigInteger}. Ties go to the lower token id. The whole token catalog is walked page by
 * page, so no token is excluded as the catalog grows.
 */
@Service
public class DailyWinnerService {

    private static final Logger logger = LoggerFactory.getLogger(DailyWinnerService.class);

    static final Comparator<DailyWinnerResult> RANKING = Comparator
            .comparing(DailyWinnerResult::getVolume).reversed()
            .thenComparing(DailyWinnerResult::getTokenId);

    private final TokenRepository tokenRepository;
    private final TradeRepository tradeRepository;
    private final DailyWinnerRepository dailyWinnerRepository;
    private final IndexerProperties.DailyWinner settings;
    private final Clock clock;
    private final Tracer tracer;

    public DailyWinnerService(TokenRepository tokenRepository,
                              TradeRepository tradeRepository,
                              DailyWinnerRepository dailyWinnerRepository,
                              IndexerProperties properties,
                              Clock clock,
                              Tracer tracer) {
        this.tokenRepository = tokenRepository;
        this.tradeRepository = tradeRepository;
        this.dailyWinnerRepository = dailyWinnerRepository;
        this.settings = properties.getDailyWinner();
        this.clock = clock;
        this.tracer = tracer;
    }

    /**
     * Daily run for the previous UTC day. Failures are logged; the next run is unaffected.
     */
    @Scheduled(cron = "${pumpfun.daily-winner.cron:0 0 0 * * *}", zone = "UTC")
    public void handleCron() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        try {
            runForDay(yesterday);
        } catch (DailyWinnerException e) {
            logger.error("Giving up on daily winner for day={} after {} attempts",
                    yesterday, settings.getMaxAttempts(), e);
        }
    }

    /**
     * Compute and store the winner of {@code day}, retrying on failure.
     *
     * @return the winner, or empty when no token traded that day
     * @throws DailyWinnerException when every attempt failed
     */
    public Optional<DailyWinnerResult> runForDay(LocalDate day) {
        try {
            return RetryUtils.executeWithRetry("get daily winner for day=" + day, () -> {
                Optional<DailyWinnerResult> winner = computeDailyWinner(day);
                winner.ifPresentOrElse(this::store,
                        () -> logger.info("Daily winner for day={}: no winner, no trades in window", day));
                return winner;
            }, settings.getMaxAttempts(), settings.getRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DailyWinnerException(day, e);
        } catch (Exception e) {
            throw new DailyWinnerException(day, e);
        }
    }

    /**
     * Rank tokens by volume over {@code [day 00:00, day+1 00:00)} UTC. Read-only.
     */
    public Optional<DailyWinnerResult> computeDailyWinner(LocalDate day) {
        Span span = tracer.spanBuilder("DailyWinnerService.computeDailyWinner")
                .setAttribute("winner.day", day.toString())
                .startSpan();
        try {
            LocalDateTime start = day.atStartOfDay();
            LocalDateTime end = day.plusDays(1).atStartOfDay();

            DailyWinnerResult best = null;
            int tokensScanned = 0;
            PageRequest pageRequest = PageRequest.of(0, settings.getTokenPageSize(), Sort.by("id").ascending());
            Page<Token> page;
            do {
                page = tokenRepository.findAll(pageRequest);
                for (Token token : page.getContent()) {
                    tokensScanned++;
                    List<BigDecimal> amounts = tradeRepository.findAmountOutByTokenIdAndCreatedAtInWindow(
                            token.getId(), start, end);
                    if (amounts.isEmpty()) {
                        continue;
                    }
                    BigInteger volume = BigInteger.ZERO;
                    for (BigDecimal amount : amounts) {
                        volume = volume.add(amount.toBigIntegerExact());
                    }
                    DailyWinnerResult candidate = DailyWinnerResult.builder()
                            .day(day)
                            .tokenId(token.getId())
                            .tokenAddress(token.getAddress())
                            .volume(volume)
                            .tradeCount(amounts.size())
                            .build();
                    if (best == null || RANKING.compare(candidate, best) < 0) {
                        best = candidate;
                    }
                }
                pageRequest = pageRequest.next();
            } while (page.hasNext());

            logger.debug("Daily winner scan for day={}: tokens={}", day, tokensScanned);
            return Optional.ofNullable(best);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void store(DailyWinnerResult winner) {
        DailyWinner row = dailyWinnerRepository.findByDay(winner.getDay()).orElseGet(DailyWinner::new);
        row.setDay(winner.getDay());
        row.setTokenId(winner.getTokenId());
        row.setTokenAddress(winner.getTokenAddress());
        row.setVolume(new BigDecimal(winner.getVolume()));
        row.setTradeCount(winner.getTradeCount());
        dailyWinnerRepository.save(row);
        logger.info("Daily winner for day={}: tokenId={}, token={}, volume={}, trades={}",
                winner.getDay(), winner.getTokenId(), winner.getTokenAddress(),
                winner.getVolume(), winner.getTradeCount());
    }
}
