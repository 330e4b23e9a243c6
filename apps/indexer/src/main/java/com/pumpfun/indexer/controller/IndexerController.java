package com.pumpfun.indexer.controller;

import com.pumpfun.indexer.modules.analytics.dto.DailyWinnerResult;
import com.pumpfun.indexer.modules.analytics.service.DailyWinnerException;
import com.pumpfun.indexer.modules.analytics.service.DailyWinnerService;
import com.pumpfun.indexer.modules.indexer.model.IterationResult;
import com.pumpfun.indexer.modules.indexer.service.CheckpointStore;
import com.pumpfun.indexer.modules.indexer.service.IndexerRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operational endpoints: indexer status and manual daily winner runs
 */
@Slf4j
@RestController
@RequestMapping("/api/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final CheckpointStore checkpointStore;
    private final IndexerRunner indexerRunner;
    private final DailyWinnerService dailyWinnerService;
    private final Clock clock;

    /**
     * GET /api/indexer/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("checkpoint", checkpointStore.peekHeight().orElse(null));
        response.put("running", indexerRunner.isRunning());
        response.put("halted", indexerRunner.isHalted());

        Optional<IterationResult> last = indexerRunner.getLastResult();
        response.put("lastOutcome", last.map(r -> r.getOutcome().name()).orElse(null));
        last.map(IterationResult::getError)
                .ifPresent(error -> response.put("lastError", error.getMessage()));
        response.put("timestamp", clock.millis());

        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/indexer/daily-winner?day=2024-01-31
     *
     * <p>Defaults to the previous UTC day.
     */
    @PostMapping("/daily-winner")
    public ResponseEntity<Map<String, Object>> runDailyWinner(
            @RequestParam(name = "day", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        LocalDate target = day != null ? day : LocalDate.now(clock).minusDays(1);
        log.info("Received request to compute daily winner for day={}", target);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("day", target.toString());
        try {
            Optional<DailyWinnerResult> winner = dailyWinnerService.runForDay(target);
            response.put("success", true);
            response.put("winner", winner.map(this::toBody).orElse(null));
            return ResponseEntity.ok(response);
        } catch (DailyWinnerException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.internalServerError().body(response);
        }
    }

    private Map<String, Object> toBody(DailyWinnerResult winner) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tokenId", winner.getTokenId());
        body.put("tokenAddress", winner.getTokenAddress());
        // String keeps full precision for JSON consumers
        body.put("volume", winner.getVolume().toString());
        body.put("tradeCount", winner.getTradeCount());
        return body;
    }
}
