package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.config.IndexerProperties;
import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.modules.chains.events.EventClassifier;
import com.pumpfun.indexer.modules.chains.events.TokenFactoryEvents;
import com.pumpfun.indexer.modules.chains.events.UnknownTokenException;
import com.pumpfun.indexer.modules.chains.ledger.LedgerSource;
import com.pumpfun.indexer.modules.indexer.model.BatchSummary;
import com.pumpfun.indexer.modules.indexer.model.BlockRange;
import com.pumpfun.indexer.modules.indexer.model.IterationOutcome;
import com.pumpfun.indexer.modules.indexer.model.IterationResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.protocol.core.methods.response.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One pass of the catch-up scanner: read the checkpoint, plan a range against the chain tip,
 * fetch and classify factory events, persist them and advance the checkpoint.
 *
 * <p>Never throws and never schedules itself; the outcome and the delay before the next pass are
 * returned to {@link IndexerRunner}.
 */
@Service
public class IndexingLoop {

    private static final Logger logger = LoggerFactory.getLogger(IndexingLoop.class);

    private final CheckpointStore checkpointStore;
    private final LedgerSource ledgerSource;
    private final EventClassifier eventClassifier;
    private final BlockRangeWriter blockRangeWriter;
    private final IndexerProperties.Indexer settings;
    private final Tracer tracer;

    public IndexingLoop(CheckpointStore checkpointStore,
                        LedgerSource ledgerSource,
                        EventClassifier eventClassifier,
                        BlockRangeWriter blockRangeWriter,
                        IndexerProperties properties,
                        Tracer tracer) {
        this.checkpointStore = checkpointStore;
        this.ledgerSource = ledgerSource;
        this.eventClassifier = eventClassifier;
        this.blockRangeWriter = blockRangeWriter;
        this.settings = properties.getIndexer();
        this.tracer = tracer;
    }

    public IterationResult runIteration() {
        Span span = tracer.spanBuilder("IndexingLoop.runIteration").startSpan();
        long checkpoint = -1;
        BlockRange range = null;
        try {
            checkpoint = checkpointStore.getHeight();
            long chainTip = ledgerSource.getChainHeight();
            span.setAttribute("indexer.checkpoint", checkpoint);
            span.setAttribute("chain.tip", chainTip);

            Optional<BlockRange> next = BlockRange.next(checkpoint, chainTip, settings.getBlocksRange());
            if (next.isEmpty()) {
                logger.debug("Waiting for chain: checkpoint={}, tip={}", checkpoint, chainTip);
                return result(IterationOutcome.STALLED, checkpoint, settings.getStallDelayMs(), null, null);
            }
            range = next.get();

            List<Log> createdLogs = ledgerSource.getLogs(range.getFromBlock(), range.getToBlock(),
                    TokenFactoryEvents.TOKEN_CREATED_TOPIC);
            List<Log> buyLogs = ledgerSource.getLogs(range.getFromBlock(), range.getToBlock(),
                    TokenFactoryEvents.TOKEN_BUY_TOPIC);
            List<Log> sellLogs = ledgerSource.getLogs(range.getFromBlock(), range.getToBlock(),
                    TokenFactoryEvents.TOKEN_SELL_TOPIC);

            List<Token> tokens = new ArrayList<>(createdLogs.size());
            for (Log created : createdLogs) {
                tokens.add(eventClassifier.toToken(created));
            }

            BatchSummary summary = blockRangeWriter.commit(range, tokens, buyLogs, sellLogs);
            logger.info("{} ({} blocks), new tokens={}, trade={} (buy={}, sell={}), duplicates={}",
                    range, range.size(), summary.getTokensCreated(), summary.trades(),
                    summary.getBuys(), summary.getSells(), summary.getDuplicatesSkipped());
            return result(IterationOutcome.ADVANCED, range.getToBlock(), 0, summary, null);
        } catch (UnknownTokenException e) {
            logger.error("{} Swap references unknown token={}, txnHash={}; halting indexer",
                    describe(range), e.getTokenAddress(), e.getTxnHash());
            span.recordException(e);
            return result(IterationOutcome.HALTED, checkpoint, 0, null, e);
        } catch (CheckpointException e) {
            logger.error("{} Checkpoint failure; halting indexer: {}", describe(range), e.getMessage(), e);
            span.recordException(e);
            return result(IterationOutcome.HALTED, checkpoint, 0, null, e);
        } catch (Exception e) {
            logger.error("{} Failed to index blocks range: {}", describe(range), e.getMessage(), e);
            span.recordException(e);
            return result(IterationOutcome.RETRY, checkpoint, settings.getErrorDelayMs(), null, e);
        } finally {
            span.end();
        }
    }

    private IterationResult result(IterationOutcome outcome, long checkpoint, long delayMs,
                                   BatchSummary summary, Throwable error) {
        return IterationResult.builder()
                .outcome(outcome)
                .checkpoint(checkpoint)
                .nextDelayMs(delayMs)
                .summary(summary)
                .error(error)
                .build();
    }

    private String describe(BlockRange range) {
        return range == null ? "[-]" : range.toString();
    }
}
