package com.pumpfun.indexer.modules.indexer.service;

import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.entity.Trade;
import com.pumpfun.indexer.entity.TradeType;
import com.pumpfun.indexer.modules.chains.events.EventClassifier;
import com.pumpfun.indexer.modules.indexer.model.BatchSummary;
import com.pumpfun.indexer.modules.indexer.model.BlockRange;
import com.pumpfun.indexer.repository.TokenRepository;
import com.pumpfun.indexer.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.web3j.protocol.core.methods.response.Log;

import java.util.List;

/**
 * Persists one scanned range and advances the checkpoint in a single transaction.
 *
 * <p>Order is fixed: token creations, then buys, then sells, so swaps can resolve tokens
 * created earlier in the same range. Records already present (token address, or trade
 * txnHash + logIndex) are skipped, which makes replaying a range harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockRangeWriter {

    private final TokenRepository tokenRepository;
    private final TradeRepository tradeRepository;
    private final EventClassifier eventClassifier;
    private final CheckpointStore checkpointStore;

    @Transactional
    public BatchSummary commit(BlockRange range, List<Token> createdTokens, List<Log> buyLogs, List<Log> sellLogs) {
        int duplicates = 0;

        int tokensCreated = 0;
        for (Token token : createdTokens) {
            if (tokenRepository.existsByAddressIgnoreCase(token.getAddress())) {
                log.debug("Token already indexed: address={}, txnHash={}", token.getAddress(), token.getTxnHash());
                duplicates++;
                continue;
            }
            tokenRepository.save(token);
            tokensCreated++;
            log.info("New token: address={}, name={}, symbol={}, user={}, txnHash={}",
                    token.getAddress(), token.getName(), token.getSymbol(),
                    token.getCreatorAddress(), token.getTxnHash());
        }

        int[] buys = persistTrades(buyLogs, TradeType.BUY);
        int[] sells = persistTrades(sellLogs, TradeType.SELL);
        duplicates += buys[1] + sells[1];

        checkpointStore.advance(range.getToBlock());

        return BatchSummary.builder()
                .range(range)
                .tokensCreated(tokensCreated)
                .buys(buys[0])
                .sells(sells[0])
                .duplicatesSkipped(duplicates)
                .build();
    }

    /**
     * @return {saved, skipped}
     */
    private int[] persistTrades(List<Log> logs, TradeType type) {
        int saved = 0;
        int skipped = 0;
        for (Log event : logs) {
            if (tradeRepository.existsByTxnHashAndLogIndex(event.getTransactionHash(), event.getLogIndex().longValue())) {
                log.debug("Trade already indexed: txnHash={}, logIndex={}", event.getTransactionHash(), event.getLogIndex());
                skipped++;
                continue;
            }
            Trade trade = eventClassifier.toTrade(event, type);
            tradeRepository.save(trade);
            saved++;
            log.info("Trade [{}]: token={}, amountIn={}, amountOut={}, fee={}",
                    type.label(), trade.getToken().getAddress(),
                    trade.getAmountIn(), trade.getAmountOut(), trade.getFee());
        }
        return new int[]{saved, skipped};
    }
}
