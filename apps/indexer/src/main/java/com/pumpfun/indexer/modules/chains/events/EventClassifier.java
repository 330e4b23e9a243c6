package com.pumpfun.indexer.modules.chains.events;

import com.pumpfun.indexer.entity.Token;
import com.pumpfun.indexer.entity.Trade;
import com.pumpfun.indexer.entity.TradeType;
import com.pumpfun.indexer.entity.UserAccount;
import com.pumpfun.indexer.modules.chains.ledger.LedgerSource;
import com.pumpfun.indexer.repository.TokenRepository;
import com.pumpfun.indexer.repository.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Maps raw token factory logs to domain records.
 * Token creations are enriched through the ledger (creator, name, symbol); swaps are
 * bound to an already persisted {@link Token}.
 */
@Component
public class EventClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EventClassifier.class);

    private final LedgerSource ledgerSource;
    private final TokenRepository tokenRepository;
    private final UserAccountRepository userAccountRepository;

    public EventClassifier(LedgerSource ledgerSource,
                           TokenRepository tokenRepository,
                           UserAccountRepository userAccountRepository) {
        this.ledgerSource = ledgerSource;
        this.tokenRepository = tokenRepository;
        this.userAccountRepository = userAccountRepository;
    }

    /**
     * Build a Token from a TokenCreated log. The creator account is optional: when the sender has
     * no user account the token keeps only the raw creator address.
     */
    @SuppressWarnings("rawtypes")
    public Token toToken(Log log) {
        List<Type> values = TokenFactoryEvents.decode(log, TokenFactoryEvents.TOKEN_CREATED);
        String tokenAddress = ((String) values.get(0).getValue()).toLowerCase();
        long timestamp = ((BigInteger) values.get(1).getValue()).longValue();

        String creatorAddress = ledgerSource.getTransactionSender(log.getTransactionHash()).toLowerCase();
        UserAccount creator = userAccountRepository.findByAddressIgnoreCase(creatorAddress).orElse(null);
        if (creator == null) {
            logger.warn("Token creator has no user account: token={}, creator={}, txnHash={}",
                    tokenAddress, creatorAddress, log.getTransactionHash());
        }

        String name = ledgerSource.callStringMethod(tokenAddress, "name");
        String symbol = ledgerSource.callStringMethod(tokenAddress, "symbol");

        Token token = new Token();
        token.setAddress(tokenAddress);
        token.setName(name);
        token.setSymbol(symbol);
        token.setTxnHash(log.getTransactionHash());
        token.setLogIndex(log.getLogIndex().longValue());
        token.setBlockNumber(log.getBlockNumber().longValue());
        token.setTimestamp(timestamp);
        token.setCreatorUser(creator);
        token.setCreatorAddress(creatorAddress);
        return token;
    }

    /**
     * Build a Trade from a TokenBuy / TokenSell log.
     *
     * @throws UnknownTokenException if the referenced token is not persisted
     */
    @SuppressWarnings("rawtypes")
    public Trade toTrade(Log log, TradeType type) {
        Event event = type == TradeType.BUY ? TokenFactoryEvents.TOKEN_BUY : TokenFactoryEvents.TOKEN_SELL;
        List<Type> values = TokenFactoryEvents.decode(log, event);
        String tokenAddress = ((String) values.get(0).getValue()).toLowerCase();

        Token token = tokenRepository.findByAddressIgnoreCase(tokenAddress)
                .orElseThrow(() -> new UnknownTokenException(tokenAddress, log.getTransactionHash()));

        Trade trade = new Trade();
        trade.setType(type);
        trade.setTxnHash(log.getTransactionHash());
        trade.setLogIndex(log.getLogIndex().longValue());
        trade.setBlockNumber(log.getBlockNumber().longValue());
        trade.setToken(token);
        trade.setAmountIn(toAmount(values.get(1)));
        trade.setAmountOut(toAmount(values.get(2)));
        trade.setFee(toAmount(values.get(3)));
        trade.setTimestamp(((BigInteger) values.get(4).getValue()).longValue());
        return trade;
    }

    @SuppressWarnings("rawtypes")
    private BigDecimal toAmount(Type value) {
        return new BigDecimal((BigInteger) value.getValue());
    }
}
