package com.pumpfun.indexer.modules.analytics.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.LocalDate;

@Value
@Builder
public class DailyWinnerResult {

    LocalDate day;
    Long tokenId;
    String tokenAddress;

    /**
     * Sum of amountOut over the token's trades persisted during {@link #day} (UTC).
     */
    BigInteger volume;

    long tradeCount;
}
