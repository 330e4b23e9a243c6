package com.pumpfun.indexer.entity;

public enum TradeType {
    BUY,
    SELL;

    public String label() {
        return name().toLowerCase();
    }
}
