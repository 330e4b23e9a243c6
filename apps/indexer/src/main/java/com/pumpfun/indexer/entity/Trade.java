package com.pumpfun.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@Entity
@Table(name = "trades", uniqueConstraints = {
        @UniqueConstraint(name = "uq_trades_txn_log", columnNames = {"txn_hash", "log_index"})
})
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trade_type", nullable = false, length = 8)
    private TradeType type;

    @Column(name = "txn_hash", nullable = false)
    private String txnHash;

    @Column(name = "log_index", nullable = false)
    private Long logIndex;

    @Column(name = "block_number", nullable = false)
    private Long blockNumber;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "token_id", nullable = false)
    private Token token;

    @Column(name = "amount_in", nullable = false, precision = 78, scale = 0)
    private BigDecimal amountIn = BigDecimal.ZERO;

    @Column(name = "amount_out", nullable = false, precision = 78, scale = 0)
    private BigDecimal amountOut = BigDecimal.ZERO;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigDecimal fee = BigDecimal.ZERO;

    // Swap time reported by the factory event, unix seconds
    @Column(name = "block_timestamp", nullable = false)
    private Long timestamp;

    // Persistence time in UTC; the daily winner window is evaluated against it
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }
}
