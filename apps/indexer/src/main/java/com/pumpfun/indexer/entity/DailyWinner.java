package com.pumpfun.indexer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Token with the highest outbound trade volume for one UTC day.
 */
@Data
@Entity
@Table(name = "daily_winners")
public class DailyWinner {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "winner_day", nullable = false, unique = true)
    private LocalDate day;

    @Column(name = "token_id", nullable = false)
    private Long tokenId;

    @Column(name = "token_address", nullable = false)
    private String tokenAddress;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigDecimal volume = BigDecimal.ZERO;

    @Column(name = "trade_count", nullable = false)
    private Long tradeCount = 0L;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        computedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
