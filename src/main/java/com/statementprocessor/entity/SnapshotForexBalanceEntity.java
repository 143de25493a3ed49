package com.statementprocessor.entity;

import com.statementprocessor.domain.enums.BalanceSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the snapshot_forex_balances table.
 * Closing cash balance per currency, child of portfolio_snapshots via snapshot_id.
 */
@Entity
@Table(name = "snapshot_forex_balances")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SnapshotForexBalanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_id", nullable = false)
    private Long snapshotId;

    @Column(name = "account_id", length = 32)
    private String accountId;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(precision = 18, scale = 4)
    private BigDecimal balance;

    @Column(name = "as_of_date")
    private LocalDate asOfDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_source", length = 20)
    private BalanceSource balanceSource;

    @Column(name = "exchange_rate", precision = 18, scale = 8)
    private BigDecimal exchangeRate;

    @Column(name = "mtm_pnl", precision = 18, scale = 4)
    private BigDecimal mtmPnl;
}
