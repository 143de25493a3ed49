package com.statementprocessor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the portfolio_snapshots table.
 * One row per (account, as-of date); re-ingesting a statement updates the row in place.
 * All amounts are in base_currency.
 */
@Entity
@Table(
        name = "portfolio_snapshots",
        uniqueConstraints =
                @UniqueConstraint(name = "uk_snapshot_account_date", columnNames = {"account_id", "as_of_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 32)
    private String accountId;

    @Column(name = "as_of_date", nullable = false)
    private LocalDate asOfDate;

    @Column(name = "period_start")
    private LocalDate periodStart;

    @Column(name = "base_currency", nullable = false, length = 3)
    private String baseCurrency;

    @Column(name = "options_credit", precision = 18, scale = 4)
    private BigDecimal optionsCredit;

    @Column(name = "short_option_mark_value", precision = 18, scale = 4)
    private BigDecimal shortOptionMarkValue;

    @Column(name = "long_option_mark_value", precision = 18, scale = 4)
    private BigDecimal longOptionMarkValue;

    @Column(name = "option_balance", precision = 18, scale = 4)
    private BigDecimal optionBalance;

    @Column(name = "equity_position_value", precision = 18, scale = 4)
    private BigDecimal equityPositionValue;

    @Column(name = "open_short_option_count")
    private int openShortOptionCount;

    @Column(name = "warning_count")
    private int warningCount;

    @Column(name = "source_document_id", length = 128)
    private String sourceDocumentId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
