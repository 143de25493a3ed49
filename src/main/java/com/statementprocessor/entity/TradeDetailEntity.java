package com.statementprocessor.entity;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.TradeAction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the trade_details table.
 * Append-only audit trail of executed trades. {@code sequence} numbers trades of the same
 * instrument on the same day in statement order, so the natural key survives re-ingestion.
 */
@Entity
@Table(
        name = "trade_details",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_trade_detail_key",
                        columnNames = {"account_id", "trade_date", "instrument", "sequence_no"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeDetailEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 32)
    private String accountId;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(nullable = false, length = 64)
    private String instrument;

    @Column(name = "sequence_no", nullable = false)
    private int sequence;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_class", length = 16)
    private AssetClass assetClass;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private TradeAction action;

    @Column(precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(precision = 18, scale = 6)
    private BigDecimal price;

    @Column(length = 3)
    private String currency;

    @Column(precision = 18, scale = 4)
    private BigDecimal proceeds;

    @Column(precision = 18, scale = 4)
    private BigDecimal commission;

    @Column(name = "realized_pnl", precision = 18, scale = 4)
    private BigDecimal realizedPnl;

    @Column(length = 32)
    private String codes;

    @Column(name = "source_document_id", length = 128)
    private String sourceDocumentId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
