package com.statementprocessor.entity;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.OptionRight;
import com.statementprocessor.domain.enums.SectionKind;
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
 * JPA entity for the snapshot_positions table.
 * Position detail behind a snapshot; option terms are null for non-option rows.
 */
@Entity
@Table(name = "snapshot_positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SnapshotPositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_id", nullable = false)
    private Long snapshotId;

    @Column(name = "account_id", length = 32)
    private String accountId;

    @Column(nullable = false, length = 64)
    private String instrument;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_class", length = 16)
    private AssetClass assetClass;

    @Column(name = "asset_category", length = 64)
    private String assetCategory;

    @Column(length = 3)
    private String currency;

    @Column(precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(precision = 10, scale = 2)
    private BigDecimal multiplier;

    @Column(name = "cost_price", precision = 18, scale = 6)
    private BigDecimal costPrice;

    @Column(name = "cost_basis", precision = 18, scale = 4)
    private BigDecimal costBasis;

    @Column(name = "mark_price", precision = 18, scale = 6)
    private BigDecimal markPrice;

    @Column(name = "market_value", precision = 18, scale = 4)
    private BigDecimal marketValue;

    @Column(name = "mtm_pnl", precision = 18, scale = 4)
    private BigDecimal mtmPnl;

    @Column(name = "new_in_period")
    private Boolean newInPeriod;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private SectionKind source;

    @Column(length = 32)
    private String underlying;

    @Column(precision = 12, scale = 4)
    private BigDecimal strike;

    private LocalDate expiry;

    @Enumerated(EnumType.STRING)
    @Column(name = "option_right", length = 4)
    private OptionRight optionRight;
}
