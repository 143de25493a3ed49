package com.statementprocessor.mapper;

import com.statementprocessor.domain.model.ForexBalance;
import com.statementprocessor.domain.model.PortfolioSnapshot;
import com.statementprocessor.domain.vo.Money;
import com.statementprocessor.entity.PortfolioSnapshotEntity;
import com.statementprocessor.entity.SnapshotForexBalanceEntity;
import java.math.BigDecimal;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper from the reconciled PortfolioSnapshot to its table rows.
 *
 * <p>Money totals are flattened to their amount; the currency lives once in base_currency.
 * Forex balances keep their own currency column. Keys and audit timestamps are set by the writer.
 */
@Mapper
public interface PortfolioSnapshotMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sourceDocumentId", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    PortfolioSnapshotEntity toEntity(PortfolioSnapshot snapshot);

    /** Overwrites the business columns of an existing row; id and createdAt are kept. */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sourceDocumentId", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void updateEntity(PortfolioSnapshot snapshot, @MappingTarget PortfolioSnapshotEntity entity);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "snapshotId", ignore = true)
    @Mapping(source = "source", target = "balanceSource")
    SnapshotForexBalanceEntity toEntity(ForexBalance balance);

    default BigDecimal toAmount(Money money) {
        return money != null ? money.getAmount() : null;
    }
}
