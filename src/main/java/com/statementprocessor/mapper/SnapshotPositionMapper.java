package com.statementprocessor.mapper;

import com.statementprocessor.domain.model.OptionPosition;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.entity.SnapshotPositionEntity;
import org.mapstruct.AfterMapping;
import org.mapstruct.Builder;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper from PositionRecord (or its OptionPosition subtype) to snapshot_positions rows.
 * Option terms are copied after the common columns when the record is an option.
 */
@Mapper(builder = @Builder(disableBuilder = true))
public interface SnapshotPositionMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "snapshotId", ignore = true)
    @Mapping(target = "underlying", ignore = true)
    @Mapping(target = "strike", ignore = true)
    @Mapping(target = "expiry", ignore = true)
    @Mapping(target = "optionRight", ignore = true)
    SnapshotPositionEntity toEntity(PositionRecord position);

    @AfterMapping
    default void copyOptionTerms(PositionRecord position, @MappingTarget SnapshotPositionEntity entity) {
        if (position instanceof OptionPosition option) {
            entity.setUnderlying(option.getUnderlying());
            entity.setStrike(option.getStrike());
            entity.setExpiry(option.getExpiry());
            entity.setOptionRight(option.getRight());
        }
    }
}
