package com.statementprocessor.mapper;

import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.entity.TradeDetailEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from TradeRecord to the trade_details audit row.
 * The sequence number and source document are assigned by the writer.
 */
@Mapper
public interface TradeDetailMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sequence", ignore = true)
    @Mapping(target = "sourceDocumentId", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    TradeDetailEntity toEntity(TradeRecord trade);
}
