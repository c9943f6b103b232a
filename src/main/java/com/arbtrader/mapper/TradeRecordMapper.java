package com.arbtrader.mapper;

import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between TradeRecord and TradeEntity.
 * Straightforward 1:1 field mapping.
 */
@Mapper
public interface TradeRecordMapper {

    TradeEntity toEntity(TradeRecord tradeRecord);

    TradeRecord toDomain(TradeEntity entity);

    List<TradeRecord> toDomainList(List<TradeEntity> entities);
}
