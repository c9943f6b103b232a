package com.arbtrader.mapper;

import com.arbtrader.domain.model.RiskEventRecord;
import com.arbtrader.entity.RiskEventEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between RiskEventRecord and RiskEventEntity.
 *
 * <p>The state snapshot is a map on the domain side and a JSON text column on the
 * entity side; {@link JsonHelper} converts between the two.
 */
@Mapper
public interface RiskEventMapper {

    @Mapping(target = "stateSnapshot", expression = "java(snapshotToJson(riskEventRecord.getStateSnapshot()))")
    RiskEventEntity toEntity(RiskEventRecord riskEventRecord);

    @Mapping(target = "stateSnapshot", expression = "java(jsonToSnapshot(entity.getStateSnapshot()))")
    RiskEventRecord toDomain(RiskEventEntity entity);

    List<RiskEventRecord> toDomainList(List<RiskEventEntity> entities);

    default String snapshotToJson(Map<String, Object> snapshot) {
        return JsonHelper.toJson(snapshot);
    }

    default Map<String, Object> jsonToSnapshot(String json) {
        return JsonHelper.toMap(json);
    }
}
