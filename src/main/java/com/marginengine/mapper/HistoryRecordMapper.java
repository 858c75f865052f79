package com.marginengine.mapper;

import com.marginengine.domain.model.ClosureRecord;
import com.marginengine.domain.model.LiquidationRecord;
import com.marginengine.entity.ClosureRecordEntity;
import com.marginengine.entity.LiquidationRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the immutable history records and their JPA entities.
 */
@Mapper(componentModel = "spring")
public interface HistoryRecordMapper {

    LiquidationRecordEntity toEntity(LiquidationRecord liquidationRecord);

    LiquidationRecord toDomain(LiquidationRecordEntity entity);

    List<LiquidationRecord> toLiquidationList(List<LiquidationRecordEntity> entities);

    ClosureRecordEntity toEntity(ClosureRecord closureRecord);

    ClosureRecord toDomain(ClosureRecordEntity entity);

    List<ClosureRecord> toClosureList(List<ClosureRecordEntity> entities);
}
