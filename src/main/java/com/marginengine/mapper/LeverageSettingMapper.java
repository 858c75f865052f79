package com.marginengine.mapper;

import com.marginengine.domain.model.LeverageSetting;
import com.marginengine.entity.LeverageSettingEntity;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between LeverageSetting and LeverageSettingEntity. 1:1 field mapping.
 */
@Mapper(componentModel = "spring")
public interface LeverageSettingMapper {

    LeverageSettingEntity toEntity(LeverageSetting leverageSetting);

    LeverageSetting toDomain(LeverageSettingEntity entity);
}
