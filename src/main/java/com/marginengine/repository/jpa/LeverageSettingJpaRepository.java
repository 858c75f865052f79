package com.marginengine.repository.jpa;

import com.marginengine.entity.LeverageSettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the leverage_settings table, keyed by owner.
 */
@Repository
public interface LeverageSettingJpaRepository extends JpaRepository<LeverageSettingEntity, String> {}
