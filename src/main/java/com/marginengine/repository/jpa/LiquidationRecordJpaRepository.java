package com.marginengine.repository.jpa;

import com.marginengine.entity.LiquidationRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the liquidation_history table.
 */
@Repository
public interface LiquidationRecordJpaRepository extends JpaRepository<LiquidationRecordEntity, Long> {

    List<LiquidationRecordEntity> findByOwnerOrderByLiquidatedAtDesc(String owner);

    List<LiquidationRecordEntity> findByPositionId(String positionId);

    long countByOwner(String owner);
}
