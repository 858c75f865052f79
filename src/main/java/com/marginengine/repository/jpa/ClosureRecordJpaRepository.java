package com.marginengine.repository.jpa;

import com.marginengine.entity.ClosureRecordEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the position_closures table.
 */
@Repository
public interface ClosureRecordJpaRepository extends JpaRepository<ClosureRecordEntity, Long> {

    List<ClosureRecordEntity> findByOwnerOrderByClosedAtDesc(String owner);

    List<ClosureRecordEntity> findByPositionId(String positionId);
}
