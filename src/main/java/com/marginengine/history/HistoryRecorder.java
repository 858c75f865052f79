package com.marginengine.history;

import com.marginengine.domain.model.ClosureRecord;
import com.marginengine.domain.model.LiquidationRecord;
import com.marginengine.entity.ClosureRecordEntity;
import com.marginengine.entity.LiquidationRecordEntity;
import com.marginengine.mapper.HistoryRecordMapper;
import com.marginengine.repository.jpa.ClosureRecordJpaRepository;
import com.marginengine.repository.jpa.LiquidationRecordJpaRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only log of liquidation and closure records in H2.
 *
 * <p>Writes are synchronous: {@code saveAndFlush} inside a transaction that commits before
 * the method returns. The ledger calls the recorder before it commits the terminal
 * position state, so a position is never visible as liquidated without its record on disk.
 *
 * <p>Records are never updated or deleted through this service.
 */
@Service
public class HistoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(HistoryRecorder.class);

    private final LiquidationRecordJpaRepository liquidationRecordJpaRepository;
    private final ClosureRecordJpaRepository closureRecordJpaRepository;
    private final HistoryRecordMapper historyRecordMapper;

    public HistoryRecorder(
            LiquidationRecordJpaRepository liquidationRecordJpaRepository,
            ClosureRecordJpaRepository closureRecordJpaRepository,
            HistoryRecordMapper historyRecordMapper) {
        this.liquidationRecordJpaRepository = liquidationRecordJpaRepository;
        this.closureRecordJpaRepository = closureRecordJpaRepository;
        this.historyRecordMapper = historyRecordMapper;
    }

    @Transactional
    public LiquidationRecord recordLiquidation(LiquidationRecord liquidationRecord) {
        LiquidationRecordEntity saved =
                liquidationRecordJpaRepository.saveAndFlush(historyRecordMapper.toEntity(liquidationRecord));
        log.info(
                "Liquidation recorded: position={}, owner={}, type={}, loss={}, remaining={}",
                saved.getPositionId(),
                saved.getOwner(),
                saved.getLiquidationType(),
                saved.getLossAmount(),
                saved.getRemainingCollateral());
        return historyRecordMapper.toDomain(saved);
    }

    /**
     * Writes the records of one cross-group liquidation in a single transaction, so the
     * group is either fully on disk or not at all.
     */
    @Transactional
    public List<LiquidationRecord> recordLiquidations(List<LiquidationRecord> liquidationRecords) {
        List<LiquidationRecordEntity> entities = liquidationRecords.stream()
                .map(historyRecordMapper::toEntity)
                .toList();
        List<LiquidationRecordEntity> saved = liquidationRecordJpaRepository.saveAllAndFlush(entities);
        log.info("Recorded {} cross-margin liquidations for {}", saved.size(), saved.isEmpty() ? "-" : saved.get(0).getOwner());
        return historyRecordMapper.toLiquidationList(saved);
    }

    @Transactional
    public ClosureRecord recordClosure(ClosureRecord closureRecord) {
        ClosureRecordEntity saved = closureRecordJpaRepository.saveAndFlush(historyRecordMapper.toEntity(closureRecord));
        log.info(
                "Closure recorded: position={}, owner={}, reason={}, realizedPnl={}",
                saved.getPositionId(),
                saved.getOwner(),
                saved.getReason(),
                saved.getRealizedPnl());
        return historyRecordMapper.toDomain(saved);
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<LiquidationRecord> liquidationsByOwner(String owner) {
        return historyRecordMapper.toLiquidationList(liquidationRecordJpaRepository.findByOwnerOrderByLiquidatedAtDesc(owner));
    }

    @Transactional(readOnly = true)
    public List<LiquidationRecord> liquidationsByPosition(String positionId) {
        return historyRecordMapper.toLiquidationList(liquidationRecordJpaRepository.findByPositionId(positionId));
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<ClosureRecord> closuresByOwner(String owner) {
        return historyRecordMapper.toClosureList(closureRecordJpaRepository.findByOwnerOrderByClosedAtDesc(owner));
    }
}
