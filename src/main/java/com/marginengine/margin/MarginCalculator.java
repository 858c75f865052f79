package com.marginengine.margin;

import com.marginengine.domain.model.MarginPosition;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Pure margin arithmetic: unrealized PnL, margin ratio and liquidation price.
 *
 * <p>No I/O and no shared state. Mark prices come in as arguments, so the same inputs
 * always produce the same result and the calculator is safe to call from any thread on
 * copies of position data.
 *
 * <p>Formulas, with {@code mm = maintenanceRate x size x entryPrice}:
 * <ul>
 *   <li>unrealizedPnl = (mark - entry) x size x (LONG ? 1 : -1)</li>
 *   <li>marginRatio = (collateral + unrealizedPnl) / (size x mark)</li>
 *   <li>LONG liquidation price = entry - (collateral - mm) / size</li>
 *   <li>SHORT liquidation price = entry + (collateral - mm) / size</li>
 * </ul>
 * CROSS positions substitute the owner's aggregate collateral and aggregate
 * maintenance margin across the whole cross group.
 *
 * <p>Snapshots with zero size or non-positive collateral yield a computation-invalid
 * result instead of an exception.
 */
@Component
public class MarginCalculator {

    public static final int PRICE_SCALE = 8;
    public static final int RATIO_SCALE = 10;

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final MarginProperties marginProperties;

    public MarginCalculator(MarginProperties marginProperties) {
        this.marginProperties = marginProperties;
    }

    public BigDecimal maintenanceRate() {
        return marginProperties.getMaintenanceRate();
    }

    /** (mark - entry) x size x side sign. */
    public BigDecimal unrealizedPnl(MarginPosition position, BigDecimal markPrice) {
        return markPrice
                .subtract(position.getEntryPrice())
                .multiply(position.getSize())
                .multiply(BigDecimal.valueOf(position.getSide().sign()));
    }

    /**
     * Evaluates a single position against a mark price as an independent collateral pool.
     * Used for ISOLATED positions, and for per-position figures of CROSS positions.
     */
    public MarginCalculation evaluate(MarginPosition position, BigDecimal markPrice) {
        String reason = invalidReason(position);
        if (reason != null) {
            return MarginCalculation.invalid(reason);
        }
        if (markPrice == null || markPrice.signum() <= 0) {
            return MarginCalculation.invalid("mark price must be positive");
        }

        BigDecimal pnl = unrealizedPnl(position, markPrice);
        BigDecimal equity = position.getCollateral().add(pnl);
        BigDecimal notional = position.notionalAt(markPrice);

        return MarginCalculation.builder()
                .valid(true)
                .unrealizedPnl(pnl)
                .equity(equity)
                .notional(notional)
                .marginRatio(equity.divide(notional, RATIO_SCALE, RoundingMode.HALF_UP))
                .liquidationPrice(isolatedLiquidationPrice(position))
                .build();
    }

    /**
     * Evaluates an owner's cross group as one pool: collateral and notional are summed
     * across the group before the ratio is taken. Positions without a mark in
     * {@code markPrices} are valued at their entry price.
     */
    public MarginCalculation evaluateCross(List<MarginPosition> crossGroup, Map<String, BigDecimal> markPrices) {
        if (crossGroup.isEmpty()) {
            return MarginCalculation.invalid("empty cross group");
        }

        BigDecimal totalCollateral = BigDecimal.ZERO;
        BigDecimal totalPnl = BigDecimal.ZERO;
        BigDecimal totalNotional = BigDecimal.ZERO;

        for (MarginPosition position : crossGroup) {
            String reason = invalidReason(position);
            if (reason != null) {
                return MarginCalculation.invalid(position.getId() + ": " + reason);
            }
            BigDecimal mark = markPrices.getOrDefault(position.getPair(), position.getEntryPrice());
            totalCollateral = totalCollateral.add(position.getCollateral());
            totalPnl = totalPnl.add(unrealizedPnl(position, mark));
            totalNotional = totalNotional.add(position.notionalAt(mark));
        }

        if (totalNotional.signum() <= 0) {
            return MarginCalculation.invalid("aggregate notional must be positive");
        }

        BigDecimal equity = totalCollateral.add(totalPnl);
        return MarginCalculation.builder()
                .valid(true)
                .unrealizedPnl(totalPnl)
                .equity(equity)
                .notional(totalNotional)
                .marginRatio(equity.divide(totalNotional, RATIO_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    /**
     * Liquidation price of {@code position}. For CROSS the full open cross group of the
     * owner (including {@code position} itself) must be supplied; it is ignored for ISOLATED.
     */
    public MarginCalculation liquidationPrice(MarginPosition position, List<MarginPosition> crossGroup) {
        String reason = invalidReason(position);
        if (reason != null) {
            return MarginCalculation.invalid(reason);
        }
        if (!position.isCross()) {
            return MarginCalculation.builder()
                    .valid(true)
                    .liquidationPrice(isolatedLiquidationPrice(position))
                    .build();
        }

        BigDecimal totalCollateral = BigDecimal.ZERO;
        BigDecimal totalMaintenance = BigDecimal.ZERO;
        for (MarginPosition member : crossGroup) {
            String memberReason = invalidReason(member);
            if (memberReason != null) {
                return MarginCalculation.invalid(member.getId() + ": " + memberReason);
            }
            totalCollateral = totalCollateral.add(member.getCollateral());
            totalMaintenance = totalMaintenance.add(maintenanceMargin(member));
        }

        return MarginCalculation.builder()
                .valid(true)
                .liquidationPrice(solve(position, totalCollateral, totalMaintenance))
                .build();
    }

    /**
     * |mark - liquidationPrice| / mark, in percent. A position whose liquidation price is
     * zero cannot be liquidated and reports 100.
     */
    public BigDecimal distanceToLiquidationPercent(BigDecimal markPrice, BigDecimal liquidationPrice) {
        if (liquidationPrice == null || liquidationPrice.signum() == 0) {
            return ONE_HUNDRED;
        }
        return markPrice
                .subtract(liquidationPrice)
                .abs()
                .multiply(ONE_HUNDRED)
                .divide(markPrice, 4, RoundingMode.HALF_UP);
    }

    /** maintenanceRate x size x entryPrice. */
    public BigDecimal maintenanceMargin(MarginPosition position) {
        return position.notionalAt(position.getEntryPrice()).multiply(marginProperties.getMaintenanceRate());
    }

    private BigDecimal isolatedLiquidationPrice(MarginPosition position) {
        return solve(position, position.getCollateral(), maintenanceMargin(position));
    }

    private BigDecimal solve(MarginPosition position, BigDecimal collateral, BigDecimal maintenance) {
        BigDecimal buffer = collateral.subtract(maintenance).divide(position.getSize(), PRICE_SCALE, RoundingMode.HALF_UP);
        BigDecimal price = position.getSide().sign() > 0
                ? position.getEntryPrice().subtract(buffer)
                : position.getEntryPrice().add(buffer);
        // A long with more equity than notional can never be liquidated
        return price.signum() < 0 ? BigDecimal.ZERO.setScale(PRICE_SCALE) : price.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private String invalidReason(MarginPosition position) {
        if (position.getSize() == null || position.getSize().signum() <= 0) {
            return "size must be positive";
        }
        if (position.getCollateral() == null || position.getCollateral().signum() <= 0) {
            return "collateral must be positive";
        }
        if (position.getEntryPrice() == null || position.getEntryPrice().signum() <= 0) {
            return "entry price must be positive";
        }
        return null;
    }
}
