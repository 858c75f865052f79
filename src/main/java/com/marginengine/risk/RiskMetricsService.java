package com.marginengine.risk;

import com.marginengine.domain.enums.RiskTier;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.OwnerRiskMetrics;
import com.marginengine.domain.model.PositionRisk;
import com.marginengine.margin.MarginCalculation;
import com.marginengine.margin.MarginCalculator;
import com.marginengine.position.PositionLedger;
import com.marginengine.pricefeed.PriceFeedAdapter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only risk dashboard for an owner's open positions.
 *
 * <p>ISOLATED positions report their own margin ratio. CROSS positions report the ratio of
 * the owner's whole cross pool, since that is the figure liquidation acts on. Pairs
 * without a mark yet are valued at entry price.
 */
@Service
public class RiskMetricsService {

    private static final Logger log = LoggerFactory.getLogger(RiskMetricsService.class);

    private final PositionLedger positionLedger;
    private final MarginCalculator marginCalculator;
    private final PriceFeedAdapter priceFeedAdapter;

    public RiskMetricsService(
            PositionLedger positionLedger, MarginCalculator marginCalculator, PriceFeedAdapter priceFeedAdapter) {
        this.positionLedger = positionLedger;
        this.marginCalculator = marginCalculator;
        this.priceFeedAdapter = priceFeedAdapter;
    }

    public OwnerRiskMetrics getRiskMetrics(String owner) {
        List<MarginPosition> open = positionLedger.getOpenPositions(owner);
        Map<String, BigDecimal> marks = priceFeedAdapter.latestPrices(
                open.stream().map(MarginPosition::getPair).distinct().toList());

        List<MarginPosition> crossGroup = open.stream().filter(MarginPosition::isCross).toList();
        MarginCalculation crossPool = crossGroup.isEmpty() ? null : marginCalculator.evaluateCross(crossGroup, marks);

        List<PositionRisk> risks = new ArrayList<>();
        BigDecimal totalCollateral = BigDecimal.ZERO;
        BigDecimal totalUnrealizedPnl = BigDecimal.ZERO;
        BigDecimal totalNotional = BigDecimal.ZERO;
        RiskTier overallTier = RiskTier.SAFE;

        for (MarginPosition position : open) {
            BigDecimal mark = marks.getOrDefault(position.getPair(), position.getEntryPrice());
            MarginCalculation calculation = marginCalculator.evaluate(position, mark);
            if (!calculation.isValid()) {
                log.error("Skipping position {} in risk metrics: {}", position.getId(), calculation.getInvalidReason());
                continue;
            }

            BigDecimal liquidationPrice =
                    position.isCross() ? position.getLiquidationPrice() : calculation.getLiquidationPrice();
            BigDecimal marginRatio = position.isCross() && crossPool != null && crossPool.isValid()
                    ? crossPool.getMarginRatio()
                    : calculation.getMarginRatio();
            BigDecimal distance = marginCalculator.distanceToLiquidationPercent(mark, liquidationPrice);
            RiskTier tier = RiskTier.fromDistancePercent(distance);

            risks.add(PositionRisk.builder()
                    .positionId(position.getId())
                    .pair(position.getPair())
                    .markPrice(mark)
                    .liquidationPrice(liquidationPrice)
                    .unrealizedPnl(calculation.getUnrealizedPnl())
                    .marginRatio(marginRatio)
                    .distanceToLiquidationPercent(distance)
                    .riskTier(tier)
                    .build());

            totalCollateral = totalCollateral.add(position.getCollateral());
            totalUnrealizedPnl = totalUnrealizedPnl.add(calculation.getUnrealizedPnl());
            totalNotional = totalNotional.add(calculation.getNotional());
            if (tier.ordinal() < overallTier.ordinal()) {
                overallTier = tier;
            }
        }

        return OwnerRiskMetrics.builder()
                .owner(owner)
                .openPositions(risks.size())
                .totalCollateral(totalCollateral)
                .totalUnrealizedPnl(totalUnrealizedPnl)
                .totalNotional(totalNotional)
                .overallTier(overallTier)
                .positions(risks)
                .build();
    }
}
