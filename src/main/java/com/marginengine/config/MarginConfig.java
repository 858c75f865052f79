package com.marginengine.config;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.margin.MarginProperties;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link MarginProperties} bean from application.properties.
 *
 * <p>Properties prefix: {@code marginengine.*}
 */
@Configuration
public class MarginConfig {

    @Bean
    public MarginProperties marginProperties(
            @Value("${marginengine.margin.maintenance-rate:0.005}") BigDecimal maintenanceRate,
            @Value("${marginengine.margin.trading-fee-rate:0.0005}") BigDecimal tradingFeeRate,
            @Value("${marginengine.margin.warning-distance-percent:15}") BigDecimal warningDistancePercent,
            @Value("${marginengine.pairs:BTC/USDT,ETH/USDT,SOL/USDT,BNB/USDT}") String pairs,
            @Value("${marginengine.leverage.platform-max:100}") int platformMaxLeverage,
            @Value("${marginengine.leverage.default-max:20}") int defaultMaxLeverage,
            @Value("${marginengine.leverage.default-preferred:10}") int defaultPreferredLeverage,
            @Value("${marginengine.leverage.default-margin-mode:ISOLATED}") MarginMode defaultMarginMode) {
        return MarginProperties.builder()
                .maintenanceRate(maintenanceRate)
                .tradingFeeRate(tradingFeeRate)
                .warningDistancePercent(warningDistancePercent)
                .pairs(Arrays.stream(pairs.split(","))
                        .map(String::trim)
                        .filter(p -> !p.isEmpty())
                        .map(p -> p.toUpperCase())
                        .collect(Collectors.toUnmodifiableSet()))
                .platformMaxLeverage(platformMaxLeverage)
                .defaultMaxLeverage(defaultMaxLeverage)
                .defaultPreferredLeverage(defaultPreferredLeverage)
                .defaultMarginMode(defaultMarginMode)
                .build();
    }
}
