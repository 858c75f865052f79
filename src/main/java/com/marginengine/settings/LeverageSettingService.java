package com.marginengine.settings;

import com.marginengine.api.dto.request.LeverageSettingRequest;
import com.marginengine.domain.model.LeverageSetting;
import com.marginengine.exception.InvalidLeverageException;
import com.marginengine.mapper.LeverageSettingMapper;
import com.marginengine.margin.MarginProperties;
import com.marginengine.repository.jpa.LeverageSettingJpaRepository;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owner-managed leverage guardrails, persisted to H2.
 *
 * <p>The engine only reads through {@link #getSetting(String)}; updates come from the
 * owner via the settings API. Owners without a stored row get the configured defaults
 * with liquidation warnings and auto-deleverage enabled.
 */
@Service
public class LeverageSettingService {

    private static final Logger log = LoggerFactory.getLogger(LeverageSettingService.class);

    private final LeverageSettingJpaRepository leverageSettingJpaRepository;
    private final LeverageSettingMapper leverageSettingMapper;
    private final MarginProperties marginProperties;

    public LeverageSettingService(
            LeverageSettingJpaRepository leverageSettingJpaRepository,
            LeverageSettingMapper leverageSettingMapper,
            MarginProperties marginProperties) {
        this.leverageSettingJpaRepository = leverageSettingJpaRepository;
        this.leverageSettingMapper = leverageSettingMapper;
        this.marginProperties = marginProperties;
    }

    public LeverageSetting getSetting(String owner) {
        return leverageSettingJpaRepository
                .findById(owner)
                .map(leverageSettingMapper::toDomain)
                .orElseGet(() -> defaults(owner));
    }

    /**
     * Applies a partial update. Max leverage is bounded by the platform ceiling and the
     * preferred leverage by the resulting max; violations are rejected, not clamped.
     */
    public LeverageSetting updateSetting(String owner, LeverageSettingRequest request) {
        LeverageSetting current = getSetting(owner);
        LeverageSetting.LeverageSettingBuilder updated = current.toBuilder();

        int maxLeverage = request.getMaxLeverage() != null ? request.getMaxLeverage() : current.getMaxLeverage();
        if (maxLeverage < 1 || maxLeverage > marginProperties.getPlatformMaxLeverage()) {
            throw new InvalidLeverageException(maxLeverage, marginProperties.getPlatformMaxLeverage());
        }
        int preferredLeverage = request.getPreferredLeverage() != null
                ? request.getPreferredLeverage()
                : Math.min(current.getPreferredLeverage(), maxLeverage);
        if (preferredLeverage < 1 || preferredLeverage > maxLeverage) {
            throw new InvalidLeverageException(preferredLeverage, maxLeverage);
        }

        updated.maxLeverage(maxLeverage).preferredLeverage(preferredLeverage);
        if (request.getDefaultMarginMode() != null) {
            updated.defaultMarginMode(request.getDefaultMarginMode());
        }
        if (request.getAutoDeleverageEnabled() != null) {
            updated.autoDeleverageEnabled(request.getAutoDeleverageEnabled());
        }
        if (request.getLiquidationWarningEnabled() != null) {
            updated.liquidationWarningEnabled(request.getLiquidationWarningEnabled());
        }
        LeverageSetting setting = updated.updatedAt(LocalDateTime.now()).build();

        leverageSettingJpaRepository.save(leverageSettingMapper.toEntity(setting));
        log.info(
                "Leverage settings updated for {}: max={}x, preferred={}x, mode={}",
                owner,
                setting.getMaxLeverage(),
                setting.getPreferredLeverage(),
                setting.getDefaultMarginMode());
        return setting;
    }

    private LeverageSetting defaults(String owner) {
        return LeverageSetting.builder()
                .owner(owner)
                .maxLeverage(marginProperties.getDefaultMaxLeverage())
                .preferredLeverage(marginProperties.getDefaultPreferredLeverage())
                .defaultMarginMode(marginProperties.getDefaultMarginMode())
                .autoDeleverageEnabled(true)
                .liquidationWarningEnabled(true)
                .build();
    }
}
