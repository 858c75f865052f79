package com.marginengine.api.controller;

import com.marginengine.api.dto.request.AdjustCollateralRequest;
import com.marginengine.api.dto.request.ClosePositionRequest;
import com.marginengine.api.dto.request.LeverageSettingRequest;
import com.marginengine.api.dto.request.LiquidateRequest;
import com.marginengine.api.dto.request.OpenPositionRequest;
import com.marginengine.api.dto.request.UpdateTriggersRequest;
import com.marginengine.api.dto.response.LiquidationHistoryResponse;
import com.marginengine.domain.model.ClosureRecord;
import com.marginengine.domain.model.LeverageSetting;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.OwnerRiskMetrics;
import com.marginengine.exception.ValidationException;
import com.marginengine.history.HistoryRecorder;
import com.marginengine.position.ExecutionCoordinator;
import com.marginengine.position.PositionLedger;
import com.marginengine.risk.RiskMetricsService;
import com.marginengine.settings.LeverageSettingService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for margin positions, their history, leverage settings and risk.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/margin/positions?owner= -- position snapshots of an owner</li>
 *   <li>GET /api/margin/positions/{id} -- one position snapshot</li>
 *   <li>POST /api/margin/positions/open -- open a position</li>
 *   <li>POST /api/margin/positions/{id}/collateral -- add or withdraw collateral</li>
 *   <li>POST /api/margin/positions/{id}/close -- close fully or partially</li>
 *   <li>POST /api/margin/positions/{id}/triggers -- replace stop-loss / take-profit</li>
 *   <li>POST /api/margin/positions/{id}/liquidate -- FORCED or MANUAL liquidation</li>
 *   <li>GET /api/margin/liquidations?owner=|positionId= -- liquidation history</li>
 *   <li>GET /api/margin/closures?owner= -- closure history</li>
 *   <li>GET|PUT /api/margin/settings?owner= -- leverage settings</li>
 *   <li>GET /api/margin/risk-metrics?owner= -- risk dashboard</li>
 * </ul>
 *
 * <p>Every mutation carries the caller's expected version. A 409 VERSION_CONFLICT means
 * the position changed since it was read; re-read before deciding to retry.
 */
@RestController
@RequestMapping("/api/margin")
public class MarginController {

    private static final Logger log = LoggerFactory.getLogger(MarginController.class);

    private final ExecutionCoordinator executionCoordinator;
    private final PositionLedger positionLedger;
    private final HistoryRecorder historyRecorder;
    private final LeverageSettingService leverageSettingService;
    private final RiskMetricsService riskMetricsService;

    public MarginController(
            ExecutionCoordinator executionCoordinator,
            PositionLedger positionLedger,
            HistoryRecorder historyRecorder,
            LeverageSettingService leverageSettingService,
            RiskMetricsService riskMetricsService) {
        this.executionCoordinator = executionCoordinator;
        this.positionLedger = positionLedger;
        this.historyRecorder = historyRecorder;
        this.leverageSettingService = leverageSettingService;
        this.riskMetricsService = riskMetricsService;
    }

    // ---- Positions ----

    @GetMapping("/positions")
    public ResponseEntity<List<MarginPosition>> getPositions(@RequestParam String owner) {
        return ResponseEntity.ok(positionLedger.getPositions(owner));
    }

    @GetMapping("/positions/{positionId}")
    public ResponseEntity<MarginPosition> getPosition(@PathVariable String positionId) {
        return ResponseEntity.ok(positionLedger.getPosition(positionId));
    }

    @PostMapping("/positions/open")
    public ResponseEntity<MarginPosition> openPosition(@Valid @RequestBody OpenPositionRequest request) {
        log.info(
                "Open requested: owner={}, {} {} {}x size={}",
                request.getOwner(),
                request.getSide(),
                request.getPair(),
                request.getLeverage(),
                request.getSize());
        MarginPosition position = executionCoordinator.execute(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @PostMapping("/positions/{positionId}/collateral")
    public ResponseEntity<MarginPosition> adjustCollateral(
            @PathVariable String positionId, @Valid @RequestBody AdjustCollateralRequest request) {
        return ResponseEntity.ok(executionCoordinator.execute(request.toCommand(positionId)));
    }

    @PostMapping("/positions/{positionId}/close")
    public ResponseEntity<MarginPosition> closePosition(
            @PathVariable String positionId, @Valid @RequestBody ClosePositionRequest request) {
        return ResponseEntity.ok(executionCoordinator.execute(request.toCommand(positionId)));
    }

    @PostMapping("/positions/{positionId}/triggers")
    public ResponseEntity<MarginPosition> updateTriggers(
            @PathVariable String positionId, @Valid @RequestBody UpdateTriggersRequest request) {
        return ResponseEntity.ok(executionCoordinator.execute(request.toCommand(positionId)));
    }

    @PostMapping("/positions/{positionId}/liquidate")
    public ResponseEntity<MarginPosition> liquidatePosition(
            @PathVariable String positionId, @Valid @RequestBody LiquidateRequest request) {
        log.warn("{} liquidation requested for {}", request.getLiquidationType(), positionId);
        return ResponseEntity.ok(executionCoordinator.execute(request.toCommand(positionId)));
    }

    // ---- History ----

    /** Exactly one of {@code owner} or {@code positionId} must be given. */
    @GetMapping("/liquidations")
    public ResponseEntity<LiquidationHistoryResponse> getLiquidations(
            @RequestParam(required = false) String owner, @RequestParam(required = false) String positionId) {
        if ((owner == null) == (positionId == null)) {
            throw new ValidationException("Exactly one of owner or positionId is required");
        }
        return ResponseEntity.ok(LiquidationHistoryResponse.of(
                owner != null
                        ? historyRecorder.liquidationsByOwner(owner)
                        : historyRecorder.liquidationsByPosition(positionId)));
    }

    @GetMapping("/closures")
    public ResponseEntity<List<ClosureRecord>> getClosures(@RequestParam String owner) {
        return ResponseEntity.ok(historyRecorder.closuresByOwner(owner));
    }

    // ---- Settings & risk ----

    @GetMapping("/settings")
    public ResponseEntity<LeverageSetting> getSettings(@RequestParam String owner) {
        return ResponseEntity.ok(leverageSettingService.getSetting(owner));
    }

    @PutMapping("/settings")
    public ResponseEntity<LeverageSetting> updateSettings(
            @RequestParam String owner, @Valid @RequestBody LeverageSettingRequest request) {
        return ResponseEntity.ok(leverageSettingService.updateSetting(owner, request));
    }

    @GetMapping("/risk-metrics")
    public ResponseEntity<OwnerRiskMetrics> getRiskMetrics(@RequestParam String owner) {
        return ResponseEntity.ok(riskMetricsService.getRiskMetrics(owner));
    }
}
