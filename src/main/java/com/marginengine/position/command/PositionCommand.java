package com.marginengine.position.command;

/**
 * Closed set of state-changing requests accepted by the
 * {@link com.marginengine.position.ExecutionCoordinator}.
 *
 * <p>Each variant carries only the fields its operation needs and rejects malformed input
 * in its constructor with a {@link com.marginengine.exception.ValidationException}, so a
 * command that exists is structurally valid. Business validation (leverage limits,
 * collateral sufficiency, pair availability) happens in the ledger.
 */
public sealed interface PositionCommand
        permits OpenPositionCommand,
                AdjustCollateralCommand,
                ClosePositionCommand,
                UpdateTriggersCommand,
                LiquidatePositionCommand {}
