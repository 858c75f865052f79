package com.marginengine.exception;

import java.util.Map;

/**
 * The pair is not tradable or has no accepted mark price yet.
 */
public class PairUnavailableException extends BaseException {

    public PairUnavailableException(String pair, String reason) {
        super(ErrorCode.PAIR_UNAVAILABLE, String.format("Pair %s is unavailable: %s", pair, reason), Map.of("pair", pair));
    }
}
