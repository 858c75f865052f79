package com.marginengine.exception;

import java.util.Map;

/**
 * The caller's expected version no longer matches the stored position.
 * The caller must re-read the position and decide whether a retry still makes sense.
 */
public class VersionConflictException extends BaseException {

    public VersionConflictException(String positionId, long expectedVersion, long actualVersion, String status) {
        super(
                ErrorCode.VERSION_CONFLICT,
                String.format(
                        "Position %s is at version %d (%s), expected %d",
                        positionId, actualVersion, status, expectedVersion),
                Map.of(
                        "positionId", positionId,
                        "expectedVersion", expectedVersion,
                        "actualVersion", actualVersion,
                        "status", status));
    }
}
