package com.marginengine.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %s does not exist", resourceType, identifier),
                Map.of("resourceType", resourceType, "identifier", identifier));
    }

    public static ResourceNotFoundException position(String positionId) {
        return new ResourceNotFoundException("Position", positionId);
    }
}
