package com.tradeingest.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String id) {
        super(ErrorCode.NOT_FOUND, resourceType + " not found: " + id);
    }
}
