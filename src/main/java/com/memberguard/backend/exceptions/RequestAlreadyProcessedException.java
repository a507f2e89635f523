package com.memberguard.backend.exceptions;

/**
 * Thrown when an admin acts on an access request that was already approved or rejected.
 */
public class RequestAlreadyProcessedException extends RuntimeException {

    private final Long requestId;

    public RequestAlreadyProcessedException(Long requestId, String currentStatus) {
        super("Access request " + requestId + " was already processed (" + currentStatus + ")");
        this.requestId = requestId;
    }

    public Long getRequestId() {
        return requestId;
    }
}
