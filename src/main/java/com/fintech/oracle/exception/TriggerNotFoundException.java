package com.fintech.oracle.exception;

public class TriggerNotFoundException extends TriggerException {

    public TriggerNotFoundException(String triggerId) {
        super(ErrorCode.NOT_FOUND, triggerId, "Trigger with ID " + triggerId + " does not exist");
    }
}
