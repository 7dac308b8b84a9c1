package com.fintech.oracle.exception;

public class DuplicateTriggerException extends TriggerException {

    public DuplicateTriggerException(String triggerId) {
        super(ErrorCode.DUPLICATE_ID, triggerId, "Trigger with ID " + triggerId + " already exists");
    }
}
