package com.fintech.oracle.exception;

public class InvalidScheduleException extends TriggerException {

    public InvalidScheduleException(String triggerId, String message) {
        super(ErrorCode.INVALID_SCHEDULE, triggerId, message);
    }

    public InvalidScheduleException(String triggerId, String message, Throwable cause) {
        super(ErrorCode.INVALID_SCHEDULE, triggerId, message, cause);
    }
}
