package io.github.drompincen.postscheduler.runtime.schedule;

/**
 * Rejected user input. The message is meant to be shown to the requester as is.
 */
public class ScheduleValidationException extends RuntimeException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
