package com.homeplanner.mortgage.exception;

/**
 * Internal defect guard. Signals a programming error (negative savings, runaway schedules),
 * never a recoverable user condition.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
