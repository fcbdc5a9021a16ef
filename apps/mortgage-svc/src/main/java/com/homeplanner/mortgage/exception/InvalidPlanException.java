package com.homeplanner.mortgage.exception;

/**
 * Raised for a malformed extra-payment plan: negative amounts or a one-time month outside the loan term.
 */
public class InvalidPlanException extends IllegalArgumentException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
