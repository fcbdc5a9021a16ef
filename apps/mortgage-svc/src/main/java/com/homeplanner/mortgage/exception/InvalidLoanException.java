package com.homeplanner.mortgage.exception;

/**
 * Raised when loan terms are structurally invalid. Thrown before any schedule is computed.
 */
public class InvalidLoanException extends IllegalArgumentException {

    public InvalidLoanException(String message) {
        super(message);
    }
}
