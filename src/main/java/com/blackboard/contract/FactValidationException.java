package com.blackboard.contract;

/**
 * Thrown when a fact does not satisfy the contract for its kind.
 * The fact is not recorded.
 */
public class FactValidationException extends RuntimeException {

    public FactValidationException(String message) {
        super(message);
    }
}
