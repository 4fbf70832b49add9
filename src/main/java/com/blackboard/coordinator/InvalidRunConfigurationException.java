package com.blackboard.coordinator;

/**
 * Rejected configuration; raised when settings or a run are constructed.
 */
public class InvalidRunConfigurationException extends IllegalArgumentException {

    public InvalidRunConfigurationException(String message) {
        super(message);
    }
}
