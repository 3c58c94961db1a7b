package org.neuralchilli.gantt.core;

/**
 * Thrown when a snapshot, edge or date change is structurally invalid
 * (unknown task, due date before start date, duplicate edge, ...).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
