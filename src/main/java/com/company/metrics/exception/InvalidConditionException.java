package com.company.metrics.exception;

public class InvalidConditionException extends IllegalArgumentException {
    public InvalidConditionException(String message) {
        super(message);
    }
}
