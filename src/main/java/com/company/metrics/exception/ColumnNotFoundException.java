package com.company.metrics.exception;

public class ColumnNotFoundException extends RuntimeException {
    public ColumnNotFoundException(String columnId) {
        super("Column not found: " + columnId);
    }
}
