package com.company.metrics.exception;

public class SliceConditionCheckException extends IllegalStateException {
    public SliceConditionCheckException(String fieldName) {
        super("Slice condition on '" + fieldName + "' is a grouping key and cannot be checked against a value");
    }
}
