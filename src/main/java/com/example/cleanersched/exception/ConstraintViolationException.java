package com.example.cleanersched.exception;

import com.example.cleanersched.conflict.ValidationResult;

/**
 * 事前検証で重大な競合が見つかり、変更を確定できない場合に送出する。
 */
public class ConstraintViolationException extends RuntimeException {

    private final String constraintType;
    private final ValidationResult validationResult;

    public ConstraintViolationException(String message, ValidationResult validationResult) {
        this(message, "SCHEDULE_CONFLICT", validationResult);
    }

    public ConstraintViolationException(String message, String constraintType, ValidationResult validationResult) {
        super(message);
        this.constraintType = constraintType;
        this.validationResult = validationResult;
    }

    public String getConstraintType() {
        return constraintType;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
