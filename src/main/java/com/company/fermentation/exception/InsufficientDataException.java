package com.company.fermentation.exception;

public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(int required, int actual) {
        super(String.format("At least %d points are required, got %d", required, actual));
    }
}
