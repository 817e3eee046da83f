package com.company.fermentation.exception;

public class ReferenceUnavailableException extends RuntimeException {
    public ReferenceUnavailableException(String message) {
        super(message);
    }
}
