package com.company.fermentation.exception;

public class InvalidSeriesException extends RuntimeException {
    public InvalidSeriesException(String message) {
        super(message);
    }
}
