package com.company.fermentation.exception;

public class UnsupportedExportFormatException extends RuntimeException {
    public UnsupportedExportFormatException(String format) {
        super("format must be 'json' or 'csv', got '" + format + "'");
    }
}
