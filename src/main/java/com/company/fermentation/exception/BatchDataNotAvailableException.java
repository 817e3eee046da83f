package com.company.fermentation.exception;

public class BatchDataNotAvailableException extends RuntimeException {
    public BatchDataNotAvailableException(int batchId) {
        super("Batch " + batchId + " data not available yet");
    }

    public BatchDataNotAvailableException() {
        super("No batch data available yet");
    }
}
