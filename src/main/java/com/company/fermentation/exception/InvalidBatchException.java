package com.company.fermentation.exception;

public class InvalidBatchException extends RuntimeException {
    public InvalidBatchException(int batchId, int batchCount) {
        super(String.format("batch_number must be 1-%d, got %d", batchCount, batchId));
    }
}
