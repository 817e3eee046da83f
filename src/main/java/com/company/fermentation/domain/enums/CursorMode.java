package com.company.fermentation.domain.enums;

/**
 * What a batch cursor does after its last sample.
 */
public enum CursorMode {
    /** Stop the batch permanently. */
    HALT,
    /** Restart the batch from sample 0. */
    WRAP
}
