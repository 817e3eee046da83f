package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.CursorState;
import com.company.fermentation.domain.enums.QualityBand;
import lombok.Builder;
import lombok.Data;

/**
 * Read position of one batch. Mutated only by the stream orchestrator.
 */
@Data
@Builder
public class BatchCursor {
    private final int batchId;
    private BatchProfile profile;
    private int position;
    private CursorState state;
    private QualityBand status;
    private long samplesProcessed;
    private int wraps;

    public boolean hasNext() {
        return profile != null && position < profile.totalSamples();
    }

    public boolean isExhausted() {
        return state == CursorState.EXHAUSTED;
    }
}
