package com.company.fermentation.source;

import com.company.fermentation.domain.BatchProfile;

/**
 * Supplies the full trajectory of a batch. Called once per batch, when its cursor opens.
 */
public interface BatchProfileSource {

    BatchProfile load(int batchId);
}
