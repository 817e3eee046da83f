package com.company.fermentation.analysis;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class NoveltyScore {
    // (0, 1], higher is more anomalous
    double anomalyScore;
    boolean outlier;
}
