package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class SimilarityMetrics {
    double euclideanSimilarity;
    double dtwSimilarity;
    double cosineSimilarity;
    double averageSimilarity;
}
