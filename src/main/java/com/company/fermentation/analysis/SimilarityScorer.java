package com.company.fermentation.analysis;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.Series;
import com.company.fermentation.domain.SimilarityMetrics;
import com.company.fermentation.domain.SimilarityResult;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.exception.InvalidSeriesException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fuses three similarity views of each parameter into one score in [0, 1]:
 * range-normalized Euclidean, DTW and cosine. Degenerate inputs map to fixed values,
 * never NaN.
 */
@Component
@RequiredArgsConstructor
public class SimilarityScorer {

    private final MonitoringProperties properties;

    public SimilarityResult score(Series generated, Series reference) {
        if (generated.size() != reference.size()) {
            throw new InvalidSeriesException(String.format(
                    "Series must be aligned before scoring: %d vs %d points", generated.size(), reference.size()));
        }
        Map<Parameter, SimilarityMetrics> parameters = new EnumMap<>(Parameter.class);
        double total = 0.0;
        for (Parameter parameter : Parameter.values()) {
            SimilarityMetrics metrics = score(generated.values(parameter), reference.values(parameter));
            parameters.put(parameter, metrics);
            total += metrics.getAverageSimilarity();
        }
        return SimilarityResult.builder()
                .parameters(Collections.unmodifiableMap(parameters))
                .overall(total / parameters.size())
                .build();
    }

    public SimilarityMetrics score(double[] generated, double[] reference) {
        double euclidean = euclideanSimilarity(generated, reference);
        double dtw = dtwSimilarity(generated, reference);
        double cosine = cosineSimilarity(generated, reference);
        return SimilarityMetrics.builder()
                .euclideanSimilarity(euclidean)
                .dtwSimilarity(dtw)
                .cosineSimilarity(cosine)
                .averageSimilarity((euclidean + dtw + cosine) / 3.0)
                .build();
    }

    /**
     * {@code 1 - dist / (sqrt(n) * range(generated))}. Normalized by the generated side only,
     * so it is not symmetric.
     */
    public double euclideanSimilarity(double[] generated, double[] reference) {
        int n = generated.length;
        if (n == 0) {
            return 1.0;
        }
        double range = StatUtils.max(generated) - StatUtils.min(generated);
        if (range <= 0.0) {
            return 1.0;
        }
        return 1.0 - MathArrays.distance(generated, reference) / (Math.sqrt(n) * range);
    }

    public double dtwSimilarity(double[] generated, double[] reference) {
        double distance = DynamicTimeWarping.distance(generated, reference, properties.getSimilarity().getDtwWindow());
        if (Double.isInfinite(distance)) {
            return 0.0;
        }
        return 1.0 / (1.0 + distance);
    }

    public double cosineSimilarity(double[] generated, double[] reference) {
        RealVector g = new ArrayRealVector(generated, false);
        RealVector r = new ArrayRealVector(reference, false);
        double normG = g.getNorm();
        double normR = r.getNorm();
        if (normG == 0.0 && normR == 0.0) {
            return 1.0;
        }
        if (normG == 0.0 || normR == 0.0) {
            return 0.0;
        }
        double cosine = g.cosine(r);
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
