package com.company.fermentation.analysis;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.DeviationMetrics;
import com.company.fermentation.domain.Series;
import com.company.fermentation.domain.enums.DeviationStatus;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.exception.InvalidSeriesException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pointwise error statistics and threshold classification of a generated series against a
 * reference of the same length.
 */
@Component
@RequiredArgsConstructor
public class DeviationScorer {

    private final MonitoringProperties properties;

    public Map<Parameter, DeviationMetrics> score(Series generated, Series reference) {
        if (generated.size() != reference.size()) {
            throw new InvalidSeriesException(String.format(
                    "Series must be aligned before scoring: %d vs %d points", generated.size(), reference.size()));
        }
        Map<Parameter, DeviationMetrics> metrics = new EnumMap<>(Parameter.class);
        for (Parameter parameter : Parameter.values()) {
            metrics.put(parameter, score(parameter, generated.values(parameter), reference.values(parameter)));
        }
        return Collections.unmodifiableMap(metrics);
    }

    public DeviationMetrics score(Parameter parameter, double[] generated, double[] reference) {
        int n = generated.length;
        if (n == 0) {
            return DeviationMetrics.builder()
                    .mae(0.0)
                    .rmse(0.0)
                    .maxDeviation(0.0)
                    .correlation(0.0)
                    .correlationPValue(1.0)
                    .pointDeviations(List.of())
                    .status(DeviationStatus.NORMAL)
                    .build();
        }

        double[] diffs = MathArrays.ebeSubtract(generated, reference);
        double[] absolute = new double[n];
        List<Double> pointDeviations = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            absolute[i] = Math.abs(diffs[i]);
            pointDeviations.add(diffs[i]);
        }
        double mae = StatUtils.mean(absolute);
        double rmse = Math.sqrt(StatUtils.sumSq(diffs) / n);
        double max = StatUtils.max(absolute);

        double r = correlation(generated, reference);
        double p = pValue(r, n);

        return DeviationMetrics.builder()
                .mae(mae)
                .rmse(rmse)
                .maxDeviation(max)
                .correlation(r)
                .correlationPValue(p)
                .pointDeviations(Collections.unmodifiableList(pointDeviations))
                .status(classify(parameter, mae, max))
                .build();
    }

    /**
     * Critical when the largest deviation reaches the critical threshold, warning when the
     * mean absolute error reaches the warning threshold.
     */
    public DeviationStatus classify(Parameter parameter, double mae, double maxDeviation) {
        MonitoringProperties.ParameterThreshold threshold = properties.getThresholds().get(parameter);
        if (maxDeviation >= threshold.getCritical()) {
            return DeviationStatus.CRITICAL;
        }
        if (mae >= threshold.getWarning()) {
            return DeviationStatus.WARNING;
        }
        return DeviationStatus.NORMAL;
    }

    /**
     * Classification of a single absolute deviation.
     */
    public DeviationStatus classifyPoint(Parameter parameter, double absoluteDeviation) {
        return classify(parameter, absoluteDeviation, absoluteDeviation);
    }

    // 0 when either side is constant or there are fewer than two points
    static double correlation(double[] x, double[] y) {
        if (x.length < 2) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(r)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, r));
    }

    // Two-sided, Student t with n - 2 degrees of freedom
    static double pValue(double r, int n) {
        if (n < 3 || r == 0.0) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - r * r));
        TDistribution distribution = new TDistribution(null, n - 2);
        double p = 2.0 * (1.0 - distribution.cumulativeProbability(t));
        return Math.max(0.0, Math.min(1.0, p));
    }
}
