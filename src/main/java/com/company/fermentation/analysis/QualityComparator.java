package com.company.fermentation.analysis;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.AnomalyDetail;
import com.company.fermentation.domain.AnomalyReport;
import com.company.fermentation.domain.Assessment;
import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.ComparisonReport;
import com.company.fermentation.domain.DeviationMetrics;
import com.company.fermentation.domain.ParameterReadings;
import com.company.fermentation.domain.ParameterStatuses;
import com.company.fermentation.domain.SamplePoint;
import com.company.fermentation.domain.Series;
import com.company.fermentation.domain.SeriesComparison;
import com.company.fermentation.domain.SimilarityResult;
import com.company.fermentation.domain.enums.DeviationStatus;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.domain.enums.QualityBand;
import com.company.fermentation.reference.ReferenceModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares batch data against the reference trajectory, either one sample at a time while
 * streaming or as a whole series on request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityComparator {

    private final DeviationScorer deviationScorer;
    private final SimilarityScorer similarityScorer;
    private final NoveltyDetector noveltyDetector;
    private final ReferenceModel referenceModel;
    private final MonitoringProperties properties;

    /**
     * Scores sample {@code index} of a batch against the reference sample at the same index,
     * clamped to the last reference sample when the batch is longer.
     */
    public ComparisonReport compareTick(BatchProfile profile, int index) {
        ReferenceModel.Snapshot installed = referenceModel.requireSnapshot();
        Series reference = installed.getSeries();
        Series series = profile.getSeries();
        SamplePoint actual = series.sample(index);
        SamplePoint ideal = reference.sample(Math.min(index, reference.size() - 1));

        ParameterReadings deviations = new ParameterReadings(
                Math.abs(actual.getPh() - ideal.getPh()),
                Math.abs(actual.getTemperature() - ideal.getTemperature()),
                Math.abs(actual.getCo2() - ideal.getCo2()));

        ParameterStatuses statuses = new ParameterStatuses(
                deviationScorer.classifyPoint(Parameter.PH, deviations.getPh()),
                deviationScorer.classifyPoint(Parameter.TEMPERATURE, deviations.getTemperature()),
                deviationScorer.classifyPoint(Parameter.CO2, deviations.getCo2()));

        double scoreTotal = 0.0;
        for (Parameter parameter : Parameter.values()) {
            scoreTotal += parameterScore(parameter, deviations.get(parameter));
        }
        double qualityScore = scoreTotal / Parameter.values().length;
        QualityBand band = properties.getQualityBands().classify(qualityScore);

        int prefix = index + 1;
        Series generatedPrefix = series.head(prefix);
        Series referencePrefix = reference.head(prefix);
        int aligned = Math.min(generatedPrefix.size(), referencePrefix.size());
        double trajectorySimilarity = similarityScorer
                .score(generatedPrefix.head(aligned), referencePrefix.head(aligned))
                .getOverall();

        NoveltyScore novelty = installed.getDetector().score(actual.toVector());

        return ComparisonReport.builder()
                .batchNumber(profile.getBatchNumber())
                .sampleIndex(index)
                .timestamp(actual.getTimestamp())
                .actual(ParameterReadings.of(actual))
                .ideal(ParameterReadings.of(ideal))
                .deviations(deviations)
                .status(statuses)
                .deviationStatus(statuses.worst())
                .overallStatus(band)
                .qualityScore(qualityScore)
                .trajectorySimilarity(trajectorySimilarity)
                .noveltyScore(novelty.getAnomalyScore())
                .outlier(novelty.isOutlier())
                .batchStatus(profile.getBatchStatus())
                .expectedQuality(profile.getExpectedQualityScore())
                .build();
    }

    /**
     * 100 at zero deviation, falling linearly to 0 at the parameter's tolerance.
     */
    public double parameterScore(Parameter parameter, double absoluteDeviation) {
        double tolerance = properties.getThresholds().get(parameter).getTolerance();
        return Math.max(0.0, 100.0 * (1.0 - absoluteDeviation / tolerance));
    }

    public SeriesComparison compare(Series generated) {
        return compare(generated, referenceModel.requireSeries());
    }

    /**
     * Full-series comparison. Both series are truncated to the shorter length first.
     */
    public SeriesComparison compare(Series generated, Series reference) {
        int n = Math.min(generated.size(), reference.size());
        Series g = generated.head(n);
        Series r = reference.head(n);
        if (generated.size() != reference.size()) {
            log.debug("Aligned series of {} and {} points to {}", generated.size(), reference.size(), n);
        }

        Map<Parameter, DeviationMetrics> deviations = deviationScorer.score(g, r);
        AnomalyReport anomalies = detectAnomalies(g, r);
        SimilarityResult similarity = similarityScorer.score(g, r);
        Assessment assessment = assess(deviations, anomalies, similarity);

        return SeriesComparison.builder()
                .comparedPoints(n)
                .deviations(deviations)
                .anomalies(anomalies)
                .similarity(similarity)
                .assessment(assessment)
                .comparisonTimestamp(Instant.now())
                .build();
    }

    /**
     * Fits a forest on the reference and scores every generated point against it.
     */
    public AnomalyReport detectAnomalies(Series generated, Series reference) {
        int n = generated.size();
        if (n < NoveltyDetector.MIN_POINTS || reference.size() < NoveltyDetector.MIN_POINTS) {
            return AnomalyReport.none(n);
        }

        IsolationForestModel model = noveltyDetector.fit(reference.vectors());
        List<NoveltyScore> scores = model.score(generated.vectors());

        List<Integer> indices = new ArrayList<>();
        List<Double> timestamps = new ArrayList<>();
        List<Double> anomalyScores = new ArrayList<>(n);
        List<AnomalyDetail> details = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            NoveltyScore score = scores.get(i);
            anomalyScores.add(score.getAnomalyScore());
            if (score.isOutlier()) {
                indices.add(i);
                SamplePoint g = generated.sample(i);
                timestamps.add(g.getTimestamp());
                details.add(describe(i, g, reference.sample(i)));
            }
        }

        return AnomalyReport.builder()
                .hasAnomalies(!indices.isEmpty())
                .anomalyCount(indices.size())
                .anomalyPercentage(100.0 * indices.size() / n)
                .anomalyIndices(Collections.unmodifiableList(indices))
                .anomalyTimestamps(Collections.unmodifiableList(timestamps))
                .anomalyScores(Collections.unmodifiableList(anomalyScores))
                .anomalyDetails(Collections.unmodifiableList(details))
                .build();
    }

    private AnomalyDetail describe(int index, SamplePoint generated, SamplePoint reference) {
        List<String> types = new ArrayList<>();
        double[] deviation = new double[Parameter.values().length];
        for (Parameter parameter : Parameter.values()) {
            double dev = Math.abs(generated.get(parameter) - reference.get(parameter));
            deviation[parameter.ordinal()] = dev;
            MonitoringProperties.ParameterThreshold threshold = properties.getThresholds().get(parameter);
            // Strictly above, unlike the series status rule
            if (dev > threshold.getCritical()) {
                types.add("critical_" + parameter.getTag() + "_deviation");
            } else if (dev > threshold.getWarning()) {
                types.add("warning_" + parameter.getTag() + "_deviation");
            }
        }
        return AnomalyDetail.builder()
                .index(index)
                .timestamp(generated.getTimestamp())
                .types(types)
                .deviations(new ParameterReadings(deviation[0], deviation[1], deviation[2]))
                .build();
    }

    Assessment assess(Map<Parameter, DeviationMetrics> deviations, AnomalyReport anomalies,
                      SimilarityResult similarity) {
        List<Parameter> critical = parametersWith(deviations, DeviationStatus.CRITICAL);
        List<Parameter> warning = parametersWith(deviations, DeviationStatus.WARNING);

        DeviationStatus status;
        String message;
        if (!critical.isEmpty()) {
            status = DeviationStatus.CRITICAL;
            message = "Critical deviations detected in: " + keys(critical);
        } else if (!warning.isEmpty()) {
            status = DeviationStatus.WARNING;
            message = "Warning deviations detected in: " + keys(warning);
        } else if (anomalies.isHasAnomalies()) {
            status = DeviationStatus.WARNING;
            message = "Anomalies detected at " + anomalies.getAnomalyCount() + " time points";
        } else if (similarity.getOverall() < properties.getSimilarity().getThreshold()) {
            status = DeviationStatus.WARNING;
            message = String.format("Low similarity score: %.2f", similarity.getOverall());
        } else {
            status = DeviationStatus.NORMAL;
            message = "Fermentation process is within normal parameters";
        }

        return Assessment.builder()
                .overallStatus(status)
                .message(message)
                .criticalParameters(critical)
                .warningParameters(warning)
                .qualityScore(similarity.getOverall() * 100.0)
                .recommendations(recommendations(critical, warning, anomalies))
                .build();
    }

    private List<String> recommendations(List<Parameter> critical, List<Parameter> warning,
                                         AnomalyReport anomalies) {
        List<String> recommendations = new ArrayList<>();

        if (critical.contains(Parameter.PH)) {
            recommendations.add("URGENT: Check pH levels - possible contamination or acid imbalance");
        } else if (warning.contains(Parameter.PH)) {
            recommendations.add("Monitor pH closely - slight deviation detected");
        }

        if (critical.contains(Parameter.TEMPERATURE)) {
            recommendations.add("URGENT: Check temperature control - cooling system may be failing");
        } else if (warning.contains(Parameter.TEMPERATURE)) {
            recommendations.add("Monitor temperature - ensure cooling system is functioning");
        }

        if (critical.contains(Parameter.CO2)) {
            recommendations.add("URGENT: Check CO2 levels - fermentation may be stalled or over-active");
        } else if (warning.contains(Parameter.CO2)) {
            recommendations.add("Monitor CO2 production - fermentation rate may be abnormal");
        }

        if (anomalies.isHasAnomalies() && anomalies.getAnomalyPercentage() > 10.0) {
            recommendations.add("Multiple anomalies detected - consider full system inspection");
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Continue monitoring - process is normal");
        }
        return recommendations;
    }

    private static List<Parameter> parametersWith(Map<Parameter, DeviationMetrics> deviations,
                                                  DeviationStatus status) {
        return deviations.entrySet().stream()
                .filter(e -> e.getValue().getStatus() == status)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String keys(List<Parameter> parameters) {
        return parameters.stream().map(Parameter::getKey).collect(Collectors.joining(", "));
    }
}
