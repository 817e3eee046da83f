package com.company.fermentation.analysis;

import com.company.fermentation.domain.AnomalyReport;
import com.company.fermentation.domain.Assessment;
import com.company.fermentation.domain.DeviationMetrics;
import com.company.fermentation.domain.SeriesComparison;
import com.company.fermentation.domain.enums.Parameter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of a {@link SeriesComparison}.
 */
@Component
public class ComparisonReportFormatter {

    private static final String RULE = "=".repeat(60);
    private static final String SUB_RULE = "-".repeat(60);

    public String format(SeriesComparison comparison) {
        StringBuilder out = new StringBuilder();
        Assessment assessment = comparison.getAssessment();

        line(out, RULE);
        line(out, "FERMENTATION DATA COMPARISON REPORT");
        line(out, RULE);
        line(out, "");
        line(out, "Overall Status: " + assessment.getOverallStatus().name());
        line(out, String.format(Locale.ROOT, "Quality Score: %.1f/100", assessment.getQualityScore()));
        line(out, "Message: " + assessment.getMessage());
        line(out, "");

        line(out, "PARAMETER DEVIATIONS:");
        line(out, SUB_RULE);
        for (Map.Entry<Parameter, DeviationMetrics> entry : comparison.getDeviations().entrySet()) {
            DeviationMetrics metrics = entry.getValue();
            line(out, entry.getKey().getKey().toUpperCase(Locale.ROOT) + ":");
            line(out, "  Status: " + metrics.getStatus().getLabel());
            line(out, String.format(Locale.ROOT, "  MAE: %.3f", metrics.getMae()));
            line(out, String.format(Locale.ROOT, "  RMSE: %.3f", metrics.getRmse()));
            line(out, String.format(Locale.ROOT, "  Max Deviation: %.3f", metrics.getMaxDeviation()));
            line(out, String.format(Locale.ROOT, "  Correlation: %.3f", metrics.getCorrelation()));
            line(out, "");
        }

        AnomalyReport anomalies = comparison.getAnomalies();
        line(out, "ANOMALY DETECTION:");
        line(out, SUB_RULE);
        line(out, "Anomalies Detected: " + anomalies.isHasAnomalies());
        line(out, "Anomaly Count: " + anomalies.getAnomalyCount());
        line(out, String.format(Locale.ROOT, "Anomaly Percentage: %.1f%%", anomalies.getAnomalyPercentage()));
        line(out, "");

        line(out, "RECOMMENDATIONS:");
        line(out, SUB_RULE);
        List<String> recommendations = assessment.getRecommendations();
        for (int i = 0; i < recommendations.size(); i++) {
            line(out, (i + 1) + ". " + recommendations.get(i));
        }
        line(out, "");
        out.append(RULE);
        return out.toString();
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
