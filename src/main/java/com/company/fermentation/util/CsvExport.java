package com.company.fermentation.util;

import com.company.fermentation.domain.BatchDataPoint;
import com.company.fermentation.domain.ComparisonReport;
import com.company.fermentation.domain.ResultEnvelope;

import java.util.List;
import java.util.Map;

/**
 * CSV rendering of batch history.
 */
public final class CsvExport {

    public static final String HEADER =
            "timestamp,ph,temperature,co2,ideal_ph,ideal_temperature,ideal_co2,quality_score,status";

    private CsvExport() {
    }

    public static String batch(List<ResultEnvelope> history) {
        StringBuilder csv = new StringBuilder(HEADER);
        for (ResultEnvelope envelope : history) {
            csv.append('\n');
            row(csv, envelope);
        }
        return csv.toString();
    }

    public static String allBatches(Map<Integer, List<ResultEnvelope>> histories) {
        StringBuilder csv = new StringBuilder("batch_number,").append(HEADER);
        histories.forEach((batchNumber, history) -> {
            for (ResultEnvelope envelope : history) {
                csv.append('\n').append(batchNumber).append(',');
                row(csv, envelope);
            }
        });
        return csv.toString();
    }

    private static void row(StringBuilder csv, ResultEnvelope envelope) {
        BatchDataPoint point = envelope.getDataPoint();
        ComparisonReport comparison = envelope.getComparison();
        csv.append(point.getTimestamp()).append(',')
                .append(point.getPh()).append(',')
                .append(point.getTemperature()).append(',')
                .append(point.getCo2()).append(',')
                .append(comparison.getIdeal().getPh()).append(',')
                .append(comparison.getIdeal().getTemperature()).append(',')
                .append(comparison.getIdeal().getCo2()).append(',')
                .append(comparison.getQualityScore()).append(',')
                .append(point.getBatchStatus());
    }
}
