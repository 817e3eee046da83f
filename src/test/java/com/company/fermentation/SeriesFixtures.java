package com.company.fermentation;

import com.company.fermentation.analysis.DeviationScorer;
import com.company.fermentation.analysis.NoveltyDetector;
import com.company.fermentation.analysis.QualityComparator;
import com.company.fermentation.analysis.SimilarityScorer;
import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.Series;
import com.company.fermentation.reference.ReferenceModel;
import com.company.fermentation.source.GoldenStandardCurves;

/**
 * Shared builders for series, profiles and a wired comparator.
 */
public final class SeriesFixtures {

    private SeriesFixtures() {
    }

    public static Series golden() {
        return GoldenStandardCurves.generate(72, 30);
    }

    /**
     * Hourly samples with the given pH values and constant temperature and CO2.
     */
    public static Series ph(double... ph) {
        int n = ph.length;
        double[] timestamps = new double[n];
        double[] temperature = new double[n];
        double[] co2 = new double[n];
        for (int i = 0; i < n; i++) {
            timestamps[i] = i;
            temperature[i] = 18.0;
            co2[i] = 1.0 + i;
        }
        return Series.of(timestamps, ph, temperature, co2);
    }

    public static Series shiftPh(Series series, double delta) {
        double[] ph = series.getPh();
        for (int i = 0; i < ph.length; i++) {
            ph[i] += delta;
        }
        return Series.of(series.getTimestamps(), ph, series.getTemperature(), series.getCo2());
    }

    public static Series withPhAt(Series series, int index, double delta) {
        double[] ph = series.getPh();
        ph[index] += delta;
        return Series.of(series.getTimestamps(), ph, series.getTemperature(), series.getCo2());
    }

    public static BatchProfile profile(int batchNumber, Series series) {
        return BatchProfile.builder()
                .batchNumber(batchNumber)
                .batchStatus("perfect")
                .expectedQualityScore(100)
                .description("test batch " + batchNumber)
                .series(series)
                .durationHours(72)
                .samplingIntervalMinutes(30)
                .build();
    }

    public static ReferenceModel referenceModel(MonitoringProperties properties, Series reference) {
        ReferenceModel model = new ReferenceModel(new NoveltyDetector(properties));
        model.install(reference);
        return model;
    }

    public static QualityComparator comparator(MonitoringProperties properties, ReferenceModel referenceModel) {
        return new QualityComparator(
                new DeviationScorer(properties),
                new SimilarityScorer(properties),
                new NoveltyDetector(properties),
                referenceModel,
                properties);
    }
}
