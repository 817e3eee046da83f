package com.company.fermentation.source;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.Series;
import com.company.fermentation.exception.InvalidBatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Generates demo batch trajectories from the ideal curves. Each batch draws from its own
 * generator seeded with {@code profile-seed + batchId}, so a batch is reproducible
 * independently of load order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FermentationProfileGenerator implements BatchProfileSource {

    static final double PH_MIN = 4.0;
    static final double PH_MAX = 6.5;
    static final double TEMPERATURE_MIN = 15.0;
    static final double TEMPERATURE_MAX = 25.0;
    static final double CO2_MIN = 0.0;
    static final double CO2_MAX = 15.0;

    private final MonitoringProperties properties;

    @Override
    public BatchProfile load(int batchId) {
        MonitoringProperties.Stream config = properties.getStream();
        if (batchId < 1 || batchId > config.getBatchCount()) {
            throw new InvalidBatchException(batchId, config.getBatchCount());
        }

        BatchTemplate template = BatchTemplate.forBatch(batchId);
        int duration = config.getDurationHours();
        int interval = config.getSamplingIntervalMinutes();
        Random random = new Random(config.getProfileSeed() + batchId);

        double[] timestamps = GoldenStandardCurves.timestamps(duration, interval);
        int n = timestamps.length;
        double[] ph = new double[n];
        double[] temperature = new double[n];
        double[] co2 = new double[n];

        for (int i = 0; i < n; i++) {
            double t = timestamps[i];
            ph[i] = GoldenStandardCurves.ph(t) + random.nextGaussian() * template.getPhNoise();
            temperature[i] = GoldenStandardCurves.temperature(t) + random.nextGaussian() * template.getTemperatureNoise();
            co2[i] = GoldenStandardCurves.co2(t) + random.nextGaussian() * template.getCo2Noise();
        }

        double start = template.getDegradationStart();
        double end = n > 0 ? timestamps[n - 1] : 0.0;
        if (end > start) {
            double[] values = new double[3];
            for (int i = 0; i < n; i++) {
                double t = timestamps[i];
                if (t < start) {
                    continue;
                }
                values[0] = ph[i];
                values[1] = temperature[i];
                values[2] = co2[i];
                template.degrade(values, t, (t - start) / (end - start), random);
                ph[i] = values[0];
                temperature[i] = values[1];
                co2[i] = values[2];
            }
        }

        for (int i = 0; i < n; i++) {
            ph[i] = clip(ph[i], PH_MIN, PH_MAX);
            temperature[i] = clip(temperature[i], TEMPERATURE_MIN, TEMPERATURE_MAX);
            co2[i] = clip(co2[i], CO2_MIN, CO2_MAX);
        }

        log.debug("Generated profile for batch {} ({}): {} samples", batchId, template.getLabel(), n);

        return BatchProfile.builder()
                .batchNumber(batchId)
                .batchStatus(template.getLabel())
                .expectedQualityScore(template.getExpectedQuality())
                .description(template.getDescription())
                .series(Series.of(timestamps, ph, temperature, co2))
                .durationHours(duration)
                .samplingIntervalMinutes(interval)
                .build();
    }

    private static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
