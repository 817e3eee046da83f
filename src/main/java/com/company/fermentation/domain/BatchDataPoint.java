package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Raw sample pulled from a batch cursor on one tick.
 */
@Value
@Builder
@AllArgsConstructor
public class BatchDataPoint {
    int batchNumber;
    String batchStatus;
    int expectedQualityScore;
    String description;
    double timestamp;
    double ph;
    double temperature;
    double co2;
    int sampleIndex;
    int totalSamples;

    public SamplePoint toSample() {
        return new SamplePoint(timestamp, ph, temperature, co2);
    }

    public static BatchDataPoint from(BatchProfile profile, int index) {
        SamplePoint sample = profile.getSeries().sample(index);
        return BatchDataPoint.builder()
                .batchNumber(profile.getBatchNumber())
                .batchStatus(profile.getBatchStatus())
                .expectedQualityScore(profile.getExpectedQualityScore())
                .description(profile.getDescription())
                .timestamp(sample.getTimestamp())
                .ph(sample.getPh())
                .temperature(sample.getTemperature())
                .co2(sample.getCo2())
                .sampleIndex(index)
                .totalSamples(profile.totalSamples())
                .build();
    }
}
