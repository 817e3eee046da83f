package com.company.fermentation.dto.request;

import com.company.fermentation.domain.Series;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a series: one array per column. Also the layout of the reference resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeriesPayload {

    @NotNull
    private double[] timestamps;

    @NotNull
    private double[] ph;

    @NotNull
    private double[] temperature;

    @NotNull
    private double[] co2;

    @JsonProperty("duration_hours")
    private Integer durationHours;

    @JsonProperty("sampling_interval_minutes")
    private Integer samplingIntervalMinutes;

    public Series toSeries() {
        return Series.of(timestamps, ph, temperature, co2);
    }

    public static SeriesPayload from(Series series) {
        return SeriesPayload.builder()
                .timestamps(series.getTimestamps())
                .ph(series.getPh())
                .temperature(series.getTemperature())
                .co2(series.getCo2())
                .build();
    }
}
