package com.company.fermentation.source;

import com.company.fermentation.domain.Series;

/**
 * Ideal fermentation curves: pH falls along a sigmoid from 5.8 to 4.8, temperature rises
 * by 3 °C around hour 15 from metabolic heat, CO2 follows logistic growth to 12 g/L.
 */
public final class GoldenStandardCurves {

    private GoldenStandardCurves() {
    }

    public static double ph(double hours) {
        return 5.8 - 1.0 / (1.0 + Math.exp(-0.1 * (hours - 36.0)));
    }

    public static double temperature(double hours) {
        double offset = hours - 15.0;
        return 18.0 + 3.0 * Math.exp(-(offset * offset) / 200.0);
    }

    public static double co2(double hours) {
        return 12.0 / (1.0 + Math.exp(-0.15 * (hours - 36.0)));
    }

    /**
     * Evenly spaced timestamps from 0 to {@code durationHours} inclusive.
     */
    public static double[] timestamps(int durationHours, int samplingIntervalMinutes) {
        int samples = (durationHours * 60) / samplingIntervalMinutes;
        double[] timestamps = new double[samples];
        if (samples == 1) {
            return timestamps;
        }
        double step = (double) durationHours / (samples - 1);
        for (int i = 0; i < samples; i++) {
            timestamps[i] = i * step;
        }
        return timestamps;
    }

    public static Series generate(int durationHours, int samplingIntervalMinutes) {
        double[] timestamps = timestamps(durationHours, samplingIntervalMinutes);
        int n = timestamps.length;
        double[] ph = new double[n];
        double[] temperature = new double[n];
        double[] co2 = new double[n];
        for (int i = 0; i < n; i++) {
            ph[i] = ph(timestamps[i]);
            temperature[i] = temperature(timestamps[i]);
            co2[i] = co2(timestamps[i]);
        }
        return Series.of(timestamps, ph, temperature, co2);
    }
}
