package com.company.fermentation.source;

import java.util.Random;

/**
 * The demo batch profiles: sensor noise on top of the ideal curves, plus a drift that grows
 * linearly from {@code degradationStart} to the end of the run.
 */
public enum BatchTemplate {

    ACCEPTABLE(1, "acceptable", 92, "Good fermentation with slight degradation after 55 hours",
            0.015, 0.12, 0.08, 55.0) {
        @Override
        void degrade(double[] values, double t, double factor, Random random) {
            values[0] += factor * 0.12;
            values[1] += factor * uniform(random, -0.4, 0.6);
            values[2] *= 1.0 - factor * 0.05;
        }
    },

    PERFECT(2, "perfect", 100, "Perfect fermentation matching golden standard",
            0.01, 0.1, 0.05, Double.POSITIVE_INFINITY) {
        @Override
        void degrade(double[] values, double t, double factor, Random random) {
        }
    },

    FAILED(3, "failed", 70, "Failed fermentation with significant deviations",
            0.02, 0.15, 0.1, 40.0) {
        @Override
        void degrade(double[] values, double t, double factor, Random random) {
            values[0] += factor * 0.6 + uniform(random, 0.0, 0.1);
            values[1] += factor * uniform(random, -3.0, 4.0);
            values[2] *= 1.0 - factor * 0.4;
        }
    },

    CONCERNING(4, "concerning", 85, "Concerning fermentation with moderate deviations throughout",
            0.025, 0.2, 0.12, 50.0) {
        @Override
        void degrade(double[] values, double t, double factor, Random random) {
            values[0] += factor * 0.22;
            values[1] += Math.sin(t) * factor;
            values[2] *= 1.0 - factor * 0.12;
        }
    };

    private final int batchNumber;
    private final String label;
    private final int expectedQuality;
    private final String description;
    private final double phNoise;
    private final double temperatureNoise;
    private final double co2Noise;
    private final double degradationStart;

    BatchTemplate(int batchNumber, String label, int expectedQuality, String description,
                  double phNoise, double temperatureNoise, double co2Noise, double degradationStart) {
        this.batchNumber = batchNumber;
        this.label = label;
        this.expectedQuality = expectedQuality;
        this.description = description;
        this.phNoise = phNoise;
        this.temperatureNoise = temperatureNoise;
        this.co2Noise = co2Noise;
        this.degradationStart = degradationStart;
    }

    /**
     * Applies the drift to one (ph, temperature, co2) sample in place.
     */
    abstract void degrade(double[] values, double t, double factor, Random random);

    public int getBatchNumber() {
        return batchNumber;
    }

    public String getLabel() {
        return label;
    }

    public int getExpectedQuality() {
        return expectedQuality;
    }

    public String getDescription() {
        return description;
    }

    public double getPhNoise() {
        return phNoise;
    }

    public double getTemperatureNoise() {
        return temperatureNoise;
    }

    public double getCo2Noise() {
        return co2Noise;
    }

    public double getDegradationStart() {
        return degradationStart;
    }

    /**
     * Batches beyond the fourth reuse the templates in order.
     */
    public static BatchTemplate forBatch(int batchId) {
        BatchTemplate[] templates = values();
        return templates[Math.floorMod(batchId - 1, templates.length)];
    }

    private static double uniform(Random random, double from, double to) {
        return from + random.nextDouble() * (to - from);
    }
}
