package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.exception.InvalidSeriesException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable multivariate time series of (timestamp hours, pH, temperature °C, CO2 g/L).
 * Timestamps are strictly increasing and every value is finite.
 */
public final class Series {

    private static final Series EMPTY = new Series(new double[0], new double[0], new double[0], new double[0]);

    private final double[] timestamps;
    private final double[] ph;
    private final double[] temperature;
    private final double[] co2;

    private Series(double[] timestamps, double[] ph, double[] temperature, double[] co2) {
        this.timestamps = timestamps;
        this.ph = ph;
        this.temperature = temperature;
        this.co2 = co2;
    }

    public static Series empty() {
        return EMPTY;
    }

    public static Series of(double[] timestamps, double[] ph, double[] temperature, double[] co2) {
        if (timestamps == null || ph == null || temperature == null || co2 == null) {
            throw new InvalidSeriesException("Series requires timestamps, ph, temperature and co2");
        }
        int n = timestamps.length;
        if (ph.length != n || temperature.length != n || co2.length != n) {
            throw new InvalidSeriesException(String.format(
                    "Series columns differ in length: timestamps=%d, ph=%d, temperature=%d, co2=%d",
                    n, ph.length, temperature.length, co2.length));
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(timestamps[i]) || !Double.isFinite(ph[i])
                    || !Double.isFinite(temperature[i]) || !Double.isFinite(co2[i])) {
                throw new InvalidSeriesException("Non-finite value at index " + i);
            }
            if (i > 0 && timestamps[i] <= timestamps[i - 1]) {
                throw new InvalidSeriesException(String.format(
                        "Timestamps must be strictly increasing (index %d: %s <= %s)",
                        i, timestamps[i], timestamps[i - 1]));
            }
        }
        return new Series(timestamps.clone(), ph.clone(), temperature.clone(), co2.clone());
    }

    public static Series of(List<SamplePoint> points) {
        int n = points.size();
        double[] ts = new double[n];
        double[] p = new double[n];
        double[] t = new double[n];
        double[] c = new double[n];
        for (int i = 0; i < n; i++) {
            SamplePoint point = points.get(i);
            ts[i] = point.getTimestamp();
            p[i] = point.getPh();
            t[i] = point.getTemperature();
            c[i] = point.getCo2();
        }
        return of(ts, p, t, c);
    }

    public int size() {
        return timestamps.length;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public SamplePoint sample(int index) {
        return new SamplePoint(timestamps[index], ph[index], temperature[index], co2[index]);
    }

    public SamplePoint last() {
        return sample(size() - 1);
    }

    public double[] getTimestamps() {
        return timestamps.clone();
    }

    public double[] getPh() {
        return ph.clone();
    }

    public double[] getTemperature() {
        return temperature.clone();
    }

    public double[] getCo2() {
        return co2.clone();
    }

    public double[] values(Parameter parameter) {
        switch (parameter) {
            case PH:
                return getPh();
            case TEMPERATURE:
                return getTemperature();
            case CO2:
                return getCo2();
            default:
                throw new IllegalArgumentException("Unsupported parameter: " + parameter);
        }
    }

    /**
     * First {@code length} samples, or this series when it is not longer than that.
     */
    public Series head(int length) {
        if (length >= size()) {
            return this;
        }
        int n = Math.max(0, length);
        return new Series(
                Arrays.copyOf(timestamps, n),
                Arrays.copyOf(ph, n),
                Arrays.copyOf(temperature, n),
                Arrays.copyOf(co2, n));
    }

    /**
     * Rows of (ph, temperature, co2), the feature space of the novelty detector.
     */
    public List<double[]> vectors() {
        List<double[]> rows = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            rows.add(new double[]{ph[i], temperature[i], co2[i]});
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Series)) return false;
        Series other = (Series) o;
        return Arrays.equals(timestamps, other.timestamps)
                && Arrays.equals(ph, other.ph)
                && Arrays.equals(temperature, other.temperature)
                && Arrays.equals(co2, other.co2);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(timestamps);
        result = 31 * result + Arrays.hashCode(ph);
        result = 31 * result + Arrays.hashCode(temperature);
        result = 31 * result + Arrays.hashCode(co2);
        return result;
    }

    @Override
    public String toString() {
        return "Series{size=" + size() + "}";
    }
}
