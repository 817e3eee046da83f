package com.company.fermentation.source;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.domain.BatchProfile;
import com.company.fermentation.domain.Series;
import com.company.fermentation.exception.InvalidBatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Demo profile generation")
class FermentationProfileGeneratorTest {

    private MonitoringProperties properties;
    private FermentationProfileGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new MonitoringProperties();
        generator = new FermentationProfileGenerator(properties);
    }

    @Test
    @DisplayName("Batches map to their templates")
    void templates() {
        assertEquals("acceptable", generator.load(1).getBatchStatus());
        assertEquals("perfect", generator.load(2).getBatchStatus());
        assertEquals("failed", generator.load(3).getBatchStatus());
        BatchProfile concerning = generator.load(4);
        assertEquals("concerning", concerning.getBatchStatus());
        assertEquals(85, concerning.getExpectedQualityScore());
        assertEquals(BatchTemplate.ACCEPTABLE, BatchTemplate.forBatch(5));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    @DisplayName("Every profile has 144 samples within the physical ranges")
    void clippedRanges(int batchId) {
        Series series = generator.load(batchId).getSeries();

        assertEquals(144, series.size());
        for (double ph : series.getPh()) {
            assertTrue(ph >= 4.0 && ph <= 6.5);
        }
        for (double temperature : series.getTemperature()) {
            assertTrue(temperature >= 15.0 && temperature <= 25.0);
        }
        for (double co2 : series.getCo2()) {
            assertTrue(co2 >= 0.0 && co2 <= 15.0);
        }
    }

    @Test
    @DisplayName("Profiles are reproducible per batch")
    void deterministic() {
        assertEquals(generator.load(3).getSeries(), new FermentationProfileGenerator(properties).load(3).getSeries());
    }

    @Test
    @DisplayName("The perfect batch tracks the ideal curve and the failed batch drifts late in the run")
    void drift() {
        Series golden = GoldenStandardCurves.generate(72, 30);
        double perfectLate = meanPhDeviation(generator.load(2).getSeries(), golden, 120, 144);
        double failedEarly = meanPhDeviation(generator.load(3).getSeries(), golden, 0, 40);
        double failedLate = meanPhDeviation(generator.load(3).getSeries(), golden, 120, 144);

        assertTrue(perfectLate < 0.05, "perfect late " + perfectLate);
        assertTrue(failedLate > failedEarly + 0.3, "failed early " + failedEarly + " late " + failedLate);
    }

    @Test
    @DisplayName("Batch ids outside the configured range are rejected")
    void invalidBatch() {
        assertThrows(InvalidBatchException.class, () -> generator.load(0));
        assertThrows(InvalidBatchException.class, () -> generator.load(5));
    }

    @Test
    @DisplayName("Ideal curves start and end at their documented values")
    void goldenCurves() {
        double[] timestamps = GoldenStandardCurves.timestamps(72, 30);

        assertEquals(144, timestamps.length);
        assertEquals(72.0, timestamps[143], 1e-9);
        assertEquals(5.3, GoldenStandardCurves.ph(36.0), 1e-12);
        assertEquals(21.0, GoldenStandardCurves.temperature(15.0), 1e-12);
        assertEquals(6.0, GoldenStandardCurves.co2(36.0), 1e-12);
    }

    private static double meanPhDeviation(Series series, Series golden, int from, int to) {
        double[] ph = series.getPh();
        double[] ideal = golden.getPh();
        double total = 0.0;
        for (int i = from; i < to; i++) {
            total += Math.abs(ph[i] - ideal[i]);
        }
        return total / (to - from);
    }
}
