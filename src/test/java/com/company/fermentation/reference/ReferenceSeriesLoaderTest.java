package com.company.fermentation.reference;

import com.company.fermentation.domain.Series;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reference resource loading")
class ReferenceSeriesLoaderTest {

    private ReferenceSeriesLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ReferenceSeriesLoader(new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    @DisplayName("The bundled golden standard loads with 144 samples")
    void bundledReference() {
        Series series = loader.load("classpath:data/golden_standard.json").orElseThrow();

        assertEquals(144, series.size());
        assertEquals(0.0, series.getTimestamps()[0]);
        assertEquals(72.0, series.last().getTimestamp(), 1e-6);
    }

    @Test
    @DisplayName("A missing resource yields nothing")
    void missingResource() {
        assertEquals(Optional.empty(), loader.load("classpath:data/does_not_exist.json"));
    }

    @Test
    @DisplayName("Out-of-order timestamps are rejected")
    void unorderedTimestamps() {
        assertTrue(loader.load("classpath:data/unordered_reference.json").isEmpty());
    }

    @Test
    @DisplayName("A resource missing a parameter column is rejected")
    void missingColumn() {
        assertTrue(loader.load("classpath:data/partial_reference.json").isEmpty());
    }
}
