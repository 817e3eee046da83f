package com.company.fermentation.reference;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.exception.InsufficientDataException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the configured reference resource into the {@link ReferenceModel} at startup.
 * A missing or invalid resource leaves the model unavailable; the service still starts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceDataInitializer {

    private final ReferenceSeriesLoader loader;
    private final ReferenceModel referenceModel;
    private final MonitoringProperties properties;

    @PostConstruct
    public void initialize() {
        String location = properties.getReference().getResource();
        loader.load(location).ifPresentOrElse(series -> {
            try {
                referenceModel.install(series);
            } catch (InsufficientDataException e) {
                log.error("Reference at {} cannot train the detector: {}", location, e.getMessage());
            }
        }, () -> log.warn("No reference trajectory available, comparisons are disabled until one is loaded"));
    }
}
