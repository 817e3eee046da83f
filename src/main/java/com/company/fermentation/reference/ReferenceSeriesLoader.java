package com.company.fermentation.reference;

import com.company.fermentation.domain.Series;
import com.company.fermentation.dto.request.SeriesPayload;
import com.company.fermentation.exception.InvalidSeriesException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads the reference trajectory from a JSON resource.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceSeriesLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    /**
     * @return empty when the resource is missing, unreadable or not a valid series
     */
    public Optional<Series> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Reference resource not found: {}", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            SeriesPayload payload = objectMapper.readValue(in, SeriesPayload.class);
            if (payload.getTimestamps() == null || payload.getPh() == null
                    || payload.getTemperature() == null || payload.getCo2() == null) {
                log.warn("Reference resource {} is missing one of timestamps/ph/temperature/co2", location);
                return Optional.empty();
            }
            return Optional.of(payload.toSeries());
        } catch (IOException e) {
            log.error("Failed to read reference resource {}", location, e);
            return Optional.empty();
        } catch (InvalidSeriesException e) {
            log.error("Reference resource {} is not a valid series: {}", location, e.getMessage());
            return Optional.empty();
        }
    }
}
