package com.company.fermentation.config;

import com.company.fermentation.domain.enums.CursorMode;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.domain.enums.QualityBand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Tunables of the monitoring pipeline, bound from {@code fermentation.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "fermentation")
public class MonitoringProperties {

    private Thresholds thresholds = new Thresholds();
    private QualityBands qualityBands = new QualityBands();
    private Similarity similarity = new Similarity();
    private Detector detector = new Detector();
    private Stream stream = new Stream();
    private Reference reference = new Reference();
    private Alerts alerts = new Alerts();
    private Broadcast broadcast = new Broadcast();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParameterThreshold {
        private double warning;
        private double critical;

        // Deviation at which the per-tick parameter score reaches 0
        private double tolerance;
    }

    @Data
    public static class Thresholds {
        private ParameterThreshold ph = new ParameterThreshold(0.3, 0.5, 1.0);
        private ParameterThreshold temperature = new ParameterThreshold(2.0, 3.5, 5.0);
        private ParameterThreshold co2 = new ParameterThreshold(1.5, 3.0, 5.0);

        public ParameterThreshold get(Parameter parameter) {
            switch (parameter) {
                case PH:
                    return ph;
                case TEMPERATURE:
                    return temperature;
                case CO2:
                    return co2;
                default:
                    throw new IllegalArgumentException("Unsupported parameter: " + parameter);
            }
        }
    }

    @Data
    public static class QualityBands {
        private double perfect = 95.0;
        private double acceptable = 90.0;
        private double concerning = 80.0;

        public QualityBand classify(double qualityScore) {
            if (qualityScore >= perfect) return QualityBand.PERFECT;
            if (qualityScore >= acceptable) return QualityBand.ACCEPTABLE;
            if (qualityScore >= concerning) return QualityBand.CONCERNING;
            return QualityBand.FAILED;
        }
    }

    @Data
    public static class Similarity {
        // Below this overall similarity a full-series comparison is a warning
        private double threshold = 0.85;

        // Sakoe-Chiba band for DTW, 0 = unconstrained
        private int dtwWindow = 0;
    }

    @Data
    public static class Detector {
        private int trees = 100;
        private int sampleSize = 256;
        private double contamination = 0.1;
        private long seed = 42L;
    }

    @Data
    public static class Stream {
        private long intervalMs = 1000;
        private long initialDelayMs = 1000;
        private CursorMode cursorMode = CursorMode.HALT;
        private int batchCount = 4;

        // Envelopes per batch replayed to a newly joined subscriber
        private int replayWindow = 50;
        // Envelopes kept per batch; 0 keeps one profile length in WRAP mode and everything in HALT mode
        private int historyRetention = 0;
        private boolean autoStart = true;
        private boolean requireSubscribers = false;

        private int durationHours = 72;
        private int samplingIntervalMinutes = 30;
        private long profileSeed = 42L;
    }

    @Data
    public static class Reference {
        private String resource = "classpath:data/golden_standard.json";
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;
        private int poolSize = 2;
        private int queueCapacity = 100;
        private Map<String, String> targetNumbers = new HashMap<>(Map.of("default", "--"));

        public String targetFor(int batchId) {
            String target = targetNumbers.get(String.valueOf(batchId));
            return target != null ? target : targetNumbers.get("default");
        }
    }

    @Data
    public static class Broadcast {
        private int subscriberQueueCapacity = 64;
        private int deliveryPoolSize = 4;
        private int sendTimeLimitMs = 5000;
        private int bufferSizeLimit = 512 * 1024;
    }
}
