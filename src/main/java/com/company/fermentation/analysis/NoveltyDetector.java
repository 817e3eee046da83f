package com.company.fermentation.analysis;

import com.company.fermentation.config.MonitoringProperties;
import com.company.fermentation.exception.InsufficientDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest trainer.
 *
 * <p>Each tree is grown on a random subsample of the reference points, splitting on a random
 * dimension at a random value inside the node's range until a node holds at most one point or
 * the depth limit {@code ceil(log2(sampleSize))} is reached. The decision threshold is the
 * {@code (1 - contamination)} quantile of the reference set's own scores.
 *
 * <p>Splits are drawn from a generator seeded with {@code fermentation.detector.seed}, so fitting
 * the same input twice yields identical classifications.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NoveltyDetector {

    public static final int MIN_POINTS = 2;

    private final MonitoringProperties properties;

    public IsolationForestModel fit(List<double[]> referencePoints) {
        int n = referencePoints == null ? 0 : referencePoints.size();
        if (n < MIN_POINTS) {
            throw new InsufficientDataException(MIN_POINTS, n);
        }

        MonitoringProperties.Detector config = properties.getDetector();
        double contamination = config.getContamination();
        if (contamination < 0.0 || contamination >= 1.0) {
            throw new IllegalArgumentException("contamination must be in [0, 1), got " + contamination);
        }

        double[][] points = referencePoints.toArray(new double[0][]);
        int sampleSize = Math.min(Math.max(config.getSampleSize(), MIN_POINTS), n);
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Random random = new Random(config.getSeed());

        List<IsolationTree> trees = new ArrayList<>(config.getTrees());
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        for (int t = 0; t < config.getTrees(); t++) {
            trees.add(IsolationTree.build(points, subsample(all, sampleSize, random), maxDepth, random));
        }

        IsolationForestModel uncalibrated =
                new IsolationForestModel(trees, sampleSize, contamination, Double.POSITIVE_INFINITY);

        double[] selfScores = new double[n];
        for (int i = 0; i < n; i++) {
            selfScores[i] = uncalibrated.anomalyScore(points[i]);
        }
        double threshold = contamination <= 0.0
                ? Double.POSITIVE_INFINITY
                : new Percentile()
                        .withEstimationType(Percentile.EstimationType.R_7)
                        .evaluate(selfScores, 100.0 * (1.0 - contamination));
        IsolationForestModel model = uncalibrated.withThreshold(threshold);

        log.debug("Fitted isolation forest: points={}, trees={}, sampleSize={}, maxDepth={}, threshold={}",
                n, trees.size(), sampleSize, maxDepth, threshold);

        return model;
    }

    // Partial Fisher-Yates, without replacement
    private int[] subsample(int[] all, int size, Random random) {
        int[] pool = all.clone();
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }
}
