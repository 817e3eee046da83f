package com.company.fermentation.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trained isolation forest. Immutable, safe to share between threads.
 */
public class IsolationForestModel {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double normalizer;
    private final double contamination;
    private final double threshold;

    IsolationForestModel(List<IsolationTree> trees, int sampleSize, double contamination, double threshold) {
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
        this.normalizer = IsolationTree.averagePathLength(sampleSize);
        this.contamination = contamination;
        this.threshold = threshold;
    }

    /**
     * Same trees with a different outlier threshold.
     */
    IsolationForestModel withThreshold(double threshold) {
        return new IsolationForestModel(trees, sampleSize, contamination, threshold);
    }

    /**
     * Raw anomaly score {@code 2^(-E[h(x)] / c(psi))}. Never throws, also for points far outside
     * the training range.
     */
    public double anomalyScore(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double meanPath = total / trees.size();
        if (normalizer <= 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -meanPath / normalizer);
    }

    public NoveltyScore score(double[] point) {
        double score = anomalyScore(point);
        return new NoveltyScore(score, score > threshold);
    }

    public List<NoveltyScore> score(List<double[]> points) {
        List<NoveltyScore> scores = new ArrayList<>(points.size());
        for (double[] point : points) {
            scores.add(score(point));
        }
        return scores;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getContamination() {
        return contamination;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getTreeCount() {
        return trees.size();
    }
}
