package com.company.fermentation.analysis;

import java.util.Random;

/**
 * One randomized partitioning tree of an isolation forest.
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree build(double[][] points, int[] sampleIndices, int maxDepth, Random random) {
        int[] indices = sampleIndices.clone();
        return new IsolationTree(grow(points, indices, 0, indices.length, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.dimension] < node.splitValue ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree of {@code n} points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static Node grow(double[][] points, int[] indices, int from, int to,
                             int depth, int maxDepth, Random random) {
        int size = to - from;
        if (size <= 1 || depth >= maxDepth) {
            return Node.leaf(size);
        }

        int dimensions = points[indices[from]].length;
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] point = points[indices[i]];
            for (int d = 0; d < dimensions; d++) {
                min[d] = Math.min(min[d], point[d]);
                max[d] = Math.max(max[d], point[d]);
            }
        }

        int[] splittable = new int[dimensions];
        int candidates = 0;
        for (int d = 0; d < dimensions; d++) {
            if (max[d] > min[d]) {
                splittable[candidates++] = d;
            }
        }
        // All remaining points are identical
        if (candidates == 0) {
            return Node.leaf(size);
        }

        int dimension = splittable[random.nextInt(candidates)];
        double splitValue = min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]);

        int boundary = from;
        for (int i = from; i < to; i++) {
            if (points[indices[i]][dimension] < splitValue) {
                int tmp = indices[boundary];
                indices[boundary] = indices[i];
                indices[i] = tmp;
                boundary++;
            }
        }

        Node left = grow(points, indices, from, boundary, depth + 1, maxDepth, random);
        Node right = grow(points, indices, boundary, to, depth + 1, maxDepth, random);
        return Node.split(dimension, splitValue, left, right);
    }

    private static final class Node {
        private final int dimension;
        private final double splitValue;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int dimension, double splitValue, Node left, Node right, int size) {
            this.dimension = dimension;
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int dimension, double splitValue, Node left, Node right) {
            return new Node(dimension, splitValue, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
