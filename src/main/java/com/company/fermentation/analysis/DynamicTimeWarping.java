package com.company.fermentation.analysis;

import java.util.Arrays;

/**
 * Dynamic time warping distance with absolute-difference local cost.
 */
public final class DynamicTimeWarping {

    private DynamicTimeWarping() {
    }

    /**
     * @param window Sakoe-Chiba band half-width, 0 for unconstrained. Widened to the length
     *               difference of the inputs so a warping path always exists.
     */
    public static double distance(double[] a, double[] b, int window) {
        int n = a.length;
        int m = b.length;
        if (n == 0 && m == 0) {
            return 0.0;
        }
        if (n == 0 || m == 0) {
            return Double.POSITIVE_INFINITY;
        }

        int band = window > 0 ? Math.max(window, Math.abs(n - m)) : Math.max(n, m);

        // Two rolling rows
        double[] previous = new double[m + 1];
        double[] current = new double[m + 1];
        Arrays.fill(previous, Double.POSITIVE_INFINITY);
        previous[0] = 0.0;

        for (int i = 1; i <= n; i++) {
            Arrays.fill(current, Double.POSITIVE_INFINITY);
            int from = Math.max(1, i - band);
            int to = Math.min(m, i + band);
            for (int j = from; j <= to; j++) {
                double cost = Math.abs(a[i - 1] - b[j - 1]);
                double best = Math.min(previous[j - 1], Math.min(previous[j], current[j - 1]));
                current[j] = cost + best;
            }
            double[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }
}
