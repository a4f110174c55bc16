package com.modelmonitor.drift;

import org.springframework.stereotype.Component;

/**
 * Population Stability Index between a reference and a current sample.
 *
 * <p>Both samples are binned on {@code bins + 1} evenly spaced edges spanning the combined
 * range. The last bin is closed on the right. Each bin's share of its sample is offset by
 * {@link #FLOOR} so empty bins contribute a finite term. A combined range collapsed to one
 * value gives 0.
 */
@Component
public class PsiCalculator {

    static final double FLOOR = 1e-6;

    public double calculate(double[] reference, double[] current, int bins) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1, got " + bins);
        }
        if (reference.length == 0 || current.length == 0) {
            return 0.0;
        }

        double min = Math.min(min(reference), min(current));
        double max = Math.max(max(reference), max(current));
        if (min == max) {
            return 0.0;
        }

        double[] baselineDensity = density(reference, min, max, bins);
        double[] currentDensity = density(current, min, max, bins);

        double psi = 0.0;
        for (int i = 0; i < bins; i++) {
            double b = baselineDensity[i];
            double c = currentDensity[i];
            psi += (c - b) * Math.log(c / b);
        }
        return psi;
    }

    private double[] density(double[] values, double min, double max, int bins) {
        double width = (max - min) / bins;
        double[] counts = new double[bins];
        for (double value : values) {
            int bin = (int) ((value - min) / width);
            if (bin >= bins) {
                bin = bins - 1;
            } else if (bin < 0) {
                bin = 0;
            }
            counts[bin]++;
        }
        for (int i = 0; i < bins; i++) {
            counts[i] = counts[i] / values.length + FLOOR;
        }
        return counts;
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }
}
