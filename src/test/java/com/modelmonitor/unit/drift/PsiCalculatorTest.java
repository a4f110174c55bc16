package com.modelmonitor.unit.drift;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.modelmonitor.drift.PsiCalculator;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PsiCalculatorTest {

    private final PsiCalculator psiCalculator = new PsiCalculator();

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 10, 50})
    void distributionAgainstItself_isZero(int bins) {
        double[] values = gaussian(new Random(7), 500, 10.0, 2.0);

        assertThat(psiCalculator.calculate(values, values.clone(), bins)).isZero();
    }

    @Test
    void randomPairs_neverNegative() {
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            double[] reference = gaussian(random, 50 + random.nextInt(200), random.nextDouble() * 10, 1.0);
            double[] current = gaussian(random, 50 + random.nextInt(200), random.nextDouble() * 10, 2.0);

            assertThat(psiCalculator.calculate(reference, current, 1 + random.nextInt(20)))
                    .isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void constantSharedValue_isZero() {
        assertThat(psiCalculator.calculate(new double[] {3, 3, 3}, new double[] {3, 3}, 10)).isZero();
    }

    @Test
    void shiftedDistribution_exceedsDefaultLimit() {
        Random random = new Random(1);
        double[] reference = gaussian(random, 1000, 0.0, 1.0);
        double[] current = gaussian(random, 1000, 2.0, 1.0);

        assertThat(psiCalculator.calculate(reference, current, 10)).isGreaterThan(0.1);
    }

    @Test
    void sameProportionsDifferentSizes_isZero() {
        double psi = psiCalculator.calculate(new double[] {0, 0, 10, 10}, new double[] {0, 10}, 4);

        assertThat(psi).isZero();
    }

    @Test
    void nonPositiveBins_rejected() {
        assertThatThrownBy(() -> psiCalculator.calculate(new double[] {1}, new double[] {2}, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[] gaussian(Random random, int n, double mean, double stdDev) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + random.nextGaussian() * stdDev;
        }
        return values;
    }
}
