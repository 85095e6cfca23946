package io.github.yok.eeg.core.metric;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PotentialNormalizerTest {

    @Test
    void subtractMean_returnsZeroMeanCopy() {
        double[] in = {1.0, 2.0, 6.0};

        double[] out = PotentialNormalizer.subtractMean(in);

        assertArrayEquals(new double[] {-2.0, -1.0, 3.0}, out, 1e-15);
        assertEquals(0.0, PotentialNormalizer.mean(out), 1e-15);
        assertArrayEquals(new double[] {1.0, 2.0, 6.0}, in, "input must not be mutated");
    }

    @Test
    void subtractMean_isIdempotent() {
        double[] once = PotentialNormalizer.subtractMean(new double[] {0.3, -1.7, 5.2, 9.9});
        double[] twice = PotentialNormalizer.subtractMean(once);

        assertArrayEquals(once, twice, 1e-12);
    }

    @Test
    void subtractMean_allEqualGivesZeros() {
        assertArrayEquals(new double[] {0.0, 0.0, 0.0},
                PotentialNormalizer.subtractMean(new double[] {4.0, 4.0, 4.0}));
    }

    @Test
    void subtractMean_rejectsEmptyAndNull() {
        assertThrows(IllegalArgumentException.class,
                () -> PotentialNormalizer.subtractMean(new double[0]));
        assertThrows(IllegalArgumentException.class, () -> PotentialNormalizer.subtractMean(null));
    }
}
