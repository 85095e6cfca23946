package io.github.yok.eeg.core.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import java.util.List;
import org.junit.jupiter.api.Test;

class ComparisonArtifactsTest {

    @Test
    void potentialsAreCopiedOnConstructionAndAccess() {
        double[] analytical = {1.0, -1.0};
        double[] numerical = {0.5, -0.5};
        ComparisonArtifacts artifacts = new ComparisonArtifacts(
                new Dipole(FieldVector.of(0, 0, 0.05), FieldVector.of(0, 0, 1)),
                List.of(FieldVector.of(0, 0, 0.092), FieldVector.of(0, 0, -0.092)), analytical,
                numerical, null, null, null);

        analytical[0] = 99.0;
        numerical[0] = 99.0;
        artifacts.getAnalytical()[1] = 99.0;
        artifacts.getNumerical()[1] = 99.0;

        assertArrayEquals(new double[] {1.0, -1.0}, artifacts.getAnalytical());
        assertArrayEquals(new double[] {0.5, -0.5}, artifacts.getNumerical());
    }
}
