package io.github.yok.eeg.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.eeg.core.forward.DomainFunction;
import io.github.yok.eeg.core.forward.ForwardSolver;
import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.pipeline.ComparisonPipeline;
import io.github.yok.eeg.core.pipeline.FailureKind;
import io.github.yok.eeg.io.EegInputSource;
import io.github.yok.eeg.out.VolumeWriter;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EegCheckCliRunnerTest {

    private static final List<Double> RADII = List.of(0.092, 0.086, 0.080, 0.078);

    private final PrintStream originalErr = System.err;

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void captureStderr() {
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStderr() {
        System.setErr(originalErr);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void successExitsWithZero() {
        EegCheckCliRunner runner = runner(new StubInput(1), RADII);

        runner.run();

        assertEquals(0, runner.getExitCode());
        assertEquals("", stderr());
    }

    @Test
    void failureKindDeterminesExitCode() {
        EegCheckCliRunner noDipole = runner(new StubInput(0), RADII);
        EegCheckCliRunner badRadii = runner(new StubInput(1), List.of(1.0, 2.0, 1.5, 3.0));

        noDipole.run();
        badRadii.run();

        assertEquals(FailureKind.PRECONDITION.exitCode(), noDipole.getExitCode());
        assertEquals(FailureKind.CONFIGURATION.exitCode(), badRadii.getExitCode());
        assertTrue(stderr().contains("stage=LOAD_DIPOLE, kind=PRECONDITION"), stderr());
        assertTrue(stderr().contains("stage=CONFIGURE, kind=CONFIGURATION"), stderr());
    }

    @Test
    void unexpectedErrorExitsWithOne() {
        EegCheckCliRunner runner = new EegCheckCliRunner(new EegCheckProperties(),
                new ComparisonPipeline(RADII, List.of(0.0, 0.0, 0.0), 0, StubSolver::new,
                        (r, c, s, e, p, m) -> new double[] {1.0, -1.0}, new StubInput(1),
                        report -> {
                            throw new IllegalStateException("console closed");
                        }, List.of(), false));

        runner.run();

        assertEquals(EegCheckCliRunner.UNEXPECTED_FAILURE, runner.getExitCode());
        assertTrue(stderr().contains("console closed"), stderr());
    }

    private static EegCheckCliRunner runner(EegInputSource input, List<Double> radii) {
        ComparisonPipeline pipeline = new ComparisonPipeline(radii, List.of(0.0, 0.0, 0.0), 0,
                StubSolver::new, (r, c, s, e, p, m) -> new double[] {1.0, -1.0}, input,
                report -> {
                }, List.of(), false);
        return new EegCheckCliRunner(new EegCheckProperties(), pipeline);
    }

    private static final class StubSolver implements ForwardSolver {

        @Override
        public DomainFunction solveEegForward(Dipole dipole) {
            return point -> 0.0;
        }

        @Override
        public void setElectrodes(List<FieldVector> electrodes) {}

        @Override
        public double[] evaluateAtElectrodes(DomainFunction solution) {
            return new double[] {0.9, -1.1};
        }

        @Override
        public VolumeWriter volumeWriter() {
            return (solution, file) -> {
            };
        }

        @Override
        public void close() {}
    }

    private static final class StubInput implements EegInputSource {

        private final int dipoleCount;

        StubInput(int dipoleCount) {
            this.dipoleCount = dipoleCount;
        }

        @Override
        public List<Dipole> readDipoles() {
            return dipoleCount == 0 ? List.of()
                    : List.of(new Dipole(FieldVector.of(0, 0, 0.05), FieldVector.of(0, 0, 1)));
        }

        @Override
        public List<FieldVector> readElectrodes() {
            return List.of(FieldVector.of(0, 0, 0.092), FieldVector.of(0, 0, -0.092));
        }

        @Override
        public List<FieldVector> readConductivities() {
            return List.of(FieldVector.of(0.43, 0.0042, 1.79, 0.33));
        }
    }
}
