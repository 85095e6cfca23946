package io.github.yok.eeg.core.analytic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MultilayerSphereAnalyticSolverTest {

    private static final double[] ORIGIN = {0.0, 0.0, 0.0};

    private static final double[] HEAD_RADII = {0.092, 0.086, 0.080, 0.078};

    private static final double[] HEAD_SIGMA = {0.43, 0.0042, 1.79, 0.33};

    private final MultilayerSphereAnalyticSolver solver =
            new MultilayerSphereAnalyticSolver(1000, 1e-12);

    @Test
    void centredDipoleInHomogeneousSphere() {
        double sigma = 0.33;
        double r = 0.09;
        List<double[]> electrodes = List.of(new double[] {0, 0, r}, new double[] {r, 0, 0},
                new double[] {0, 0, -r}, new double[] {0, r / Math.sqrt(2), r / Math.sqrt(2)});

        double[] v = solver.solve(new double[] {r}, ORIGIN, new double[] {sigma}, electrodes,
                ORIGIN, new double[] {0, 0, 1e-8});

        double peak = 3.0 * 1e-8 / (4.0 * Math.PI * sigma * r * r);
        assertEquals(peak, v[0], peak * 1e-12);
        assertEquals(0.0, v[1], peak * 1e-12);
        assertEquals(-peak, v[2], peak * 1e-12);
        assertEquals(peak / Math.sqrt(2), v[3], peak * 1e-12);
    }

    @Test
    void offCentreRadialDipoleMatchesClosedFormAtPole() {
        // 単位球・σ=1、z 軸上 b の半径方向双極子の北極での電位は (3-b)/(1-b)^2/(4π)
        double b = 0.5;
        double[] v = solver.solve(new double[] {1.0}, ORIGIN, new double[] {1.0},
                List.of(new double[] {0, 0, 1}), new double[] {0, 0, b}, new double[] {0, 0, 1});

        double expected = (3.0 - b) / ((1.0 - b) * (1.0 - b)) / (4.0 * Math.PI);
        assertEquals(expected, v[0], expected * 1e-10);
    }

    @Test
    void equalConductivityLayersMatchSingleSphere() {
        List<double[]> electrodes = ring(0.092, 12);
        double[] position = {0.01, -0.02, 0.04};
        double[] moment = {0.3, 0.2, 1.0};

        double[] layered = solver.solve(HEAD_RADII, ORIGIN, new double[] {0.33, 0.33, 0.33, 0.33},
                electrodes, position, moment);
        double[] single = solver.solve(new double[] {0.092}, ORIGIN, new double[] {0.33},
                electrodes, position, moment);

        for (int i = 0; i < single.length; i++) {
            assertEquals(single[i], layered[i], 1e-9 * maxAbs(single));
        }
    }

    @Test
    void radiiOrderDoesNotMatter() {
        List<double[]> electrodes = ring(0.092, 8);
        double[] position = {0.0, 0.02, 0.05};
        double[] moment = {1.0, 0.0, 0.5};

        double[] outerFirst =
                solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position, moment);
        double[] innerFirst = solver.solve(new double[] {0.078, 0.080, 0.086, 0.092}, ORIGIN,
                new double[] {0.33, 1.79, 0.0042, 0.43}, electrodes, position, moment);

        for (int i = 0; i < outerFirst.length; i++) {
            assertEquals(outerFirst[i], innerFirst[i], Math.abs(outerFirst[i]) * 1e-12);
        }
    }

    @Test
    void linearInMoment() {
        List<double[]> electrodes = ring(0.092, 6);
        double[] position = {0.02, 0.0, 0.03};

        double[] vx = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position,
                new double[] {1, 0, 0});
        double[] vz = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position,
                new double[] {0, 0, 1});
        double[] combined = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position,
                new double[] {2, 0, -3});

        for (int i = 0; i < combined.length; i++) {
            double expected = 2 * vx[i] - 3 * vz[i];
            assertEquals(expected, combined[i], 1e-10 * maxAbs(combined));
        }
    }

    @Test
    void skullAttenuatesScalpPotential() {
        List<double[]> electrodes = List.of(new double[] {0, 0, 0.092});
        double[] position = {0, 0, 0.06};
        double[] moment = {0, 0, 1};

        double head = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position, moment)[0];
        double homogeneous = solver.solve(HEAD_RADII, ORIGIN,
                new double[] {0.33, 0.33, 0.33, 0.33}, electrodes, position, moment)[0];

        assertTrue(head > 0.0);
        assertTrue(head < homogeneous);
    }

    @Test
    void electrodesAreProjectedOntoOuterSurface() {
        double[] position = {0.0, 0.01, 0.03};
        double[] moment = {0.0, 1.0, 1.0};

        double[] onSurface = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA,
                List.<double[]>of(new double[] {0.0, 0.0, 0.092}), position, moment);
        double[] farAway = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA,
                List.<double[]>of(new double[] {0.0, 0.0, 0.5}), position, moment);

        assertEquals(onSurface[0], farAway[0], Math.abs(onSurface[0]) * 1e-14);
    }

    @Test
    void shiftedCentreIsTranslationInvariant() {
        double[] shift = {0.1, -0.2, 0.3};
        double[] position = {0.0, 0.01, 0.04};
        double[] moment = {0.5, 0.0, 1.0};
        List<double[]> electrodes = ring(0.092, 5);
        List<double[]> shiftedElectrodes = electrodes.stream()
                .map(e -> new double[] {e[0] + shift[0], e[1] + shift[1], e[2] + shift[2]})
                .collect(java.util.stream.Collectors.toList());

        double[] base = solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, electrodes, position, moment);
        double[] shifted = solver.solve(HEAD_RADII, shift, HEAD_SIGMA, shiftedElectrodes,
                new double[] {position[0] + shift[0], position[1] + shift[1],
                        position[2] + shift[2]},
                moment);

        for (int i = 0; i < base.length; i++) {
            assertEquals(base[i], shifted[i], 1e-9 * maxAbs(base));
        }
    }

    @Test
    void rejectsDipoleOutsideInnermostLayer() {
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, ring(0.092, 3),
                        new double[] {0, 0, 0.079}, new double[] {0, 0, 1}));
    }

    @Test
    void rejectsInvalidInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(new double[] {0.092, 0.080, 0.086, 0.078}, ORIGIN, HEAD_SIGMA,
                        ring(0.092, 3), ORIGIN, new double[] {0, 0, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, ring(0.092, 3), ORIGIN,
                        new double[] {0, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> solver.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA,
                        List.<double[]>of(new double[] {0, 0, 0}), ORIGIN,
                        new double[] {0, 0, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> new MultilayerSphereAnalyticSolver(0, 1e-12));
    }

    @Test
    void failsWhenSeriesDoesNotConverge() {
        MultilayerSphereAnalyticSolver truncated = new MultilayerSphereAnalyticSolver(2, 1e-12);

        assertThrows(IllegalStateException.class,
                () -> truncated.solve(HEAD_RADII, ORIGIN, HEAD_SIGMA, ring(0.092, 3),
                        new double[] {0, 0, 0.07}, new double[] {0, 0, 1}));
    }

    private static double maxAbs(double[] v) {
        double m = 0.0;
        for (double x : v) {
            m = Math.max(m, Math.abs(x));
        }
        return m;
    }

    private static List<double[]> ring(double r, int count) {
        double[][] out = new double[count][];
        for (int i = 0; i < count; i++) {
            double theta = Math.PI * (i + 0.5) / count;
            double phi = 2.0 * Math.PI * i / count;
            out[i] = new double[] {r * Math.sin(theta) * Math.cos(phi),
                    r * Math.sin(theta) * Math.sin(phi), r * Math.cos(theta)};
        }
        return List.of(out);
    }
}
