package io.github.yok.eeg.core.forward;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.eeg.core.geometry.LayeredSphere;
import org.junit.jupiter.api.Test;

class VoxelGridTest {

    private static final LayeredSphere TWO_LAYERS = LayeredSphere.of(new double[] {1.0, 0.5},
            new double[] {0.0, 0.0, 0.0}, new double[] {2.0, 7.0});

    @Test
    void coversSphereSymmetrically() {
        VoxelGrid grid = VoxelGrid.covering(TWO_LAYERS, 0.25);

        assertEquals(9, grid.nodesPerAxis());
        assertEquals(-1.0, grid.origin(0), 1e-15);
        assertEquals(0.25, grid.spacing());

        // 軸上の端点（半径ちょうど）は領域に含まれ、角は含まれない
        assertTrue(grid.unknownAt(8, 4, 4) >= 0);
        assertTrue(grid.unknownAt(0, 4, 4) >= 0);
        assertEquals(-1, grid.unknownAt(0, 0, 0));
        assertEquals(-1, grid.unknownAt(-1, 4, 4));
        assertEquals(-1, grid.unknownAt(9, 4, 4));
    }

    @Test
    void assignsLayerConductivity() {
        VoxelGrid grid = VoxelGrid.covering(TWO_LAYERS, 0.25);

        assertEquals(7.0, grid.conductivityOf(grid.unknownAt(4, 4, 4)));
        assertEquals(7.0, grid.conductivityOf(grid.unknownAt(6, 4, 4)));
        assertEquals(2.0, grid.conductivityOf(grid.unknownAt(7, 4, 4)));
    }

    @Test
    void unknownIndexRoundTrips() {
        VoxelGrid grid = VoxelGrid.covering(TWO_LAYERS, 0.25);

        for (int u = 0; u < grid.unknownCount(); u++) {
            int[] idx = grid.indexOfUnknown(u);
            assertEquals(u, grid.unknownAt(idx[0], idx[1], idx[2]));
        }
        int centre = grid.unknownAt(4, 4, 4);
        assertArrayEquals(new int[] {4, 4, 4}, grid.indexOfUnknown(centre));
        assertEquals(centre, grid.closestUnknown(0.01, -0.02, 0.1));
    }

    @Test
    void rejectsOversizedOrInvalidSpacing() {
        assertThrows(IllegalArgumentException.class, () -> VoxelGrid.covering(TWO_LAYERS, 0.001));
        assertThrows(IllegalArgumentException.class, () -> VoxelGrid.covering(TWO_LAYERS, 0.0));
        assertThrows(IllegalArgumentException.class, () -> VoxelGrid.covering(TWO_LAYERS, 5.0));
    }
}
