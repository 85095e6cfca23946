package io.github.yok.eeg.out;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.forward.DomainFunction;
import io.github.yok.eeg.core.forward.GridFunction;
import io.github.yok.eeg.core.forward.VoxelGrid;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 格子上の電位を legacy VTK（ASCII, STRUCTURED_POINTS）で出力するクラスです。
 *
 * <p>
 * 点データとして {@code potential}・{@code conductivity}（スカラー）と {@code gradient}（ベクトル）を持ちます。
 * 計算領域外の格子点は電位・導電率・勾配とも 0 です。
 * </p>
 */
public final class VtkVolumeWriter implements VolumeWriter {

    @Override
    public void write(DomainFunction solution, Path file) throws IOException {
        checkNotNull(solution, "solution は null 不可です");
        checkNotNull(file, "file は null 不可です");
        checkArgument(solution instanceof GridFunction, "格子上の解ではありません: %s",
                solution.getClass().getName());

        GridFunction f = (GridFunction) solution;
        VoxelGrid grid = f.grid();
        int n = grid.nodesPerAxis();
        long points = (long) n * n * n;

        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            pw.println("# vtk DataFile Version 3.0");
            pw.println("eeg forward solution");
            pw.println("ASCII");
            pw.println("DATASET STRUCTURED_POINTS");
            pw.println("DIMENSIONS " + n + " " + n + " " + n);
            pw.println("ORIGIN " + VtkFormat.number(grid.origin(0)) + " "
                    + VtkFormat.number(grid.origin(1)) + " " + VtkFormat.number(grid.origin(2)));
            String h = VtkFormat.number(grid.spacing());
            pw.println("SPACING " + h + " " + h + " " + h);
            pw.println("POINT_DATA " + points);

            // x が最も速く変わる順（VTK の STRUCTURED_POINTS の並び）
            pw.println("SCALARS potential double 1");
            pw.println("LOOKUP_TABLE default");
            for (int iz = 0; iz < n; iz++) {
                for (int iy = 0; iy < n; iy++) {
                    for (int ix = 0; ix < n; ix++) {
                        pw.println(VtkFormat.number(f.valueAtNode(ix, iy, iz)));
                    }
                }
            }

            pw.println("SCALARS conductivity double 1");
            pw.println("LOOKUP_TABLE default");
            for (int iz = 0; iz < n; iz++) {
                for (int iy = 0; iy < n; iy++) {
                    for (int ix = 0; ix < n; ix++) {
                        int u = grid.unknownAt(ix, iy, iz);
                        pw.println(VtkFormat.number(u < 0 ? 0.0 : grid.conductivityOf(u)));
                    }
                }
            }

            pw.println("VECTORS gradient double");
            for (int iz = 0; iz < n; iz++) {
                for (int iy = 0; iy < n; iy++) {
                    for (int ix = 0; ix < n; ix++) {
                        pw.println(VtkFormat.vector(f.gradientAtNode(ix, iy, iz)));
                    }
                }
            }
            if (pw.checkError()) {
                throw new IOException("VTK の書き込みに失敗しました: " + file);
            }
        }
    }
}
