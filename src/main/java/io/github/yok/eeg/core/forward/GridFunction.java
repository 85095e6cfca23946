package io.github.yok.eeg.core.forward;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;

/**
 * 格子点上の電位（有限体積法の解）を保持するクラスです。
 */
public final class GridFunction implements DomainFunction {

    private final VoxelGrid grid;

    /**
     * 未知数ごとの電位です。
     */
    private final double[] values;

    /**
     * 格子関数を生成します。
     *
     * @param grid 格子です（null 不可）
     * @param values 未知数ごとの電位です（長さは未知数の数）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public GridFunction(VoxelGrid grid, double[] values) {
        this.grid = checkNotNull(grid, "grid は null 不可です");
        checkNotNull(values, "values は null 不可です");
        checkArgument(values.length == grid.unknownCount(), "values の長さが未知数の数と一致しません: %s vs %s",
                values.length, grid.unknownCount());
        this.values = values.clone();
    }

    public VoxelGrid grid() {
        return grid;
    }

    /**
     * 未知数の電位を返します。
     *
     * @param unknown 未知数インデックスです
     * @return 電位です
     */
    public double valueOf(int unknown) {
        return values[unknown];
    }

    /**
     * 最も近い領域内格子点の値を返します。
     */
    @Override
    public double evaluate(FieldVector point) {
        double[] p = GeometryConverter.toArray(point, GeometryConverter.DIM);
        return values[grid.closestUnknown(p[0], p[1], p[2])];
    }

    /**
     * 格子点の値を返します。
     *
     * @param ix x 方向インデックスです
     * @param iy y 方向インデックスです
     * @param iz z 方向インデックスです
     * @return 電位です（領域外は 0）
     */
    public double valueAtNode(int ix, int iy, int iz) {
        int u = grid.unknownAt(ix, iy, iz);
        return (u < 0) ? 0.0 : values[u];
    }

    /**
     * 格子点での電位勾配を差分で返します。
     *
     * <p>
     * 両隣が領域内なら中心差分、片側のみなら片側差分、どちらも領域外なら 0 とします。
     * </p>
     *
     * @param ix x 方向インデックスです
     * @param iy y 方向インデックスです
     * @param iz z 方向インデックスです
     * @return 勾配 {gx, gy, gz} です（領域外の点は 0 ベクトル）
     */
    public double[] gradientAtNode(int ix, int iy, int iz) {
        double[] g = new double[3];
        int center = grid.unknownAt(ix, iy, iz);
        if (center < 0) {
            return g;
        }
        int[][] step = {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};
        double h = grid.spacing();
        for (int d = 0; d < 3; d++) {
            int plus = grid.unknownAt(ix + step[d][0], iy + step[d][1], iz + step[d][2]);
            int minus = grid.unknownAt(ix - step[d][0], iy - step[d][1], iz - step[d][2]);
            if (plus >= 0 && minus >= 0) {
                g[d] = (values[plus] - values[minus]) / (2.0 * h);
            } else if (plus >= 0) {
                g[d] = (values[plus] - values[center]) / h;
            } else if (minus >= 0) {
                g[d] = (values[center] - values[minus]) / h;
            }
        }
        return g;
    }
}
