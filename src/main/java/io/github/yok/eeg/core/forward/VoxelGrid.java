package io.github.yok.eeg.core.forward;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.geometry.LayeredSphere;
import java.util.Arrays;

/**
 * 多層球を覆う立方体の等間隔格子を表すクラスです。
 *
 * <p>
 * 格子点は球の中心を含むように配置し、中心からの距離が最外層半径以下の点を計算領域（未知数）とします。
 * 格子点インデックスは {@code index = (iz * n + iy) * n + ix} です。
 * </p>
 */
public final class VoxelGrid {

    /**
     * 1 軸あたりの格子点数の上限です。
     */
    static final int MAX_NODES_PER_AXIS = 256;

    /**
     * 格子間隔です。
     */
    private final double spacing;

    /**
     * 格子点 (0,0,0) の座標です。
     */
    private final double[] origin;

    /**
     * 1 軸あたりの格子点数です。
     */
    private final int n;

    /**
     * 格子点 → 未知数インデックス（領域外は -1）です。
     */
    private final int[] unknownOfNode;

    /**
     * 未知数インデックス → 格子点です。
     */
    private final int[] nodeOfUnknown;

    /**
     * 未知数ごとの導電率です。
     */
    private final double[] conductivity;

    private VoxelGrid(double spacing, double[] origin, int n, int[] unknownOfNode,
            int[] nodeOfUnknown, double[] conductivity) {
        this.spacing = spacing;
        this.origin = origin;
        this.n = n;
        this.unknownOfNode = unknownOfNode;
        this.nodeOfUnknown = nodeOfUnknown;
        this.conductivity = conductivity;
    }

    /**
     * 多層球を覆う格子を生成します。
     *
     * @param sphere 多層球です（null 不可）
     * @param spacing 格子間隔です（正）
     * @return 格子です
     * @throws IllegalArgumentException 引数が不正、または格子が大きすぎる場合に発生します
     */
    public static VoxelGrid covering(LayeredSphere sphere, double spacing) {
        checkNotNull(sphere, "sphere は null 不可です");
        checkArgument(Double.isFinite(spacing) && spacing > 0.0, "spacing は正の有限値である必要があります: %s",
                spacing);

        double outer = sphere.outerRadius();
        long half = (long) Math.ceil(outer / spacing);
        long nodes = 2 * half + 1;
        checkArgument(nodes <= MAX_NODES_PER_AXIS, "格子が大きすぎます: 1 軸あたり %s 点（上限 %s）。spacing を大きくしてください",
                nodes, MAX_NODES_PER_AXIS);
        int n = (int) nodes;

        double[] origin = new double[3];
        for (int d = 0; d < 3; d++) {
            origin[d] = sphere.center(d) - half * spacing;
        }

        int[] unknownOfNode = new int[n * n * n];
        Arrays.fill(unknownOfNode, -1);
        int[] nodeBuf = new int[n * n * n];
        double[] sigmaBuf = new double[n * n * n];
        int count = 0;
        // 境界上の点を丸め誤差で落とさないための相対余裕
        double slack = 1e-12 * outer;
        for (int iz = 0; iz < n; iz++) {
            for (int iy = 0; iy < n; iy++) {
                for (int ix = 0; ix < n; ix++) {
                    double x = origin[0] + ix * spacing;
                    double y = origin[1] + iy * spacing;
                    double z = origin[2] + iz * spacing;
                    double dist = sphere.distanceFromCenter(x, y, z);
                    int layer = sphere.layerAt(Math.max(0.0, dist - slack));
                    if (layer < 0) {
                        continue;
                    }
                    int node = (iz * n + iy) * n + ix;
                    unknownOfNode[node] = count;
                    nodeBuf[count] = node;
                    sigmaBuf[count] = sphere.conductivity(layer);
                    count++;
                }
            }
        }
        checkArgument(count > 1, "計算領域の格子点が不足しています: %s", count);
        return new VoxelGrid(spacing, origin, n, unknownOfNode, Arrays.copyOf(nodeBuf, count),
                Arrays.copyOf(sigmaBuf, count));
    }

    /**
     * 格子間隔を返します。
     *
     * @return 格子間隔です
     */
    public double spacing() {
        return spacing;
    }

    /**
     * 1 軸あたりの格子点数を返します。
     *
     * @return 格子点数です
     */
    public int nodesPerAxis() {
        return n;
    }

    /**
     * 格子点 (0,0,0) の座標成分を返します。
     *
     * @param axis 軸です（0..2）
     * @return 座標です
     */
    public double origin(int axis) {
        return origin[axis];
    }

    /**
     * 未知数（計算領域内の格子点）の数を返します。
     *
     * @return 未知数の数です
     */
    public int unknownCount() {
        return nodeOfUnknown.length;
    }

    /**
     * 格子座標に対応する未知数インデックスを返します。
     *
     * @param ix x 方向インデックスです
     * @param iy y 方向インデックスです
     * @param iz z 方向インデックスです
     * @return 未知数インデックスです（格子外・領域外は -1）
     */
    public int unknownAt(int ix, int iy, int iz) {
        if (ix < 0 || iy < 0 || iz < 0 || ix >= n || iy >= n || iz >= n) {
            return -1;
        }
        return unknownOfNode[(iz * n + iy) * n + ix];
    }

    /**
     * 未知数の格子座標を返します。
     *
     * @param unknown 未知数インデックスです
     * @return {ix, iy, iz} です
     */
    public int[] indexOfUnknown(int unknown) {
        int node = nodeOfUnknown[unknown];
        return new int[] {node % n, (node / n) % n, node / (n * n)};
    }

    /**
     * 未知数の位置の導電率を返します。
     *
     * @param unknown 未知数インデックスです
     * @return 導電率です
     */
    public double conductivityOf(int unknown) {
        return conductivity[unknown];
    }

    /**
     * 指定点に最も近い未知数を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @param z z 座標です
     * @return 未知数インデックスです
     */
    public int closestUnknown(double x, double y, double z) {
        int best = -1;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int u = 0; u < nodeOfUnknown.length; u++) {
            int[] idx = indexOfUnknown(u);
            double dx = origin[0] + idx[0] * spacing - x;
            double dy = origin[1] + idx[1] * spacing - y;
            double dz = origin[2] + idx[2] * spacing - z;
            double d = dx * dx + dy * dy + dz * dz;
            if (d < bestDist) {
                bestDist = d;
                best = u;
            }
        }
        return best;
    }
}
