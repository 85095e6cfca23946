package io.github.yok.eeg.core.geometry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 同心多層球の幾何と導電率を、内側→外側の順に正規化して保持するクラスです。
 *
 * <p>
 * 設定では半径を外側→内側（頭皮・頭蓋骨・脳脊髄液・脳）で与えることが多いため、 並びを判定して内側→外側へ揃えます。
 * 導電率は半径とインデックス対応で同じ並べ替えを受けます。
 * </p>
 */
public final class LayeredSphere {

    private final double[] center;

    private final double[] radii;

    private final double[] conductivities;

    private LayeredSphere(double[] center, double[] radii, double[] conductivities) {
        this.center = center;
        this.radii = radii;
        this.conductivities = conductivities;
    }

    /**
     * 半径・中心・導電率から層構造を生成します。
     *
     * @param radii 各層の半径です（狭義単調、正の有限値）
     * @param center 中心です（3 成分）
     * @param conductivities 各層の導電率です（radii と同じ長さ、正の有限値）
     * @return 内側→外側に揃えた層構造です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public static LayeredSphere of(double[] radii, double[] center, double[] conductivities) {
        checkNotNull(radii, "radii は null 不可です");
        checkNotNull(center, "center は null 不可です");
        checkNotNull(conductivities, "conductivities は null 不可です");
        checkArgument(center.length == GeometryConverter.DIM, "center は 3 成分が必要です: %s",
                center.length);
        checkArgument(radii.length > 0, "radii は 1 層以上が必要です");
        checkArgument(radii.length == conductivities.length,
                "radii と conductivities の層数が一致しません: %s vs %s", radii.length,
                conductivities.length);

        int n = radii.length;
        for (int l = 0; l < n; l++) {
            checkArgument(Double.isFinite(radii[l]) && radii[l] > 0.0,
                    "radii[%s] は正の有限値である必要があります: %s", l, Double.valueOf(radii[l]));
            checkArgument(Double.isFinite(conductivities[l]) && conductivities[l] > 0.0,
                    "conductivities[%s] は正の有限値である必要があります: %s", l,
                    Double.valueOf(conductivities[l]));
        }
        boolean increasing = true;
        boolean decreasing = true;
        for (int l = 1; l < n; l++) {
            increasing &= radii[l] > radii[l - 1];
            decreasing &= radii[l] < radii[l - 1];
        }
        checkArgument(increasing || decreasing, "radii は狭義単調である必要があります");

        double[] r = new double[n];
        double[] sigma = new double[n];
        for (int l = 0; l < n; l++) {
            int src = increasing ? l : n - 1 - l;
            r[l] = radii[src];
            sigma[l] = conductivities[src];
        }
        return new LayeredSphere(center.clone(), r, sigma);
    }

    /**
     * 層数を返します。
     *
     * @return 層数です
     */
    public int layerCount() {
        return radii.length;
    }

    /**
     * 中心の指定成分を返します。
     *
     * @param axis 軸です（0..2）
     * @return 中心座標です
     */
    public double center(int axis) {
        return center[axis];
    }

    /**
     * 内側から数えた層の半径を返します。
     *
     * @param layer 層番号です（0 が最内層）
     * @return 半径です
     */
    public double radius(int layer) {
        return radii[layer];
    }

    /**
     * 内側から数えた層の導電率を返します。
     *
     * @param layer 層番号です（0 が最内層）
     * @return 導電率です
     */
    public double conductivity(int layer) {
        return conductivities[layer];
    }

    /**
     * 最外層の半径を返します。
     *
     * @return 最外層半径です
     */
    public double outerRadius() {
        return radii[radii.length - 1];
    }

    /**
     * 中心からの距離を返します。
     *
     * @param x x 座標です
     * @param y y 座標です
     * @param z z 座標です
     * @return 距離です
     */
    public double distanceFromCenter(double x, double y, double z) {
        double dx = x - center[0];
        double dy = y - center[1];
        double dz = z - center[2];
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * 中心からの距離に対応する層番号を返します。
     *
     * <p>
     * 境界上の点は内側の層に含めます。
     * </p>
     *
     * @param distance 中心からの距離です
     * @return 層番号です（球外の場合は -1）
     */
    public int layerAt(double distance) {
        for (int l = 0; l < radii.length; l++) {
            if (distance <= radii[l]) {
                return l;
            }
        }
        return -1;
    }
}
