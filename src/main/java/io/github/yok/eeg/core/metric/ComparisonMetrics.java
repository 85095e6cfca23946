package io.github.yok.eeg.core.metric;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * EEG 順問題の数値解を解析解と比較する指標（ノルム・相対誤差・MAG・RDM）を計算するクラスです。
 *
 * <h2>前提</h2>
 * <ul>
 * <li>2 つのベクトルは同じ長さ（電極数）で、インデックスが同じ電極に対応していること。</li>
 * <li>比をとる指標では分母のノルムが 0 でないこと。0 の場合は Inf/NaN を返さず {@link ArithmeticException} とします。</li>
 * </ul>
 *
 * <p>
 * 許容誤差による合否判定は行いません（呼び出し側の責務です）。
 * </p>
 */
public final class ComparisonMetrics {

    private ComparisonMetrics() {}

    /**
     * ユークリッド（L2）ノルムを返します。
     *
     * <p>
     * 零ベクトルのノルムは 0 です（この層では不正扱いしません）。 二乗和は最大絶対値で割った成分でとるため、 極端に小さい・大きい成分でも 0 や無限大に潰れません。
     * </p>
     *
     * @param v ベクトルです（null 不可）
     * @return ノルムです
     */
    public static double norm(double[] v) {
        checkNotNull(v, "v は null 不可です");
        double scale = 0.0;
        for (double x : v) {
            scale = Math.max(scale, Math.abs(x));
        }
        if (scale == 0.0 || !Double.isFinite(scale)) {
            return scale;
        }
        double s = 0.0;
        for (double x : v) {
            double y = x / scale;
            s += y * y;
        }
        return scale * Math.sqrt(s);
    }

    /**
     * 相対誤差 {@code ||num - ana|| / ||ana||} を返します。
     *
     * @param numerical 数値解です
     * @param analytical 解析解です
     * @return 相対誤差です
     * @throws IllegalArgumentException 長さ不一致または空の場合に発生します
     * @throws ArithmeticException 解析解のノルムが 0 の場合に発生します
     */
    public static double relativeError(double[] numerical, double[] analytical) {
        requireComparable(numerical, analytical);
        double denom = requireNonZeroNorm(analytical, "解析解");
        double[] diff = new double[numerical.length];
        for (int i = 0; i < diff.length; i++) {
            diff[i] = numerical[i] - analytical[i];
        }
        return norm(diff) / denom;
    }

    /**
     * MAG {@code ||num|| / ||ana||} を返します。
     *
     * @param numerical 数値解です
     * @param analytical 解析解です
     * @return MAG です
     * @throws IllegalArgumentException 長さ不一致または空の場合に発生します
     * @throws ArithmeticException 解析解のノルムが 0 の場合に発生します
     */
    public static double magnitudeError(double[] numerical, double[] analytical) {
        requireComparable(numerical, analytical);
        double denom = requireNonZeroNorm(analytical, "解析解");
        return norm(numerical) / denom;
    }

    /**
     * RDM {@code ||num/||num|| - ana/||ana|| ||} を返します。
     *
     * <p>
     * 両ベクトルを単位ノルムに揃えてから差をとるため、振幅に依存せず分布形状のみを比較します。
     * </p>
     *
     * @param numerical 数値解です
     * @param analytical 解析解です
     * @return RDM です（0 以上 2 以下）
     * @throws IllegalArgumentException 長さ不一致または空の場合に発生します
     * @throws ArithmeticException どちらかのノルムが 0 の場合に発生します
     */
    public static double relativeDifferenceMeasure(double[] numerical, double[] analytical) {
        requireComparable(numerical, analytical);
        double normNum = requireNonZeroNorm(numerical, "数値解");
        double normAna = requireNonZeroNorm(analytical, "解析解");
        double[] diff = new double[numerical.length];
        for (int i = 0; i < diff.length; i++) {
            diff[i] = numerical[i] / normNum - analytical[i] / normAna;
        }
        return norm(diff);
    }

    /**
     * 全指標をまとめて計算します。
     *
     * @param numerical 数値解です
     * @param analytical 解析解です
     * @return 比較結果です
     * @throws IllegalArgumentException 長さ不一致または空の場合に発生します
     * @throws ArithmeticException 分母となるノルムが 0 の場合に発生します
     */
    public static MetricResult compare(double[] numerical, double[] analytical) {
        requireComparable(numerical, analytical);
        return new MetricResult(norm(analytical), norm(numerical),
                relativeError(numerical, analytical), magnitudeError(numerical, analytical),
                relativeDifferenceMeasure(numerical, analytical));
    }

    private static void requireComparable(double[] numerical, double[] analytical) {
        checkNotNull(numerical, "numerical は null 不可です");
        checkNotNull(analytical, "analytical は null 不可です");
        checkArgument(numerical.length == analytical.length,
                "数値解と解析解の長さ（電極数）が一致しません: numerical=%s, analytical=%s", numerical.length,
                analytical.length);
        checkArgument(numerical.length > 0, "比較対象のベクトルが空です");
    }

    private static double requireNonZeroNorm(double[] v, String label) {
        double n = norm(v);
        if (!Double.isFinite(n)) {
            throw new ArithmeticException(label + "のノルムが有限値ではありません: " + n);
        }
        if (n == 0.0) {
            throw new ArithmeticException(label + "のノルムが 0 のため比を定義できません");
        }
        return n;
    }
}
