package io.github.yok.eeg.core.analytic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.geometry.LayeredSphere;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 等方性の多層同心球モデルに対して、電流双極子が作る表面電位を Legendre 級数で計算するクラスです。
 *
 * <h2>定式化</h2>
 * <ul>
 * <li>長さは最外層半径 R で無次元化し、電位は最後に {@code 1/R^2} を掛けて物理単位へ戻します。</li>
 * <li>次数 n ごとに、各層の解 {@code A r^n + B r^-(n+1)} を対数微分 {@code y=V'/V} で表し、 最外面の Neumann
 * 条件（{@code y=0}）から内側へ伝搬します。界面では {@code σ y} が連続です。</li>
 * <li>双極子を含む最内層で反射係数を確定し、各層の電位比を掛けて表面電位係数 {@code K_n} を得ます。</li>
 * <li>双極子電位は単極子解の源位置に関する勾配として、 {@code Σ K_n |q|^(n-1) [n P_n(x)(p·q̂) + P_n'(x)(p·r̂ - x p·q̂)]}
 * で評価します。</li>
 * </ul>
 *
 * <p>
 * 係数は比の形（{@code t = B r^-(2n+1) / A}）で保持するため、高次でも桁あふれや桁落ちを起こしません。
 * </p>
 *
 * <h2>制約</h2>
 * <ul>
 * <li>双極子は最内層の内部（中心からの距離が最内層半径未満）にあること。</li>
 * <li>電極は中心から放射方向に最外面へ射影して評価します。</li>
 * </ul>
 */
@Slf4j
public final class MultilayerSphereAnalyticSolver implements AnalyticSolver {

    /**
     * 収束判定に用いる連続回数です。
     */
    private static final int CONVERGED_STREAK = 3;

    /**
     * 級数の最大項数です。
     */
    private final int maxTerms;

    /**
     * 収束判定の相対許容誤差です。
     *
     * <p>
     * 項の絶対値が、それまでの最大項の {@code tolerance} 倍以下となる状態が 3 項続いた時点で打ち切ります。
     * </p>
     */
    private final double tolerance;

    /**
     * 解析解ソルバを生成します。
     *
     * @param maxTerms 級数の最大項数（1 以上）
     * @param tolerance 収束判定の相対許容誤差（0 より大きい）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public MultilayerSphereAnalyticSolver(int maxTerms, double tolerance) {
        checkArgument(maxTerms > 0, "maxTerms は 1 以上である必要があります: %s", maxTerms);
        checkArgument(tolerance > 0.0, "tolerance は 0 より大きい必要があります: %s", tolerance);
        this.maxTerms = maxTerms;
        this.tolerance = tolerance;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException 幾何・導電率・双極子位置が不正な場合に発生します
     * @throws IllegalStateException 級数が最大項数までに収束しない場合に発生します
     */
    @Override
    public double[] solve(double[] radii, double[] center, double[] conductivities,
            List<double[]> electrodes, double[] dipolePosition, double[] dipoleMoment) {
        checkNotNull(radii, "radii は null 不可です");
        checkNotNull(conductivities, "conductivities は null 不可です");
        checkNotNull(electrodes, "electrodes は null 不可です");
        checkLength(center, 3, "center");
        checkLength(dipolePosition, 3, "dipolePosition");
        checkLength(dipoleMoment, 3, "dipoleMoment");

        LayeredSphere sphere = LayeredSphere.of(radii, center, conductivities);
        double outer = sphere.outerRadius();

        // 中心基準・最外層半径で無次元化した双極子位置
        double[] q = new double[3];
        for (int d = 0; d < 3; d++) {
            q[d] = (dipolePosition[d] - center[d]) / outer;
        }
        double qNorm = Math.sqrt(dot(q, q));
        double innermost = sphere.radius(0) / outer;
        checkArgument(qNorm < innermost, "双極子が最内層の内部にありません: |r0|/R=%s, 最内層半径/R=%s", qNorm,
                innermost);

        double[] k = surfaceCoefficients(sphere);

        double[] out = new double[electrodes.size()];
        double scale = 1.0 / (outer * outer);
        for (int i = 0; i < out.length; i++) {
            double[] e = electrodes.get(i);
            checkLength(e, 3, "electrodes[" + i + "]");
            double[] rHat = new double[3];
            for (int d = 0; d < 3; d++) {
                rHat[d] = e[d] - center[d];
            }
            double rNorm = Math.sqrt(dot(rHat, rHat));
            checkArgument(rNorm > 0.0, "electrodes[%s] が球の中心と一致しています", i);
            for (int d = 0; d < 3; d++) {
                rHat[d] /= rNorm;
            }
            out[i] = scale * dipoleSeries(k, q, qNorm, dipoleMoment, rHat, i);
        }
        return out;
    }

    /**
     * 表面電位係数 {@code K_n}（n=1..maxTerms）を計算します。
     *
     * <p>
     * {@code K_n} は、無次元化した最内層内の単極子（源位置 |q|）が最外面に作る n 次成分から {@code |q|^n} を除いたものです。
     * </p>
     *
     * @param sphere 内側→外側に揃えた層構造です
     * @return 係数配列です（添字 n、0 番目は未使用）
     */
    private double[] surfaceCoefficients(LayeredSphere sphere) {
        int layerCount = sphere.layerCount();
        double[] s = new double[layerCount];
        for (int l = 0; l < layerCount; l++) {
            s[l] = sphere.radius(l) / sphere.outerRadius();
        }
        double c = 1.0 / (4.0 * Math.PI * sphere.conductivity(0));

        double[] k = new double[maxTerms + 1];
        double[] tOuter = new double[layerCount];
        for (int n = 1; n <= maxTerms; n++) {
            // 外側から内側へ: 各層の外半径での t を求める
            tOuter[layerCount - 1] = (double) n / (n + 1); // 最外面 y=0
            for (int l = layerCount - 1; l >= 1; l--) {
                double rho = s[l] / s[l - 1];
                double tInner = tOuter[l] * Math.pow(rho, 2 * n + 1);
                double yr = logDerivative(tInner, n);
                // 界面: σ y が連続
                double yrBelow = yr * sphere.conductivity(l) / sphere.conductivity(l - 1);
                tOuter[l - 1] = (n - yrBelow) / (yrBelow + n + 1);
            }

            // 最内層（源の層）の外半径での電位と、外側への電位比
            double kn = c * (1.0 + 1.0 / tOuter[0]);
            for (int l = 1; l < layerCount; l++) {
                double rho = s[l] / s[l - 1];
                kn *= (1.0 + tOuter[l]) / (Math.pow(rho, -(2 * n + 1)) + tOuter[l]);
            }
            k[n] = kn;
        }
        return k;
    }

    /**
     * 1 電極について双極子電位の級数を評価します（無次元量）。
     *
     * @param k 表面電位係数です
     * @param q 無次元化した双極子位置です
     * @param qNorm |q| です
     * @param p 双極子モーメントです
     * @param rHat 電極方向の単位ベクトルです
     * @param electrodeIndex エラーメッセージ用の電極番号です
     * @return 無次元の電位です
     */
    private double dipoleSeries(double[] k, double[] q, double qNorm, double[] p, double[] rHat,
            int electrodeIndex) {
        double pDotR = dot(p, rHat);
        if (qNorm == 0.0) {
            // 中心の双極子は n=1 のみが寄与する
            return k[1] * pDotR;
        }

        double[] qHat = {q[0] / qNorm, q[1] / qNorm, q[2] / qNorm};
        double x = Math.max(-1.0, Math.min(1.0, dot(rHat, qHat)));
        double pDotQ = dot(p, qHat);

        double pPrev = 1.0; // P_0
        double pCur = x; // P_1
        double dPrev = 0.0; // P_0'
        double dCur = 1.0; // P_1'
        double qPow = 1.0; // |q|^(n-1)

        double sum = 0.0;
        double maxTerm = 0.0;
        int streak = 0;
        for (int n = 1; n <= maxTerms; n++) {
            double term = k[n] * qPow * (n * pCur * pDotQ + dCur * (pDotR - x * pDotQ));
            sum += term;

            double abs = Math.abs(term);
            maxTerm = Math.max(maxTerm, abs);
            streak = (abs <= tolerance * maxTerm) ? streak + 1 : 0;
            if (streak >= CONVERGED_STREAK || qPow == 0.0) {
                log.debug("電極 {} の級数が収束しました。項数={}", electrodeIndex, n);
                return sum;
            }

            double pNext = ((2 * n + 1) * x * pCur - n * pPrev) / (n + 1);
            double dNext = dPrev + (2 * n + 1) * pCur;
            pPrev = pCur;
            pCur = pNext;
            dPrev = dCur;
            dCur = dNext;
            qPow *= qNorm;
        }
        throw new IllegalStateException("解析解の級数が最大項数までに収束しませんでした: electrode=" + electrodeIndex
                + ", maxTerms=" + maxTerms + ", |r0|/R=" + qNorm);
    }

    /**
     * {@code t = B r^-(2n+1) / A} から無次元対数微分 {@code r V'/V} を求めます。
     *
     * @param t 係数比です（無限大を含み得ます）
     * @param n 次数です
     * @return {@code r V'/V} です
     */
    private static double logDerivative(double t, int n) {
        if (Math.abs(t) > 1.0) {
            double inv = 1.0 / t;
            return (n * inv - (n + 1)) / (inv + 1.0);
        }
        return (n - (n + 1) * t) / (1.0 + t);
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static void checkLength(double[] v, int expected, String name) {
        checkNotNull(v, "%s は null 不可です", name);
        checkArgument(v.length == expected, "%s の長さが一致しません: length=%s, expected=%s", name,
                v.length, expected);
    }
}
