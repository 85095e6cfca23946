package io.github.yok.eeg.core.linearalgebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * 対称正定値の疎行列に対して、Jacobi 前処理付き共役勾配法（PCG）で {@code A x = b} を解くクラスです。
 *
 * <p>
 * 行列は EJML の {@link DMatrixSparseCSC} で保持し、行列ベクトル積は {@link CommonOps_DSCC#mult} を使います。
 * 収束判定は相対残差 {@code ||b - A x|| / ||b||} です。
 * </p>
 */
@Slf4j
public final class ConjugateGradientSolver {

    /**
     * 進捗ログを出力する反復間隔です。
     */
    private static final int LOG_INTERVAL = 500;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 相対残差の許容誤差です。
     */
    private final double tolerance;

    /**
     * PCG ソルバを生成します。
     *
     * @param maxIterations 最大反復回数（1 以上）
     * @param tolerance 相対残差の許容誤差（0 より大きい）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ConjugateGradientSolver(int maxIterations, double tolerance) {
        checkArgument(maxIterations > 0, "maxIterations は 1 以上である必要があります: %s", maxIterations);
        checkArgument(tolerance > 0.0, "tolerance は 0 より大きい必要があります: %s", tolerance);
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * 連立一次方程式を解きます。
     *
     * @param a 係数行列です（正方、対称正定値）
     * @param b 右辺です（長さは行列次元）
     * @return 解と収束情報です
     * @throws IllegalArgumentException 次元が一致しない、または対角成分が正でない場合に発生します
     */
    public Result solve(DMatrixSparseCSC a, double[] b) {
        checkNotNull(a, "a は null 不可です");
        checkNotNull(b, "b は null 不可です");
        checkArgument(a.numRows == a.numCols, "a は正方行列である必要があります: %sx%s", a.numRows, a.numCols);
        checkArgument(a.numRows == b.length, "右辺の長さが行列次元と一致しません: %s vs %s", b.length, a.numRows);

        int n = b.length;
        double[] invDiag = inverseDiagonal(a);

        DMatrixRMaj x = new DMatrixRMaj(n, 1);
        double bNorm = norm(b);
        if (bNorm == 0.0) {
            return new Result(x.data, 0, 0.0, true);
        }

        double[] r = b.clone();
        double[] z = new double[n];
        for (int i = 0; i < n; i++) {
            z[i] = invDiag[i] * r[i];
        }
        DMatrixRMaj p = new DMatrixRMaj(n, 1);
        System.arraycopy(z, 0, p.data, 0, n);
        DMatrixRMaj ap = new DMatrixRMaj(n, 1);

        double rz = dot(r, z);
        double relResidual = 1.0;
        for (int iter = 1; iter <= maxIterations; iter++) {
            CommonOps_DSCC.mult(a, p, ap);
            double pAp = dot(p.data, ap.data);
            if (!(pAp > 0.0)) {
                throw new IllegalStateException("行列が正定値ではありません（p^T A p=" + pAp + "）");
            }
            double alpha = rz / pAp;
            for (int i = 0; i < n; i++) {
                x.data[i] += alpha * p.data[i];
                r[i] -= alpha * ap.data[i];
            }

            relResidual = norm(r) / bNorm;
            if (iter % LOG_INTERVAL == 0) {
                log.debug("PCG反復 {}：相対残差={}", iter, fmt(relResidual));
            }
            if (relResidual <= tolerance) {
                return new Result(x.data, iter, relResidual, true);
            }

            for (int i = 0; i < n; i++) {
                z[i] = invDiag[i] * r[i];
            }
            double rzNew = dot(r, z);
            double beta = rzNew / rz;
            rz = rzNew;
            for (int i = 0; i < n; i++) {
                p.data[i] = z[i] + beta * p.data[i];
            }
        }
        return new Result(x.data, maxIterations, relResidual, false);
    }

    /**
     * PCG の結果です。
     */
    @Value
    public static class Result {

        /**
         * 解ベクトルです。
         */
        double[] solution;

        /**
         * 実行した反復回数です。
         */
        int iterations;

        /**
         * 最終の相対残差です。
         */
        double relativeResidual;

        /**
         * 許容誤差に到達したかどうかです。
         */
        boolean converged;
    }

    /**
     * 対角成分の逆数（Jacobi 前処理）を返します。
     *
     * @param a 係数行列です
     * @return 対角成分の逆数です
     */
    private static double[] inverseDiagonal(DMatrixSparseCSC a) {
        double[] inv = new double[a.numRows];
        for (int i = 0; i < a.numRows; i++) {
            double d = a.get(i, i);
            if (!(d > 0.0)) {
                throw new IllegalArgumentException("対角成分が正ではありません: row=" + i + ", value=" + d);
            }
            inv[i] = 1.0 / d;
        }
        return inv;
    }

    private static double dot(double[] u, double[] v) {
        double s = 0.0;
        for (int i = 0; i < u.length; i++) {
            s += u[i] * v[i];
        }
        return s;
    }

    private static double norm(double[] v) {
        return Math.sqrt(dot(v, v));
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}
