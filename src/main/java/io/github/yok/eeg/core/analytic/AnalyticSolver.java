package io.github.yok.eeg.core.analytic;

import java.util.List;

/**
 * 多層同心球モデルにおける EEG 順問題の解析解を計算するインタフェースです。
 *
 * <p>
 * 入出力はすべて固定長配列で、戻り値は {@code electrodes} とインデックスが対応します。
 * </p>
 */
public interface AnalyticSolver {

    /**
     * 電極位置での電位を計算します。
     *
     * @param radii 各層の半径です（外側→内側、または内側→外側の単調列）
     * @param center 球の中心です（3 成分）
     * @param conductivities 各層の導電率です（radii とインデックス対応）
     * @param electrodes 電極位置の列です（各 3 成分）
     * @param dipolePosition 双極子位置です（3 成分）
     * @param dipoleMoment 双極子モーメントです（3 成分）
     * @return 電極ごとの電位です
     */
    double[] solve(double[] radii, double[] center, double[] conductivities,
            List<double[]> electrodes, double[] dipolePosition, double[] dipoleMoment);
}
