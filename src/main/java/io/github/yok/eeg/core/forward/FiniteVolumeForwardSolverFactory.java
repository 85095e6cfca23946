package io.github.yok.eeg.core.forward;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.geometry.LayeredSphere;
import io.github.yok.eeg.core.linearalgebra.ConjugateGradientSolver;
import io.github.yok.eeg.io.EegInputSource;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 多層球の設定と導電率ファイルから {@link FiniteVolumeForwardSolver} を生成するファクトリです。
 *
 * <p>
 * 導電率は {@link #create()} のたびに入力元から読み直します。
 * </p>
 */
@Slf4j
public final class FiniteVolumeForwardSolverFactory implements ForwardSolverFactory {

    private final double[] radii;

    private final double[] center;

    private final double gridSpacing;

    private final ElectrodeEvaluation evaluation;

    private final int cgMaxIterations;

    private final double cgTolerance;

    private final EegInputSource input;

    /**
     * ファクトリを生成します。
     *
     * @param radii 各層の半径です（4 成分）
     * @param center 球の中心です（3 成分）
     * @param gridSpacing 格子間隔です
     * @param evaluation 電極での評価方法です
     * @param cgMaxIterations 共役勾配法の最大反復回数です
     * @param cgTolerance 共役勾配法の相対残差の許容誤差です
     * @param input 導電率の入力元です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public FiniteVolumeForwardSolverFactory(double[] radii, double[] center, double gridSpacing,
            ElectrodeEvaluation evaluation, int cgMaxIterations, double cgTolerance,
            EegInputSource input) {
        checkNotNull(radii, "radii は null 不可です");
        checkNotNull(center, "center は null 不可です");
        checkArgument(radii.length == GeometryConverter.LAYER_COUNT, "radii は %s 成分が必要です: %s",
                GeometryConverter.LAYER_COUNT, radii.length);
        checkArgument(center.length == GeometryConverter.DIM, "center は %s 成分が必要です: %s",
                GeometryConverter.DIM, center.length);
        this.radii = radii.clone();
        this.center = center.clone();
        this.gridSpacing = gridSpacing;
        this.evaluation = checkNotNull(evaluation, "evaluation は null 不可です");
        this.cgMaxIterations = cgMaxIterations;
        this.cgTolerance = cgTolerance;
        this.input = checkNotNull(input, "input は null 不可です");
    }

    /**
     * 導電率を読み込み、格子と係数行列を組み立ててソルバを生成します。
     *
     * @return 順問題ソルバです
     * @throws IllegalArgumentException 導電率が空、または幾何が不正な場合に発生します
     * @throws java.io.UncheckedIOException 導電率ファイルを読み込めない場合に発生します
     */
    @Override
    public ForwardSolver create() {
        List<FieldVector> conductivities = input.readConductivities();
        checkArgument(!conductivities.isEmpty(), "導電率が 1 件も読み込めませんでした");
        if (conductivities.size() > 1) {
            log.warn("導電率が {} 件ありますが、先頭の 1 件のみを使用します", conductivities.size());
        }
        double[] sigma =
                GeometryConverter.toArray(conductivities.get(0), GeometryConverter.LAYER_COUNT);

        LayeredSphere sphere = LayeredSphere.of(radii, center, sigma);
        VoxelGrid grid = VoxelGrid.covering(sphere, gridSpacing);
        return new FiniteVolumeForwardSolver(grid, evaluation,
                new ConjugateGradientSolver(cgMaxIterations, cgTolerance));
    }
}
