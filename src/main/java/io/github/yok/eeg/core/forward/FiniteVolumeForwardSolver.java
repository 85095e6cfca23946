package io.github.yok.eeg.core.forward;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.linearalgebra.ConjugateGradientSolver;
import io.github.yok.eeg.out.VolumeWriter;
import io.github.yok.eeg.out.VtkVolumeWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;

/**
 * 等間隔格子上の有限体積法で EEG 順問題 {@code ∇·(σ∇u) = ∇·j} を解くクラスです。
 *
 * <h2>離散化</h2>
 * <ul>
 * <li>未知数は計算領域内の格子点の電位です。隣接点間のコンダクタンスは {@code h * 2σaσb/(σa+σb)} です。</li>
 * <li>外表面は電流ゼロ（Neumann）で、未知数 0 を基準点（電位 0）として固定します。</li>
 * <li>双極子は、モーメント方向に格子間隔だけ離した ±q の単極子対（{@code q=|p|/h}）で表し、 各単極子を周囲 8 点へ三線形に配分します。</li>
 * </ul>
 *
 * <p>
 * 係数行列は生成時に一度だけ組み立て、{@link #close()} で解放します。
 * </p>
 */
@Slf4j
public final class FiniteVolumeForwardSolver implements ForwardSolver {

    /**
     * 基準点（電位 0 に固定する未知数）です。
     */
    private static final int REFERENCE_UNKNOWN = 0;

    private final VoxelGrid grid;

    private final ElectrodeEvaluation evaluation;

    private final ConjugateGradientSolver linearSolver;

    /**
     * 係数行列です（close 後は null）。
     */
    private DMatrixSparseCSC stiffness;

    /**
     * 電極ごとの評価ステンシルです（未設定は null）。
     */
    private List<Stencil> electrodeStencils;

    /**
     * 有限体積ソルバを生成します。
     *
     * @param grid 格子です（null 不可）
     * @param evaluation 電極での評価方法です（null 不可）
     * @param linearSolver 線形ソルバです（null 不可）
     */
    public FiniteVolumeForwardSolver(VoxelGrid grid, ElectrodeEvaluation evaluation,
            ConjugateGradientSolver linearSolver) {
        this.grid = checkNotNull(grid, "grid は null 不可です");
        this.evaluation = checkNotNull(evaluation, "evaluation は null 不可です");
        this.linearSolver = checkNotNull(linearSolver, "linearSolver は null 不可です");
        this.stiffness = assemble(grid);
        log.info("有限体積ソルバを構築しました。格子={}^3、間隔={}、未知数={}、非零要素={}", grid.nodesPerAxis(),
                grid.spacing(), grid.unknownCount(), stiffness.nz_length);
    }

    @Override
    public DomainFunction solveEegForward(Dipole dipole) {
        checkNotNull(dipole, "dipole は null 不可です");
        checkState(stiffness != null, "ソルバは close 済みです");

        double[] rhs = new double[grid.unknownCount()];
        double[] p = GeometryConverter.toArray(dipole.getPosition(), GeometryConverter.DIM);
        double[] m = GeometryConverter.toArray(dipole.getMoment(), GeometryConverter.DIM);
        double moment = dipole.getMoment().norm();
        if (moment == 0.0) {
            log.warn("双極子モーメントが 0 のため、電位は恒等的に 0 です");
            return new GridFunction(grid, rhs);
        }

        double h = grid.spacing();
        double q = moment / h;
        double[] plus = new double[3];
        double[] minus = new double[3];
        for (int d = 0; d < 3; d++) {
            double offset = 0.5 * h * m[d] / moment;
            plus[d] = p[d] + offset;
            minus[d] = p[d] - offset;
        }
        addMonopole(rhs, plus, q);
        addMonopole(rhs, minus, -q);
        rhs[REFERENCE_UNKNOWN] = 0.0;

        long t0 = System.nanoTime();
        ConjugateGradientSolver.Result result = linearSolver.solve(stiffness, rhs);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        if (!result.isConverged()) {
            throw new IllegalStateException("線形ソルバが収束しませんでした: 反復回数=" + result.getIterations()
                    + ", 相対残差=" + fmt(result.getRelativeResidual()));
        }
        log.info("順問題を解きました。反復回数={}、相対残差={}、所要時間={}ms", result.getIterations(),
                fmt(result.getRelativeResidual()), elapsedMs);
        return new GridFunction(grid, result.getSolution());
    }

    @Override
    public void setElectrodes(List<FieldVector> electrodes) {
        checkNotNull(electrodes, "electrodes は null 不可です");
        checkArgument(!electrodes.isEmpty(), "electrodes が空です");
        List<Stencil> stencils = new ArrayList<>(electrodes.size());
        int fallbacks = 0;
        for (double[] e : GeometryConverter.toArrays(electrodes, GeometryConverter.DIM)) {
            Stencil s = (evaluation == ElectrodeEvaluation.TRILINEAR) ? trilinearStencil(e) : null;
            if (s == null) {
                if (evaluation == ElectrodeEvaluation.TRILINEAR) {
                    fallbacks++;
                }
                s = new Stencil(new int[] {grid.closestUnknown(e[0], e[1], e[2])},
                        new double[] {1.0});
            }
            stencils.add(s);
        }
        if (fallbacks > 0) {
            log.info("三線形補間できない電極 {} 個は最近傍の格子点で評価します", fallbacks);
        }
        this.electrodeStencils = stencils;
    }

    @Override
    public double[] evaluateAtElectrodes(DomainFunction solution) {
        checkNotNull(solution, "solution は null 不可です");
        checkState(electrodeStencils != null, "電極が設定されていません（setElectrodes を先に呼び出してください）");
        checkArgument(solution instanceof GridFunction && ((GridFunction) solution).grid() == grid,
                "このソルバが計算した解ではありません");
        GridFunction f = (GridFunction) solution;
        double[] out = new double[electrodeStencils.size()];
        for (int i = 0; i < out.length; i++) {
            Stencil s = electrodeStencils.get(i);
            double v = 0.0;
            for (int k = 0; k < s.unknowns.length; k++) {
                v += s.weights[k] * f.valueOf(s.unknowns[k]);
            }
            out[i] = v;
        }
        return out;
    }

    @Override
    public VolumeWriter volumeWriter() {
        return new VtkVolumeWriter();
    }

    @Override
    public void close() {
        stiffness = null;
        electrodeStencils = null;
    }

    /**
     * 係数行列を組み立てます。
     *
     * <p>
     * 基準点の行・列は単位行列に置き換えます（他の行の基準点への結合は既知値 0 のため落とします）。
     * </p>
     *
     * @param grid 格子です
     * @return 係数行列です
     */
    private static DMatrixSparseCSC assemble(VoxelGrid grid) {
        int unknowns = grid.unknownCount();
        double h = grid.spacing();
        double[] diag = new double[unknowns];
        DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(unknowns, unknowns, unknowns * 7);

        for (int a = 0; a < unknowns; a++) {
            int[] idx = grid.indexOfUnknown(a);
            // +x, +y, +z 方向のみを見て各辺を 1 回だけ処理する
            int[] neighbors = {grid.unknownAt(idx[0] + 1, idx[1], idx[2]),
                    grid.unknownAt(idx[0], idx[1] + 1, idx[2]),
                    grid.unknownAt(idx[0], idx[1], idx[2] + 1)};
            for (int b : neighbors) {
                if (b < 0) {
                    continue;
                }
                double sa = grid.conductivityOf(a);
                double sb = grid.conductivityOf(b);
                double g = h * 2.0 * sa * sb / (sa + sb);
                diag[a] += g;
                diag[b] += g;
                if (a != REFERENCE_UNKNOWN && b != REFERENCE_UNKNOWN) {
                    triplet.addItem(a, b, -g);
                    triplet.addItem(b, a, -g);
                }
            }
        }
        diag[REFERENCE_UNKNOWN] = 1.0;
        for (int a = 0; a < unknowns; a++) {
            triplet.addItem(a, a, diag[a]);
        }
        return DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
    }

    /**
     * 単極子を周囲 8 格子点へ三線形に配分して右辺に加えます。
     *
     * @param rhs 右辺です
     * @param position 単極子の位置です
     * @param current 電流です
     * @throws IllegalArgumentException 重みを持つ格子点が計算領域外の場合に発生します
     */
    private void addMonopole(double[] rhs, double[] position, double current) {
        Stencil s = trilinearStencil(position);
        if (s == null) {
            throw new IllegalArgumentException("双極子が計算領域の外、または外表面に近すぎます: position="
                    + position[0] + ", " + position[1] + ", " + position[2]);
        }
        for (int k = 0; k < s.unknowns.length; k++) {
            rhs[s.unknowns[k]] += current * s.weights[k];
        }
    }

    /**
     * 三線形補間のステンシルを作ります。
     *
     * @param point 点です
     * @return ステンシルです（重みが正の頂点に領域外の点がある場合は null）
     */
    private Stencil trilinearStencil(double[] point) {
        double h = grid.spacing();
        int[] base = new int[3];
        double[] frac = new double[3];
        for (int d = 0; d < 3; d++) {
            double f = (point[d] - grid.origin(d)) / h;
            base[d] = (int) Math.floor(f);
            frac[d] = f - base[d];
        }

        int[] unknowns = new int[8];
        double[] weights = new double[8];
        int count = 0;
        for (int corner = 0; corner < 8; corner++) {
            int dx = corner & 1;
            int dy = (corner >> 1) & 1;
            int dz = (corner >> 2) & 1;
            double w = (dx == 1 ? frac[0] : 1.0 - frac[0]) * (dy == 1 ? frac[1] : 1.0 - frac[1])
                    * (dz == 1 ? frac[2] : 1.0 - frac[2]);
            if (w == 0.0) {
                continue;
            }
            int u = grid.unknownAt(base[0] + dx, base[1] + dy, base[2] + dz);
            if (u < 0) {
                return null;
            }
            unknowns[count] = u;
            weights[count] = w;
            count++;
        }
        int[] us = new int[count];
        double[] ws = new double[count];
        System.arraycopy(unknowns, 0, us, 0, count);
        System.arraycopy(weights, 0, ws, 0, count);
        return new Stencil(us, ws);
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }

    /**
     * 未知数と重みの組です。
     */
    private static final class Stencil {

        final int[] unknowns;

        final double[] weights;

        Stencil(int[] unknowns, double[] weights) {
            this.unknowns = unknowns;
            this.weights = weights;
        }
    }
}
