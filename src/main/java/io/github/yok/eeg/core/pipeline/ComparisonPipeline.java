package io.github.yok.eeg.core.pipeline;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.analytic.AnalyticSolver;
import io.github.yok.eeg.core.forward.DomainFunction;
import io.github.yok.eeg.core.forward.ForwardSolver;
import io.github.yok.eeg.core.forward.ForwardSolverFactory;
import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.geometry.LayeredSphere;
import io.github.yok.eeg.core.metric.ComparisonMetrics;
import io.github.yok.eeg.core.metric.MetricResult;
import io.github.yok.eeg.core.metric.PotentialNormalizer;
import io.github.yok.eeg.io.EegInputSource;
import io.github.yok.eeg.out.ResultWriter;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 数値解と解析解を電極位置で比較するパイプラインです。
 *
 * <p>
 * 段階は {@link PipelineStage} の順に直列に実行し、最初の失敗で打ち切ります。 各段階の例外は
 * {@link StageFailure}（段階と失敗の種類）に変換して返し、呼び出し元へ例外として伝播させません。
 * </p>
 *
 * <p>
 * 順問題ソルバは生成に成功した時点から、結果にかかわらず必ず close します。 レポートの後に出力を行い、出力の失敗は警告ログのみとします。
 * </p>
 */
@Slf4j
public final class ComparisonPipeline {

    private final List<Double> radii;

    private final List<Double> center;

    private final int dipoleIndex;

    private final ForwardSolverFactory solverFactory;

    private final AnalyticSolver analyticSolver;

    private final EegInputSource input;

    private final ComparisonReporter reporter;

    private final List<ResultWriter> resultWriters;

    private final boolean writeOutput;

    /**
     * パイプラインを生成します。
     *
     * @param radii 各層の半径（設定値）です
     * @param center 球の中心（設定値）です
     * @param dipoleIndex 使用する双極子のインデックスです
     * @param solverFactory 順問題ソルバのファクトリです
     * @param analyticSolver 解析解エンジンです
     * @param input 入力データの供給元です
     * @param reporter 比較結果の提示先です
     * @param resultWriters 出力先です
     * @param writeOutput 出力を行うかどうかです
     */
    public ComparisonPipeline(List<Double> radii, List<Double> center, int dipoleIndex,
            ForwardSolverFactory solverFactory, AnalyticSolver analyticSolver,
            EegInputSource input, ComparisonReporter reporter, List<ResultWriter> resultWriters,
            boolean writeOutput) {
        this.radii = radii;
        this.center = center;
        this.dipoleIndex = dipoleIndex;
        this.solverFactory = checkNotNull(solverFactory, "solverFactory は null 不可です");
        this.analyticSolver = checkNotNull(analyticSolver, "analyticSolver は null 不可です");
        this.input = checkNotNull(input, "input は null 不可です");
        this.reporter = checkNotNull(reporter, "reporter は null 不可です");
        this.resultWriters = List.copyOf(checkNotNull(resultWriters, "resultWriters は null 不可です"));
        this.writeOutput = writeOutput;
    }

    /**
     * 比較を実行します。
     *
     * @return 成功時は比較結果、失敗時は失敗した段階と種類です
     */
    public StageOutcome<ComparisonReport> run() {
        StageOutcome<Geometry> geometry = configure();
        if (!geometry.isSuccess()) {
            return geometry.propagate();
        }

        StageOutcome<ForwardSolver> built = attempt(PipelineStage.BUILD_SOLVER,
                FailureKind.COLLABORATOR, FailureKind.COLLABORATOR, solverFactory::create);
        if (!built.isSuccess()) {
            return built.propagate();
        }

        try (ForwardSolver solver = built.getValue()) {
            return runWith(solver, geometry.getValue());
        }
    }

    /**
     * ソルバ生成後の段階を実行します。
     */
    private StageOutcome<ComparisonReport> runWith(ForwardSolver solver, Geometry geometry) {
        StageOutcome<Dipole> dipole = loadDipole();
        if (!dipole.isSuccess()) {
            return dipole.propagate();
        }
        Dipole d = dipole.getValue();

        StageOutcome<DomainFunction> solution = attempt(PipelineStage.SOLVE_NUMERICAL,
                FailureKind.COLLABORATOR, FailureKind.COLLABORATOR,
                () -> solver.solveEegForward(d));
        if (!solution.isSuccess()) {
            return solution.propagate();
        }

        StageOutcome<List<FieldVector>> electrodes = attempt(PipelineStage.EVALUATE_ELECTRODES,
                FailureKind.IO, FailureKind.IO, input::readElectrodes);
        if (!electrodes.isSuccess()) {
            return electrodes.propagate();
        }
        List<FieldVector> e = electrodes.getValue();
        if (e.isEmpty()) {
            return StageOutcome.failure(PipelineStage.EVALUATE_ELECTRODES,
                    FailureKind.PRECONDITION, "電極が 1 件も読み込めませんでした", null);
        }

        StageOutcome<double[]> numerical = attempt(PipelineStage.EVALUATE_ELECTRODES,
                FailureKind.COLLABORATOR, FailureKind.COLLABORATOR, () -> {
                    solver.setElectrodes(e);
                    return solver.evaluateAtElectrodes(solution.getValue());
                });
        if (!numerical.isSuccess()) {
            return numerical.propagate();
        }
        log.info("数値解を電極 {} 個で評価しました", e.size());

        StageOutcome<double[]> analytical = solveAnalytic(geometry, d, e);
        if (!analytical.isSuccess()) {
            return analytical.propagate();
        }

        StageOutcome<Compared> compared = attempt(PipelineStage.COMPARE,
                FailureKind.PRECONDITION, FailureKind.PRECONDITION,
                () -> compare(numerical.getValue(), analytical.getValue(), e.size()));
        if (!compared.isSuccess()) {
            return compared.propagate();
        }
        Compared c = compared.getValue();

        ComparisonReport report = new ComparisonReport(d, dipoleIndex, e.size(), c.metrics);
        log.info("段階 {}", PipelineStage.REPORT);
        reporter.report(report);

        if (writeOutput) {
            export(new ComparisonArtifacts(d, e, c.analytical, c.numerical, c.metrics,
                    solution.getValue(), solver::volumeWriter));
        }
        return StageOutcome.success(report);
    }

    /**
     * 電位ベクトルの長さを電極数と照合し、平均を差し引いてから指標を計算します。
     *
     * @throws IllegalArgumentException 長さが電極数と一致しない、または空の場合に発生します
     */
    private static Compared compare(double[] numerical, double[] analytical, int electrodeCount) {
        checkArgument(numerical.length == electrodeCount,
                "数値解の長さが電極数と一致しません: numerical=%s, electrodes=%s", numerical.length,
                electrodeCount);
        checkArgument(analytical.length == electrodeCount,
                "解析解の長さが電極数と一致しません: analytical=%s, electrodes=%s", analytical.length,
                electrodeCount);
        double[] num = PotentialNormalizer.subtractMean(numerical);
        double[] ana = PotentialNormalizer.subtractMean(analytical);
        return new Compared(num, ana, ComparisonMetrics.compare(num, ana));
    }

    /**
     * 幾何の設定値を変換・検証します。
     */
    private StageOutcome<Geometry> configure() {
        return attempt(PipelineStage.CONFIGURE, FailureKind.CONFIGURATION,
                FailureKind.CONFIGURATION, () -> {
                    double[] r = GeometryConverter.toArray(radii, GeometryConverter.LAYER_COUNT,
                            "analytic-solution.radii");
                    double[] c = GeometryConverter.toArray(center, GeometryConverter.DIM,
                            "analytic-solution.center");
                    // 導電率はまだ読まないため、幾何の検証には仮の値を使う
                    double[] unit = new double[GeometryConverter.LAYER_COUNT];
                    Arrays.fill(unit, 1.0);
                    LayeredSphere.of(r, c, unit);
                    return new Geometry(r, c);
                });
    }

    /**
     * 双極子を読み込み、設定されたインデックスのものを選びます。
     */
    private StageOutcome<Dipole> loadDipole() {
        StageOutcome<List<Dipole>> dipoles = attempt(PipelineStage.LOAD_DIPOLE, FailureKind.IO,
                FailureKind.IO, input::readDipoles);
        if (!dipoles.isSuccess()) {
            return dipoles.propagate();
        }
        List<Dipole> list = dipoles.getValue();
        if (list.isEmpty()) {
            return StageOutcome.failure(PipelineStage.LOAD_DIPOLE, FailureKind.PRECONDITION,
                    "双極子が 1 件も読み込めませんでした", null);
        }
        if (dipoleIndex < 0 || dipoleIndex >= list.size()) {
            return StageOutcome.failure(PipelineStage.LOAD_DIPOLE, FailureKind.PRECONDITION,
                    "dipole.index が範囲外です: " + dipoleIndex + "（双極子数 " + list.size() + "）",
                    null);
        }
        if (list.size() > 1) {
            log.warn("双極子が {} 件ありますが、index={} の 1 件のみを比較します", list.size(), dipoleIndex);
        }
        Dipole d = list.get(dipoleIndex);
        log.info("双極子を読み込みました: position={}, moment={}", d.getPosition(), d.getMoment());
        return StageOutcome.success(d);
    }

    /**
     * 解析解を電極位置で計算します。
     */
    private StageOutcome<double[]> solveAnalytic(Geometry geometry, Dipole dipole,
            List<FieldVector> electrodes) {
        StageOutcome<List<FieldVector>> conductivities = attempt(PipelineStage.ANALYTIC_SOLUTION,
                FailureKind.IO, FailureKind.IO, input::readConductivities);
        if (!conductivities.isSuccess()) {
            return conductivities.propagate();
        }
        if (conductivities.getValue().isEmpty()) {
            return StageOutcome.failure(PipelineStage.ANALYTIC_SOLUTION, FailureKind.PRECONDITION,
                    "導電率が 1 件も読み込めませんでした", null);
        }

        return attempt(PipelineStage.ANALYTIC_SOLUTION, FailureKind.COLLABORATOR,
                FailureKind.COLLABORATOR, () -> {
                    double[] sigma = GeometryConverter.toArray(conductivities.getValue().get(0),
                            GeometryConverter.LAYER_COUNT);
                    List<double[]> points =
                            GeometryConverter.toArrays(electrodes, GeometryConverter.DIM);
                    double[] position = GeometryConverter.toArray(dipole.getPosition(),
                            GeometryConverter.DIM);
                    double[] moment =
                            GeometryConverter.toArray(dipole.getMoment(), GeometryConverter.DIM);
                    return analyticSolver.solve(geometry.radii.clone(), geometry.center.clone(),
                            sigma, points, position, moment);
                });
    }

    /**
     * 比較結果を出力します（失敗は警告ログのみ）。
     */
    private void export(ComparisonArtifacts artifacts) {
        log.info("段階 {}", PipelineStage.EXPORT);
        for (ResultWriter writer : resultWriters) {
            try {
                writer.write(artifacts);
            } catch (RuntimeException e) {
                log.warn("{} の出力に失敗しました（比較結果は有効です）: {}", writer.getClass().getSimpleName(),
                        e.getMessage(), e);
            }
        }
    }

    /**
     * 段階を実行し、例外を失敗に変換します。
     *
     * <p>
     * {@link UncheckedIOException} は常に {@link FailureKind#IO} とします。
     * </p>
     *
     * @param stage 段階です
     * @param onIllegalArgument {@link IllegalArgumentException} の場合の種類です
     * @param onOther その他の実行時例外の場合の種類です
     * @param step 段階の処理です
     * @return 段階の結果です
     */
    private static <T> StageOutcome<T> attempt(PipelineStage stage, FailureKind onIllegalArgument,
            FailureKind onOther, Supplier<T> step) {
        log.info("段階 {}", stage);
        try {
            T value = step.get();
            if (value == null) {
                return StageOutcome.failure(stage, onOther, "結果が null です", null);
            }
            return StageOutcome.success(value);
        } catch (UncheckedIOException e) {
            return StageOutcome.failure(stage, FailureKind.IO, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            return StageOutcome.failure(stage, onIllegalArgument, e.getMessage(), e);
        } catch (RuntimeException e) {
            return StageOutcome.failure(stage, onOther, String.valueOf(e.getMessage()), e);
        }
    }

    /**
     * 平均を差し引いた電位と指標です。
     */
    private static final class Compared {

        final double[] numerical;

        final double[] analytical;

        final MetricResult metrics;

        Compared(double[] numerical, double[] analytical, MetricResult metrics) {
            this.numerical = numerical;
            this.analytical = analytical;
            this.metrics = metrics;
        }
    }

    /**
     * 検証済みの幾何です。
     */
    private static final class Geometry {

        final double[] radii;

        final double[] center;

        Geometry(double[] radii, double[] center) {
            this.radii = radii;
            this.center = center;
        }
    }
}
