package io.github.yok.eeg.app;

import io.github.yok.eeg.core.analytic.AnalyticSolver;
import io.github.yok.eeg.core.analytic.MultilayerSphereAnalyticSolver;
import io.github.yok.eeg.core.forward.FiniteVolumeForwardSolverFactory;
import io.github.yok.eeg.core.forward.ForwardSolverFactory;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.pipeline.ComparisonPipeline;
import io.github.yok.eeg.core.pipeline.ComparisonReporter;
import io.github.yok.eeg.io.EegInputSource;
import io.github.yok.eeg.io.FileInputSource;
import io.github.yok.eeg.out.ConsoleComparisonReporter;
import io.github.yok.eeg.out.CsvResultWriter;
import io.github.yok.eeg.out.ResultWriter;
import io.github.yok.eeg.out.VtkResultWriter;
import java.nio.file.Paths;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 有限体積法の順問題ソルバ + 多層球解析解による比較パイプラインの Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class EegCheckConfiguration {

    /**
     * eeg-forward-check の設定値（eeg.*）です。
     */
    private final EegCheckProperties p;

    /**
     * 入力ファイルの読み込み元を生成します。
     *
     * @return 入力データの供給元です
     */
    @Bean
    public EegInputSource eegInputSource() {
        return new FileInputSource(Paths.get(p.getDipole().getFilename()),
                Paths.get(p.getElectrodes().getFilename()),
                Paths.get(p.getVolumeConductor().getTensors().getFilename()));
    }

    /**
     * 順問題ソルバのファクトリを生成します。
     *
     * @param input 入力データの供給元です
     * @return ファクトリです
     */
    @Bean
    public ForwardSolverFactory forwardSolverFactory(EegInputSource input) {
        EegCheckProperties.AnalyticSolution a = p.getAnalyticSolution();
        EegCheckProperties.Solver s = p.getSolver();
        return new FiniteVolumeForwardSolverFactory(
                GeometryConverter.toArray(a.getRadii(), GeometryConverter.LAYER_COUNT,
                        "analytic-solution.radii"),
                GeometryConverter.toArray(a.getCenter(), GeometryConverter.DIM,
                        "analytic-solution.center"),
                s.getGridSpacing(), p.getElectrodes().getType(), s.getCg().getMaxIterations(),
                s.getCg().getTolerance(), input);
    }

    /**
     * 多層球の解析解エンジンを生成します。
     *
     * @return 解析解エンジンです
     */
    @Bean
    public AnalyticSolver analyticSolver() {
        EegCheckProperties.AnalyticSolution.Series s = p.getAnalyticSolution().getSeries();
        return new MultilayerSphereAnalyticSolver(s.getMaxTerms(), s.getTolerance());
    }

    /**
     * 比較結果の表示先を生成します。
     *
     * @return 標準出力への表示です
     */
    @Bean
    public ComparisonReporter comparisonReporter() {
        EegCheckProperties.Comparison.Thresholds t = p.getComparison().getThresholds();
        return new ConsoleComparisonReporter(System.out, t.getRelativeError(),
                t.getMagDeviation(), t.getRdm());
    }

    /**
     * CSV 出力を生成します。
     *
     * @return CSV 出力です
     */
    @Bean
    public ResultWriter csvResultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }

    /**
     * VTK 出力を生成します。
     *
     * @return VTK 出力です
     */
    @Bean
    public ResultWriter vtkResultWriter() {
        EegCheckProperties.Output o = p.getOutput();
        return new VtkResultWriter(o.getDir(), o.getFilenameVolume(), o.getFilenameDipole(),
                o.getFilenameElectrodePotentials());
    }

    /**
     * 比較パイプラインを生成します。
     *
     * @param factory 順問題ソルバのファクトリです
     * @param analyticSolver 解析解エンジンです
     * @param input 入力データの供給元です
     * @param reporter 比較結果の表示先です
     * @param writers 出力先です
     * @return 比較パイプラインです
     */
    @Bean
    public ComparisonPipeline comparisonPipeline(ForwardSolverFactory factory,
            AnalyticSolver analyticSolver, EegInputSource input, ComparisonReporter reporter,
            List<ResultWriter> writers) {
        return new ComparisonPipeline(p.getAnalyticSolution().getRadii(),
                p.getAnalyticSolution().getCenter(), p.getDipole().getIndex(), factory,
                analyticSolver, input, reporter, writers, p.getOutput().isWrite());
    }
}
