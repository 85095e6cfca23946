package io.github.yok.eeg.core.pipeline;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.forward.DomainFunction;
import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.metric.MetricResult;
import io.github.yok.eeg.out.VolumeWriter;
import java.util.List;
import java.util.function.Supplier;
import lombok.Value;

/**
 * 1 回の比較実行で得られた、出力に必要な成果物一式です。
 *
 * <p>
 * 電極電位はいずれも平均を差し引いた値で、{@link #getElectrodes()} とインデックス対応します。 配列は生成時と取得時に複製します。
 * </p>
 */
@Value
public class ComparisonArtifacts {

    /**
     * 比較に用いた双極子です。
     */
    Dipole dipole;

    /**
     * 電極位置です。
     */
    List<FieldVector> electrodes;

    /**
     * 解析解の電極電位（平均除去済み）です。
     */
    double[] analytical;

    /**
     * 数値解の電極電位（平均除去済み）です。
     */
    double[] numerical;

    /**
     * 比較指標です。
     */
    MetricResult metrics;

    /**
     * 計算領域全体の数値解です。
     */
    DomainFunction solution;

    /**
     * {@link #getSolution()} を出力するライタの取得元です。
     *
     * <p>
     * 出力の直前まで取得しないため、取得の失敗は出力側の失敗として扱われます。
     * </p>
     */
    Supplier<VolumeWriter> volumeWriter;

    /**
     * 成果物を生成します。
     *
     * @param dipole 双極子です
     * @param electrodes 電極位置です
     * @param analytical 解析解の電極電位です
     * @param numerical 数値解の電極電位です
     * @param metrics 比較指標です
     * @param solution 計算領域全体の数値解です
     * @param volumeWriter 体積出力ライタの取得元です
     */
    public ComparisonArtifacts(Dipole dipole, List<FieldVector> electrodes, double[] analytical,
            double[] numerical, MetricResult metrics, DomainFunction solution,
            Supplier<VolumeWriter> volumeWriter) {
        this.dipole = dipole;
        this.electrodes = List.copyOf(checkNotNull(electrodes, "electrodes は null 不可です"));
        this.analytical = checkNotNull(analytical, "analytical は null 不可です").clone();
        this.numerical = checkNotNull(numerical, "numerical は null 不可です").clone();
        this.metrics = metrics;
        this.solution = solution;
        this.volumeWriter = volumeWriter;
    }

    public double[] getAnalytical() {
        return analytical.clone();
    }

    public double[] getNumerical() {
        return numerical.clone();
    }
}
