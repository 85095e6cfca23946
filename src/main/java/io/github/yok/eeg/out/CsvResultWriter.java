package io.github.yok.eeg.out;

import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.metric.MetricResult;
import io.github.yok.eeg.core.pipeline.ComparisonArtifacts;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 比較結果を CSV に出力するクラスです。
 *
 * <ul>
 * <li>{@code eeg_electrode_potentials.csv}（電極ごとの解析解・数値解・差）</li>
 * <li>{@code eeg_metrics.csv}（ノルムと比較指標）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "eeg";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 電極電位と比較指標を出力します。
     *
     * @param artifacts 比較実行の成果物です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(ComparisonArtifacts artifacts) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts は null 不可です");
        }
        int count = artifacts.getElectrodes().size();
        if (artifacts.getAnalytical().length != count || artifacts.getNumerical().length != count) {
            throw new IllegalArgumentException("電極数と電位の長さが一致しません: electrodes=" + count
                    + ", analytical=" + artifacts.getAnalytical().length + ", numerical="
                    + artifacts.getNumerical().length);
        }

        try {
            Files.createDirectories(outputDir);
            writePotentialsCsv(artifacts);
            writeMetricsCsv(artifacts);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 電極ごとの電位を出力します。
     *
     * @param artifacts 比較実行の成果物です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writePotentialsCsv(ComparisonArtifacts artifacts) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_electrode_potentials.csv");

        List<double[]> xyz =
                GeometryConverter.toArrays(artifacts.getElectrodes(), GeometryConverter.DIM);
        double[] ana = artifacts.getAnalytical();
        double[] num = artifacts.getNumerical();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("i", "x", "y", "z", "potential_analytical",
                                "potential_numerical", "difference")
                        .build().print(w)) {

            for (int i = 0; i < xyz.size(); i++) {
                double[] p = xyz.get(i);
                pr.printRecord(i, p[0], p[1], p[2], ana[i], num[i], num[i] - ana[i]);
            }
        }
    }

    /**
     * 比較指標を出力します。
     *
     * @param artifacts 比較実行の成果物です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetricsCsv(ComparisonArtifacts artifacts) throws IOException {
        Path file = outputDir.resolve(FILE_HEAD + "_metrics.csv");
        MetricResult m = artifacts.getMetrics();
        double[] pos = GeometryConverter.toArray(artifacts.getDipole().getPosition(),
                GeometryConverter.DIM);
        double[] mom =
                GeometryConverter.toArray(artifacts.getDipole().getMoment(), GeometryConverter.DIM);

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("dipole.x", pos[0]);
            pr.printRecord("dipole.y", pos[1]);
            pr.printRecord("dipole.z", pos[2]);
            pr.printRecord("dipole.mx", mom[0]);
            pr.printRecord("dipole.my", mom[1]);
            pr.printRecord("dipole.mz", mom[2]);

            pr.printRecord("electrodes", artifacts.getElectrodes().size());

            pr.printRecord("norm.analytical", m.getAnalyticalNorm());
            pr.printRecord("norm.numerical", m.getNumericalNorm());
            pr.printRecord("relative_error", m.getRelativeError());
            pr.printRecord("mag", m.getMagnitudeError());
            pr.printRecord("rdm", m.getRelativeDifferenceMeasure());
        }
    }
}
