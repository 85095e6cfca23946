package io.github.yok.eeg.out;

import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.pipeline.ComparisonArtifacts;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 比較結果を legacy VTK（ASCII）で可視化用に出力するクラスです。
 *
 * <ul>
 * <li>計算領域全体の電位（ソルバの {@link VolumeWriter} に委譲）</li>
 * <li>双極子（位置とモーメント）</li>
 * <li>電極（解析解・数値解の電位）</li>
 * </ul>
 */
@Slf4j
public final class VtkResultWriter implements ResultWriter {

    private final Path volumeFile;

    private final Path dipoleFile;

    private final Path electrodeFile;

    /**
     * VTK 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param volumeFilename 計算領域全体の電位のファイル名です
     * @param dipoleFilename 双極子のファイル名です
     * @param electrodeFilename 電極電位のファイル名です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public VtkResultWriter(String outputDir, String volumeFilename, String dipoleFilename,
            String electrodeFilename) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        Path dir = Paths.get(outputDir);
        this.volumeFile = dir.resolve(requireName(volumeFilename, "filenameVolume"));
        this.dipoleFile = dir.resolve(requireName(dipoleFilename, "filenameDipole"));
        this.electrodeFile =
                dir.resolve(requireName(electrodeFilename, "filenameElectrodePotentials"));
    }

    @Override
    public void write(ComparisonArtifacts artifacts) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts は null 不可です");
        }
        try {
            artifacts.getVolumeWriter().get().write(artifacts.getSolution(), volumeFile);
            log.info("計算領域の電位を出力しました: {}", volumeFile);

            Map<String, List<FieldVector>> moment = VtkFormat.named();
            moment.put("moment", List.of(artifacts.getDipole().getMoment()));
            VtkFormat.writePoints(dipoleFile, "eeg dipole",
                    List.of(artifacts.getDipole().getPosition()), VtkFormat.named(), moment);
            log.info("双極子を出力しました: {}", dipoleFile);

            Map<String, double[]> potentials = VtkFormat.named();
            potentials.put("potential_analytical", artifacts.getAnalytical());
            potentials.put("potential_numerical", artifacts.getNumerical());
            VtkFormat.writePoints(electrodeFile, "eeg electrode potentials",
                    artifacts.getElectrodes(), potentials, VtkFormat.named());
            log.info("電極電位を出力しました: {}", electrodeFile);
        } catch (IOException e) {
            throw new IllegalStateException("VTK 出力に失敗しました: " + volumeFile.getParent(), e);
        }
    }

    private static String requireName(String name, String key) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("output." + key + " は必須です");
        }
        return name;
    }
}
