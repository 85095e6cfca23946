package io.github.yok.eeg.app;

import io.github.yok.eeg.core.forward.ElectrodeEvaluation;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import javax.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * eeg-forward-check の設定値（eeg.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、順問題ソルバ・解析解・比較パイプラインの構築に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "eeg")
public class EegCheckProperties {

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 双極子設定です。
     */
    @Valid
    private Dipole dipole = new Dipole();

    /**
     * 電極設定です。
     */
    @Valid
    private Electrodes electrodes = new Electrodes();

    /**
     * 解析解（多層球）の設定です。
     */
    @Valid
    private AnalyticSolution analyticSolution = new AnalyticSolution();

    /**
     * 体積導体（導電率）の設定です。
     */
    @Valid
    private VolumeConductor volumeConductor = new VolumeConductor();

    /**
     * 順問題ソルバ（有限体積法）の設定です。
     */
    @Valid
    private Solver solver = new Solver();

    /**
     * 比較結果の判定設定です。
     */
    @Valid
    private Comparison comparison = new Comparison();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "eeg")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Output o = getOutput();
        AnalyticSolution a = getAnalyticSolution();
        Solver s = getSolver();
        Comparison.Thresholds th = getComparison().getThresholds();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "output",
                // write: 可視化・CSV を出力するかどうか
                "write", o.isWrite(),
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                "filenameVolume", o.getFilenameVolume(),
                "filenameDipole", o.getFilenameDipole(),
                "filenameElectrodePotentials", o.getFilenameElectrodePotentials());

        appendSection(sb, nl, "dipole",
                "filename", getDipole().getFilename(),
                // index: 使用する双極子の行番号（0 始まり）
                "index", getDipole().getIndex());

        appendSection(sb, nl, "electrodes",
                "filename", getElectrodes().getFilename(),
                // type: 電極での評価方法（CLOSEST_NODE/TRILINEAR）
                "type", getElectrodes().getType());

        appendSection(sb, nl, "analyticSolution",
                // radii: 各層の半径（外側→内側）
                "radii", a.getRadii(),
                // center: 球の中心
                "center", a.getCenter(),
                "series.maxTerms", a.getSeries().getMaxTerms(),
                "series.tolerance", a.getSeries().getTolerance());

        appendSection(sb, nl, "volumeConductor",
                "tensors.filename", getVolumeConductor().getTensors().getFilename());

        appendSection(sb, nl, "solver",
                // gridSpacing: 格子間隔
                "gridSpacing", s.getGridSpacing(),
                "cg.maxIterations", s.getCg().getMaxIterations(),
                "cg.tolerance", s.getCg().getTolerance());

        appendSection(sb, nl, "comparison",
                // 未設定（null）の閾値は判定しません
                "thresholds.relativeError", th.getRelativeError(),
                "thresholds.magDeviation", th.getMagDeviation(),
                "thresholds.rdm", th.getRdm());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Output {

        /**
         * 可視化ファイル・CSV を出力するかどうかです。
         */
        private boolean write = false;

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";

        /**
         * 計算領域全体の電位と勾配（VTK）のファイル名です。
         */
        @NotBlank
        private String filenameVolume = "eeg_volume.vtk";

        /**
         * 双極子（VTK）のファイル名です。
         */
        @NotBlank
        private String filenameDipole = "eeg_dipole.vtk";

        /**
         * 電極位置の電位（VTK）のファイル名です。
         */
        @NotBlank
        private String filenameElectrodePotentials = "eeg_electrode_potentials.vtk";
    }

    @Data
    public static class Dipole {

        /**
         * 双極子ファイル（1 行 {@code x y z mx my mz}）です。
         */
        @NotBlank
        private String filename;

        /**
         * 使用する双極子のインデックス（0 始まり）です。
         *
         * <p>
         * 指定以外の双極子は読み込み後に無視します。
         * </p>
         */
        @PositiveOrZero
        private int index = 0;
    }

    @Data
    public static class Electrodes {

        /**
         * 電極ファイル（1 行 {@code x y z}）です。
         */
        @NotBlank
        private String filename;

        /**
         * 電極位置での評価方法です。
         */
        @NotNull
        private ElectrodeEvaluation type = ElectrodeEvaluation.CLOSEST_NODE;
    }

    @Data
    public static class AnalyticSolution {

        /**
         * 各層の半径です（4 層、外側→内側または内側→外側）。
         */
        @Size(min = 4, max = 4)
        private List<Double> radii = List.of();

        /**
         * 球の中心です（3 成分）。
         */
        @Size(min = 3, max = 3)
        private List<Double> center = List.of(0.0, 0.0, 0.0);

        /**
         * Legendre 級数の設定です。
         */
        @Valid
        private Series series = new Series();

        @Data
        public static class Series {

            /**
             * 最大項数です。
             */
            @Positive
            private int maxTerms = 1000;

            /**
             * 打ち切りの相対許容誤差です。
             */
            @Positive
            private double tolerance = 1e-12;
        }
    }

    @Data
    public static class VolumeConductor {

        /**
         * 導電率ファイルの設定です。
         */
        @Valid
        private Tensors tensors = new Tensors();

        @Data
        public static class Tensors {

            /**
             * 導電率ファイル（1 行 4 成分、半径と同じ層順）です。
             */
            @NotBlank
            private String filename;
        }
    }

    @Data
    public static class Solver {

        /**
         * 格子間隔です（座標と同じ単位）。
         */
        @Positive
        private double gridSpacing = 0.004;

        /**
         * 共役勾配法の設定です。
         */
        @Valid
        private Cg cg = new Cg();

        @Data
        public static class Cg {

            /**
             * 最大反復回数です。
             */
            @Positive
            private int maxIterations = 20000;

            /**
             * 相対残差の許容誤差です。
             */
            @Positive
            private double tolerance = 1e-10;
        }
    }

    /**
     * 比較結果の合否判定（レポート表示のみ）の設定です。
     */
    @Data
    public static class Comparison {

        @Valid
        private Thresholds thresholds = new Thresholds();

        @Data
        public static class Thresholds {

            /**
             * 相対誤差の上限です（null は判定なし）。
             */
            @PositiveOrZero
            private Double relativeError;

            /**
             * {@code |MAG - 1|} の上限です（null は判定なし）。
             */
            @PositiveOrZero
            private Double magDeviation;

            /**
             * RDM の上限です（null は判定なし）。
             */
            @PositiveOrZero
            private Double rdm;
        }
    }
}
