package io.github.yok.eeg.out;

import io.github.yok.eeg.core.geometry.GeometryConverter;
import io.github.yok.eeg.core.metric.MetricResult;
import io.github.yok.eeg.core.pipeline.ComparisonReport;
import io.github.yok.eeg.core.pipeline.ComparisonReporter;
import java.io.PrintStream;
import java.util.Locale;

/**
 * 比較結果を標準出力へ表示するクラスです。
 *
 * <p>
 * 閾値が設定されている指標には {@code [OK]}/{@code [NG]} を付けます。 判定は表示のみで、実行結果（終了コード）には影響しません。
 * </p>
 */
public final class ConsoleComparisonReporter implements ComparisonReporter {

    private final PrintStream out;

    private final Double relativeErrorLimit;

    private final Double magDeviationLimit;

    private final Double rdmLimit;

    /**
     * 表示先と閾値を指定して生成します。
     *
     * @param out 表示先です
     * @param relativeErrorLimit 相対誤差の上限です（null は判定なし）
     * @param magDeviationLimit {@code |MAG - 1|} の上限です（null は判定なし）
     * @param rdmLimit RDM の上限です（null は判定なし）
     */
    public ConsoleComparisonReporter(PrintStream out, Double relativeErrorLimit,
            Double magDeviationLimit, Double rdmLimit) {
        if (out == null) {
            throw new IllegalArgumentException("out は null 不可です");
        }
        this.out = out;
        this.relativeErrorLimit = relativeErrorLimit;
        this.magDeviationLimit = magDeviationLimit;
        this.rdmLimit = rdmLimit;
    }

    @Override
    public void report(ComparisonReport report) {
        MetricResult m = report.getMetrics();
        double[] p =
                GeometryConverter.toArray(report.getDipole().getPosition(), GeometryConverter.DIM);
        double[] q =
                GeometryConverter.toArray(report.getDipole().getMoment(), GeometryConverter.DIM);

        out.println("=== 比較結果 ===");
        out.println("双極子[" + report.getDipoleIndex() + "]: position=(" + fmt5(p[0]) + ", "
                + fmt5(p[1]) + ", " + fmt5(p[2]) + "), moment=(" + fmt5(q[0]) + ", " + fmt5(q[1])
                + ", " + fmt5(q[2]) + ")");
        out.println("電極数: " + report.getElectrodeCount());
        out.println("norm(analytical) = " + fmtE(m.getAnalyticalNorm()));
        out.println("norm(numerical)  = " + fmtE(m.getNumericalNorm()));
        out.println("relative error   = " + fmtE(m.getRelativeError())
                + verdict(m.getRelativeError(), relativeErrorLimit));
        out.println("MAG              = " + fmtE(m.getMagnitudeError())
                + verdict(Math.abs(m.getMagnitudeError() - 1.0), magDeviationLimit));
        out.println("RDM              = " + fmtE(m.getRelativeDifferenceMeasure())
                + verdict(m.getRelativeDifferenceMeasure(), rdmLimit));
    }

    /**
     * 閾値判定の表示文字列を返します。
     *
     * @param value 判定する値です
     * @param limit 上限です（null は判定なし）
     * @return {@code " [OK]"}、{@code " [NG]"}、または空文字です
     */
    static String verdict(double value, Double limit) {
        if (limit == null) {
            return "";
        }
        return value <= limit ? " [OK]" : " [NG]";
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
