package io.github.yok.eeg.core.pipeline;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.metric.MetricResult;
import lombok.Value;

/**
 * 比較実行の結果レポートです。
 */
@Value
public class ComparisonReport {

    /**
     * 比較に用いた双極子です。
     */
    Dipole dipole;

    /**
     * 読み込んだ双極子の中での位置（0 始まり）です。
     */
    int dipoleIndex;

    /**
     * 電極数です。
     */
    int electrodeCount;

    /**
     * 比較指標です。
     */
    MetricResult metrics;
}
