package io.github.yok.eeg.core.metric;

import lombok.Value;

/**
 * 数値解と解析解の比較結果を保持するクラスです。
 */
@Value
public class MetricResult {

    /**
     * 解析解のノルムです。
     */
    double analyticalNorm;

    /**
     * 数値解のノルムです。
     */
    double numericalNorm;

    /**
     * 相対誤差 {@code ||num - ana|| / ||ana||} です。
     */
    double relativeError;

    /**
     * MAG {@code ||num|| / ||ana||} です（1.0 で振幅一致）。
     */
    double magnitudeError;

    /**
     * RDM {@code ||num/||num|| - ana/||ana|| ||} です（形状の差、0 で一致）。
     */
    double relativeDifferenceMeasure;
}
