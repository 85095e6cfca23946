package io.github.yok.eeg.core.pipeline;

/**
 * 比較結果を利用者に提示する処理のインタフェースです。
 */
public interface ComparisonReporter {

    /**
     * 比較結果を提示します。
     *
     * @param report 比較結果です
     */
    void report(ComparisonReport report);
}
