package io.github.yok.eeg.out;

import io.github.yok.eeg.core.pipeline.ComparisonArtifacts;

/**
 * 比較結果をファイルに出力する処理のインタフェースです。
 *
 * <p>
 * 出力は比較レポートの後に行われ、失敗しても比較結果そのものは無効になりません。
 * </p>
 */
public interface ResultWriter {

    /**
     * 比較結果を出力します。
     *
     * @param artifacts 比較実行の成果物です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    void write(ComparisonArtifacts artifacts);
}
