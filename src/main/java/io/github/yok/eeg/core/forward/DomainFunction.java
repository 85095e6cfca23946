package io.github.yok.eeg.core.forward;

import io.github.yok.eeg.core.geometry.FieldVector;

/**
 * 順問題ソルバが計算領域全体に持つスカラー場（電位）を表すインタフェースです。
 *
 * <p>
 * 比較パイプラインからは「点で評価できる」こと以外の構造は参照しません。
 * </p>
 */
public interface DomainFunction {

    /**
     * 指定点での値を返します。
     *
     * @param point 評価点です（3 次元）
     * @return 値です
     */
    double evaluate(FieldVector point);
}
