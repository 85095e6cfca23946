package io.github.yok.eeg.core.forward;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.out.VolumeWriter;
import java.util.List;

/**
 * EEG 順問題を数値的に解くソルバを表すインタフェースです。
 *
 * <p>
 * 実装の差し替え（離散化手法・線形ソルバ）と、比較パイプラインのテスト用フェイク差し替えのための境界です。
 * ソルバは 1 回の比較実行の間だけ保持され、終了時に必ず {@link #close()} されます。
 * </p>
 */
public interface ForwardSolver extends AutoCloseable {

    /**
     * 双極子に対する順問題を解き、計算領域全体の電位を返します。
     *
     * @param dipole 双極子です
     * @return 計算領域全体の電位です
     */
    DomainFunction solveEegForward(Dipole dipole);

    /**
     * 電極位置を設定します（評価用の射影を準備します）。
     *
     * @param electrodes 電極位置です（順序は評価結果のインデックスに対応します）
     */
    void setElectrodes(List<FieldVector> electrodes);

    /**
     * 設定済みの電極位置で電位を評価します。
     *
     * @param solution {@link #solveEegForward(Dipole)} の結果です
     * @return 電極ごとの電位です（{@link #setElectrodes(List)} の順序）
     */
    double[] evaluateAtElectrodes(DomainFunction solution);

    /**
     * 計算領域全体の電位を可視化形式で出力するライタを返します。
     *
     * @return ボリュームライタです
     */
    VolumeWriter volumeWriter();

    /**
     * ソルバが保持する資源を解放します。
     */
    @Override
    void close();
}
