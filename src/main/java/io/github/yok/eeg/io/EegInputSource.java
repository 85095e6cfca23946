package io.github.yok.eeg.io;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import java.util.List;

/**
 * 比較実行に必要な入力データ（双極子・電極・導電率）の供給元を表すインタフェースです。
 */
public interface EegInputSource {

    /**
     * 双極子の一覧を読み込みます。
     *
     * @return 双極子の一覧です（ファイル記載順）
     */
    List<Dipole> readDipoles();

    /**
     * 電極位置の一覧を読み込みます。
     *
     * @return 電極位置の一覧です（ファイル記載順、3 次元）
     */
    List<FieldVector> readElectrodes();

    /**
     * 層ごとの導電率ベクトルの一覧を読み込みます。
     *
     * @return 導電率ベクトルの一覧です（各 4 成分）
     */
    List<FieldVector> readConductivities();
}
