package io.github.yok.eeg.core.geometry;

import lombok.Value;

/**
 * 電流双極子（位置とモーメント）を表すクラスです。
 *
 * <p>
 * 位置・モーメントともに 3 次元で、生成後は変更されません。
 * </p>
 */
@Value
public class Dipole {

    /**
     * 双極子の位置です（3 次元）。
     */
    FieldVector position;

    /**
     * 双極子モーメントです（3 次元）。
     */
    FieldVector moment;

    /**
     * 双極子を生成します。
     *
     * @param position 位置です（3 次元、null 不可）
     * @param moment モーメントです（3 次元、null 不可）
     * @throws IllegalArgumentException null または次元が 3 でない場合に発生します
     */
    public Dipole(FieldVector position, FieldVector moment) {
        GeometryConverter.requireDimension(position, GeometryConverter.DIM, "dipole.position");
        GeometryConverter.requireDimension(moment, GeometryConverter.DIM, "dipole.moment");
        this.position = position;
        this.moment = moment;
    }
}
