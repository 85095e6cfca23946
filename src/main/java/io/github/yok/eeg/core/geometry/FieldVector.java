package io.github.yok.eeg.core.geometry;

import java.util.Arrays;

/**
 * 順問題ソルバ側で扱う固定次元の数値ベクトルを表すクラスです。
 *
 * <p>
 * 次元は生成時に確定し、以後変更されません。電極座標（3 次元）や層ごとの導電率（4 成分）を保持します。
 * </p>
 */
public final class FieldVector {

    /**
     * 成分配列です（外部へは複製して渡します）。
     */
    private final double[] components;

    private FieldVector(double[] components) {
        this.components = components;
    }

    /**
     * 成分を指定してベクトルを生成します。
     *
     * @param components 成分です（null 不可、長さ 1 以上）
     * @return ベクトルです
     * @throws IllegalArgumentException 成分が null または空の場合に発生します
     */
    public static FieldVector of(double... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("components は 1 成分以上が必要です");
        }
        return new FieldVector(components.clone());
    }

    /**
     * 次元を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return components.length;
    }

    /**
     * 指定成分を返します。
     *
     * @param index 成分インデックスです（0 以上 dimension 未満）
     * @return 成分値です
     * @throws IndexOutOfBoundsException インデックスが範囲外の場合に発生します
     */
    public double get(int index) {
        if (index < 0 || index >= components.length) {
            throw new IndexOutOfBoundsException(
                    "index が範囲外です: " + index + "（dimension=" + components.length + "）");
        }
        return components[index];
    }

    /**
     * 成分配列の複製を返します。
     *
     * @return 成分配列です
     */
    public double[] toArray() {
        return components.clone();
    }

    /**
     * ユークリッドノルムを返します。
     *
     * @return ノルムです
     */
    public double norm() {
        double s = 0.0;
        for (double c : components) {
            s += c * c;
        }
        return Math.sqrt(s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldVector)) {
            return false;
        }
        return Arrays.equals(components, ((FieldVector) o).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return Arrays.toString(components);
    }
}
