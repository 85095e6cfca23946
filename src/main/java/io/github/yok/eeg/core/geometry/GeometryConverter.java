package io.github.yok.eeg.core.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * 順問題ソルバの表現（{@link FieldVector}）と解析解エンジンの表現（固定長 {@code double[]}）を相互に変換するクラスです。
 *
 * <p>
 * 変換は成分のコピーのみで、座標系の変換は行いません。 長さが宣言次元と一致しない場合は切り詰めや補完をせず、例外とします。
 * </p>
 */
public final class GeometryConverter {

    /**
     * 空間次元です。
     */
    public static final int DIM = 3;

    /**
     * 球モデルの層数です（頭皮・頭蓋骨・脳脊髄液・脳）。
     */
    public static final int LAYER_COUNT = 4;

    private GeometryConverter() {}

    /**
     * ベクトルを固定長配列に変換します。
     *
     * @param vector 変換元です（null 不可）
     * @param expectedDimension 期待する次元です
     * @return 変換後の配列です
     * @throws IllegalArgumentException null または次元不一致の場合に発生します
     */
    public static double[] toArray(FieldVector vector, int expectedDimension) {
        requireDimension(vector, expectedDimension, "vector");
        return vector.toArray();
    }

    /**
     * ベクトル列を固定長配列の列に変換します（順序は保持します）。
     *
     * @param vectors 変換元です（null 不可）
     * @param expectedDimension 期待する次元です
     * @return 変換後の配列リストです
     * @throws IllegalArgumentException null または次元不一致の要素がある場合に発生します
     */
    public static List<double[]> toArrays(List<FieldVector> vectors, int expectedDimension) {
        if (vectors == null) {
            throw new IllegalArgumentException("vectors は null 不可です");
        }
        List<double[]> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            requireDimension(vectors.get(i), expectedDimension, "vectors[" + i + "]");
            out.add(vectors.get(i).toArray());
        }
        return out;
    }

    /**
     * 固定長配列をベクトルに変換します。
     *
     * @param array 変換元です（null 不可）
     * @param expectedDimension 期待する次元です
     * @return 変換後のベクトルです
     * @throws IllegalArgumentException null または長さ不一致の場合に発生します
     */
    public static FieldVector fromArray(double[] array, int expectedDimension) {
        if (array == null) {
            throw new IllegalArgumentException("array は null 不可です");
        }
        if (array.length != expectedDimension) {
            throw new IllegalArgumentException(
                    "配列長が次元と一致しません: length=" + array.length + ", expected=" + expectedDimension);
        }
        return FieldVector.of(array);
    }

    /**
     * 固定長配列の列をベクトル列に変換します（順序は保持します）。
     *
     * @param arrays 変換元です（null 不可）
     * @param expectedDimension 期待する次元です
     * @return 変換後のベクトルリストです
     * @throws IllegalArgumentException null または長さ不一致の要素がある場合に発生します
     */
    public static List<FieldVector> fromArrays(List<double[]> arrays, int expectedDimension) {
        if (arrays == null) {
            throw new IllegalArgumentException("arrays は null 不可です");
        }
        List<FieldVector> out = new ArrayList<>(arrays.size());
        for (double[] a : arrays) {
            out.add(fromArray(a, expectedDimension));
        }
        return out;
    }

    /**
     * 設定値の数値リストを固定長配列に変換します。
     *
     * @param values 設定値です（null 不可、null 要素不可）
     * @param expectedLength 期待する長さです
     * @param name エラーメッセージに使う設定キーです
     * @return 変換後の配列です
     * @throws IllegalArgumentException null・null 要素・長さ不一致の場合に発生します
     */
    public static double[] toArray(List<Double> values, int expectedLength, String name) {
        if (values == null) {
            throw new IllegalArgumentException(name + " は必須です");
        }
        if (values.size() != expectedLength) {
            throw new IllegalArgumentException(name + " は " + expectedLength + " 個の値が必要です: "
                    + values.size() + " 個指定されています");
        }
        double[] out = new double[expectedLength];
        for (int i = 0; i < expectedLength; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new IllegalArgumentException(name + " に null が含まれています: index=" + i);
            }
            out[i] = v;
        }
        return out;
    }

    /**
     * ベクトルの次元を検証します。
     *
     * @param vector 検証対象です
     * @param expectedDimension 期待する次元です
     * @param name エラーメッセージに使う名前です
     * @throws IllegalArgumentException null または次元不一致の場合に発生します
     */
    static void requireDimension(FieldVector vector, int expectedDimension, String name) {
        if (vector == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
        if (vector.dimension() != expectedDimension) {
            throw new IllegalArgumentException(name + " の次元が一致しません: dimension="
                    + vector.dimension() + ", expected=" + expectedDimension);
        }
    }
}
