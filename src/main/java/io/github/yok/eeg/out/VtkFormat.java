package io.github.yok.eeg.out;

import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * legacy VTK（ASCII）の数値整形と点群（POLYDATA）出力をまとめたクラスです。
 */
final class VtkFormat {

    private VtkFormat() {}

    /**
     * 数値を VTK 用に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    static String number(double v) {
        return String.format(Locale.ROOT, "%.9e", v);
    }

    /**
     * 3 成分ベクトルを空白区切りで整形します。
     *
     * @param v ベクトルです
     * @return 整形文字列です
     */
    static String vector(double[] v) {
        return number(v[0]) + " " + number(v[1]) + " " + number(v[2]);
    }

    /**
     * 点群を POLYDATA（VERTICES）として出力します。
     *
     * @param file 出力ファイルです
     * @param title 表題行です
     * @param points 点の座標です
     * @param scalars 点ごとのスカラー（名前 → 値、点数と同じ長さ）です
     * @param vectors 点ごとのベクトル（名前 → 3 成分の列）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    static void writePoints(Path file, String title, List<FieldVector> points,
            Map<String, double[]> scalars, Map<String, List<FieldVector>> vectors)
            throws IOException {
        int count = points.size();
        List<double[]> xyz = GeometryConverter.toArrays(points, GeometryConverter.DIM);

        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            pw.println("# vtk DataFile Version 3.0");
            pw.println(title);
            pw.println("ASCII");
            pw.println("DATASET POLYDATA");
            pw.println("POINTS " + count + " double");
            for (double[] p : xyz) {
                pw.println(vector(p));
            }
            pw.println("VERTICES " + count + " " + (2 * count));
            for (int i = 0; i < count; i++) {
                pw.println("1 " + i);
            }
            pw.println("POINT_DATA " + count);
            for (Map.Entry<String, double[]> e : scalars.entrySet()) {
                double[] values = e.getValue();
                if (values.length != count) {
                    throw new IllegalArgumentException(e.getKey() + " の長さが点数と一致しません: "
                            + values.length + " vs " + count);
                }
                pw.println("SCALARS " + e.getKey() + " double 1");
                pw.println("LOOKUP_TABLE default");
                for (double v : values) {
                    pw.println(number(v));
                }
            }
            for (Map.Entry<String, List<FieldVector>> e : vectors.entrySet()) {
                List<double[]> values = GeometryConverter.toArrays(e.getValue(), GeometryConverter.DIM);
                if (values.size() != count) {
                    throw new IllegalArgumentException(e.getKey() + " の長さが点数と一致しません: "
                            + values.size() + " vs " + count);
                }
                pw.println("VECTORS " + e.getKey() + " double");
                for (double[] v : values) {
                    pw.println(vector(v));
                }
            }
            if (pw.checkError()) {
                throw new IOException("VTK の書き込みに失敗しました: " + file);
            }
        }
    }

    /**
     * 挿入順を保つ名前付きデータを作ります。
     *
     * @param <T> 値の型です
     * @return 空のマップです
     */
    static <T> Map<String, T> named() {
        return new LinkedHashMap<>();
    }
}
