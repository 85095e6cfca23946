package io.github.yok.eeg.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.github.yok.eeg.core.geometry.FieldVector;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 空白区切りの数値テキストから固定次元ベクトルの列を読み込むクラスです。
 *
 * <p>
 * 1 行 1 ベクトルで、空行と {@code #} で始まる行は読み飛ばします。
 * </p>
 */
public final class FieldVectorReader {

    private static final Splitter FIELDS =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

    private FieldVectorReader() {}

    /**
     * ファイルを読み込みます。
     *
     * @param file 入力ファイルです
     * @param dimension 1 行あたりの成分数です
     * @return ベクトルの列です（記載順）
     * @throws IllegalArgumentException 列数や数値の書式が不正な場合に発生します
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     */
    public static List<FieldVector> read(Path file, int dimension) {
        List<FieldVector> out = new ArrayList<>();
        for (double[] row : readRows(file, dimension)) {
            out.add(FieldVector.of(row));
        }
        return out;
    }

    /**
     * ファイルを数値行の列として読み込みます。
     *
     * @param file 入力ファイルです
     * @param columns 1 行あたりの列数です
     * @return 数値行の列です（記載順）
     * @throws IllegalArgumentException 列数や数値の書式が不正な場合に発生します
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     */
    static List<double[]> readRows(Path file, int columns) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ファイルを読み込めません: " + file, e);
        }

        List<double[]> rows = new ArrayList<>();
        for (int lineNo = 1; lineNo <= lines.size(); lineNo++) {
            String line = lines.get(lineNo - 1).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            List<String> fields = FIELDS.splitToList(line);
            if (fields.size() != columns) {
                throw new IllegalArgumentException(file + ":" + lineNo + " の列数が不正です: "
                        + fields.size() + "（期待値 " + columns + "）");
            }
            double[] row = new double[columns];
            for (int c = 0; c < columns; c++) {
                try {
                    row[c] = Double.parseDouble(fields.get(c));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            file + ":" + lineNo + " の数値が不正です: " + fields.get(c), e);
                }
                if (!Double.isFinite(row[c])) {
                    throw new IllegalArgumentException(
                            file + ":" + lineNo + " に有限でない値があります: " + fields.get(c));
                }
            }
            rows.add(row);
        }
        return rows;
    }
}
