package io.github.yok.eeg.io;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 双極子ファイル（1 行 {@code x y z mx my mz}）を読み込むクラスです。
 */
public final class DipoleReader {

    private DipoleReader() {}

    /**
     * ファイルを読み込みます。
     *
     * @param file 入力ファイルです
     * @return 双極子の列です（記載順、空の場合もあります）
     * @throws IllegalArgumentException 書式が不正な場合に発生します
     * @throws java.io.UncheckedIOException 読み込みに失敗した場合に発生します
     */
    public static List<Dipole> read(Path file) {
        List<Dipole> out = new ArrayList<>();
        for (double[] row : FieldVectorReader.readRows(file, 6)) {
            out.add(new Dipole(FieldVector.of(row[0], row[1], row[2]),
                    FieldVector.of(row[3], row[4], row[5])));
        }
        return out;
    }
}
