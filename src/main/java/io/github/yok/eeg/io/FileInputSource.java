package io.github.yok.eeg.io;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.eeg.core.geometry.Dipole;
import io.github.yok.eeg.core.geometry.FieldVector;
import io.github.yok.eeg.core.geometry.GeometryConverter;
import java.nio.file.Path;
import java.util.List;

/**
 * 設定されたファイルパスから入力データを読み込む {@link EegInputSource} の実装です。
 */
public final class FileInputSource implements EegInputSource {

    private final Path dipoleFile;

    private final Path electrodeFile;

    private final Path conductivityFile;

    /**
     * ファイル入力を生成します。
     *
     * @param dipoleFile 双極子ファイルです
     * @param electrodeFile 電極ファイルです
     * @param conductivityFile 導電率ファイルです
     */
    public FileInputSource(Path dipoleFile, Path electrodeFile, Path conductivityFile) {
        this.dipoleFile = checkNotNull(dipoleFile, "dipoleFile は null 不可です");
        this.electrodeFile = checkNotNull(electrodeFile, "electrodeFile は null 不可です");
        this.conductivityFile = checkNotNull(conductivityFile, "conductivityFile は null 不可です");
    }

    @Override
    public List<Dipole> readDipoles() {
        return DipoleReader.read(dipoleFile);
    }

    @Override
    public List<FieldVector> readElectrodes() {
        return FieldVectorReader.read(electrodeFile, GeometryConverter.DIM);
    }

    @Override
    public List<FieldVector> readConductivities() {
        return FieldVectorReader.read(conductivityFile, GeometryConverter.LAYER_COUNT);
    }
}
