package io.github.yok.eeg.out;

import io.github.yok.eeg.core.forward.DomainFunction;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 計算領域全体の電位を可視化ファイルに出力するインタフェースです。
 *
 * <p>
 * 出力形式は順問題ソルバの離散化に依存するため、ソルバ自身が実装を返します。
 * </p>
 */
public interface VolumeWriter {

    /**
     * 電位を出力します。
     *
     * @param solution 順問題ソルバが計算した電位です
     * @param file 出力ファイルです
     * @throws IOException 出力に失敗した場合に発生します
     * @throws IllegalArgumentException 対応していない解が渡された場合に発生します
     */
    void write(DomainFunction solution, Path file) throws IOException;
}
