package io.github.yok.eeg.core.forward;

/**
 * 設定から順問題ソルバを生成するファクトリです。
 */
public interface ForwardSolverFactory {

    /**
     * 順問題ソルバを生成します。
     *
     * @return 順問題ソルバです
     */
    ForwardSolver create();
}
