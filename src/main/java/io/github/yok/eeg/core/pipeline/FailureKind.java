package io.github.yok.eeg.core.pipeline;

/**
 * 比較実行の失敗の種類です。
 *
 * <p>
 * 種類ごとにプロセスの終了コードが決まります（成功は 0、想定外の失敗は 1）。
 * </p>
 */
public enum FailureKind {

    /**
     * 設定値（幾何・パラメータ）が不正です。
     */
    CONFIGURATION(2),

    /**
     * 入力データが比較の前提を満たしません（双極子なし、長さ不一致、ノルム 0 など）。
     */
    PRECONDITION(3),

    /**
     * 順問題ソルバまたは解析解エンジンが失敗しました。
     */
    COLLABORATOR(4),

    /**
     * 入力ファイルを読み込めません。
     */
    IO(5);

    private final int exitCode;

    FailureKind(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * プロセスの終了コードを返します。
     *
     * @return 終了コードです
     */
    public int exitCode() {
        return exitCode;
    }
}
