package io.github.yok.eeg.app;

import io.github.yok.eeg.core.pipeline.ComparisonPipeline;
import io.github.yok.eeg.core.pipeline.ComparisonReport;
import io.github.yok.eeg.core.pipeline.StageFailure;
import io.github.yok.eeg.core.pipeline.StageOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * CLI で eeg-forward-check を実行するクラスです。
 *
 * <p>
 * 比較パイプラインを 1 回実行し、結果に応じた終了コードを保持します（成功 0、想定外の失敗 1、 それ以外は失敗の種類ごとの値）。
 * 失敗時の要約行は標準エラーへ出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EegCheckCliRunner implements CommandLineRunner, ExitCodeGenerator {

    /**
     * 想定外の失敗の終了コードです。
     */
    static final int UNEXPECTED_FAILURE = 1;

    /**
     * eeg-forward-check の設定値（eeg.*）です。
     */
    private final EegCheckProperties properties;

    /**
     * 比較パイプラインです。
     */
    private final ComparisonPipeline pipeline;

    private int exitCode = 0;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== eeg-forward-check start: numerical vs analytical ===");
        System.out.print(properties.toMultilineString());

        StageOutcome<ComparisonReport> outcome;
        try {
            outcome = pipeline.run();
        } catch (RuntimeException e) {
            log.error("比較の実行中に想定外のエラーが発生しました", e);
            System.err.println("=== eeg-forward-check failed: unexpected " + e + " ===");
            exitCode = UNEXPECTED_FAILURE;
            return;
        }

        if (outcome.isSuccess()) {
            System.out.println("=== eeg-forward-check done ===");
            exitCode = 0;
            return;
        }

        StageFailure f = outcome.getFailure();
        if (f.getCause() != null) {
            log.error("{}", f, f.getCause());
        } else {
            log.error("{}", f);
        }
        // 失敗の診断は標準エラーへ出す
        System.err.println("=== eeg-forward-check failed: stage=" + f.getStage() + ", kind="
                + f.getKind() + ", message=" + f.getMessage() + " ===");
        exitCode = f.getKind().exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
