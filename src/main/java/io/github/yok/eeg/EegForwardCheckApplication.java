package io.github.yok.eeg;

import com.google.common.base.Throwables;
import io.github.yok.eeg.core.pipeline.FailureKind;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;

/**
 * eeg-forward-check のエントリポイントです。
 *
 * <p>
 * 設定クラス（@ConfigurationProperties）をスキャンし、CLI 実行を開始します。 比較結果に応じた終了コードでプロセスを終了します。
 * </p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.github.yok.eeg")
public class EegForwardCheckApplication {

    /**
     * Spring Boot アプリケーションを起動します。
     *
     * @param args 起動引数です
     */
    public static void main(String[] args) {
        int code;
        try {
            code = SpringApplication
                    .exit(SpringApplication.run(EegForwardCheckApplication.class, args));
        } catch (RuntimeException e) {
            code = startupFailureExitCode(e);
        }
        System.exit(code);
    }

    /**
     * 起動失敗時の終了コードを返します。
     *
     * @param e 起動時の例外です
     * @return 設定値の束縛・検証の失敗は設定エラー、それ以外は 1 です
     */
    static int startupFailureExitCode(Throwable e) {
        for (Throwable t : Throwables.getCausalChain(e)) {
            if (t instanceof BindException || t instanceof BindValidationException) {
                return FailureKind.CONFIGURATION.exitCode();
            }
        }
        return 1;
    }
}
