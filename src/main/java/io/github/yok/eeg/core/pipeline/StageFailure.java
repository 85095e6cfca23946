package io.github.yok.eeg.core.pipeline;

import lombok.Value;

/**
 * パイプラインの段階で発生した失敗です。
 */
@Value
public class StageFailure {

    /**
     * 失敗した段階です。
     */
    PipelineStage stage;

    /**
     * 失敗の種類です。
     */
    FailureKind kind;

    /**
     * 失敗内容です。
     */
    String message;

    /**
     * 原因となった例外です（null の場合もあります）。
     */
    Throwable cause;

    @Override
    public String toString() {
        return stage + " で失敗しました（" + kind + "）: " + message;
    }
}
