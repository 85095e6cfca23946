package io.github.yok.eeg.core.pipeline;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.function.Function;

/**
 * パイプラインの段階の結果（成功値または失敗）を表すクラスです。
 *
 * @param <T> 成功値の型です
 */
public final class StageOutcome<T> {

    private final T value;

    private final StageFailure failure;

    private StageOutcome(T value, StageFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    /**
     * 成功を生成します。
     *
     * @param <T> 成功値の型です
     * @param value 成功値です（null 不可）
     * @return 成功です
     */
    public static <T> StageOutcome<T> success(T value) {
        return new StageOutcome<>(checkNotNull(value, "value は null 不可です"), null);
    }

    /**
     * 失敗を生成します。
     *
     * @param <T> 成功値の型です
     * @param failure 失敗です（null 不可）
     * @return 失敗です
     */
    public static <T> StageOutcome<T> failure(StageFailure failure) {
        return new StageOutcome<>(null, checkNotNull(failure, "failure は null 不可です"));
    }

    /**
     * 失敗を生成します。
     *
     * @param <T> 成功値の型です
     * @param stage 失敗した段階です
     * @param kind 失敗の種類です
     * @param message 失敗内容です
     * @param cause 原因です（null 可）
     * @return 失敗です
     */
    public static <T> StageOutcome<T> failure(PipelineStage stage, FailureKind kind,
            String message, Throwable cause) {
        return failure(new StageFailure(stage, kind, message, cause));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * 成功値を返します。
     *
     * @return 成功値です
     * @throws IllegalStateException 失敗の場合に発生します
     */
    public T getValue() {
        checkState(isSuccess(), "失敗した結果には値がありません: %s", failure);
        return value;
    }

    /**
     * 失敗を返します。
     *
     * @return 失敗です
     * @throws IllegalStateException 成功の場合に発生します
     */
    public StageFailure getFailure() {
        checkState(!isSuccess(), "成功した結果には失敗がありません");
        return failure;
    }

    /**
     * 成功値を変換します（失敗はそのまま引き継ぎます）。
     *
     * @param <R> 変換後の型です
     * @param mapper 変換です
     * @return 変換後の結果です
     */
    public <R> StageOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure);
    }

    /**
     * 成功値を次の段階に渡します（失敗はそのまま引き継ぎます）。
     *
     * @param <R> 次の段階の成功値の型です
     * @param next 次の段階です
     * @return 次の段階の結果です
     */
    public <R> StageOutcome<R> flatMap(Function<? super T, StageOutcome<R>> next) {
        return isSuccess() ? next.apply(value) : failure(failure);
    }

    /**
     * 失敗を別の成功値の型の結果として引き継ぎます。
     *
     * @param <R> 成功値の型です
     * @return 同じ失敗です
     * @throws IllegalStateException 成功の場合に発生します
     */
    public <R> StageOutcome<R> propagate() {
        return failure(getFailure());
    }

    @Override
    public String toString() {
        return isSuccess() ? "StageOutcome[success=" + value + "]"
                : "StageOutcome[failure=" + failure + "]";
    }
}
