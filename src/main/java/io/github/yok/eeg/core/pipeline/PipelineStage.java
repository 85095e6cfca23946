package io.github.yok.eeg.core.pipeline;

/**
 * 比較パイプラインの段階です（実行順）。
 */
public enum PipelineStage {

    CONFIGURE,

    BUILD_SOLVER,

    LOAD_DIPOLE,

    SOLVE_NUMERICAL,

    EVALUATE_ELECTRODES,

    ANALYTIC_SOLUTION,

    COMPARE,

    REPORT,

    EXPORT
}
