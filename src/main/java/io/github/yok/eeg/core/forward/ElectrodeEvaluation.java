package io.github.yok.eeg.core.forward;

/**
 * 電極位置での電位の評価方法です。
 */
public enum ElectrodeEvaluation {

    /**
     * 計算領域内で最も近い格子点の値を使います。
     */
    CLOSEST_NODE,

    /**
     * 電極を含むセルの 8 頂点から三線形補間します（頂点が領域外の場合は最近傍点にフォールバックします）。
     */
    TRILINEAR
}
