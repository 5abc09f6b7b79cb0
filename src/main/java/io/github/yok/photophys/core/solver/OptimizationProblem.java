package io.github.yok.photophys.core.solver;

import lombok.Builder;
import lombok.Value;

/**
 * 箱型制約付き最小化問題（初期値・目的関数・境界・停止条件）を保持するクラスです。
 *
 * <p>
 * 最適化器は呼び出しをまたいで状態を持たないため、1回の最小化に必要な入力はすべてここに含めます。
 * </p>
 */
@Value
@Builder
public class OptimizationProblem {

    /**
     * 既定の最大反復回数です。
     */
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    /**
     * 初期推定値 x0 です（長さ n が未知数の数になります）。
     */
    double[] initialGuess;

    /**
     * 目的関数です。
     */
    ObjectiveFunction objective;

    /**
     * 全成分共通の下限です。
     */
    double low;

    /**
     * 全成分共通の上限です。
     */
    double high;

    /**
     * 範囲外に出た点の戻し方です。
     */
    @Builder.Default
    BoundaryPolicy boundaryPolicy = BoundaryPolicy.CLAMP_TO_BOUNDS;

    /**
     * 最大反復回数です。
     */
    @Builder.Default
    int maxIterations = DEFAULT_MAX_ITERATIONS;

    /**
     * 収束判定の許容誤差（頂点の目的関数値の母標準偏差）です。
     */
    @Builder.Default
    double tolerance = 1e-9;
}
