package io.github.yok.photophys.core.solver;

import lombok.Value;

/**
 * 箱型制約付きで、導関数を使わずにスカラー目的関数を最小化するインタフェースです。
 *
 * <p>
 * 実装は呼び出しをまたいで状態を持ちません。未収束でも例外は投げず、その時点の最良点を返します。
 * </p>
 */
public interface BoxConstrainedOptimizer {

    /**
     * 問題を最小化します。
     *
     * @param problem 最小化問題です
     * @return 最適化結果です
     */
    default OptimizationResult minimize(OptimizationProblem problem) {
        return minimize(problem, IterationListener.NONE);
    }

    /**
     * 問題を最小化し、各反復の終わりにリスナへ最良値を通知します。
     *
     * @param problem 最小化問題です
     * @param listener 反復ごとの通知先です
     * @return 最適化結果です
     */
    OptimizationResult minimize(OptimizationProblem problem, IterationListener listener);

    /**
     * 反復ごとの進捗を受け取るリスナです。
     */
    @FunctionalInterface
    interface IterationListener {

        /**
         * 何もしないリスナです。
         */
        IterationListener NONE = (iteration, bestValue) -> {
        };

        /**
         * 1反復が終わったときに呼ばれます。
         *
         * @param iteration 反復番号です（1 始まり）
         * @param bestValue その時点の最良の目的関数値です
         */
        void onIteration(int iteration, double bestValue);
    }

    /**
     * 最適化結果を表すクラスです。
     */
    @Value
    class OptimizationResult {

        /**
         * 最良頂点（フィットしたパラメータベクトル）です。
         */
        double[] solution;

        /**
         * 最良頂点での目的関数値です。
         */
        double value;

        /**
         * 実行した反復回数です。
         */
        int iterations;

        /**
         * 許容誤差内で収束したかどうかです（上限到達の場合は false）。
         */
        boolean converged;
    }
}
