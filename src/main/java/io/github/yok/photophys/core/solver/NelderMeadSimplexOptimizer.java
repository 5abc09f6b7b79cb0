package io.github.yok.photophys.core.solver;

import com.google.common.base.Preconditions;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * 箱型制約付きの滑降シンプレックス法（Nelder–Mead）で目的関数を最小化します。
 *
 * <p>
 * 係数は反射 1、拡大 2、縮小 0.5 です。各反復では最良/最悪頂点を求め、最悪頂点を除く重心を通して反射・拡大・縮小・全体縮小を行います。
 * 範囲外に出た点は {@link BoundaryPolicy} に従って範囲内へ戻してから評価します。
 * </p>
 *
 * <p>
 * 停止条件は「頂点の目的関数値の母標準偏差が許容誤差以下」または「最大反復回数到達」のみです。
 * </p>
 *
 * <p>
 * 初期シンプレックスは、頂点0を初期値 x0 とし、頂点 i（1..n）を「座標 i-1 だけ x0[i-1]、他は 0」とするベクトルで構成します。
 * x0 からの微小摂動による一般的な構成ではありません。x0 の成分が 0 の座標では頂点が退化します。
 * </p>
 */
@Slf4j
public final class NelderMeadSimplexOptimizer implements BoxConstrainedOptimizer {

    /**
     * 反射係数です。
     */
    private static final double REFLECT = 1.0;

    /**
     * 拡大係数です。
     */
    private static final double EXPAND = 2.0;

    /**
     * 縮小係数です。
     */
    private static final double CONTRACT = 0.5;

    /**
     * 問題を最小化し、各反復の終わりにリスナへ最良値を通知します。
     *
     * @param problem 最小化問題です
     * @param listener 反復ごとの通知先です
     * @return 最適化結果です（未収束でも最良頂点を返します）
     * @throws NullPointerException problem、初期値、目的関数、境界処理、listener のいずれかが null の場合
     * @throws IllegalArgumentException 境界・最大反復回数・許容誤差が不正な場合
     */
    @Override
    public OptimizationResult minimize(OptimizationProblem problem, IterationListener listener) {
        Preconditions.checkNotNull(problem, "最小化問題が null です。");
        Preconditions.checkNotNull(problem.getInitialGuess(), "初期値が null です。");
        Preconditions.checkNotNull(problem.getObjective(), "目的関数が null です。");
        Preconditions.checkNotNull(problem.getBoundaryPolicy(), "境界処理が null です。");
        Preconditions.checkNotNull(listener, "listener が null です。");
        Preconditions.checkArgument(problem.getLow() <= problem.getHigh(),
                "下限は上限以下である必要があります。low=%s, high=%s", problem.getLow(), problem.getHigh());
        Preconditions.checkArgument(problem.getMaxIterations() > 0, "最大反復回数は 1 以上が必要です。maxIter=%s",
                problem.getMaxIterations());
        Preconditions.checkArgument(problem.getTolerance() >= 0.0, "許容誤差は 0 以上が必要です。tol=%s",
                problem.getTolerance());

        final ObjectiveFunction f = problem.getObjective();
        final int n = problem.getInitialGuess().length;

        // 未知数なし：f([]) をそのまま返す
        if (n == 0) {
            double value = f.evaluate(new double[0]);
            log.debug("未知数が 0 のため最適化を省略します。f={}", fmt5(value));
            return new OptimizationResult(new double[0], value, 0, true);
        }

        final double low = problem.getLow();
        final double high = problem.getHigh();
        final BoundaryPolicy policy = problem.getBoundaryPolicy();
        final int maxIterations = problem.getMaxIterations();
        final double tolerance = problem.getTolerance();

        SimplexState simplex = SimplexState.initial(problem.getInitialGuess(), policy, low, high, f);

        log.debug("シンプレックス探索を開始します。未知数={}、範囲=[{}, {}]、境界処理={}、許容誤差={}、最大反復回数={}、初期最良値={}", n,
                fmt5(low), fmt5(high), policy, tolerance, maxIterations,
                fmt5(simplex.values[simplex.bestIndex()]));

        boolean converged = false;
        int iter = 0;
        while (iter < maxIterations) {
            iter++;

            step(simplex, policy, low, high, f);

            // 全頂点を範囲内に戻して再評価
            simplex.boundAndEvaluateAll(policy, low, high, f);

            double best = simplex.values[simplex.bestIndex()];
            double spread = simplex.valueStandardDeviation();
            listener.onIteration(iter, best);

            if (log.isTraceEnabled()) {
                log.trace("反復{}：最良値={}、標準偏差={}", iter, fmt5(best), spread);
            }

            if (spread <= tolerance) {
                converged = true;
                break;
            }
        }

        int bestIndex = simplex.bestIndex();
        double[] solution = simplex.vertices[bestIndex].clone();
        double bestValue = simplex.values[bestIndex];

        if (converged) {
            log.debug("シンプレックス探索が収束しました。反復回数={}、最良値={}", iter, fmt5(bestValue));
        } else {
            log.warn("シンプレックス探索が上限到達で終了しました（未収束）。反復回数={}、最良値={}、標準偏差={}、許容誤差={}", iter,
                    fmt5(bestValue), simplex.valueStandardDeviation(), tolerance);
        }

        return new OptimizationResult(solution, bestValue, iter, converged);
    }

    /**
     * 1反復分の反射・拡大・縮小・全体縮小を行い、頂点を更新します。
     *
     * <p>
     * 頂点の目的関数値は、呼び出し側でまとめて再評価します。
     * </p>
     *
     * @param s シンプレックスです
     * @param policy 境界処理です
     * @param low 下限です
     * @param high 上限です
     * @param f 目的関数です
     */
    private static void step(SimplexState s, BoundaryPolicy policy, double low, double high,
            ObjectiveFunction f) {
        final int n = s.dimension;
        final int numPoints = n + 1;
        final double[][] x = s.vertices;
        final double[] y = s.values;

        // 1) 最良/最悪頂点（同値は先頭優先）
        int best = 0;
        int worst = 0;
        for (int i = 1; i < numPoints; i++) {
            if (y[i] < y[best]) {
                best = i;
            } else if (y[i] > y[worst]) {
                worst = i;
            }
        }

        // 2) 最悪頂点を除いた重心
        double[] centroid = new double[n];
        for (int i = 0; i < numPoints; i++) {
            if (i == worst) {
                continue;
            }
            for (int j = 0; j < n; j++) {
                centroid[j] += x[i][j];
            }
        }
        for (int j = 0; j < n; j++) {
            centroid[j] /= n;
        }

        // 3) 反射
        double[] reflected = new double[n];
        for (int j = 0; j < n; j++) {
            reflected[j] = (1.0 + REFLECT) * centroid[j] - REFLECT * x[worst][j];
        }
        policy.apply(reflected, low, high);
        double yReflected = f.evaluate(reflected.clone());

        if (yReflected < y[best]) {
            // 4) 拡大：反射点と比べて良い方を最悪頂点に採用
            double[] expanded = new double[n];
            for (int j = 0; j < n; j++) {
                expanded[j] = (1.0 + EXPAND) * reflected[j] - EXPAND * centroid[j];
            }
            policy.apply(expanded, low, high);
            double yExpanded = f.evaluate(expanded.clone());
            x[worst] = (yExpanded < yReflected) ? expanded : reflected;
            return;
        }

        // 反射点が、最悪以外のいずれかの頂点と同等以下の改善しかないか
        boolean notBetterThanSome = false;
        for (int i = 0; i < numPoints; i++) {
            if (i != worst && yReflected >= y[i]) {
                notBetterThanSome = true;
                break;
            }
        }

        if (!notBetterThanSome) {
            // 6) 最悪以外のすべてより良い（ただし最良ではない）：反射点を採用
            x[worst] = reflected;
            return;
        }

        // 5) 最悪より良ければいったん反射点を採用してから縮小
        if (yReflected < y[worst]) {
            x[worst] = reflected;
            y[worst] = yReflected;
        }

        double[] contracted = new double[n];
        for (int j = 0; j < n; j++) {
            contracted[j] = CONTRACT * x[worst][j] + (1.0 - CONTRACT) * centroid[j];
        }
        policy.apply(contracted, low, high);
        double yContracted = f.evaluate(contracted.clone());

        if (yContracted > y[worst]) {
            // 全体縮小：全頂点を最良頂点へ半分だけ寄せる
            double[] anchor = x[best].clone();
            for (int i = 0; i < numPoints; i++) {
                for (int j = 0; j < n; j++) {
                    x[i][j] = 0.5 * (anchor[j] + x[i][j]);
                }
                policy.apply(x[i], low, high);
            }
        } else {
            x[worst] = contracted;
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 1回の最小化の間だけ使うシンプレックス（n+1 個の頂点と目的関数値）です。
     */
    private static final class SimplexState {

        /**
         * 未知数の数 n です。
         */
        final int dimension;

        /**
         * 頂点の座標です（[n+1][n]）。
         */
        final double[][] vertices;

        /**
         * 各頂点の目的関数値です（長さ n+1）。
         */
        final double[] values;

        SimplexState(int dimension) {
            this.dimension = dimension;
            this.vertices = new double[dimension + 1][dimension];
            this.values = new double[dimension + 1];
        }

        /**
         * 初期シンプレックスを作成して評価します。
         *
         * @param x0 初期値です
         * @param policy 境界処理です
         * @param low 下限です
         * @param high 上限です
         * @param f 目的関数です
         * @return 初期シンプレックスです
         */
        static SimplexState initial(double[] x0, BoundaryPolicy policy, double low, double high,
                ObjectiveFunction f) {
            int n = x0.length;
            SimplexState s = new SimplexState(n);
            System.arraycopy(x0, 0, s.vertices[0], 0, n);
            for (int i = 1; i <= n; i++) {
                s.vertices[i][i - 1] = x0[i - 1];
            }
            s.boundAndEvaluateAll(policy, low, high, f);
            return s;
        }

        /**
         * 全頂点を範囲内に戻し、目的関数値を評価し直します。
         *
         * @param policy 境界処理です
         * @param low 下限です
         * @param high 上限です
         * @param f 目的関数です
         */
        void boundAndEvaluateAll(BoundaryPolicy policy, double low, double high,
                ObjectiveFunction f) {
            for (int i = 0; i < vertices.length; i++) {
                policy.apply(vertices[i], low, high);
                values[i] = f.evaluate(vertices[i].clone());
            }
        }

        /**
         * 目的関数値が最小の頂点番号を返します（同値は先頭優先）。
         *
         * @return 最良頂点の番号です
         */
        int bestIndex() {
            int best = 0;
            for (int i = 1; i < values.length; i++) {
                if (values[i] < values[best]) {
                    best = i;
                }
            }
            return best;
        }

        /**
         * 目的関数値の母標準偏差を返します。
         *
         * @return 母標準偏差です
         */
        double valueStandardDeviation() {
            double mean = 0.0;
            for (double v : values) {
                mean += v;
            }
            mean /= values.length;
            double sumSq = 0.0;
            for (double v : values) {
                double d = v - mean;
                sumSq += d * d;
            }
            return Math.sqrt(sumSq / values.length);
        }
    }
}
