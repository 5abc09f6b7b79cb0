package io.github.yok.photophys.core.solver;

/**
 * 最小化するスカラー目的関数 {@code f: R^n → R} を表すインタフェースです。
 */
@FunctionalInterface
public interface ObjectiveFunction {

    /**
     * 目的関数を評価します。
     *
     * @param x 評価点です（呼び出し側のコピーが渡されるため、書き換えても構いません）
     * @return 目的関数値です
     */
    double evaluate(double[] x);
}
