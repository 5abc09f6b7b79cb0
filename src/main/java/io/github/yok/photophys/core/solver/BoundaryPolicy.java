package io.github.yok.photophys.core.solver;

/**
 * 探索点が箱型制約 [low, high] の外に出たときの戻し方を表す列挙型です。
 */
public enum BoundaryPolicy {

    /**
     * 近い方の境界値に丸め込みます（多成分解析で使用）。
     */
    CLAMP_TO_BOUNDS {
        @Override
        public double bound(double value, double low, double high) {
            if (value < low) {
                return low;
            }
            if (value > high) {
                return high;
            }
            return value;
        }
    },

    /**
     * 下限を下回った値は {@code (low+high)/3}、上限を上回った値は {@code 2(low+high)/3} に置き直します（エネルギー移動解析で使用）。
     *
     * <p>
     * 頂点が境界に張り付いて収束が止まるのを避けるための戻し方です。 置き直した値が範囲外になる境界設定では、最後に範囲内へ丸めます。
     * </p>
     */
    MID_RANGE_RECENTER {
        @Override
        public double bound(double value, double low, double high) {
            double recentered = value;
            if (value < low) {
                recentered = (low + high) / 3.0;
            } else if (value > high) {
                recentered = 2.0 * (low + high) / 3.0;
            }
            return CLAMP_TO_BOUNDS.bound(recentered, low, high);
        }
    };

    /**
     * 1成分を範囲内に戻します。
     *
     * @param value 値です
     * @param low 下限です
     * @param high 上限です
     * @return 範囲内に戻した値です
     */
    public abstract double bound(double value, double low, double high);

    /**
     * ベクトルの全成分を、その場で範囲内に戻します。
     *
     * @param x ベクトルです（上書きされます）
     * @param low 下限です
     * @param high 上限です
     */
    public void apply(double[] x, double low, double high) {
        for (int i = 0; i < x.length; i++) {
            x[i] = bound(x[i], low, high);
        }
    }
}
