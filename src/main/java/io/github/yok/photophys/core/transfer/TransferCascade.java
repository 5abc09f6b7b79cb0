package io.github.yok.photophys.core.transfer;

/**
 * ドナー→…→アクセプター連鎖の見かけの量子収率 Q' を計算する漸化式です。
 *
 * <pre>
 * carry := 0
 * Q'_i  = (fracE_i + carry) · QY_i · (1 − T_i)
 * carry := (carry + fracE_i) · T_i
 * </pre>
 */
public final class TransferCascade {

    private TransferCascade() {}

    /**
     * 吸収の重みから吸収分率 {@code max(0,E_i) / Σ max(0,E)} を求めます。
     *
     * @param weights 吸収の重みです
     * @return 吸収分率です（重みの合計が 0 の場合はすべて 0）
     */
    public static double[] fractionsFromWeights(double[] weights) {
        double sum = 0.0;
        for (double w : weights) {
            sum += positiveOrZero(w);
        }
        double[] fractions = new double[weights.length];
        if (sum > 0.0) {
            for (int i = 0; i < weights.length; i++) {
                fractions[i] = positiveOrZero(weights[i]) / sum;
            }
        }
        return fractions;
    }

    /**
     * 連鎖に沿って各成分の Q' を計算します。
     *
     * <p>
     * QY と T は [0, 1] に丸め込みます。配列が短い場合、不足分は 0 として扱います。
     * </p>
     *
     * @param fractions 吸収分率です
     * @param quantumYields 量子収率です
     * @param efficiencies 移動効率です
     * @return 各成分の Q' です（長さは吸収分率と同じ）
     */
    public static double[] quantumYieldsAfterTransfer(double[] fractions, double[] quantumYields,
            double[] efficiencies) {
        int n = fractions.length;
        double[] out = new double[n];
        double carry = 0.0;
        for (int i = 0; i < n; i++) {
            double t = clamp01(i < efficiencies.length ? efficiencies[i] : 0.0);
            double qy = clamp01(i < quantumYields.length ? quantumYields[i] : 0.0);
            out[i] = (fractions[i] + carry) * qy * (1.0 - t);
            carry = (carry + fractions[i]) * t;
        }
        return out;
    }

    /**
     * 値を [0, 1] に丸め込みます（NaN は 0）。
     *
     * @param v 値です
     * @return 丸め込んだ値です
     */
    public static double clamp01(double v) {
        if (Double.isNaN(v) || v < 0.0) {
            return 0.0;
        }
        return (v > 1.0) ? 1.0 : v;
    }

    private static double positiveOrZero(double v) {
        return (Double.isNaN(v) || v < 0.0) ? 0.0 : v;
    }
}
