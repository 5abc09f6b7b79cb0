package io.github.yok.photophys.core.transfer;

import lombok.Value;

/**
 * エネルギー移動連鎖の1成分（吸収の重み・量子収率・移動効率）の入力です。
 *
 * <p>
 * 数値はいずれも未入力（null）を許し、その場合は 0 として扱います（成分を読み飛ばすことはしません）。
 * </p>
 */
@Value
public class TransferComponent {

    /**
     * 化合物IDです（スペクトルとの対応付けに使います）。
     */
    String id;

    /**
     * 表示名です。
     */
    String name;

    /**
     * 励起波長での吸収の重み E（非負の任意単位）です。
     */
    Double absorptionWeight;

    /**
     * 量子収率 QY（0〜1）です。
     */
    Double quantumYield;

    /**
     * 次の成分へのエネルギー移動効率 T（0〜1）です。逆解析では初期値として使います。
     */
    Double transferEfficiency;

    /**
     * 吸収の重みを返します（未入力は 0）。
     *
     * @return 吸収の重みです
     */
    public double absorptionWeightOrZero() {
        return orZero(absorptionWeight);
    }

    /**
     * 量子収率を返します（未入力は 0）。
     *
     * @return 量子収率です
     */
    public double quantumYieldOrZero() {
        return orZero(quantumYield);
    }

    /**
     * 移動効率を返します（未入力は 0）。
     *
     * @return 移動効率です
     */
    public double transferEfficiencyOrZero() {
        return orZero(transferEfficiency);
    }

    private static double orZero(Double v) {
        return (v == null || v.isNaN()) ? 0.0 : v;
    }
}
