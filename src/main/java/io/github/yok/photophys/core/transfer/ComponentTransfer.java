package io.github.yok.photophys.core.transfer;

import lombok.Value;

/**
 * エネルギー移動解析での1成分の結果です。
 */
@Value
public class ComponentTransfer {

    /**
     * 化合物IDです。
     */
    String id;

    /**
     * 表示名です。
     */
    String name;

    /**
     * 吸収の重み E です。
     */
    double absorptionWeight;

    /**
     * 吸収分率 fracE です。
     */
    double absorptionFraction;

    /**
     * 量子収率 QY（[0, 1] に丸め込み済み）です。
     */
    double quantumYield;

    /**
     * 移動効率 T（[0, 1] に丸め込み済み）です。
     */
    double transferEfficiency;

    /**
     * エネルギー移動後の見かけの量子収率 Q' です。
     */
    double quantumYieldAfterTransfer;
}
