package io.github.yok.photophys.core.photophysics;

import lombok.Value;

/**
 * Förster 型エネルギー移動の計算結果です。
 */
@Value
public class ForsterTransferResult {

    /**
     * スペクトル重なり積分 J です。
     */
    double overlapIntegral;

    /**
     * Förster 距離 R0（Å）です。
     */
    double forsterDistance;

    /**
     * 距離 r での移動効率 E（%）です。
     */
    double transferEfficiency;

    /**
     * 移動速度定数 k_T（s⁻¹）です。
     */
    double transferRate;

    /**
     * Dexter 型の重なり値（eV⁻¹）です。
     */
    double dexterOverlap;
}
