package io.github.yok.photophys.core.photophysics;

import lombok.Value;

/**
 * Strickler–Berg 式による計算結果です。
 */
@Value
public class RadiativeLifetimeResult {

    /**
     * 吸収の積分項 {@code ∫ε d ln ν} です。
     */
    double integralTerm;

    /**
     * 発光の {@code <ν⁻³>⁻¹}（cm⁻³）です。
     */
    double reciprocalMeanInverseCube;

    /**
     * 自然放射寿命 τ0（ns）です。
     */
    double naturalLifetime;

    /**
     * 放射速度定数 k_f（s⁻¹）です。
     */
    double radiativeRate;

    /**
     * 実際の蛍光寿命 τ = Φf·τ0（ns）です。
     */
    double fluorescenceLifetime;

    /**
     * 積分範囲内での ε の最大値です。
     */
    double maxEpsilon;
}
