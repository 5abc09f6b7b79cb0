package io.github.yok.photophys.core.photophysics;

import lombok.Builder;
import lombok.Value;

/**
 * Förster 型エネルギー移動の計算条件です。
 */
@Value
@Builder
public class ForsterTransferParameters {

    /**
     * 媒質の屈折率 n です。
     */
    double refractiveIndex;

    /**
     * 配向因子 κ² です。
     */
    double orientationFactor;

    /**
     * ドナーの蛍光寿命 τ_D（ns）です。
     */
    double donorLifetime;

    /**
     * ドナー・アクセプター間距離 r（Å）です。
     */
    double distance;

    /**
     * ドナーの蛍光量子収率 Φ_D です。
     */
    double donorQuantumYield;

    /**
     * アクセプターのモル吸光係数 ε*（M⁻¹cm⁻¹）です。
     */
    double acceptorEpsilon;

    /**
     * ε* を与える波長 λ*（nm）です。
     */
    double epsilonWavelength;

    /**
     * 重なり積分の下限波長（nm）です。
     */
    double lowWavelength;

    /**
     * 重なり積分の上限波長（nm）です。
     */
    double highWavelength;
}
