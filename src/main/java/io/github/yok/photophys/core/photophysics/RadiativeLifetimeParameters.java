package io.github.yok.photophys.core.photophysics;

import lombok.Builder;
import lombok.Value;

/**
 * Strickler–Berg 式による自然放射寿命の計算条件です。
 */
@Value
@Builder
public class RadiativeLifetimeParameters {

    /**
     * 吸収積分の下限波長（nm）です。
     */
    double lowWavelength;

    /**
     * 吸収積分の上限波長（nm）です。
     */
    double highWavelength;

    /**
     * 屈折率 n（1 以上）です。
     */
    double refractiveIndex;

    /**
     * モル吸光係数 ε*（M⁻¹cm⁻¹）です。
     */
    double epsilon;

    /**
     * ε* を与える波長 λ*（nm）です。
     */
    double epsilonWavelength;

    /**
     * 蛍光量子収率 Φf（0〜1）です。
     */
    double quantumYield;
}
