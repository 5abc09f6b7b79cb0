package io.github.yok.photophys.core.photophysics;

import lombok.Builder;
import lombok.Value;

/**
 * 振動子強度の計算条件です。
 */
@Value
@Builder
public class OscillatorStrengthParameters {

    /**
     * ピーク探索の下限波長（nm）です。
     */
    double lowWavelength;

    /**
     * ピーク探索の上限波長（nm）です。
     */
    double highWavelength;

    /**
     * ε* を与える波長 λ*（nm）です。
     */
    double epsilonWavelength;

    /**
     * モル吸光係数 ε*（M⁻¹cm⁻¹）です。
     */
    double epsilon;
}
