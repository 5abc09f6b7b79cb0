package io.github.yok.photophys.core.photophysics;

import lombok.Value;

/**
 * 振動子強度と遷移双極子モーメントの計算結果です。
 *
 * <p>
 * 有限かつ正でない出力値は 0 として報告します。
 * </p>
 */
@Value
public class OscillatorStrengthResult {

    /**
     * 振動子強度 f です。
     */
    double oscillatorStrength;

    /**
     * 遷移双極子モーメント（Debye）です。
     */
    double transitionDipoleMomentDebye;

    /**
     * 遷移双極子モーメント（C·m）です。
     */
    double transitionDipoleMomentCoulombMeter;

    /**
     * ピーク波長（nm）です。
     */
    double peakWavelength;

    /**
     * ピークでのモル吸光係数です。
     */
    double peakEpsilon;

    /**
     * 半値全幅（cm⁻¹）です。
     */
    double halfWidth;
}
