package io.github.yok.photophys.core.spectrum;

import lombok.Value;

/**
 * 波長ごとのスペクトル値（1点分）を保持するクラスです。
 *
 * <p>
 * 吸収係数と発光の正規化強度の両方を持てます。測定されていない側の値は 0 とします。
 * </p>
 */
@Value
public class SpectralSample {

    /**
     * 波長（nm）です。
     */
    double wavelength;

    /**
     * 吸収係数（相対吸光度）です。
     */
    double coefficient;

    /**
     * 発光の正規化強度です。
     */
    double normalized;

    /**
     * 吸収スペクトルのサンプルを作成します。
     *
     * @param wavelength 波長（nm）です
     * @param coefficient 吸収係数です
     * @return サンプルです
     */
    public static SpectralSample absorption(double wavelength, double coefficient) {
        return new SpectralSample(wavelength, coefficient, 0.0);
    }

    /**
     * 発光スペクトルのサンプルを作成します。
     *
     * @param wavelength 波長（nm）です
     * @param intensity 正規化強度です
     * @return サンプルです
     */
    public static SpectralSample emission(double wavelength, double intensity) {
        return new SpectralSample(wavelength, 0.0, intensity);
    }

    /**
     * 指定した種別の値だけを持つサンプルを作成します。
     *
     * @param kind 種別です
     * @param wavelength 波長（nm）です
     * @param value 値です
     * @return サンプルです
     */
    public static SpectralSample of(SpectrumKind kind, double wavelength, double value) {
        return (kind == SpectrumKind.EMISSION) ? emission(wavelength, value)
                : absorption(wavelength, value);
    }
}
