package io.github.yok.photophys.core.photophysics;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.Locale;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;

/**
 * Lambert–Beer 則 {@code A = ε·c·l} で、吸収スペクトルから濃度（µM）を見積もります。
 *
 * <p>
 * 吸光度には λ* での正規化強度を使います。入力が不正な場合は 0 を返します。
 * </p>
 */
@Slf4j
public class ConcentrationEstimator {

    /**
     * 既定の光路長（cm）です。
     */
    public static final double DEFAULT_PATH_LENGTH = 1.0;

    /**
     * 化合物メタデータの文字列（ε*・λ*）から濃度を見積もります。
     *
     * @param absorption 吸収スペクトルです
     * @param epsilonText ε* の文字列です（例：{@code "12,500"}）
     * @param wavelengthText λ* の文字列です（例：{@code "450 nm"}）
     * @param pathLength 光路長（cm）です
     * @return 濃度（µM）です
     */
    public double estimateMicromolar(SpectralSeries absorption, String epsilonText,
            String wavelengthText, double pathLength) {
        OptionalDouble epsilon = NumericText.parseFirstNumber(epsilonText);
        OptionalDouble wavelength = NumericText.parseFirstNumber(wavelengthText);
        if (!epsilon.isPresent() || !wavelength.isPresent()) {
            log.debug("濃度：ε* または λ* を読み取れません。ε*='{}'、λ*='{}'", epsilonText, wavelengthText);
            return 0.0;
        }
        return estimateMicromolar(absorption, epsilon.getAsDouble(), wavelength.getAsDouble(),
                pathLength);
    }

    /**
     * 濃度を見積もります。
     *
     * @param absorption 吸収スペクトルです
     * @param epsilon モル吸光係数 ε*（M⁻¹cm⁻¹）です
     * @param wavelength ε* を与える波長 λ*（nm）です
     * @param pathLength 光路長（cm）です
     * @return 濃度（µM）です（入力が不正な場合は 0）
     */
    public double estimateMicromolar(SpectralSeries absorption, double epsilon, double wavelength,
            double pathLength) {
        Preconditions.checkNotNull(absorption, "absorption が null です。");
        if (absorption.getKind() != SpectrumKind.ABSORPTION || absorption.isEmpty()
                || !(pathLength > 0) || !(epsilon > 0) || !(wavelength > 0)) {
            return 0.0;
        }
        double y = absorption.sortAscending().normalizedValueAt(wavelength);
        if (!(y > 0)) {
            return 0.0;
        }
        double micromolar = 1e6 * y / (epsilon * pathLength);
        log.debug("濃度：ID={}、A={}、c={} µM", absorption.getCompoundId(), fmt5(y), fmt5(micromolar));
        return micromolar;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
