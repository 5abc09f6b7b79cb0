package io.github.yok.photophys.core.spectrum;

/**
 * 波長と波数の換算を行うユーティリティです。
 */
public final class Wavenumbers {

    /**
     * nm → cm⁻¹ の換算係数です。
     */
    public static final double NM_TO_WAVENUMBER = 1e7;

    private Wavenumbers() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * 波長（nm）を波数（cm⁻¹）に換算します。
     *
     * @param wavelength 波長（nm）です
     * @return 波数（cm⁻¹）です
     */
    public static double fromWavelength(double wavelength) {
        return NM_TO_WAVENUMBER / wavelength;
    }

    /**
     * 2つの波長の間の波数差 {@code |1e7/λ1 - 1e7/λ2|} を返します。
     *
     * @param wavelength1 波長1（nm）です
     * @param wavelength2 波長2（nm）です
     * @return 波数差（cm⁻¹）です
     */
    public static double spacing(double wavelength1, double wavelength2) {
        return Math.abs(fromWavelength(wavelength1) - fromWavelength(wavelength2));
    }
}
