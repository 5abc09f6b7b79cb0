package io.github.yok.photophys.core.spectrum;

/**
 * 台形積分の横軸（積分変数）を表す列挙型です。
 */
public enum SpectralDomain {

    /**
     * 波長（nm）で積分します。
     */
    WAVELENGTH,

    /**
     * 波数（cm⁻¹、{@code 1e7/λ}）で積分します。
     */
    WAVENUMBER
}
