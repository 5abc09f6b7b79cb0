package io.github.yok.photophys.core.spectrum;

import lombok.Value;

/**
 * 発光スペクトル全体から求めた面積と ν⁻³ 重み付き面積を保持するクラスです。
 *
 * <p>
 * いずれも波長刻みで積分し、{@code 1e7} を掛けた値です。
 * </p>
 */
@Value
public class EmissionAreas {

    /**
     * {@code Σ Δλ·1e7·(I1+I2)/2} です。
     */
    double area;

    /**
     * {@code Σ Δλ·1e7·(I1/ν1³+I2/ν2³)/2} です。
     */
    double inverseCubeWeightedArea;

    /**
     * {@code <ν⁻³>⁻¹ = area / inverseCubeWeightedArea} を返します。
     *
     * @return 平均値の逆数です（分母が 0 の場合は NaN）
     */
    public double reciprocalMeanInverseCube() {
        if (inverseCubeWeightedArea == 0.0) {
            return Double.NaN;
        }
        return area / inverseCubeWeightedArea;
    }
}
