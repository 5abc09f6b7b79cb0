package io.github.yok.photophys.core.unmixing;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import lombok.Value;

/**
 * 多成分解析の1成分（参照スペクトル・濃度・初期分率）を表すクラスです。
 *
 * <p>
 * 濃度と初期分率は未入力（null）を許し、その場合は 0 として扱います。
 * </p>
 */
@Value
public class ComponentSpecification {

    /**
     * 成分の参照スペクトルです。
     */
    SpectralSeries spectrum;

    /**
     * 表示名です。
     */
    String name;

    /**
     * 入力濃度（µM）です。
     */
    Double concentration;

    /**
     * 初期分率の推定値です。
     */
    Double initialFraction;

    /**
     * 化合物IDを返します。
     *
     * @return 参照スペクトルの化合物IDです
     */
    public String getCompoundId() {
        return spectrum.getCompoundId();
    }

    /**
     * 濃度を返します（未入力は 0）。
     *
     * @return 濃度です
     */
    public double concentrationOrZero() {
        return orZero(concentration);
    }

    /**
     * 初期分率を返します（未入力は 0）。
     *
     * @return 初期分率です
     */
    public double initialFractionOrZero() {
        return orZero(initialFraction);
    }

    private static double orZero(Double v) {
        return (v == null || v.isNaN()) ? 0.0 : v;
    }
}
