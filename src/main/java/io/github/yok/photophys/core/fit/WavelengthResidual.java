package io.github.yok.photophys.core.fit;

import lombok.Value;

/**
 * 解析波長1点での計算値・実測値・残差です。
 */
@Value
public class WavelengthResidual {

    /**
     * 波長（nm）です。
     */
    double wavelength;

    /**
     * 再構成した計算値です。
     */
    double calculated;

    /**
     * 実測（合成スペクトル）の値です。
     */
    double experimental;

    /**
     * 残差（計算値 - 実測値）です。
     */
    double residual;
}
