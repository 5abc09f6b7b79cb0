package io.github.yok.photophys.core.unmixing;

import lombok.Value;

/**
 * 多成分解析でフィットした1成分の結果です。
 */
@Value
public class ComponentFraction {

    /**
     * 化合物IDです。
     */
    String compoundId;

    /**
     * 表示名です。
     */
    String name;

    /**
     * 入力濃度（µM、未入力は 0）です。
     */
    double concentration;

    /**
     * 初期分率です。
     */
    double initialFraction;

    /**
     * フィットした分率です。
     */
    double fittedFraction;

    /**
     * フィットした濃度（分率 × 入力濃度）です。
     */
    double fittedConcentration;
}
