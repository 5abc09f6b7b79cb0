package io.github.yok.photophys.core.unmixing;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 多成分解析の入力（合成スペクトル・成分・解析波長・波長範囲）です。
 */
@Value
@Builder
public class UnmixingRequest {

    /**
     * 分解対象の合成スペクトルです。
     */
    SpectralSeries composite;

    /**
     * 成分の一覧です（合成スペクトルと同じ種別であること）。
     */
    @Singular
    List<ComponentSpecification> components;

    /**
     * 解析波長の候補です（範囲外・重複・非有限値は除外されます）。
     */
    @Singular
    List<Double> wavelengths;

    /**
     * 解析波長の下限（nm）です。
     */
    @Builder.Default
    double minWavelength = 0.0;

    /**
     * 解析波長の上限（nm）です。
     */
    @Builder.Default
    double maxWavelength = Double.MAX_VALUE;
}
