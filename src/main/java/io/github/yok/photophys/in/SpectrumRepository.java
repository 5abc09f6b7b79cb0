package io.github.yok.photophys.in;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.Optional;

/**
 * 化合物IDと種別からスペクトルを取得するインタフェースです。
 */
public interface SpectrumRepository {

    /**
     * スペクトルを取得します。
     *
     * @param compoundId 化合物IDです
     * @param kind 種別（吸収/発光）です
     * @return スペクトルです（見つからない場合は空）
     */
    Optional<SpectralSeries> findSpectrum(String compoundId, SpectrumKind kind);
}
