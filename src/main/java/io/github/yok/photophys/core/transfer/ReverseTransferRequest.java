package io.github.yok.photophys.core.transfer;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 逆解析の入力です。
 *
 * <p>
 * 成分スペクトルは連鎖の順（ドナー側から）に並べます。成分の入力値は化合物IDでスペクトルに対応付けるため、 順序は問いません。
 * </p>
 */
@Value
@Builder
public class ReverseTransferRequest {

    /**
     * 合成（混合物）の発光スペクトルです。
     */
    SpectralSeries composite;

    /**
     * 成分の発光スペクトルです（連鎖の順）。
     */
    @Singular("componentSpectrum")
    List<SpectralSeries> componentSpectra;

    /**
     * 成分の入力値です。
     */
    @Singular
    List<TransferComponent> components;

    /**
     * 解析波長です（非有限値・重複は除外し、昇順に並べ替えます）。
     */
    @Singular
    List<Double> wavelengths;

    /**
     * 逆解析の設定です。
     */
    @Builder.Default
    ReverseTransferOptions options = ReverseTransferOptions.defaults();
}
