package io.github.yok.photophys.out;

import io.github.yok.photophys.core.photophysics.ForsterTransferResult;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthResult;
import io.github.yok.photophys.core.photophysics.RadiativeLifetimeResult;
import io.github.yok.photophys.core.transfer.ForwardTransferResult;
import io.github.yok.photophys.core.transfer.ReverseTransferResult;
import io.github.yok.photophys.core.unmixing.UnmixingResult;

/**
 * 解析結果を出力する処理のインタフェースです。
 *
 * <p>
 * label は出力の命名規約に使う識別子（試料名など）です。
 * </p>
 */
public interface ResultWriter {

    /**
     * 多成分解析の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeUnmixing(String label, UnmixingResult result);

    /**
     * エネルギー移動（順方向）の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeForwardTransfer(String label, ForwardTransferResult result);

    /**
     * エネルギー移動（逆解析）の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeReverseTransfer(String label, ReverseTransferResult result);

    /**
     * Förster 計算の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeForster(String label, ForsterTransferResult result);

    /**
     * Strickler–Berg 計算の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeRadiativeLifetime(String label, RadiativeLifetimeResult result);

    /**
     * 振動子強度の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     */
    void writeOscillatorStrength(String label, OscillatorStrengthResult result);
}
