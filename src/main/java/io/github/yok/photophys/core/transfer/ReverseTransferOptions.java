package io.github.yok.photophys.core.transfer;

import io.github.yok.photophys.core.solver.OptimizationProblem;
import lombok.Builder;
import lombok.Value;

/**
 * 逆解析（発光スペクトルから T をフィット）の設定です。
 */
@Value
@Builder
public class ReverseTransferOptions {

    /**
     * 最後の成分の T を 0 に固定するかどうかです。
     */
    @Builder.Default
    boolean zeroLastT = true;

    /**
     * 最大反復回数です。
     */
    @Builder.Default
    int maxIterations = OptimizationProblem.DEFAULT_MAX_ITERATIONS;

    /**
     * スケーリング前の許容誤差です（合成スペクトルの最大絶対値を掛けて使います）。
     */
    @Builder.Default
    double baseTolerance = 1e-9;

    /**
     * T の下限です。
     */
    @Builder.Default
    double low = 0.0;

    /**
     * T の上限です。
     */
    @Builder.Default
    double high = 1.0;

    /**
     * 既定値の設定を返します。
     *
     * @return 既定値の設定です
     */
    public static ReverseTransferOptions defaults() {
        return builder().build();
    }
}
