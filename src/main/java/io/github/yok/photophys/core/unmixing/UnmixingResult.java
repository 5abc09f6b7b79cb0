package io.github.yok.photophys.core.unmixing;

import io.github.yok.photophys.core.fit.FitReport;
import java.util.List;
import lombok.Value;

/**
 * 多成分解析の結果です。
 */
@Value
public class UnmixingResult {

    /**
     * 最良頂点での残差ノルム {@code sqrt(Σ residual²)} です。
     */
    double lsq;

    /**
     * 成分ごとの結果です（入力と同じ順序）。
     */
    List<ComponentFraction> components;

    /**
     * 残差診断です。
     */
    FitReport fitReport;

    /**
     * シンプレックス探索の反復回数です。
     */
    int iterations;

    /**
     * 許容誤差内で収束したかどうかです。
     */
    boolean converged;
}
