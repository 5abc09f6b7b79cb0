package io.github.yok.photophys.core.transfer;

import io.github.yok.photophys.core.fit.FitReport;
import java.util.List;
import lombok.Value;

/**
 * 逆解析の結果です。
 */
@Value
public class ReverseTransferResult {

    /**
     * 成分ごとの結果です（スペクトルの順）。
     */
    List<ComponentTransfer> components;

    /**
     * 全体の量子収率 {@code Σ Q'} です。
     */
    double totalQuantumYield;

    /**
     * フィットした T です（最後の T を固定した場合も全成分分の長さで、固定値 0 を含みます）。
     */
    double[] optimizedEfficiencies;

    /**
     * 残差ノルム {@code sqrt(Σ residual²)} です。
     */
    double lsq;

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
