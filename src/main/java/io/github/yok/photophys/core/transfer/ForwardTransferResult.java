package io.github.yok.photophys.core.transfer;

import java.util.List;
import lombok.Value;

/**
 * 順方向シミュレーション（T から Q' を計算）の結果です。
 */
@Value
public class ForwardTransferResult {

    /**
     * 成分ごとの結果です（入力と同じ順序）。
     */
    List<ComponentTransfer> components;

    /**
     * 全体の量子収率 {@code Σ Q'} です。
     */
    double totalQuantumYield;
}
