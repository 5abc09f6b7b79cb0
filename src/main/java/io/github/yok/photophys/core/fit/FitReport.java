package io.github.yok.photophys.core.fit;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * フィット結果の残差診断（波長ごとの残差、R²、平均/最大絶対残差、lsq）を保持する読み取り専用クラスです。
 *
 * <p>
 * 最適化結果から一度だけ計算し、以後は変更しません。
 * </p>
 */
@Value
public class FitReport {

    /**
     * 波長ごとの計算値・実測値・残差です（波長昇順）。
     */
    List<WavelengthResidual> residuals;

    /**
     * 決定係数 {@code R² = 1 - SSres/SStot} です（SStot が 0 の場合は 0）。
     */
    double rSquared;

    /**
     * 絶対残差の平均です。
     */
    double meanAbsoluteResidual;

    /**
     * 絶対残差の最大値です。
     */
    double maxAbsoluteResidual;

    /**
     * 残差二乗和の平方根（lsq）です。
     */
    double lsq;

    /**
     * 計算値と実測値から残差診断を作成します。
     *
     * @param wavelengths 解析波長です
     * @param calculated 計算値です
     * @param experimental 実測値です
     * @return 残差診断です
     * @throws IllegalArgumentException 配列長が一致しない場合
     */
    public static FitReport of(double[] wavelengths, double[] calculated, double[] experimental) {
        Preconditions.checkArgument(
                wavelengths.length == calculated.length && calculated.length == experimental.length,
                "配列長が一致しません: wavelengths=%s, calculated=%s, experimental=%s", wavelengths.length,
                calculated.length, experimental.length);

        int m = wavelengths.length;
        List<WavelengthResidual> rows = new ArrayList<>(m);

        double ssRes = 0.0;
        double sumAbs = 0.0;
        double maxAbs = 0.0;
        double mean = 0.0;

        for (int i = 0; i < m; i++) {
            double r = calculated[i] - experimental[i];
            rows.add(new WavelengthResidual(wavelengths[i], calculated[i], experimental[i], r));
            ssRes += r * r;
            sumAbs += Math.abs(r);
            maxAbs = Math.max(maxAbs, Math.abs(r));
            mean += experimental[i];
        }

        double ssTot = 0.0;
        if (m > 0) {
            mean /= m;
            for (double e : experimental) {
                ssTot += (e - mean) * (e - mean);
            }
        }

        double r2 = (ssTot > 0.0) ? 1.0 - ssRes / ssTot : 0.0;
        double meanAbs = (m > 0) ? sumAbs / m : 0.0;

        return new FitReport(Collections.unmodifiableList(rows), r2, meanAbs, maxAbs,
                Math.sqrt(ssRes));
    }
}
