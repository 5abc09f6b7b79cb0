package io.github.yok.photophys.core.spectrum;

import com.google.common.base.Preconditions;
import lombok.Value;

/**
 * 積分やフィッティングに参加する波長範囲 [low, high] を表すクラスです。
 */
@Value
public class AnalysisWindow {

    /**
     * 下限波長（nm）です。
     */
    double low;

    /**
     * 上限波長（nm）です。
     */
    double high;

    /**
     * 波長範囲を作成します。
     *
     * @param low 下限波長（nm）です
     * @param high 上限波長（nm）です
     * @throws IllegalArgumentException low &gt;= high、または有限値でない場合
     */
    public AnalysisWindow(double low, double high) {
        Preconditions.checkArgument(isValid(low, high), "波長範囲が不正です（low < high が必要）。low=%s, high=%s",
                low, high);
        this.low = low;
        this.high = high;
    }

    /**
     * 範囲として成立するか（両端が有限かつ low &lt; high）を判定します。
     *
     * @param low 下限です
     * @param high 上限です
     * @return 成立する場合は true です
     */
    public static boolean isValid(double low, double high) {
        return Double.isFinite(low) && Double.isFinite(high) && high > low;
    }

    /**
     * 波長が範囲内（両端を含む）かどうかを返します。
     *
     * @param wavelength 波長（nm）です
     * @return 範囲内なら true です
     */
    public boolean contains(double wavelength) {
        return wavelength >= low && wavelength <= high;
    }
}
