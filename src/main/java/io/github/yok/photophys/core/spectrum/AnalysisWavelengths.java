package io.github.yok.photophys.core.spectrum;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * 解析波長の一覧を整える（有限値のみ・重複除去・昇順）ユーティリティです。
 */
public final class AnalysisWavelengths {

    private AnalysisWavelengths() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * 有限値のみを残し、重複を除いて昇順に並べます。
     *
     * @param wavelengths 波長の一覧です（null 要素は無視します）
     * @return 整えた波長配列です
     */
    public static double[] sanitize(Collection<Double> wavelengths) {
        return sanitize(wavelengths, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    /**
     * 有限値かつ [min, max] 内の値のみを残し、重複を除いて昇順に並べます。
     *
     * @param wavelengths 波長の一覧です（null 要素は無視します）
     * @param min 下限（含む）です
     * @param max 上限（含む）です
     * @return 整えた波長配列です
     */
    public static double[] sanitize(Collection<Double> wavelengths, double min, double max) {
        if (wavelengths == null) {
            return new double[0];
        }
        TreeSet<Double> unique = new TreeSet<>();
        for (Double w : wavelengths) {
            if (w == null || !Double.isFinite(w)) {
                continue;
            }
            if (w >= min && w <= max) {
                unique.add(w);
            }
        }
        List<Double> sorted = new ArrayList<>(unique);
        double[] out = new double[sorted.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = sorted.get(i);
        }
        return out;
    }
}
