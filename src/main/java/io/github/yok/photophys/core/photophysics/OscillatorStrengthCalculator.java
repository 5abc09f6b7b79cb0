package io.github.yok.photophys.core.photophysics;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.SpectralSample;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.Wavenumbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * 吸収帯のピーク高さと半値全幅から、振動子強度と遷移双極子モーメントを見積もります。
 *
 * <pre>
 * f  = 4.32e-9 · ε_peak · Δν½
 * μ  = 4.86e-27 · sqrt(f / ν_peak)  [C·m]
 * </pre>
 *
 * <p>
 * スペクトルは保存順（昇順・降順のどちらでも可）のまま扱います。
 * </p>
 */
@Slf4j
public class OscillatorStrengthCalculator {

    /**
     * 振動子強度の係数です。
     */
    static final double OSCILLATOR_CONSTANT = 4.32e-9;

    /**
     * 遷移双極子モーメント（C·m）の係数です。
     */
    static final double DIPOLE_CONSTANT = 4.86e-27;

    /**
     * 1 Debye あたりの C·m です。
     */
    static final double COULOMB_METER_PER_DEBYE = 3.33564e-30;

    /**
     * 計算します。
     *
     * @param absorption 吸収スペクトル（吸光係数を読みます）です
     * @param params 計算条件です
     * @return 結果です（点数不足・範囲不正・ピークが窓の端にある場合などは空）
     */
    public Optional<OscillatorStrengthResult> calculate(SpectralSeries absorption,
            OscillatorStrengthParameters params) {
        Preconditions.checkNotNull(absorption, "absorption が null です。");
        Preconditions.checkNotNull(params, "params が null です。");

        List<SpectralSample> data = new ArrayList<>(absorption.size());
        for (int i = 0; i < absorption.size(); i++) {
            SpectralSample s = absorption.get(i);
            if (Double.isFinite(s.getWavelength()) && Double.isFinite(s.getCoefficient())) {
                data.add(s);
            }
        }
        if (data.size() < 3) {
            log.warn("振動子強度：有効なサンプルが3点未満です。点数={}", data.size());
            return Optional.empty();
        }

        final double firstW = data.get(0).getWavelength();
        final double lastW = data.get(data.size() - 1).getWavelength();
        final boolean ascending = firstW <= lastW;

        // 探索範囲をデータの内側に狭める
        double low = params.getLowWavelength();
        double high = params.getHighWavelength();
        double minW = ascending ? firstW : lastW;
        double maxW = ascending ? lastW : firstW;
        if (minW > low) {
            low = minW + 1;
        }
        if (maxW < high) {
            high = maxW - 1;
        }
        if (!(low < high)) {
            log.warn("振動子強度：探索範囲が不正です。[{}, {}]", fmt5(low), fmt5(high));
            return Optional.empty();
        }

        int startIdx = indexFor(data, low, ascending);
        int endIdx = indexFor(data, high, ascending);
        int i0 = Math.min(startIdx, endIdx);
        int i1 = Math.max(startIdx, endIdx);
        if (i1 - i0 < 2) {
            log.warn("振動子強度：探索範囲内のサンプルが不足しています。[{}, {}]", fmt5(low), fmt5(high));
            return Optional.empty();
        }
        List<SpectralSample> window = data.subList(i0, i1 + 1);

        double peak = Double.NEGATIVE_INFINITY;
        int peakIndex = -1;
        for (int i = 0; i < window.size(); i++) {
            double c = window.get(i).getCoefficient();
            if (c > peak) {
                peak = c;
                peakIndex = i;
            }
        }
        if (peakIndex <= 1 || peakIndex >= window.size() - 2 || !(peak > 0)) {
            log.warn("振動子強度：ピークが探索範囲の端にあるか、正ではありません。位置={}/{}、値={}", peakIndex,
                    window.size(), peak);
            return Optional.empty();
        }
        double peakWavelength = window.get(peakIndex).getWavelength();

        double anchor = interpolate(data, params.getEpsilonWavelength(), ascending);
        double anchorOrPeak = (anchor == 0.0 || Double.isNaN(anchor)) ? peak : anchor;
        double peakEpsilon = params.getEpsilon() * (peak / anchorOrPeak);

        double half = peak / 2.0;
        double leftW = halfMaximumCrossing(window, peakIndex, -1, half);
        double rightW = halfMaximumCrossing(window, peakIndex, +1, half);
        double halfPeak1 = Double.isFinite(leftW) ? leftW : low;
        double halfPeak2 = Double.isFinite(rightW) ? rightW : high;

        double halfLow = Math.min(halfPeak1, halfPeak2);
        double halfHigh = Math.max(halfPeak1, halfPeak2);
        double halfWidth = Math.abs(
                Wavenumbers.fromWavelength(halfLow) - Wavenumbers.fromWavelength(halfHigh));
        double peakWavenumber = Wavenumbers.fromWavelength(peakWavelength);

        double f = OSCILLATOR_CONSTANT * peakEpsilon * halfWidth;
        double muSi = (f > 0 && peakWavenumber > 0)
                ? DIPOLE_CONSTANT * Math.sqrt(f / peakWavenumber)
                : 0.0;
        double muDebye = muSi / COULOMB_METER_PER_DEBYE;

        OscillatorStrengthResult result = new OscillatorStrengthResult(positiveOrZero(f),
                positiveOrZero(muDebye), positiveOrZero(muSi), peakWavelength, peakEpsilon,
                halfWidth);
        log.info("振動子強度：ピーク={} nm、ε_peak={}、Δν½={} cm⁻¹、f={}、μ={} D", fmt5(peakWavelength),
                fmt5(peakEpsilon), fmt5(halfWidth), fmt5(result.getOscillatorStrength()),
                fmt5(result.getTransitionDipoleMomentDebye()));
        return Optional.of(result);
    }

    /**
     * 保存順で、指定波長に最初に到達するサンプル番号を返します。
     */
    private static int indexFor(List<SpectralSample> data, double w, boolean ascending) {
        int idx = 0;
        if (ascending) {
            while (idx < data.size() - 1 && data.get(idx).getWavelength() < w) {
                idx++;
            }
        } else {
            while (idx < data.size() - 1 && data.get(idx).getWavelength() > w) {
                idx++;
            }
        }
        return idx;
    }

    /**
     * 保存順で挟み込む2点から線形補間します。挟み込めない場合は最も近いサンプルの値を返します。
     */
    private static double interpolate(List<SpectralSample> data, double target,
            boolean ascending) {
        for (int i = 0; i < data.size() - 1; i++) {
            SpectralSample a = data.get(i);
            SpectralSample b = data.get(i + 1);
            boolean bracketed = ascending
                    ? (a.getWavelength() <= target && target <= b.getWavelength())
                    : (a.getWavelength() >= target && target >= b.getWavelength());
            if (bracketed) {
                double span = b.getWavelength() - a.getWavelength();
                double t = (target - a.getWavelength()) / (span != 0.0 ? span : 1.0);
                return a.getCoefficient() + t * (b.getCoefficient() - a.getCoefficient());
            }
        }

        SpectralSample nearest = data.get(0);
        double best = Math.abs(nearest.getWavelength() - target);
        for (SpectralSample p : data) {
            double d = Math.abs(p.getWavelength() - target);
            if (d < best) {
                best = d;
                nearest = p;
            }
        }
        return nearest.getCoefficient();
    }

    /**
     * ピークから指定方向へ半値を横切る位置を探し、線形補間した波長を返します。
     *
     * @param window 探索窓です
     * @param peakIndex ピークの位置です
     * @param direction -1 で番号の小さい側、+1 で大きい側です
     * @param half 半値です
     * @return 半値の波長です（見つからない場合は NaN）
     */
    private static double halfMaximumCrossing(List<SpectralSample> window, int peakIndex,
            int direction, double half) {
        for (int i = peakIndex; i + direction >= 0 && i + direction < window.size();
                i += direction) {
            SpectralSample m = window.get(i);
            SpectralSample nb = window.get(i + direction);
            double fm = m.getCoefficient();
            double fn = nb.getCoefficient();
            if (fm >= half && fn <= half && fm != fn) {
                double dx = nb.getWavelength() - m.getWavelength();
                double dy = fn - fm;
                return m.getWavelength() + (half - fm) * (dx / dy);
            }
        }
        return Double.NaN;
    }

    private static double positiveOrZero(double v) {
        return (Double.isFinite(v) && v > 0) ? v : 0.0;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
