package io.github.yok.photophys.core.photophysics;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.AnalysisWindow;
import io.github.yok.photophys.core.spectrum.EmissionAreas;
import io.github.yok.photophys.core.spectrum.SpectralSample;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import io.github.yok.photophys.core.spectrum.Wavenumbers;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Strickler–Berg 式で、吸収・発光スペクトルから自然放射寿命と放射速度定数を計算します。
 *
 * <pre>
 * k_f = 2.88e-9 · n² · &lt;ν⁻³&gt;⁻¹ · ∫ε d ln ν
 * τ0  = 1e9 / k_f (ns)
 * τ   = Φf · τ0
 * </pre>
 */
@Slf4j
public class StricklerBergCalculator {

    /**
     * Strickler–Berg 式の係数です。
     */
    static final double STRICKLER_BERG_CONSTANT = 2.880e-9;

    /**
     * 計算します。
     *
     * @param emission 発光スペクトル（正規化強度を読みます）です
     * @param absorption 吸収スペクトル（吸光係数を読みます）です
     * @param params 計算条件です
     * @return 結果です（入力が不正、または k_f が正にならない場合は空）
     */
    public Optional<RadiativeLifetimeResult> calculate(SpectralSeries emission,
            SpectralSeries absorption, RadiativeLifetimeParameters params) {
        Preconditions.checkNotNull(emission, "emission が null です。");
        Preconditions.checkNotNull(absorption, "absorption が null です。");
        Preconditions.checkNotNull(params, "params が null です。");

        if (emission.size() < 2 || absorption.size() < 2) {
            log.warn("Strickler–Berg 計算：スペクトルの点数が不足しています。発光={}、吸収={}", emission.size(),
                    absorption.size());
            return Optional.empty();
        }

        double low = params.getLowWavelength();
        double high = params.getHighWavelength();
        double n = params.getRefractiveIndex();
        double epsilon = params.getEpsilon();
        double lambdaStar = params.getEpsilonWavelength();
        double phi = params.getQuantumYield();
        if (!AnalysisWindow.isValid(low, high) || n < 1 || epsilon <= 0 || lambdaStar <= 0
                || phi < 0 || phi > 1) {
            log.warn("Strickler–Berg 計算：条件が不正です。範囲=[{}, {}]、n={}、ε*={}、λ*={}、Φf={}", fmt5(low),
                    fmt5(high), fmt5(n), fmt5(epsilon), fmt5(lambdaStar), fmt5(phi));
            return Optional.empty();
        }

        AnalysisWindow window = new AnalysisWindow(low, high);
        SpectralSeries ems = emission.sortAscending();
        SpectralSeries abs = absorption.sortAscending();

        EmissionAreas areas = ems.emissionAreas();
        if (!(areas.getArea() > 0) || !(areas.getInverseCubeWeightedArea() > 0)) {
            log.warn("Strickler–Berg 計算：発光スペクトルの面積が正ではありません。");
            return Optional.empty();
        }
        double meanInverseCubeReciprocal = areas.reciprocalMeanInverseCube();

        double anchor = abs.valueAt(lambdaStar, SpectrumKind.ABSORPTION);
        if (!(anchor > 0)) {
            log.warn("Strickler–Berg 計算：基準波長 {} nm での吸光度が正ではありません。", fmt5(lambdaStar));
            return Optional.empty();
        }
        double scale = epsilon / anchor;

        double integral = 0.0;
        double maxEpsilon = 0.0;
        // 現在点が範囲内にある区間のみ積算
        for (int i = 1; i < abs.size(); i++) {
            SpectralSample cur = abs.get(i);
            if (!window.contains(cur.getWavelength())) {
                continue;
            }
            SpectralSample pre = abs.get(i - 1);
            double v1 = Wavenumbers.fromWavelength(pre.getWavelength());
            double v2 = Wavenumbers.fromWavelength(cur.getWavelength());
            double dv = Math.abs(v1 - v2);

            double e1 = scale * pre.getCoefficient();
            double e2 = scale * cur.getCoefficient();
            maxEpsilon = Math.max(maxEpsilon, Math.max(e1, e2));

            integral += (e1 / v1 + e2 / v2) * dv / 2.0;
        }

        double rate = STRICKLER_BERG_CONSTANT * n * n * meanInverseCubeReciprocal * integral;
        if (!(rate > 0)) {
            log.warn("Strickler–Berg 計算：放射速度定数が正ではありません。kf={}", rate);
            return Optional.empty();
        }

        double tau0 = 1e9 / rate;
        double tau = phi * tau0;

        log.info("Strickler–Berg 計算：∫εdlnν={}、<ν⁻³>⁻¹={}、kf={} s⁻¹、τ0={} ns、τ={} ns、εmax={}",
                fmt5(integral), meanInverseCubeReciprocal, rate, fmt5(tau0), fmt5(tau),
                fmt5(maxEpsilon));
        return Optional.of(new RadiativeLifetimeResult(integral, meanInverseCubeReciprocal, tau0,
                rate, tau, maxEpsilon));
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
