package io.github.yok.photophys.core.photophysics;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.AnalysisWindow;
import io.github.yok.photophys.core.spectrum.SpectralDomain;
import io.github.yok.photophys.core.spectrum.SpectralSample;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import io.github.yok.photophys.core.spectrum.Wavenumbers;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * ドナー発光とアクセプター吸収の重なりから、Förster 距離・移動効率・移動速度を計算します。
 */
@Slf4j
public class ForsterTransferCalculator {

    /**
     * R0⁶ の係数 {@code 1e25·9000·ln10 / (128·π⁵·N_A)} です（N_A は 1e23 を除いた値）。
     */
    static final double R0_PREFACTOR =
            1e25 * 9000 * 2.302585 / (128 * Math.pow(Math.PI, 5) * 6.0221367);

    /**
     * Dexter 重なり値の換算係数（cm⁻¹/eV）です。
     */
    private static final double WAVENUMBER_PER_EV = 8066;

    /**
     * 計算します。
     *
     * @param donorEmission ドナーの発光スペクトル（正規化強度を読みます）です
     * @param acceptorAbsorption アクセプターの吸収スペクトル（吸光係数を読みます）です
     * @param params 計算条件です
     * @return 結果です（点数不足・範囲不正・面積や基準吸光度が正でない場合は空）
     */
    public Optional<ForsterTransferResult> calculate(SpectralSeries donorEmission,
            SpectralSeries acceptorAbsorption, ForsterTransferParameters params) {
        Preconditions.checkNotNull(donorEmission, "donorEmission が null です。");
        Preconditions.checkNotNull(acceptorAbsorption, "acceptorAbsorption が null です。");
        Preconditions.checkNotNull(params, "params が null です。");

        if (donorEmission.size() < 2 || acceptorAbsorption.size() < 2) {
            log.warn("Förster 計算：スペクトルの点数が不足しています。発光={}、吸収={}", donorEmission.size(),
                    acceptorAbsorption.size());
            return Optional.empty();
        }

        double low = params.getLowWavelength();
        double high = params.getHighWavelength();
        if (!AnalysisWindow.isValid(low, high)) {
            log.warn("Förster 計算：波長範囲が不正です。[{}, {}]", fmt5(low), fmt5(high));
            return Optional.empty();
        }
        AnalysisWindow window = new AnalysisWindow(low, high);

        SpectralSeries ems = donorEmission.sortAscending();
        SpectralSeries abs = acceptorAbsorption.sortAscending();

        double fluoArea = ems.emissionAreas().getArea();
        double absArea = abs.areaTrapezoid(SpectralDomain.WAVENUMBER, SpectrumKind.ABSORPTION);
        if (!(fluoArea > 0) || !(absArea > 0)) {
            log.warn("Förster 計算：スペクトル面積が正ではありません。発光={}、吸収={}", fluoArea, absArea);
            return Optional.empty();
        }

        double epsilon = params.getAcceptorEpsilon();
        double anchor = abs.valueAt(params.getEpsilonWavelength(), SpectrumKind.ABSORPTION);
        if (!(epsilon > 0) || !(anchor > 0)) {
            log.warn("Förster 計算：基準の吸光係数が不正です。ε*={}、A(λ*={})={}", fmt5(epsilon),
                    fmt5(params.getEpsilonWavelength()), anchor);
            return Optional.empty();
        }

        double j = 0.0;
        double dexter = 0.0;
        // 現在点が範囲内にある区間のみ積算
        for (int m = 1; m < ems.size(); m++) {
            SpectralSample cur = ems.get(m);
            if (!window.contains(cur.getWavelength())) {
                continue;
            }
            SpectralSample pre = ems.get(m - 1);

            double v1 = Wavenumbers.fromWavelength(pre.getWavelength());
            double v2 = Wavenumbers.fromWavelength(cur.getWavelength());
            double f1 = pre.getNormalized() / fluoArea;
            double f2 = cur.getNormalized() / fluoArea;
            double dl = Math.abs(cur.getWavelength() - pre.getWavelength());

            double a1 = abs.valueAt(pre.getWavelength(), SpectrumKind.ABSORPTION);
            double a2 = abs.valueAt(cur.getWavelength(), SpectrumKind.ABSORPTION);
            double e1 = epsilon * a1 / anchor;
            double e2 = epsilon * a2 / anchor;

            double value = Wavenumbers.NM_TO_WAVENUMBER
                    * (f1 * e1 / Math.pow(v1, 4) + f2 * e2 / Math.pow(v2, 4)) * (dl / 2.0);
            double dexterValue = Wavenumbers.NM_TO_WAVENUMBER
                    * (f1 * a1 / absArea + f2 * a2 / absArea) * WAVENUMBER_PER_EV * (dl / 2.0);

            if (value > 0) {
                j += value;
            }
            if (dexterValue > 0) {
                dexter += dexterValue;
            }
        }

        double r06 = R0_PREFACTOR * j * params.getOrientationFactor()
                * params.getDonorQuantumYield() / Math.pow(params.getRefractiveIndex(), 4);
        double r0 = (r06 > 0) ? Math.pow(r06, 1.0 / 6.0) : 0.0;

        double r = params.getDistance();
        double r6 = Math.pow(r, 6);
        double efficiency = (r06 > 0) ? 100.0 * r06 / (r06 + r6) : 0.0;
        double rate = (params.getDonorLifetime() > 0 && r > 0 && r06 > 0)
                ? 1e9 * r06 / (r6 * params.getDonorLifetime())
                : 0.0;

        log.info("Förster 計算：J={}、R0={} Å、E={} %、kT={} s⁻¹、Dexter={}", j, fmt5(r0),
                fmt5(efficiency), rate, dexter);
        return Optional.of(new ForsterTransferResult(j, r0, efficiency, rate, dexter));
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
