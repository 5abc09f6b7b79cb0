package io.github.yok.photophys.core.transfer;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.fit.FitReport;
import io.github.yok.photophys.core.linearalgebra.SpectralDesignMatrix;
import io.github.yok.photophys.core.solver.BoundaryPolicy;
import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer;
import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer.OptimizationResult;
import io.github.yok.photophys.core.solver.OptimizationProblem;
import io.github.yok.photophys.core.spectrum.AnalysisWavelengths;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 直列のエネルギー移動（ドナー→…→アクセプター）を扱う解析です。
 *
 * <ul>
 * <li>順方向：与えた移動効率 T から各成分の Q' と全体の量子収率を計算します。</li>
 * <li>逆方向：成分の発光スペクトルの線形結合 {@code Σ Q'_j(T)·N_j(λ)} が合成スペクトルに一致するように T をフィットします。</li>
 * </ul>
 *
 * <p>
 * 逆解析の境界処理は {@link BoundaryPolicy#MID_RANGE_RECENTER} です。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class CascadedEnergyTransferAnalyzer {

    /**
     * 逆解析に使う最適化器です。
     */
    private final BoxConstrainedOptimizer optimizer;

    /**
     * 順方向シミュレーションを行います。
     *
     * @param components 連鎖の順に並べた成分です
     * @return 結果です
     * @throws NullPointerException components が null の場合
     */
    public ForwardTransferResult forward(List<TransferComponent> components) {
        Preconditions.checkNotNull(components, "components が null です。");

        int n = components.size();
        double[] weights = new double[n];
        double[] quantumYields = new double[n];
        double[] efficiencies = new double[n];
        for (int i = 0; i < n; i++) {
            TransferComponent c = Preconditions.checkNotNull(components.get(i),
                    "成分%s が null です。", i + 1);
            weights[i] = c.absorptionWeightOrZero();
            quantumYields[i] = TransferCascade.clamp01(c.quantumYieldOrZero());
            efficiencies[i] = TransferCascade.clamp01(c.transferEfficiencyOrZero());
        }

        double[] fractions = TransferCascade.fractionsFromWeights(weights);
        double[] qPrime =
                TransferCascade.quantumYieldsAfterTransfer(fractions, quantumYields, efficiencies);

        List<ComponentTransfer> out = new ArrayList<>(n);
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            TransferComponent c = components.get(i);
            out.add(new ComponentTransfer(c.getId(), c.getName(), weights[i], fractions[i],
                    quantumYields[i], efficiencies[i], qPrime[i]));
            total += qPrime[i];
        }

        log.info("エネルギー移動（順方向）：成分数={}、全体の量子収率={}", n, fmt5(total));
        return new ForwardTransferResult(Collections.unmodifiableList(out), total);
    }

    /**
     * 逆解析を行い、移動効率 T をフィットします。
     *
     * @param request 入力です
     * @return 結果です
     * @throws NullPointerException request が null の場合
     * @throws IllegalArgumentException 発光スペクトルが合計2本未満、解析波長がない、発光以外のスペクトルがある、
     *         スペクトルに対応する成分の入力がない、または設定が不正な場合
     */
    public ReverseTransferResult reverse(ReverseTransferRequest request) {
        Preconditions.checkNotNull(request, "request が null です。");

        SpectralSeries composite = request.getComposite();
        List<SpectralSeries> spectra = request.getComponentSpectra();
        int totalSpectra = ((composite == null) ? 0 : 1) + spectra.size();
        Preconditions.checkArgument(composite != null && totalSpectra >= 2,
                "合成スペクトルと成分の発光スペクトルが合計2本以上必要です。本数=%s", totalSpectra);

        double[] waves = AnalysisWavelengths.sanitize(request.getWavelengths());
        Preconditions.checkArgument(waves.length > 0, "逆解析の解析波長がありません。");

        checkEmission(composite);
        for (SpectralSeries s : spectra) {
            checkEmission(s);
        }

        ReverseTransferOptions options = request.getOptions();
        Preconditions.checkNotNull(options, "options が null です。");
        Preconditions.checkArgument(options.getLow() < options.getHigh(),
                "T の範囲が不正です。low=%s, high=%s", options.getLow(), options.getHigh());

        // スペクトルの順に成分の入力を並べ替える
        List<TransferComponent> ordered = orderBySpectra(spectra, request.getComponents());

        final int n = ordered.size();
        double[] weights = new double[n];
        double[] quantumYields = new double[n];
        double[] initialEfficiencies = new double[n];
        for (int i = 0; i < n; i++) {
            TransferComponent c = ordered.get(i);
            weights[i] = Math.max(0.0, c.absorptionWeightOrZero());
            quantumYields[i] = TransferCascade.clamp01(c.quantumYieldOrZero());
            initialEfficiencies[i] = TransferCascade.clamp01(c.transferEfficiencyOrZero());
        }
        final double[] fractions = TransferCascade.fractionsFromWeights(weights);

        List<SpectralSeries> sortedSpectra = new ArrayList<>(n);
        for (SpectralSeries s : spectra) {
            sortedSpectra.add(s.sortAscending());
        }
        SpectralSeries compositeSorted = composite.sortAscending();

        final SpectralDesignMatrix design =
                SpectralDesignMatrix.sampleNormalized(waves, sortedSpectra, SpectrumKind.EMISSION);
        final double[] observed = new double[waves.length];
        double maxAbs = 0.0;
        for (int i = 0; i < waves.length; i++) {
            observed[i] = compositeSorted.normalizedValueAt(waves[i]);
            maxAbs = Math.max(maxAbs, Math.abs(observed[i]));
        }

        final boolean zeroLastT = options.isZeroLastT();
        final int nVars = zeroLastT ? Math.max(0, n - 1) : n;
        double[] initial = Arrays.copyOf(initialEfficiencies, nVars);
        double tolerance =
                (maxAbs > 0.0) ? options.getBaseTolerance() * maxAbs : options.getBaseTolerance();

        log.info("エネルギー移動（逆解析）を開始します。成分数={}、未知数={}、解析波長数={}、最後の T を固定={}、範囲=[{}, {}]、許容誤差={}", n,
                nVars, waves.length, zeroLastT, fmt5(options.getLow()), fmt5(options.getHigh()),
                tolerance);

        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(initial)
                .objective(t -> design.residualNorm(TransferCascade
                        .quantumYieldsAfterTransfer(fractions, quantumYields, fullLength(t, n)),
                        observed))
                .low(options.getLow())
                .high(options.getHigh())
                .boundaryPolicy(BoundaryPolicy.MID_RANGE_RECENTER)
                .maxIterations(options.getMaxIterations())
                .tolerance(tolerance)
                .build();

        OptimizationResult opt = optimizer.minimize(problem);

        double[] bestT = fullLength(opt.getSolution(), n);
        double[] qPrime = TransferCascade.quantumYieldsAfterTransfer(fractions, quantumYields, bestT);
        FitReport report = FitReport.of(waves, design.combine(qPrime), observed);

        List<ComponentTransfer> out = new ArrayList<>(n);
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            TransferComponent c = ordered.get(i);
            out.add(new ComponentTransfer(c.getId(), c.getName(), weights[i], fractions[i],
                    quantumYields[i], bestT[i], qPrime[i]));
            total += qPrime[i];
            log.info("成分{}：ID={}、fracE={}、QY={}、T={}、Q'={}", i + 1, c.getId(), fmt5(fractions[i]),
                    fmt5(quantumYields[i]), fmt5(bestT[i]), fmt5(qPrime[i]));
        }

        log.info("エネルギー移動（逆解析）を終了します。lsq={}、R²={}、全体の量子収率={}、反復回数={}（{}）",
                fmt5(report.getLsq()), fmt5(report.getRSquared()), fmt5(total), opt.getIterations(),
                opt.isConverged() ? "収束" : "未収束");

        return new ReverseTransferResult(Collections.unmodifiableList(out), total, bestT,
                report.getLsq(), report, opt.getIterations(), opt.isConverged());
    }

    /**
     * スペクトルの化合物IDに対応する成分の入力を、スペクトルの順に並べます。
     *
     * @param spectra 成分スペクトルです
     * @param components 成分の入力です
     * @return 並べ替えた成分の入力です
     * @throws IllegalArgumentException スペクトルに対応する入力がない場合
     */
    private static List<TransferComponent> orderBySpectra(List<SpectralSeries> spectra,
            List<TransferComponent> components) {
        Map<String, TransferComponent> byId = new LinkedHashMap<>();
        for (TransferComponent c : components) {
            if (c != null && c.getId() != null) {
                byId.putIfAbsent(c.getId(), c);
            }
        }
        List<TransferComponent> ordered = new ArrayList<>(spectra.size());
        for (SpectralSeries s : spectra) {
            TransferComponent c = byId.get(s.getCompoundId());
            Preconditions.checkArgument(c != null, "スペクトル（ID=%s）に対応する成分の入力がありません。",
                    s.getCompoundId());
            ordered.add(c);
        }
        return ordered;
    }

    private static void checkEmission(SpectralSeries s) {
        Preconditions.checkArgument(s != null && s.getKind() == SpectrumKind.EMISSION,
                "エネルギー移動解析には発光スペクトルのみ使用できます。ID=%s", (s == null) ? null : s.getCompoundId());
    }

    /**
     * 最後の T を固定した場合の未知数ベクトルを、全成分分の長さに伸ばします（不足分は 0）。
     *
     * @param t 未知数ベクトルです
     * @param n 成分数です
     * @return 長さ n の T です
     */
    private static double[] fullLength(double[] t, int n) {
        return (t.length == n) ? t.clone() : Arrays.copyOf(t, n);
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
