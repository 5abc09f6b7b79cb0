package io.github.yok.photophys.core.unmixing;

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
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 合成スペクトルを成分スペクトルの非負線形結合として再構成し、成分分率をフィットする多成分解析です。
 *
 * <p>
 * 目的関数は {@code sqrt(Σ_λ (Σ_j c_j·N_j(λ) - N_mix(λ))²)} です（N は min-max 正規化した強度）。 分率は
 * [lowBound, highBound]（既定 [0, 10000]）の範囲で、境界外は丸め込み（{@link BoundaryPolicy#CLAMP_TO_BOUNDS}）で扱います。
 * </p>
 *
 * <p>
 * 入力不足（成分が2未満、解析波長数が成分数以下など）の場合は例外ではなく空の結果を返します。
 * </p>
 */
@Slf4j
@Getter
public final class LinearUnmixingAnalyzer {

    /**
     * 分率の既定の下限です。
     */
    public static final double DEFAULT_LOW_BOUND = 0.0;

    /**
     * 分率の既定の上限です。
     */
    public static final double DEFAULT_HIGH_BOUND = 10000.0;

    /**
     * スケーリング前の既定の許容誤差です。
     */
    public static final double DEFAULT_BASE_TOLERANCE = 1e-9;

    /**
     * 最小化に使う最適化器です。
     */
    private final BoxConstrainedOptimizer optimizer;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * スケーリング前の許容誤差です。
     */
    private final double baseTolerance;

    /**
     * 分率の下限です。
     */
    private final double lowBound;

    /**
     * 分率の上限です。
     */
    private final double highBound;

    /**
     * 既定値（最大反復 1000、許容誤差 1e-9、範囲 [0, 10000]）で解析器を生成します。
     *
     * @param optimizer 最適化器です
     */
    public LinearUnmixingAnalyzer(BoxConstrainedOptimizer optimizer) {
        this(optimizer, OptimizationProblem.DEFAULT_MAX_ITERATIONS, DEFAULT_BASE_TOLERANCE,
                DEFAULT_LOW_BOUND, DEFAULT_HIGH_BOUND);
    }

    /**
     * 解析器を生成します。
     *
     * @param optimizer 最適化器です（null 不可）
     * @param maxIterations 最大反復回数です（1 以上）
     * @param baseTolerance スケーリング前の許容誤差です（0 以上）
     * @param lowBound 分率の下限です
     * @param highBound 分率の上限です（下限より大きいこと）
     * @throws NullPointerException optimizer が null の場合
     * @throws IllegalArgumentException 数値設定が不正な場合
     */
    public LinearUnmixingAnalyzer(BoxConstrainedOptimizer optimizer, int maxIterations,
            double baseTolerance, double lowBound, double highBound) {
        Preconditions.checkNotNull(optimizer, "optimizer が null です。");
        Preconditions.checkArgument(maxIterations > 0, "最大反復回数は 1 以上が必要です。maxIter=%s",
                maxIterations);
        Preconditions.checkArgument(baseTolerance >= 0.0, "許容誤差は 0 以上が必要です。tol=%s",
                baseTolerance);
        Preconditions.checkArgument(lowBound < highBound, "分率の範囲が不正です。low=%s, high=%s", lowBound,
                highBound);
        this.optimizer = optimizer;
        this.maxIterations = maxIterations;
        this.baseTolerance = baseTolerance;
        this.lowBound = lowBound;
        this.highBound = highBound;
    }

    /**
     * 多成分解析を実行します。
     *
     * @param request 入力です
     * @return 結果です（前提条件を満たさない場合は空）
     * @throws NullPointerException request が null の場合
     */
    public Optional<UnmixingResult> analyze(UnmixingRequest request) {
        Preconditions.checkNotNull(request, "request が null です。");

        SpectralSeries composite = request.getComposite();
        List<ComponentSpecification> components = request.getComponents();

        if (composite == null || components == null || components.size() < 2) {
            log.warn("多成分解析を実行できません：合成スペクトル1本と成分スペクトル2本以上が必要です。成分数={}",
                    (components == null) ? 0 : components.size());
            return Optional.empty();
        }

        SpectrumKind kind = composite.getKind();
        for (ComponentSpecification c : components) {
            if (c == null || c.getSpectrum() == null || c.getSpectrum().getKind() != kind) {
                log.warn("多成分解析を実行できません：成分スペクトルの種別が合成スペクトル（{}）と一致しません。", kind);
                return Optional.empty();
            }
        }

        final int nVars = components.size();

        // 解析波長：有限・範囲内・重複なし・昇順
        double[] waves = AnalysisWavelengths.sanitize(request.getWavelengths(),
                request.getMinWavelength(), request.getMaxWavelength());

        // 未知数より多い式（波長）が必要
        if (waves.length <= nVars) {
            log.warn("多成分解析を実行できません：解析波長の数（{}）は成分数（{}）より多い必要があります。範囲=[{}, {}]",
                    waves.length, nVars, fmt5(request.getMinWavelength()),
                    fmt5(request.getMaxWavelength()));
            return Optional.empty();
        }

        SpectralSeries compositeSorted = composite.sortAscending();
        List<SpectralSeries> componentSpectra = new ArrayList<>(nVars);
        double[] initialFractions = new double[nVars];
        for (int j = 0; j < nVars; j++) {
            ComponentSpecification c = components.get(j);
            componentSpectra.add(c.getSpectrum().sortAscending());
            initialFractions[j] = c.initialFractionOrZero();
        }

        SpectralDesignMatrix design =
                SpectralDesignMatrix.sampleNormalized(waves, componentSpectra, kind);

        double[] observed = new double[waves.length];
        double peak = 0.0;
        for (int i = 0; i < waves.length; i++) {
            observed[i] = compositeSorted.normalizedValueAt(waves[i]);
            peak = Math.max(peak, observed[i]);
        }

        double tolerance = scaleTolerance(baseTolerance, peak);

        log.info("多成分解析を開始します。種別={}、成分数={}、解析波長数={}、範囲=[{}, {}]、許容誤差={}、最大反復回数={}", kind,
                nVars, waves.length, fmt5(lowBound), fmt5(highBound), tolerance, maxIterations);

        OptimizationProblem problem = OptimizationProblem.builder()
                .initialGuess(initialFractions)
                .objective(c -> design.residualNorm(c, observed))
                .low(lowBound)
                .high(highBound)
                .boundaryPolicy(BoundaryPolicy.CLAMP_TO_BOUNDS)
                .maxIterations(maxIterations)
                .tolerance(tolerance)
                .build();

        OptimizationResult opt = optimizer.minimize(problem);
        double[] fractions = opt.getSolution();

        FitReport report = FitReport.of(waves, design.combine(fractions), observed);

        List<ComponentFraction> out = new ArrayList<>(nVars);
        for (int j = 0; j < nVars; j++) {
            ComponentSpecification c = components.get(j);
            double conc = c.concentrationOrZero();
            out.add(new ComponentFraction(c.getCompoundId(), c.getName(), conc,
                    initialFractions[j], fractions[j], fractions[j] * conc));
            log.info("成分{}：ID={}、初期分率={}、分率={}、濃度={}", j + 1, c.getCompoundId(),
                    fmt5(initialFractions[j]), fmt5(fractions[j]), fmt5(fractions[j] * conc));
        }

        log.info("多成分解析を終了します。lsq={}、R²={}、平均残差={}、最大残差={}、反復回数={}（{}）", fmt5(opt.getValue()),
                fmt5(report.getRSquared()), fmt5(report.getMeanAbsoluteResidual()),
                fmt5(report.getMaxAbsoluteResidual()), opt.getIterations(),
                opt.isConverged() ? "収束" : "未収束");

        return Optional.of(new UnmixingResult(opt.getValue(), Collections.unmodifiableList(out),
                report, opt.getIterations(), opt.isConverged()));
    }

    /**
     * 合成スペクトルのピーク値で許容誤差をスケーリングします。
     *
     * <p>
     * ピークが 1 より大きい場合は {@code 1/peak} 倍、0 より大きく 1 以下の場合は {@code peak} 倍、それ以外はそのままです。
     * </p>
     *
     * @param base スケーリング前の許容誤差です
     * @param peak 合成スペクトルの正規化強度の最大値です
     * @return スケーリング後の許容誤差です
     */
    static double scaleTolerance(double base, double peak) {
        if (peak > 1.0) {
            return base * (1.0 / peak);
        }
        if (peak > 0.0) {
            return base * peak;
        }
        return base;
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
