package io.github.yok.photophys.app;

import io.github.yok.photophys.core.photophysics.ConcentrationEstimator;
import io.github.yok.photophys.core.photophysics.ForsterTransferCalculator;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthCalculator;
import io.github.yok.photophys.core.photophysics.StricklerBergCalculator;
import io.github.yok.photophys.core.solver.BoxConstrainedOptimizer;
import io.github.yok.photophys.core.solver.NelderMeadSimplexOptimizer;
import io.github.yok.photophys.core.transfer.CascadedEnergyTransferAnalyzer;
import io.github.yok.photophys.core.unmixing.LinearUnmixingAnalyzer;
import io.github.yok.photophys.in.CsvSpectrumRepository;
import io.github.yok.photophys.in.SpectrumRepository;
import io.github.yok.photophys.out.CsvResultWriter;
import io.github.yok.photophys.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * スペクトル解析一式（最適化器・解析器・計算器・入出力）の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class PhotophysConfiguration {

    /**
     * photophys-solver の設定値（photophys.*）です。
     */
    private final PhotophysProperties p;

    /**
     * 箱型制約付きの最適化器（Nelder–Mead シンプレックス法）を生成します。
     *
     * @return 最適化器です
     */
    @Bean
    public BoxConstrainedOptimizer boxConstrainedOptimizer() {
        return new NelderMeadSimplexOptimizer();
    }

    /**
     * 多成分解析を生成します。
     *
     * @param optimizer 最適化器です
     * @return 多成分解析です
     */
    @Bean
    public LinearUnmixingAnalyzer linearUnmixingAnalyzer(BoxConstrainedOptimizer optimizer) {
        PhotophysProperties.Optimizer o = p.getOptimizer();
        PhotophysProperties.MultiComponent m = p.getMultiComponent();
        return new LinearUnmixingAnalyzer(optimizer, o.getMaxIterations(), o.getBaseTolerance(),
                m.getLowBound(), m.getHighBound());
    }

    /**
     * エネルギー移動解析を生成します。
     *
     * @param optimizer 最適化器です
     * @return エネルギー移動解析です
     */
    @Bean
    public CascadedEnergyTransferAnalyzer cascadedEnergyTransferAnalyzer(
            BoxConstrainedOptimizer optimizer) {
        return new CascadedEnergyTransferAnalyzer(optimizer);
    }

    /**
     * Förster 計算を生成します。
     *
     * @return Förster 計算です
     */
    @Bean
    public ForsterTransferCalculator forsterTransferCalculator() {
        return new ForsterTransferCalculator();
    }

    /**
     * Strickler–Berg 計算を生成します。
     *
     * @return Strickler–Berg 計算です
     */
    @Bean
    public StricklerBergCalculator stricklerBergCalculator() {
        return new StricklerBergCalculator();
    }

    /**
     * 振動子強度計算を生成します。
     *
     * @return 振動子強度計算です
     */
    @Bean
    public OscillatorStrengthCalculator oscillatorStrengthCalculator() {
        return new OscillatorStrengthCalculator();
    }

    /**
     * 濃度推定を生成します。
     *
     * @return 濃度推定です
     */
    @Bean
    public ConcentrationEstimator concentrationEstimator() {
        return new ConcentrationEstimator();
    }

    /**
     * スペクトル入力を生成します。
     *
     * @return スペクトル入力です
     */
    @Bean
    public SpectrumRepository spectrumRepository() {
        return new CsvSpectrumRepository(p.getInput().getDir());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
