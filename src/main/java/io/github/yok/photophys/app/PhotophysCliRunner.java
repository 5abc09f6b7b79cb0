package io.github.yok.photophys.app;

import io.github.yok.photophys.core.photophysics.ConcentrationEstimator;
import io.github.yok.photophys.core.photophysics.ForsterTransferCalculator;
import io.github.yok.photophys.core.photophysics.ForsterTransferParameters;
import io.github.yok.photophys.core.photophysics.ForsterTransferResult;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthCalculator;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthParameters;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthResult;
import io.github.yok.photophys.core.photophysics.RadiativeLifetimeParameters;
import io.github.yok.photophys.core.photophysics.RadiativeLifetimeResult;
import io.github.yok.photophys.core.photophysics.StricklerBergCalculator;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import io.github.yok.photophys.core.transfer.CascadedEnergyTransferAnalyzer;
import io.github.yok.photophys.core.transfer.ComponentTransfer;
import io.github.yok.photophys.core.transfer.ForwardTransferResult;
import io.github.yok.photophys.core.transfer.ReverseTransferOptions;
import io.github.yok.photophys.core.transfer.ReverseTransferRequest;
import io.github.yok.photophys.core.transfer.ReverseTransferResult;
import io.github.yok.photophys.core.transfer.TransferComponent;
import io.github.yok.photophys.core.unmixing.ComponentFraction;
import io.github.yok.photophys.core.unmixing.ComponentSpecification;
import io.github.yok.photophys.core.unmixing.LinearUnmixingAnalyzer;
import io.github.yok.photophys.core.unmixing.UnmixingRequest;
import io.github.yok.photophys.core.unmixing.UnmixingResult;
import io.github.yok.photophys.in.SpectrumRepository;
import io.github.yok.photophys.out.ResultWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で photophys-solver を実行するクラスです。
 *
 * <p>
 * {@code photophys.analysis} で選択した解析を1回実行し、結果を表示して出力します。 前提条件を満たさず結果が得られない場合は、その旨を表示して何も出力しません。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PhotophysCliRunner implements CommandLineRunner {

    /**
     * photophys-solver の設定値（photophys.*）です。
     */
    private final PhotophysProperties properties;

    /**
     * スペクトル入力です。
     */
    private final SpectrumRepository spectrumRepository;

    /**
     * 多成分解析です。
     */
    private final LinearUnmixingAnalyzer linearUnmixingAnalyzer;

    /**
     * エネルギー移動解析です。
     */
    private final CascadedEnergyTransferAnalyzer energyTransferAnalyzer;

    /**
     * Förster 計算です。
     */
    private final ForsterTransferCalculator forsterTransferCalculator;

    /**
     * Strickler–Berg 計算です。
     */
    private final StricklerBergCalculator stricklerBergCalculator;

    /**
     * 振動子強度計算です。
     */
    private final OscillatorStrengthCalculator oscillatorStrengthCalculator;

    /**
     * 濃度推定です。
     */
    private final ConcentrationEstimator concentrationEstimator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     * @throws IllegalStateException 設定が不正、または入力スペクトルが見つからない場合に発生します
     */
    @Override
    public void run(String... args) {
        System.out.println("=== photophys-solver start: " + properties.getAnalysis() + " ===");
        System.out.print(properties.toMultilineString());

        String label = properties.getLabel();
        switch (properties.getAnalysis()) {
            case UNMIXING:
                runUnmixing(label);
                break;
            case TRANSFER_FORWARD:
                runForwardTransfer(label);
                break;
            case TRANSFER_REVERSE:
                runReverseTransfer(label);
                break;
            case FORSTER:
                runForster(label);
                break;
            case RADIATIVE_LIFETIME:
                runRadiativeLifetime(label);
                break;
            case OSCILLATOR_STRENGTH:
                runOscillatorStrength(label);
                break;
            default:
                throw new IllegalStateException("未対応の解析です: " + properties.getAnalysis());
        }
    }

    /**
     * 多成分解析を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runUnmixing(String label) {
        PhotophysProperties.MultiComponent m = properties.getMultiComponent();
        SpectrumKind kind = m.getKind();
        SpectralSeries composite =
                requireSpectrum(m.getCompositeId(), kind, "multiComponent.compositeId");

        UnmixingRequest.UnmixingRequestBuilder request = UnmixingRequest.builder()
                .composite(composite)
                .wavelengths(m.getWavelengths())
                .minWavelength(m.getMinWavelength())
                .maxWavelength(m.getMaxWavelength());
        for (PhotophysProperties.MultiComponent.Component c : m.getComponents()) {
            SpectralSeries spectrum = requireSpectrum(c.getId(), kind, "multiComponent.components");
            request.component(new ComponentSpecification(spectrum, displayName(c.getId(),
                    c.getName()), concentrationOf(c, spectrum, m.getPathLength()),
                    c.getInitialFraction()));
        }

        Optional<UnmixingResult> result = linearUnmixingAnalyzer.analyze(request.build());
        if (!result.isPresent()) {
            System.out.println("結果なし: 多成分解析の前提条件を満たしていません（警告ログを参照してください）");
            return;
        }

        UnmixingResult r = result.get();
        for (ComponentFraction c : r.getComponents()) {
            System.out.println("結果: " + c.getCompoundId() + " 分率=" + fmt5(c.getFittedFraction())
                    + ", 濃度=" + fmt5(c.getFittedConcentration()));
        }
        System.out.println("結果: lsq=" + fmt5(r.getLsq()) + ", R2="
                + fmt5(r.getFitReport().getRSquared()) + ", iterations=" + r.getIterations());
        resultWriter.writeUnmixing(label, r);
    }

    /**
     * 入力濃度を決めます。未指定の場合は、モル吸光係数の文字列から Lambert–Beer 則で推定します。
     *
     * @param c 成分の設定です
     * @param spectrum 成分のスペクトルです
     * @param pathLength 光路長（cm）です
     * @return 濃度です（決められない場合は null）
     */
    private Double concentrationOf(PhotophysProperties.MultiComponent.Component c,
            SpectralSeries spectrum, double pathLength) {
        if (c.getConcentration() != null) {
            return c.getConcentration();
        }
        if (c.getEpsilon() == null) {
            return null;
        }
        SpectralSeries absorption = (spectrum.getKind() == SpectrumKind.ABSORPTION) ? spectrum
                : spectrumRepository.findSpectrum(c.getId(), SpectrumKind.ABSORPTION).orElse(null);
        if (absorption == null) {
            return null;
        }
        double estimated = concentrationEstimator.estimateMicromolar(absorption, c.getEpsilon(),
                c.getEpsilonWavelength(), pathLength);
        return (estimated > 0) ? estimated : null;
    }

    /**
     * エネルギー移動（順方向）を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runForwardTransfer(String label) {
        ForwardTransferResult r = energyTransferAnalyzer.forward(transferComponents());
        printTransfer(r.getComponents(), r.getTotalQuantumYield());
        resultWriter.writeForwardTransfer(label, r);
    }

    /**
     * エネルギー移動（逆解析）を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runReverseTransfer(String label) {
        PhotophysProperties.EnergyTransfer e = properties.getEnergyTransfer();
        PhotophysProperties.Optimizer o = properties.getOptimizer();

        ReverseTransferRequest.ReverseTransferRequestBuilder request =
                ReverseTransferRequest.builder()
                        .composite(requireSpectrum(e.getCompositeId(), SpectrumKind.EMISSION,
                                "energyTransfer.compositeId"))
                        .components(transferComponents())
                        .wavelengths(e.getWavelengths())
                        .options(ReverseTransferOptions.builder()
                                .zeroLastT(e.isZeroLastT())
                                .maxIterations(o.getMaxIterations())
                                .baseTolerance(o.getBaseTolerance())
                                .low(e.getLow())
                                .high(e.getHigh())
                                .build());
        for (PhotophysProperties.EnergyTransfer.Component c : e.getComponents()) {
            request.componentSpectrum(
                    requireSpectrum(c.getId(), SpectrumKind.EMISSION, "energyTransfer.components"));
        }

        ReverseTransferResult r = energyTransferAnalyzer.reverse(request.build());
        printTransfer(r.getComponents(), r.getTotalQuantumYield());
        System.out.println("結果: lsq=" + fmt5(r.getLsq()) + ", R2="
                + fmt5(r.getFitReport().getRSquared()) + ", iterations=" + r.getIterations());
        resultWriter.writeReverseTransfer(label, r);
    }

    /**
     * Förster 計算を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runForster(String label) {
        PhotophysProperties.Forster f = properties.getForster();
        SpectralSeries donor =
                requireSpectrum(f.getDonorId(), SpectrumKind.EMISSION, "forster.donorId");
        SpectralSeries acceptor =
                requireSpectrum(f.getAcceptorId(), SpectrumKind.ABSORPTION, "forster.acceptorId");

        ForsterTransferParameters params = ForsterTransferParameters.builder()
                .refractiveIndex(f.getRefractiveIndex())
                .orientationFactor(f.getOrientationFactor())
                .donorLifetime(f.getDonorLifetime())
                .distance(f.getDistance())
                .donorQuantumYield(f.getDonorQuantumYield())
                .acceptorEpsilon(f.getAcceptorEpsilon())
                .epsilonWavelength(f.getEpsilonWavelength())
                .lowWavelength(f.getLowWavelength())
                .highWavelength(f.getHighWavelength())
                .build();

        Optional<ForsterTransferResult> result =
                forsterTransferCalculator.calculate(donor, acceptor, params);
        if (!result.isPresent()) {
            System.out.println("結果なし: Förster 計算の前提条件を満たしていません（警告ログを参照してください）");
            return;
        }
        ForsterTransferResult r = result.get();
        System.out.println("結果: J=" + r.getOverlapIntegral() + ", R0=" + fmt5(r.getForsterDistance())
                + " Å, E=" + fmt5(r.getTransferEfficiency()) + " %, kT=" + r.getTransferRate());
        resultWriter.writeForster(label, r);
    }

    /**
     * Strickler–Berg 計算を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runRadiativeLifetime(String label) {
        PhotophysProperties.RadiativeLifetime rl = properties.getRadiativeLifetime();
        SpectralSeries emission = requireSpectrum(rl.getCompoundId(), SpectrumKind.EMISSION,
                "radiativeLifetime.compoundId");
        SpectralSeries absorption = requireSpectrum(rl.getCompoundId(), SpectrumKind.ABSORPTION,
                "radiativeLifetime.compoundId");

        RadiativeLifetimeParameters params = RadiativeLifetimeParameters.builder()
                .lowWavelength(rl.getLowWavelength())
                .highWavelength(rl.getHighWavelength())
                .refractiveIndex(rl.getRefractiveIndex())
                .epsilon(rl.getEpsilon())
                .epsilonWavelength(rl.getEpsilonWavelength())
                .quantumYield(rl.getQuantumYield())
                .build();

        Optional<RadiativeLifetimeResult> result =
                stricklerBergCalculator.calculate(emission, absorption, params);
        if (!result.isPresent()) {
            System.out.println(
                    "結果なし: Strickler–Berg 計算の前提条件を満たしていません（警告ログを参照してください）");
            return;
        }
        RadiativeLifetimeResult r = result.get();
        System.out.println("結果: τ0=" + fmt5(r.getNaturalLifetime()) + " ns, τ="
                + fmt5(r.getFluorescenceLifetime()) + " ns, kf=" + r.getRadiativeRate());
        resultWriter.writeRadiativeLifetime(label, r);
    }

    /**
     * 振動子強度計算を実行します。
     *
     * @param label 出力の識別子です
     */
    private void runOscillatorStrength(String label) {
        PhotophysProperties.OscillatorStrength os = properties.getOscillatorStrength();
        SpectralSeries absorption = requireSpectrum(os.getCompoundId(), SpectrumKind.ABSORPTION,
                "oscillatorStrength.compoundId");

        OscillatorStrengthParameters params = OscillatorStrengthParameters.builder()
                .lowWavelength(os.getLowWavelength())
                .highWavelength(os.getHighWavelength())
                .epsilon(os.getEpsilon())
                .epsilonWavelength(os.getEpsilonWavelength())
                .build();

        Optional<OscillatorStrengthResult> result =
                oscillatorStrengthCalculator.calculate(absorption, params);
        if (!result.isPresent()) {
            System.out.println("結果なし: 振動子強度の前提条件を満たしていません（警告ログを参照してください）");
            return;
        }
        OscillatorStrengthResult r = result.get();
        System.out.println("結果: f=" + fmt5(r.getOscillatorStrength()) + ", μ="
                + fmt5(r.getTransitionDipoleMomentDebye()) + " D");
        resultWriter.writeOscillatorStrength(label, r);
    }

    /**
     * エネルギー移動の成分設定を、解析の入力に変換します。
     *
     * @return 成分の入力です
     * @throws IllegalStateException 成分が指定されていない場合に発生します
     */
    private List<TransferComponent> transferComponents() {
        List<PhotophysProperties.EnergyTransfer.Component> configured =
                properties.getEnergyTransfer().getComponents();
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("energyTransfer.components は必須です");
        }
        List<TransferComponent> out = new ArrayList<>(configured.size());
        for (PhotophysProperties.EnergyTransfer.Component c : configured) {
            out.add(new TransferComponent(c.getId(), displayName(c.getId(), c.getName()),
                    c.getAbsorptionWeight(), c.getQuantumYield(), c.getTransferEfficiency()));
        }
        return out;
    }

    /**
     * スペクトルを取得します。
     *
     * @param compoundId 化合物IDです
     * @param kind 種別です
     * @param key エラー表示に使う設定キーです
     * @return スペクトルです
     * @throws IllegalStateException ID が未指定、またはスペクトルが見つからない場合に発生します
     */
    private SpectralSeries requireSpectrum(String compoundId, SpectrumKind kind, String key) {
        if (compoundId == null || compoundId.isEmpty()) {
            throw new IllegalStateException(key + " は必須です");
        }
        return spectrumRepository.findSpectrum(compoundId, kind)
                .orElseThrow(() -> new IllegalStateException(
                        "スペクトルが見つかりません: " + key + "=" + compoundId + "（" + kind.label() + "）"));
    }

    private static void printTransfer(List<ComponentTransfer> components, double totalQy) {
        for (ComponentTransfer c : components) {
            System.out.println("結果: " + c.getId() + " fracE=" + fmt5(c.getAbsorptionFraction())
                    + ", T=" + fmt5(c.getTransferEfficiency()) + ", Q'="
                    + fmt5(c.getQuantumYieldAfterTransfer()));
        }
        System.out.println("結果: totalQY=" + fmt5(totalQy));
    }

    private static String displayName(String id, String name) {
        return (name == null || name.isEmpty()) ? id : name;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
