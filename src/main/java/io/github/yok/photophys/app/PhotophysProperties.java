package io.github.yok.photophys.app;

import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * photophys-solver の設定値（photophys.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時に解析の種類と入力条件を決めるために使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "photophys")
public class PhotophysProperties {

    /**
     * 実行する解析の種類です。
     */
    @NotNull
    private Analysis analysis = Analysis.UNMIXING;

    /**
     * 出力ファイル名に使う識別子（試料名など）です。
     */
    @NotEmpty
    private String label = "sample";

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * シンプレックス探索の設定です。
     */
    @Valid
    private Optimizer optimizer = new Optimizer();

    /**
     * 多成分解析の設定です。
     */
    @Valid
    private MultiComponent multiComponent = new MultiComponent();

    /**
     * エネルギー移動解析の設定です。
     */
    @Valid
    private EnergyTransfer energyTransfer = new EnergyTransfer();

    /**
     * Förster 計算の設定です。
     */
    private Forster forster = new Forster();

    /**
     * Strickler–Berg 計算の設定です。
     */
    private RadiativeLifetime radiativeLifetime = new RadiativeLifetime();

    /**
     * 振動子強度計算の設定です。
     */
    private OscillatorStrength oscillatorStrength = new OscillatorStrength();

    /**
     * 解析の種類です。
     */
    public enum Analysis {
        UNMIXING, TRANSFER_FORWARD, TRANSFER_REVERSE, FORSTER, RADIATIVE_LIFETIME,
        OSCILLATOR_STRENGTH
    }

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * <p>
     * 共通設定に加えて、選択した解析のセクションのみ出力します。
     * </p>
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "photophys")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "common",
                // analysis: 実行する解析
                "analysis", getAnalysis(),
                // label: 出力ファイル名の識別子
                "label", getLabel(),
                // input.dir: スペクトル CSV の入力ディレクトリ
                "input.dir", getInput().getDir(),
                // output.dir: 出力先ディレクトリ
                "output.dir", getOutput().getDir());

        appendSection(sb, nl, "optimizer",
                // maxIterations: 最大反復回数
                "maxIterations", getOptimizer().getMaxIterations(),
                // baseTolerance: スケーリング前の許容誤差
                "baseTolerance", getOptimizer().getBaseTolerance());

        switch (getAnalysis()) {
            case UNMIXING: {
                MultiComponent m = getMultiComponent();
                appendSection(sb, nl, "multiComponent",
                        // compositeId: 合成スペクトルの化合物ID
                        "compositeId", m.getCompositeId(),
                        // kind: スペクトルの種別
                        "kind", m.getKind(),
                        // components: 成分（ID, 濃度, 初期分率）
                        "components", m.getComponents(),
                        // wavelengths: 解析波長
                        "wavelengths", m.getWavelengths(),
                        // minWavelength / maxWavelength: 解析波長の範囲
                        "minWavelength", m.getMinWavelength(),
                        "maxWavelength", m.getMaxWavelength(),
                        // lowBound / highBound: 分率の範囲
                        "lowBound", m.getLowBound(),
                        "highBound", m.getHighBound(),
                        // pathLength: 濃度推定に使う光路長（cm）
                        "pathLength", m.getPathLength());
                break;
            }
            case TRANSFER_FORWARD:
            case TRANSFER_REVERSE: {
                EnergyTransfer e = getEnergyTransfer();
                appendSection(sb, nl, "energyTransfer",
                        // compositeId: 合成（混合物）発光スペクトルの化合物ID
                        "compositeId", e.getCompositeId(),
                        // components: 連鎖の順に並べた成分
                        "components", e.getComponents(),
                        // wavelengths: 逆解析の解析波長
                        "wavelengths", e.getWavelengths(),
                        // zeroLastT: 最後の T を 0 に固定するかどうか
                        "zeroLastT", e.isZeroLastT(),
                        // low / high: T の範囲
                        "low", e.getLow(),
                        "high", e.getHigh());
                break;
            }
            case FORSTER: {
                Forster f = getForster();
                appendSection(sb, nl, "forster",
                        "donorId", f.getDonorId(),
                        "acceptorId", f.getAcceptorId(),
                        "refractiveIndex", f.getRefractiveIndex(),
                        "orientationFactor", f.getOrientationFactor(),
                        "donorLifetime", f.getDonorLifetime(),
                        "distance", f.getDistance(),
                        "donorQuantumYield", f.getDonorQuantumYield(),
                        "acceptorEpsilon", f.getAcceptorEpsilon(),
                        "epsilonWavelength", f.getEpsilonWavelength(),
                        "lowWavelength", f.getLowWavelength(),
                        "highWavelength", f.getHighWavelength());
                break;
            }
            case RADIATIVE_LIFETIME: {
                RadiativeLifetime r = getRadiativeLifetime();
                appendSection(sb, nl, "radiativeLifetime",
                        "compoundId", r.getCompoundId(),
                        "lowWavelength", r.getLowWavelength(),
                        "highWavelength", r.getHighWavelength(),
                        "refractiveIndex", r.getRefractiveIndex(),
                        "epsilon", r.getEpsilon(),
                        "epsilonWavelength", r.getEpsilonWavelength(),
                        "quantumYield", r.getQuantumYield());
                break;
            }
            case OSCILLATOR_STRENGTH: {
                OscillatorStrength o = getOscillatorStrength();
                appendSection(sb, nl, "oscillatorStrength",
                        "compoundId", o.getCompoundId(),
                        "lowWavelength", o.getLowWavelength(),
                        "highWavelength", o.getHighWavelength(),
                        "epsilon", o.getEpsilon(),
                        "epsilonWavelength", o.getEpsilonWavelength());
                break;
            }
            default:
                break;
        }

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * スペクトル CSV の入力ディレクトリです。
         */
        @NotEmpty
        private String dir = "./spectra";
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotEmpty
        private String dir = "./out";
    }

    @Data
    public static class Optimizer {

        /**
         * 最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 1000;

        /**
         * スケーリング前の許容誤差です。
         */
        @DecimalMin("0.0")
        private double baseTolerance = 1e-9;
    }

    @Data
    public static class MultiComponent {

        /**
         * 合成スペクトルの化合物IDです。
         */
        private String compositeId;

        /**
         * スペクトルの種別です。
         */
        private SpectrumKind kind = SpectrumKind.ABSORPTION;

        /**
         * 成分の一覧です。
         */
        @Valid
        private List<Component> components = new ArrayList<>();

        /**
         * 解析波長です。
         */
        private List<Double> wavelengths = new ArrayList<>();

        /**
         * 解析波長の下限（nm）です。
         */
        private double minWavelength = 0.0;

        /**
         * 解析波長の上限（nm）です。
         */
        private double maxWavelength = 10000.0;

        /**
         * 分率の下限です。
         */
        private double lowBound = 0.0;

        /**
         * 分率の上限です。
         */
        private double highBound = 10000.0;

        /**
         * 濃度推定（Lambert–Beer）に使う光路長（cm）です。
         */
        private double pathLength = 1.0;

        @Data
        public static class Component {

            /**
             * 化合物IDです。
             */
            @NotEmpty
            private String id;

            /**
             * 表示名です（未指定時は ID）。
             */
            private String name;

            /**
             * 濃度（µM）です。未指定時は epsilon と epsilonWavelength から推定します。
             */
            private Double concentration;

            /**
             * 初期分率です。
             */
            private Double initialFraction;

            /**
             * モル吸光係数の文字列（例：{@code "12,500 (in MeOH)"}）です。
             */
            private String epsilon;

            /**
             * モル吸光係数を与える波長の文字列（例：{@code "450 nm"}）です。
             */
            private String epsilonWavelength;
        }
    }

    @Data
    public static class EnergyTransfer {

        /**
         * 合成（混合物）発光スペクトルの化合物IDです（逆解析のみ）。
         */
        private String compositeId;

        /**
         * 連鎖の順（ドナー側から）に並べた成分です。
         */
        @Valid
        private List<Component> components = new ArrayList<>();

        /**
         * 逆解析の解析波長です。
         */
        private List<Double> wavelengths = new ArrayList<>();

        /**
         * 最後の T を 0 に固定するかどうかです。
         */
        private boolean zeroLastT = true;

        /**
         * T の下限です。
         */
        private double low = 0.0;

        /**
         * T の上限です。
         */
        private double high = 1.0;

        @Data
        public static class Component {

            /**
             * 化合物IDです。
             */
            @NotEmpty
            private String id;

            /**
             * 表示名です（未指定時は ID）。
             */
            private String name;

            /**
             * 吸収の重み E です。
             */
            private Double absorptionWeight;

            /**
             * 量子収率 QY です。
             */
            private Double quantumYield;

            /**
             * 移動効率 T（逆解析では初期値）です。
             */
            private Double transferEfficiency;
        }
    }

    @Data
    public static class Forster {

        /**
         * ドナー（発光）の化合物IDです。
         */
        private String donorId;

        /**
         * アクセプター（吸収）の化合物IDです。
         */
        private String acceptorId;

        /**
         * 屈折率 n です。
         */
        private double refractiveIndex = 1.4;

        /**
         * 配向因子 κ² です。
         */
        private double orientationFactor = 0.6667;

        /**
         * ドナーの蛍光寿命（ns）です。
         */
        private double donorLifetime = 1.0;

        /**
         * ドナー・アクセプター間距離（Å）です。
         */
        private double distance = 50.0;

        /**
         * ドナーの蛍光量子収率です。
         */
        private double donorQuantumYield = 1.0;

        /**
         * アクセプターのモル吸光係数（M⁻¹cm⁻¹）です。
         */
        private double acceptorEpsilon;

        /**
         * モル吸光係数を与える波長（nm）です。
         */
        private double epsilonWavelength;

        /**
         * 重なり積分の下限波長（nm）です。
         */
        private double lowWavelength = 0.0;

        /**
         * 重なり積分の上限波長（nm）です。
         */
        private double highWavelength = 10000.0;
    }

    @Data
    public static class RadiativeLifetime {

        /**
         * 化合物IDです（吸収・発光の両方を読みます）。
         */
        private String compoundId;

        /**
         * 吸収積分の下限波長（nm）です。
         */
        private double lowWavelength = 0.0;

        /**
         * 吸収積分の上限波長（nm）です。
         */
        private double highWavelength = 10000.0;

        /**
         * 屈折率 n です。
         */
        private double refractiveIndex = 1.0;

        /**
         * モル吸光係数（M⁻¹cm⁻¹）です。
         */
        private double epsilon;

        /**
         * モル吸光係数を与える波長（nm）です。
         */
        private double epsilonWavelength;

        /**
         * 蛍光量子収率です。
         */
        private double quantumYield = 1.0;
    }

    @Data
    public static class OscillatorStrength {

        /**
         * 化合物IDです（吸収を読みます）。
         */
        private String compoundId;

        /**
         * ピーク探索の下限波長（nm）です。
         */
        private double lowWavelength = 0.0;

        /**
         * ピーク探索の上限波長（nm）です。
         */
        private double highWavelength = 10000.0;

        /**
         * モル吸光係数（M⁻¹cm⁻¹）です。
         */
        private double epsilon;

        /**
         * モル吸光係数を与える波長（nm）です。
         */
        private double epsilonWavelength;
    }
}
