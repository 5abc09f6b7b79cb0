package io.github.yok.photophys.out;

import io.github.yok.photophys.core.fit.FitReport;
import io.github.yok.photophys.core.fit.WavelengthResidual;
import io.github.yok.photophys.core.photophysics.ForsterTransferResult;
import io.github.yok.photophys.core.photophysics.OscillatorStrengthResult;
import io.github.yok.photophys.core.photophysics.RadiativeLifetimeResult;
import io.github.yok.photophys.core.transfer.ComponentTransfer;
import io.github.yok.photophys.core.transfer.ForwardTransferResult;
import io.github.yok.photophys.core.transfer.ReverseTransferResult;
import io.github.yok.photophys.core.unmixing.ComponentFraction;
import io.github.yok.photophys.core.unmixing.UnmixingResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 解析結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（label は試料などの識別子）。
 * </p>
 *
 * <ul>
 * <li>{@code photophys_unmixing_mix01.csv}（成分ごとの分率・濃度）</li>
 * <li>{@code photophys_unmixingResiduals_mix01.csv}（波長ごとの計算値・実測値・残差）</li>
 * <li>{@code photophys_unmixingMeta_mix01.csv}（lsq、R² などの補助情報）</li>
 * <li>{@code photophys_transferForward_mix01.csv}</li>
 * <li>{@code photophys_transferReverse_mix01.csv}、{@code ..Residuals..}、{@code ..Meta..}</li>
 * <li>{@code photophys_forster_mix01.csv}、{@code photophys_radiativeLifetime_mix01.csv}、
 * {@code photophys_oscillatorStrength_mix01.csv}（key,value 形式）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "photophys";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 多成分解析の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeUnmixing(String label, UnmixingResult result) {
        requireArguments(label, result);
        try {
            Files.createDirectories(outputDir);

            try (CSVPrinter pr = open("unmixing", label, "compoundId", "name", "concentration",
                    "initialFraction", "fittedFraction", "fittedConcentration")) {
                for (ComponentFraction c : result.getComponents()) {
                    pr.printRecord(c.getCompoundId(), c.getName(), c.getConcentration(),
                            c.getInitialFraction(), c.getFittedFraction(),
                            c.getFittedConcentration());
                }
            }

            writeResiduals("unmixingResiduals", label, result.getFitReport());

            try (CSVPrinter pr = open("unmixingMeta", label, "key", "value")) {
                printFitMeta(pr, result.getFitReport(), result.getIterations(),
                        result.isConverged());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * エネルギー移動（順方向）の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeForwardTransfer(String label, ForwardTransferResult result) {
        requireArguments(label, result);
        try {
            Files.createDirectories(outputDir);
            writeTransferComponents("transferForward", label, result.getComponents());
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * エネルギー移動（逆解析）の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeReverseTransfer(String label, ReverseTransferResult result) {
        requireArguments(label, result);
        try {
            Files.createDirectories(outputDir);
            writeTransferComponents("transferReverse", label, result.getComponents());
            writeResiduals("transferReverseResiduals", label, result.getFitReport());

            try (CSVPrinter pr = open("transferReverseMeta", label, "key", "value")) {
                pr.printRecord("totalQY", result.getTotalQuantumYield());
                printFitMeta(pr, result.getFitReport(), result.getIterations(),
                        result.isConverged());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * Förster 計算の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeForster(String label, ForsterTransferResult result) {
        requireArguments(label, result);
        writeKeyValues("forster", label,
                // J: スペクトル重なり積分
                "overlapIntegral", result.getOverlapIntegral(),
                // R0: Förster 距離（Å）
                "forsterDistance", result.getForsterDistance(),
                // E: 移動効率（%）
                "transferEfficiency", result.getTransferEfficiency(),
                // kT: 移動速度定数（s^-1）
                "transferRate", result.getTransferRate(),
                // Dexter 重なり値（eV^-1）
                "dexterOverlap", result.getDexterOverlap());
    }

    /**
     * Strickler–Berg 計算の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeRadiativeLifetime(String label, RadiativeLifetimeResult result) {
        requireArguments(label, result);
        writeKeyValues("radiativeLifetime", label,
                "integralTerm", result.getIntegralTerm(),
                "reciprocalMeanInverseCube", result.getReciprocalMeanInverseCube(),
                "naturalLifetime", result.getNaturalLifetime(),
                "radiativeRate", result.getRadiativeRate(),
                "fluorescenceLifetime", result.getFluorescenceLifetime(),
                "maxEpsilon", result.getMaxEpsilon());
    }

    /**
     * 振動子強度の結果を出力します。
     *
     * @param label 識別子です
     * @param result 結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeOscillatorStrength(String label, OscillatorStrengthResult result) {
        requireArguments(label, result);
        writeKeyValues("oscillatorStrength", label,
                "oscillatorStrength", result.getOscillatorStrength(),
                "transitionDipoleMomentDebye", result.getTransitionDipoleMomentDebye(),
                "transitionDipoleMomentCoulombMeter",
                result.getTransitionDipoleMomentCoulombMeter(),
                "peakWavelength", result.getPeakWavelength(),
                "peakEpsilon", result.getPeakEpsilon(),
                "halfWidth", result.getHalfWidth());
    }

    /**
     * エネルギー移動の成分ごとの結果を出力します。
     *
     * @param kind 量の識別子です
     * @param label 識別子です
     * @param components 成分ごとの結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeTransferComponents(String kind, String label,
            List<ComponentTransfer> components) throws IOException {
        try (CSVPrinter pr = open(kind, label, "id", "name", "E", "fracE", "QY", "T", "QYPrime")) {
            for (ComponentTransfer c : components) {
                pr.printRecord(c.getId(), c.getName(), c.getAbsorptionWeight(),
                        c.getAbsorptionFraction(), c.getQuantumYield(),
                        c.getTransferEfficiency(), c.getQuantumYieldAfterTransfer());
            }
        }
    }

    /**
     * 波長ごとの残差を出力します。
     *
     * @param kind 量の識別子です
     * @param label 識別子です
     * @param report 残差診断です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeResiduals(String kind, String label, FitReport report) throws IOException {
        try (CSVPrinter pr =
                open(kind, label, "wavelength", "calculated", "experimental", "residual")) {
            for (WavelengthResidual r : report.getResiduals()) {
                pr.printRecord(r.getWavelength(), r.getCalculated(), r.getExperimental(),
                        r.getResidual());
            }
        }
    }

    /**
     * 残差診断と探索の情報を key,value で出力します。
     *
     * @param pr 出力先です
     * @param report 残差診断です
     * @param iterations 反復回数です
     * @param converged 収束したかどうかです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void printFitMeta(CSVPrinter pr, FitReport report, int iterations,
            boolean converged) throws IOException {
        pr.printRecord("lsq", report.getLsq());
        pr.printRecord("rSquared", report.getRSquared());
        pr.printRecord("meanResidual", report.getMeanAbsoluteResidual());
        pr.printRecord("maxResidual", report.getMaxAbsoluteResidual());
        pr.printRecord("iterations", iterations);
        pr.printRecord("converged", converged);
    }

    /**
     * (key, value) ペア列を key,value 形式の CSV に出力します。
     *
     * @param kind 量の識別子です
     * @param label 識別子です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    private void writeKeyValues(String kind, String label, Object... kvPairs) {
        try {
            Files.createDirectories(outputDir);
            try (CSVPrinter pr = open(kind, label, "key", "value")) {
                for (int i = 0; i < kvPairs.length; i += 2) {
                    pr.printRecord(kvPairs[i], (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 命名規約に従ったファイルを開き、ヘッダ付きの CSVPrinter を返します。
     *
     * @param kind 量の識別子です
     * @param label 識別子です
     * @param header ヘッダです
     * @return CSVPrinter です（呼び出し側で閉じます）
     * @throws IOException 出力に失敗した場合に発生します
     */
    private CSVPrinter open(String kind, String label, String... header) throws IOException {
        Path file = outputDir.resolve(buildFileName(kind, label));
        return printer(Files.newBufferedWriter(file, StandardCharsets.UTF_8), header);
    }

    /**
     * Writer にヘッダを書き込み、CSVPrinter を返します。
     *
     * <p>
     * ヘッダの書き込みに失敗した場合は Writer を閉じてから例外を送出します。
     * </p>
     *
     * @param w 出力先です
     * @param header ヘッダです
     * @return CSVPrinter です（呼び出し側で閉じます）
     * @throws IOException 出力に失敗した場合に発生します
     */
    static CSVPrinter printer(Writer w, String... header) throws IOException {
        try {
            return CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(header).build().print(w);
        } catch (IOException | RuntimeException e) {
            try {
                w.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code photophys_unmixing_mix01.csv}（ファイル名に使えない文字は {@code _} に置換）
     * </p>
     *
     * @param kind 量の識別子です
     * @param label 識別子です
     * @return ファイル名です
     */
    static String buildFileName(String kind, String label) {
        return FILE_HEAD + "_" + kind + "_" + label.replaceAll("[^A-Za-z0-9._-]", "_") + ".csv";
    }

    private static void requireArguments(String label, Object result) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("label は必須です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
    }
}
