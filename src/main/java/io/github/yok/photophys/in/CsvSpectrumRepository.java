package io.github.yok.photophys.in;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.SpectralSample;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * ディレクトリ上の CSV からスペクトルを読み込むクラスです。
 *
 * <p>
 * ファイル名は {@code <化合物ID>_<absorption|emission>.csv}、ヘッダは {@code wavelength,value} です。
 * 行はファイルの順のまま保持します（並べ替えは解析側で行います）。
 * </p>
 */
@Slf4j
public final class CsvSpectrumRepository implements SpectrumRepository {

    /**
     * 波長列のヘッダ名です。
     */
    static final String WAVELENGTH = "wavelength";

    /**
     * 値列のヘッダ名です。
     */
    static final String VALUE = "value";

    /**
     * 入力 CSV の書式です。
     */
    private static final CSVFormat FORMAT = CSVFormat.Builder.create(CSVFormat.DEFAULT)
            .setHeader().setSkipHeaderRecord(true).setIgnoreEmptyLines(true).setTrim(true)
            .build();

    /**
     * 入力ディレクトリです。
     */
    private final Path inputDir;

    /**
     * CSV 入力を生成します。
     *
     * @param inputDir 入力ディレクトリです
     * @throws IllegalArgumentException 入力ディレクトリが空の場合に発生します
     */
    public CsvSpectrumRepository(String inputDir) {
        Preconditions.checkArgument(inputDir != null && !inputDir.isEmpty(), "input.dir は必須です");
        this.inputDir = Paths.get(inputDir);
    }

    /**
     * スペクトルを読み込みます。
     *
     * @param compoundId 化合物IDです
     * @param kind 種別です
     * @return スペクトルです（ファイルがない場合は空）
     * @throws UncheckedIOException 読み込みに失敗した場合に発生します
     * @throws IllegalStateException 数値として読めない行がある場合に発生します
     */
    @Override
    public Optional<SpectralSeries> findSpectrum(String compoundId, SpectrumKind kind) {
        Preconditions.checkArgument(compoundId != null && !compoundId.isEmpty(),
                "compoundId は必須です");
        Preconditions.checkNotNull(kind, "kind が null です。");

        Path file = inputDir.resolve(fileName(compoundId, kind));
        if (!Files.isRegularFile(file)) {
            log.warn("スペクトルのファイルがありません: {}", file);
            return Optional.empty();
        }

        List<SpectralSample> samples = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = FORMAT.parse(r)) {
            for (CSVRecord rec : parser) {
                samples.add(SpectralSample.of(kind, parse(rec, WAVELENGTH, file),
                        parse(rec, VALUE, file)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("スペクトルの読み込みに失敗しました: " + file, e);
        }

        log.debug("スペクトルを読み込みました: {}（{}点）", file, samples.size());
        return Optional.of(new SpectralSeries(compoundId, kind, samples));
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code coumarin153_emission.csv}
     * </p>
     *
     * @param compoundId 化合物IDです
     * @param kind 種別です
     * @return ファイル名です
     */
    static String fileName(String compoundId, SpectrumKind kind) {
        return compoundId + "_" + kind.label() + ".csv";
    }

    private static double parse(CSVRecord rec, String column, Path file) {
        String text = rec.get(column);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("数値として読めません: " + file + " 行="
                    + rec.getRecordNumber() + " 列=" + column + " 値=" + text, e);
        }
    }
}
