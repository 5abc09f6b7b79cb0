package io.github.yok.photophys.core.spectrum;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 波長順に並んだスペクトル（化合物ID・種別・サンプル列）を保持する不変クラスです。
 *
 * <p>
 * サンプルは渡された順序のまま保持します。補間・正規化・積分の各操作は昇順のサンプル列を前提とするため、 呼び出し側は事前に
 * {@link #sortAscending()} で昇順のコピーを作成してください。
 * </p>
 *
 * <p>
 * 補間は範囲外で 0 を返し、外挿は行いません。
 * </p>
 */
@Getter
@EqualsAndHashCode(of = {"compoundId", "kind", "samples"})
@ToString(of = {"compoundId", "kind"})
public final class SpectralSeries {

    /**
     * 化合物IDです（不明な場合は空文字）。
     */
    private final String compoundId;

    /**
     * 測定種別です。
     */
    private final SpectrumKind kind;

    /**
     * サンプル列です（変更不可）。
     */
    private final List<SpectralSample> samples;

    /**
     * 波長配列です（samples と同じ順序）。
     */
    @Getter(AccessLevel.NONE)
    private final double[] wavelengths;

    /**
     * スペクトルを作成します。
     *
     * @param compoundId 化合物IDです（null は空文字として扱います）
     * @param kind 測定種別です
     * @param samples サンプル列です
     * @throws NullPointerException kind または samples が null の場合
     */
    public SpectralSeries(String compoundId, SpectrumKind kind, List<SpectralSample> samples) {
        Preconditions.checkNotNull(kind, "kind が null です。");
        Preconditions.checkNotNull(samples, "samples が null です。");
        this.compoundId = (compoundId == null) ? "" : compoundId;
        this.kind = kind;
        List<SpectralSample> copy = new ArrayList<>(samples.size());
        for (SpectralSample s : samples) {
            copy.add(Preconditions.checkNotNull(s, "samples に null が含まれています。"));
        }
        this.samples = Collections.unmodifiableList(copy);
        this.wavelengths = new double[copy.size()];
        for (int i = 0; i < copy.size(); i++) {
            this.wavelengths[i] = copy.get(i).getWavelength();
        }
    }

    /**
     * 波長と値の配列からスペクトルを作成します。
     *
     * @param compoundId 化合物IDです
     * @param kind 測定種別です
     * @param wavelengths 波長配列です
     * @param values 値の配列です（kind に対応するフィールドへ設定します）
     * @return スペクトルです
     * @throws IllegalArgumentException 配列長が一致しない場合
     */
    public static SpectralSeries of(String compoundId, SpectrumKind kind, double[] wavelengths,
            double[] values) {
        Preconditions.checkArgument(wavelengths.length == values.length,
                "波長と値の配列長が一致しません: %s vs %s", wavelengths.length, values.length);
        List<SpectralSample> list = new ArrayList<>(wavelengths.length);
        for (int i = 0; i < wavelengths.length; i++) {
            list.add(SpectralSample.of(kind, wavelengths[i], values[i]));
        }
        return new SpectralSeries(compoundId, kind, list);
    }

    /**
     * サンプル数を返します。
     *
     * @return サンプル数です
     */
    public int size() {
        return samples.size();
    }

    /**
     * サンプルが1つもないかどうかを返します。
     *
     * @return 空なら true です
     */
    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * 指定位置のサンプルを返します。
     *
     * @param index 位置です
     * @return サンプルです
     */
    public SpectralSample get(int index) {
        return samples.get(index);
    }

    /**
     * 先頭と末尾の波長から、昇順で格納されているかどうかを判定します。
     *
     * @return 昇順（または要素数 1 以下）なら true です
     */
    public boolean isStoredAscending() {
        int n = wavelengths.length;
        return n <= 1 || wavelengths[0] <= wavelengths[n - 1];
    }

    /**
     * 波長の昇順に並べ替えた新しいスペクトルを返します（自身は変更しません）。
     *
     * <p>
     * 同じ波長のサンプルは元の順序を保ちます（安定ソート）。
     * </p>
     *
     * @return 昇順のスペクトルです
     */
    public SpectralSeries sortAscending() {
        List<SpectralSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparingDouble(SpectralSample::getWavelength));
        return new SpectralSeries(compoundId, kind, sorted);
    }

    /**
     * 自身の種別の値を、指定波長で線形補間して返します。
     *
     * @param wavelength 波長（nm）です
     * @return 補間値です（範囲外は 0）
     */
    public double valueAt(double wavelength) {
        return valueAt(wavelength, kind);
    }

    /**
     * 指定種別の値を、指定波長で線形補間して返します。
     *
     * <ul>
     * <li>空のスペクトルは 0 を返します</li>
     * <li>サンプルが 1 点のみの場合はその値を返します</li>
     * <li>[先頭波長, 末尾波長] の範囲外は 0 を返します（外挿しません）</li>
     * <li>波長が一致するサンプルがあればその値をそのまま返します</li>
     * </ul>
     *
     * @param wavelength 波長（nm）です
     * @param valueKind 読み取る値の種別です
     * @return 補間値です
     */
    public double valueAt(double wavelength, SpectrumKind valueKind) {
        return interpolate(wavelengths, values(valueKind), wavelength);
    }

    /**
     * 自身の種別の値を min-max 正規化した上で、指定波長で線形補間して返します。
     *
     * @param wavelength 波長（nm）です
     * @return 正規化空間での補間値です（範囲外は 0）
     */
    public double normalizedValueAt(double wavelength) {
        return normalizedValueAt(wavelength, kind);
    }

    /**
     * 指定種別の値を min-max 正規化した上で、指定波長で線形補間して返します。
     *
     * <p>
     * 全サンプルが同じ値（max == min）の場合、正規化値はすべて 0.5 になります。
     * </p>
     *
     * @param wavelength 波長（nm）です
     * @param valueKind 読み取る値の種別です
     * @return 正規化空間での補間値です
     */
    public double normalizedValueAt(double wavelength, SpectrumKind valueKind) {
        return interpolate(wavelengths, normalizedValues(valueKind), wavelength);
    }

    /**
     * 自身の種別の値を min-max 正規化した新しいスペクトルを返します。
     *
     * @return 正規化したスペクトルです
     */
    public SpectralSeries normalized() {
        return of(compoundId, kind, wavelengths.clone(), normalizedValues(kind));
    }

    /**
     * 指定種別の値の最大値を返します。
     *
     * @param valueKind 読み取る値の種別です
     * @return 最大値です（空の場合は NaN）
     */
    public double maxValue(SpectrumKind valueKind) {
        double max = Double.NaN;
        for (SpectralSample s : samples) {
            double v = valueKind.read(s);
            if (Double.isNaN(max) || v > max) {
                max = v;
            }
        }
        return max;
    }

    /**
     * 自身の種別の値で台形積分した面積を返します。
     *
     * @param domain 積分の横軸です
     * @return 面積です
     */
    public double areaTrapezoid(SpectralDomain domain) {
        return areaTrapezoid(domain, kind);
    }

    /**
     * 指定種別の値で台形積分した面積 {@code Σ Δx·(y1+y2)/2} を返します。
     *
     * <p>
     * {@link SpectralDomain#WAVELENGTH} では Δx は波長差、{@link SpectralDomain#WAVENUMBER} では
     * {@code |1e7/λ1 - 1e7/λ2|} です。
     * </p>
     *
     * @param domain 積分の横軸です
     * @param valueKind 読み取る値の種別です
     * @return 面積です
     */
    public double areaTrapezoid(SpectralDomain domain, SpectrumKind valueKind) {
        Preconditions.checkNotNull(domain, "domain が null です。");
        double area = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            SpectralSample p1 = samples.get(i - 1);
            SpectralSample p2 = samples.get(i);
            double dx = (domain == SpectralDomain.WAVELENGTH)
                    ? Math.abs(p2.getWavelength() - p1.getWavelength())
                    : Wavenumbers.spacing(p1.getWavelength(), p2.getWavelength());
            area += dx * (valueKind.read(p1) + valueKind.read(p2)) / 2.0;
        }
        return area;
    }

    /**
     * 発光強度から、Strickler–Berg 式などで使う面積と ν⁻³ 重み付き面積を計算します。
     *
     * @return 面積の組です
     */
    public EmissionAreas emissionAreas() {
        double area = 0.0;
        double inverseCube = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            SpectralSample p1 = samples.get(i - 1);
            SpectralSample p2 = samples.get(i);
            double v1 = Wavenumbers.fromWavelength(p1.getWavelength());
            double v2 = Wavenumbers.fromWavelength(p2.getWavelength());
            double dl = Math.abs(p2.getWavelength() - p1.getWavelength());
            double i1 = p1.getNormalized();
            double i2 = p2.getNormalized();
            area += Wavenumbers.NM_TO_WAVENUMBER * dl * (i1 + i2) / 2.0;
            inverseCube += Wavenumbers.NM_TO_WAVENUMBER * dl
                    * (i1 / (v1 * v1 * v1) + i2 / (v2 * v2 * v2)) / 2.0;
        }
        return new EmissionAreas(area, inverseCube);
    }

    /**
     * 指定種別の値の配列を返します。
     *
     * @param valueKind 種別です
     * @return 値の配列です
     */
    private double[] values(SpectrumKind valueKind) {
        double[] ys = new double[samples.size()];
        for (int i = 0; i < ys.length; i++) {
            ys[i] = valueKind.read(samples.get(i));
        }
        return ys;
    }

    /**
     * 指定種別の値を min-max 正規化した配列を返します。
     *
     * @param valueKind 種別です
     * @return 正規化した値の配列です
     */
    private double[] normalizedValues(SpectrumKind valueKind) {
        double[] ys = values(valueKind);
        if (ys.length == 0) {
            return ys;
        }
        double min = ys[0];
        double max = ys[0];
        for (double y : ys) {
            min = Math.min(min, y);
            max = Math.max(max, y);
        }
        double range = max - min;
        for (int i = 0; i < ys.length; i++) {
            ys[i] = (range != 0.0) ? (ys[i] - min) / range : 0.5;
        }
        return ys;
    }

    /**
     * 昇順の (x, y) 列に対して、二分探索で挟み込む2点を求めて線形補間します。
     *
     * @param xs 昇順の波長配列です
     * @param ys 値の配列です
     * @param x 補間する波長です
     * @return 補間値です
     */
    private static double interpolate(double[] xs, double[] ys, double x) {
        int n = xs.length;
        if (n == 0) {
            return 0.0;
        }
        if (n == 1) {
            return ys[0];
        }
        if (Double.isNaN(x) || x < xs[0] || x > xs[n - 1]) {
            return 0.0;
        }
        if (xs[0] == x) {
            return ys[0];
        }
        if (xs[n - 1] == x) {
            return ys[n - 1];
        }

        int low = 0;
        int high = n - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (xs[mid] == x) {
                return ys[mid];
            }
            if (xs[mid] > x) {
                high = mid - 1;
            } else {
                low = mid + 1;
            }
        }

        // ここでは xs[high] < x < xs[low]
        return ys[high] + (ys[low] - ys[high]) * (x - xs[high]) / (xs[low] - xs[high]);
    }
}
