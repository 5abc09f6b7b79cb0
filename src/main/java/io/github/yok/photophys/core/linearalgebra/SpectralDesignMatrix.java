package io.github.yok.photophys.core.linearalgebra;

import com.google.common.base.Preconditions;
import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 解析波長 × 成分の正規化強度行列 A を EJML で保持するクラスです。
 *
 * <p>
 * 行が解析波長、列が成分スペクトルです。重みベクトル w に対する再構成スペクトルは {@code A·w} です。
 * </p>
 */
public final class SpectralDesignMatrix {

    /**
     * 強度行列です（行=波長、列=成分）。
     */
    private final DMatrixRMaj matrix;

    /**
     * 強度行列を保持します。
     *
     * @param matrix 強度行列です
     */
    private SpectralDesignMatrix(DMatrixRMaj matrix) {
        this.matrix = matrix;
    }

    /**
     * 各成分スペクトルを解析波長で正規化補間し、強度行列を作成します。
     *
     * @param wavelengths 解析波長です（昇順・重複なしを想定）
     * @param components 成分スペクトルです（昇順に並べ替え済みであること）
     * @param valueKind 読み取る値の種別です
     * @return 強度行列です
     * @throws IllegalArgumentException 波長または成分が空の場合
     */
    public static SpectralDesignMatrix sampleNormalized(double[] wavelengths,
            List<SpectralSeries> components, SpectrumKind valueKind) {
        Preconditions.checkArgument(wavelengths.length > 0, "解析波長が空です。");
        Preconditions.checkArgument(!components.isEmpty(), "成分スペクトルが空です。");

        DMatrixRMaj a = new DMatrixRMaj(wavelengths.length, components.size());
        for (int col = 0; col < components.size(); col++) {
            SpectralSeries series = components.get(col);
            for (int row = 0; row < wavelengths.length; row++) {
                a.set(row, col, series.normalizedValueAt(wavelengths[row], valueKind));
            }
        }
        return new SpectralDesignMatrix(a);
    }

    /**
     * 解析波長の数（行数）を返します。
     *
     * @return 行数です
     */
    public int rows() {
        return matrix.numRows;
    }

    /**
     * 成分の数（列数）を返します。
     *
     * @return 列数です
     */
    public int columns() {
        return matrix.numCols;
    }

    /**
     * 指定位置の強度を返します。
     *
     * @param row 波長の番号です
     * @param col 成分の番号です
     * @return 正規化強度です
     */
    public double get(int row, int col) {
        return matrix.get(row, col);
    }

    /**
     * 重み付き線形結合 {@code A·w} を計算します。
     *
     * @param weights 成分ごとの重みです（長さ=列数）
     * @return 波長ごとの再構成値です
     * @throws IllegalArgumentException 重みの長さが列数と一致しない場合
     */
    public double[] combine(double[] weights) {
        Preconditions.checkArgument(weights.length == matrix.numCols,
                "重みの長さが成分数と一致しません: %s vs %s", weights.length, matrix.numCols);
        DMatrixRMaj w = DMatrixRMaj.wrap(weights.length, 1, weights.clone());
        DMatrixRMaj out = new DMatrixRMaj(matrix.numRows, 1);
        CommonOps_DDRM.mult(matrix, w, out);
        double[] result = new double[matrix.numRows];
        System.arraycopy(out.data, 0, result, 0, matrix.numRows);
        return result;
    }

    /**
     * 再構成値と観測値の差の二乗和の平方根 {@code sqrt(Σ(A·w - y)²)} を計算します。
     *
     * @param weights 成分ごとの重みです
     * @param observed 波長ごとの観測値です（長さ=行数）
     * @return 残差ノルム（lsq）です
     */
    public double residualNorm(double[] weights, double[] observed) {
        Preconditions.checkArgument(observed.length == matrix.numRows,
                "観測値の長さが波長数と一致しません: %s vs %s", observed.length, matrix.numRows);
        double[] calc = combine(weights);
        double sumSq = 0.0;
        for (int i = 0; i < calc.length; i++) {
            double r = calc[i] - observed[i];
            sumSq += r * r;
        }
        return Math.sqrt(sumSq);
    }
}
