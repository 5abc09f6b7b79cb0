package io.github.yok.photophys.core.spectrum;

/**
 * スペクトルの測定種別を表す列挙型です。
 *
 * <p>
 * 種別によって、補間や積分で読み取る値のフィールドが切り替わります。
 * </p>
 */
public enum SpectrumKind {

    /**
     * 吸収スペクトルです（吸収係数 {@code coefficient} を読み取ります）。
     */
    ABSORPTION("absorption") {
        @Override
        public double read(SpectralSample sample) {
            return sample.getCoefficient();
        }
    },

    /**
     * 発光スペクトルです（正規化強度 {@code normalized} を読み取ります）。
     */
    EMISSION("emission") {
        @Override
        public double read(SpectralSample sample) {
            return sample.getNormalized();
        }
    };

    /**
     * ファイル名などに使う小文字のラベルです。
     */
    private final String label;

    SpectrumKind(String label) {
        this.label = label;
    }

    /**
     * この種別に対応する値をサンプルから読み取ります。
     *
     * @param sample サンプルです
     * @return 読み取った値です
     */
    public abstract double read(SpectralSample sample);

    /**
     * 小文字のラベルを返します。
     *
     * @return ラベル（absorption/emission）です
     */
    public String label() {
        return label;
    }
}
