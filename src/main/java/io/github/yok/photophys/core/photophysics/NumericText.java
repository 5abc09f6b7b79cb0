package io.github.yok.photophys.core.photophysics;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 化合物メタデータの文字列（例：{@code "12,500 (in MeOH)"}）から数値を取り出すユーティリティです。
 */
public final class NumericText {

    private static final Pattern FIRST_NUMBER =
            Pattern.compile("[-+]?\\d*\\.?\\d+(?:[eE][-+]?\\d+)?");

    private NumericText() {}

    /**
     * 文字列中の最初の数値を返します。桁区切りのカンマは無視します。
     *
     * @param text 文字列です（null 可）
     * @return 数値です（見つからない、または有限でない場合は空）
     */
    public static OptionalDouble parseFirstNumber(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher m = FIRST_NUMBER.matcher(text.replace(",", ""));
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        double v = Double.parseDouble(m.group());
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }
}
