package io.github.yok.eeg.core.metric;

/**
 * 電位ベクトルから参照電位の不定性（加法定数）を取り除くクラスです。
 *
 * <p>
 * EEG の電位は定数分の自由度を持つため、比較前に数値解・解析解の双方へ同じ平均値減算を適用します。 入力配列は変更せず、新しい配列を返します。
 * </p>
 */
public final class PotentialNormalizer {

    private PotentialNormalizer() {}

    /**
     * 算術平均を返します。
     *
     * @param potentials 電位ベクトルです（null 不可、長さ 1 以上）
     * @return 平均値です
     * @throws IllegalArgumentException null または空の場合に発生します
     */
    public static double mean(double[] potentials) {
        requireNonEmpty(potentials);
        double s = 0.0;
        for (double v : potentials) {
            s += v;
        }
        return s / potentials.length;
    }

    /**
     * 平均値を減算した新しい電位ベクトルを返します。
     *
     * <p>
     * 全要素が等しい場合は全要素 0 のベクトルになります（例外にはしません）。
     * </p>
     *
     * @param potentials 電位ベクトルです（null 不可、長さ 1 以上）
     * @return 平均 0 の電位ベクトルです
     * @throws IllegalArgumentException null または空の場合に発生します
     */
    public static double[] subtractMean(double[] potentials) {
        double m = mean(potentials);
        double[] out = new double[potentials.length];
        for (int i = 0; i < potentials.length; i++) {
            out[i] = potentials[i] - m;
        }
        return out;
    }

    private static void requireNonEmpty(double[] potentials) {
        if (potentials == null) {
            throw new IllegalArgumentException("potentials は null 不可です");
        }
        if (potentials.length == 0) {
            throw new IllegalArgumentException("空の電位ベクトルは平均を定義できません");
        }
    }
}
