package io.github.yok.jw.core.encoder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Arrays;

/**
 * PQRS 項の観測順序がどの置換クラスに属するかを判定し、4 成分係数を計算するクラスです。
 *
 * <p>
 * 昇順インデックス (p, q, r, s) に対して、扱う置換は pqrs, psqr, prsq, qprs, spqr, prqs の 6 通りです。
 * 符号補正が必要なのは prsq, pqsr, psrq の参照順序に一致した場合のみで、それ以外は補正なし (h = 0) として扱います。
 * </p>
 *
 * <p>
 * 比較は prsq, pqsr, psrq の順で行います。
 * </p>
 */
public final class PermutationClassifier {

    /**
     * 入力係数に掛ける Jordan–Wigner 前因子 (1/16) です。
     */
    static final double PREFACTOR = 0.0625;

    /**
     * 置換を分類し、4 成分係数を計算します。
     *
     * <ul>
     * <li>{@code c = coeff / 16}</li>
     * <li>prsq → {@code h = (0, 0, c)}、pqsr → {@code h = (-c, 0, 0)}、psrq → {@code h = (0, -c, 0)}、その他 →
     * {@code h = (0, 0, 0)}</li>
     * <li>{@code v = (-h0-h1+h2, h0-h1+h2, -h0-h1-h2, -h0+h1+h2)}</li>
     * </ul>
     *
     * @param sorted 昇順に並べたインデックス (p, q, r, s) です（長さ 4）
     * @param permuted 観測されたインデックス順序です（長さ 4）
     * @param coefficient 係数です
     * @return 分類結果（sorted はそのまま返します）
     * @throws IllegalArgumentException 配列長が 4 でない場合に発生します
     */
    public PermutationClassification classify(int[] sorted, int[] permuted, double coefficient) {
        checkNotNull(sorted, "sorted は null 不可です");
        checkNotNull(permuted, "permuted は null 不可です");
        checkArgument(sorted.length == 4, "sorted は長さ 4 が必要です: %s", sorted.length);
        checkArgument(permuted.length == 4, "permuted は長さ 4 が必要です: %s", permuted.length);

        double c = coefficient * PREFACTOR;

        int p = sorted[0];
        int q = sorted[1];
        int r = sorted[2];
        int s = sorted[3];

        int[] prsq = {p, r, s, q};
        int[] pqsr = {p, q, s, r};
        int[] psrq = {p, s, r, q};

        double h0 = 0.0;
        double h1 = 0.0;
        double h2 = 0.0;

        if (Arrays.equals(permuted, prsq)) {
            h2 = c;
        } else if (Arrays.equals(permuted, pqsr)) {
            h0 = -c;
        } else if (Arrays.equals(permuted, psrq)) {
            h1 = -c;
        }

        double[] v = {-h0 - h1 + h2, h0 - h1 + h2, -h0 - h1 - h2, -h0 + h1 + h2};

        return new PermutationClassification(sorted, v);
    }
}
