package io.github.yok.jw.core.encoder;

import lombok.Value;

/**
 * 4 インデックス項の置換分類結果を保持するクラスです。
 */
@Value
public class PermutationClassification {

    /**
     * 昇順に並べたインデックス (p, q, r, s) です。
     */
    int[] sorted;

    /**
     * 反対称化された 4 成分係数 (v0, v1, v2, v3) です。
     */
    double[] coefficients;
}
