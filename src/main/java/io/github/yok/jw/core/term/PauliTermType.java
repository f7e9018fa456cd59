package io.github.yok.jw.core.term;

/**
 * Pauli 項の構造タグを表す列挙型です。
 */
public enum PauliTermType {

    /**
     * 恒等演算子です。
     */
    IDENTITY,

    /**
     * 単一量子ビットの Z です。
     */
    Z,

    /**
     * 2 量子ビットの ZZ です。
     */
    ZZ,

    /**
     * 2 インデックス励起の Jordan–Wigner 文字列（p..q 間の Z 列を含む XX + YY）です。
     */
    PQ,

    /**
     * 縮退 2 体項 PQQR に対応する Jordan–Wigner 文字列です。
     */
    PQQR,

    /**
     * 4 インデックス 2 体項の反対称化された 4 成分演算子です。
     *
     * <p>
     * 係数は 4 成分ベクトル {@code (v0, v1, v2, v3)} で与えられます。
     * </p>
     */
    V01234
}
