package io.github.yok.jw.core.term;

/**
 * フェルミオン項の対称性クラスを表す列挙型です。
 *
 * <p>
 * クラスごとにインデックス列の長さ（アリティ）と、Jordan–Wigner 変換で適用する展開規則が決まります。
 * </p>
 */
public enum FermionTermType {

    /**
     * 恒等項です（インデックスなし）。
     */
    IDENTITY(0),

    /**
     * 数演算子 {@code a†_p a_p} です。
     */
    PP(1),

    /**
     * 1 体励起 {@code a†_p a_q} です。
     */
    PQ(2),

    /**
     * 密度-密度項 {@code a†_p a†_q a_q a_p} です。
     */
    PQQP(2),

    /**
     * 縮退したインデックス対を含む 2 体項 {@code a†_p a†_q a_q a_r} です。
     */
    PQQR(4),

    /**
     * 4 つの異なるインデックスを持つ一般の 2 体項 {@code a†_p a†_q a_r a_s} です。
     */
    PQRS(4);

    /**
     * インデックス列の長さです。
     */
    private final int arity;

    FermionTermType(int arity) {
        this.arity = arity;
    }

    /**
     * このクラスが要求するインデックス列の長さを返します。
     *
     * @return インデックス列の長さです
     */
    public int arity() {
        return arity;
    }
}
