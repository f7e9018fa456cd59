package io.github.yok.jw.core.encoder;

import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import io.github.yok.jw.core.term.WeightedPauliTerm;
import java.util.List;

/**
 * フェルミオン項 1 つを係数付き Pauli 項の列へ変換するインタフェースです。
 *
 * <p>
 * 量子ビットへの写像（Jordan–Wigner など）を差し替えるための境界です。 実装は状態を持たず、並列に呼び出せる必要があります。
 * </p>
 */
public interface TermEncoder {

    /**
     * フェルミオン項を係数付き Pauli 項の列へ変換します。
     *
     * @param term フェルミオン項です
     * @param termType 対称性クラスです
     * @param coefficient 係数です
     * @return 係数付き Pauli 項の列です（出力順は展開規則の順）
     * @throws MalformedTermException インデックス数が対称性クラスと一致しない場合に発生します
     * @throws UnsupportedTermClassException 未対応の対称性クラスの場合に発生します
     */
    List<WeightedPauliTerm> encode(FermionTerm term, FermionTermType termType, double coefficient);
}
