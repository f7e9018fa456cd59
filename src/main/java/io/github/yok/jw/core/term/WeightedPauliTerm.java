package io.github.yok.jw.core.term;

import lombok.Value;

/**
 * Pauli 項と係数の組（変換出力の最小単位）を保持するクラスです。
 */
@Value
public class WeightedPauliTerm {

    /**
     * Pauli 項です。
     */
    PauliTerm term;

    /**
     * 係数です。
     */
    PauliTermValue value;
}
