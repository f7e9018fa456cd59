package io.github.yok.jw.core.term;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import lombok.Value;

/**
 * Pauli 項（量子ビットインデックス列と構造タグの組）を表す値オブジェクトです。
 *
 * <p>
 * インデックス列は生成時の順序をそのまま保持し、以後並べ替えません。
 * </p>
 */
@Value
public class PauliTerm {

    /**
     * 量子ビットインデックス列です。
     */
    ImmutableList<Integer> qubits;

    /**
     * Pauli 構造タグです。
     */
    PauliTermType type;

    private PauliTerm(ImmutableList<Integer> qubits, PauliTermType type) {
        this.qubits = qubits;
        this.type = type;
    }

    /**
     * Pauli 項を生成します。
     *
     * @param type Pauli 構造タグです（null 不可）
     * @param qubits 量子ビットインデックス列です（null 不可、各要素 0 以上）
     * @return Pauli 項です
     * @throws NullPointerException type または qubits が null の場合に発生します
     * @throws IllegalArgumentException 負のインデックスを含む場合に発生します
     */
    public static PauliTerm of(PauliTermType type, int... qubits) {
        checkNotNull(type, "type は null 不可です");
        checkNotNull(qubits, "qubits は null 不可です");
        for (int qubit : qubits) {
            checkArgument(qubit >= 0, "量子ビットインデックスは 0 以上が必要です: %s", qubit);
        }
        return new PauliTerm(ImmutableList.copyOf(Ints.asList(qubits)), type);
    }

    /**
     * 恒等項を返します。
     *
     * @return 恒等項です
     */
    public static PauliTerm identity() {
        return new PauliTerm(ImmutableList.of(), PauliTermType.IDENTITY);
    }
}
