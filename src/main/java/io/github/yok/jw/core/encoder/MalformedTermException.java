package io.github.yok.jw.core.encoder;

import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import lombok.Getter;

/**
 * フェルミオン項のインデックス数が対称性クラスの要求と一致しない場合に発生する例外です。
 */
@Getter
public class MalformedTermException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 不正な項です。
     */
    private final transient FermionTerm term;

    /**
     * 宣言された対称性クラスです。
     */
    private final FermionTermType termType;

    /**
     * 例外を生成します。
     *
     * @param term 不正な項です
     * @param termType 宣言された対称性クラスです
     */
    public MalformedTermException(FermionTerm term, FermionTermType termType) {
        super("インデックス数が対称性クラスと一致しません: type=" + termType + ", 要求="
                + termType.arity() + ", 実際=" + term.size() + ", term=" + term.getIndices());
        this.term = term;
        this.termType = termType;
    }
}
