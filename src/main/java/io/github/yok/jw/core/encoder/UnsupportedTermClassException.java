package io.github.yok.jw.core.encoder;

import io.github.yok.jw.core.term.FermionTermType;
import lombok.Getter;

/**
 * エンコーダが扱えない対称性クラスが渡された場合に発生する例外です。
 */
@Getter
public class UnsupportedTermClassException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    /**
     * 渡された対称性クラスです（null の場合があります）。
     */
    private final FermionTermType termType;

    /**
     * 例外を生成します。
     *
     * @param termType 渡された対称性クラスです
     */
    public UnsupportedTermClassException(FermionTermType termType) {
        super("未対応の対称性クラスです: " + termType);
        this.termType = termType;
    }
}
