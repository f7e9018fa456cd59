package io.github.yok.jw.core.hamiltonian;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.jw.core.encoder.MalformedTermException;
import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 対称性クラスごとにフェルミオン項と係数を保持するハミルトニアンです。
 *
 * <p>
 * 項の追加時にスピン軌道インデックスを系インデックス集合へ登録します。 同じ項が再度追加された場合は係数を加算します。
 * </p>
 */
public final class FermionHamiltonian {

    /**
     * 対称性クラス → (項 → 係数) の対応です。
     */
    private final Map<FermionTermType, Map<FermionTerm, Double>> terms =
            new EnumMap<>(FermionTermType.class);

    /**
     * 系（スピン軌道）インデックスの集合です。
     */
    private final SortedSet<Integer> systemIndices = new TreeSet<>();

    /**
     * 項を追加します。
     *
     * @param termType 対称性クラスです（null 不可）
     * @param term フェルミオン項です（null 不可）
     * @param coefficient 係数です
     * @return このハミルトニアンです
     * @throws MalformedTermException インデックス数が対称性クラスと一致しない場合に発生します
     */
    public FermionHamiltonian addTerm(FermionTermType termType, FermionTerm term,
            double coefficient) {
        checkNotNull(termType, "termType は null 不可です");
        checkNotNull(term, "term は null 不可です");
        if (term.size() != termType.arity()) {
            throw new MalformedTermException(term, termType);
        }
        terms.computeIfAbsent(termType, k -> new LinkedHashMap<>()).merge(term, coefficient,
                Double::sum);
        systemIndices.addAll(term.getIndices());
        return this;
    }

    /**
     * 対称性クラスごとの項を返します（読み取り専用）。
     *
     * @return 対称性クラス → (項 → 係数) の対応です
     */
    public Map<FermionTermType, Map<FermionTerm, Double>> getTerms() {
        Map<FermionTermType, Map<FermionTerm, Double>> view = new EnumMap<>(FermionTermType.class);
        terms.forEach((type, bucket) -> view.put(type, Collections.unmodifiableMap(bucket)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * 系インデックス集合を返します（読み取り専用）。
     *
     * @return 系インデックス集合です
     */
    public Set<Integer> getSystemIndices() {
        return Collections.unmodifiableSortedSet(systemIndices);
    }

    /**
     * 系インデックスを登録します。
     *
     * <p>
     * 項を持たないスピン軌道も系の一部として扱う場合に使用します。
     * </p>
     *
     * @param index 系インデックスです（0 以上）
     * @return このハミルトニアンです
     * @throws IllegalArgumentException index が負の場合に発生します
     */
    public FermionHamiltonian addSystemIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("系インデックスは 0 以上が必要です: " + index);
        }
        systemIndices.add(index);
        return this;
    }

    /**
     * 系のサイズ（最大系インデックス + 1）を返します。
     *
     * @return 系のサイズです（空の場合は 0）
     */
    public int systemSize() {
        return systemIndices.isEmpty() ? 0 : systemIndices.last() + 1;
    }

    /**
     * 全クラスの項数を返します。
     *
     * @return 項数です
     */
    public int termCount() {
        int count = 0;
        for (Map<FermionTerm, Double> bucket : terms.values()) {
            count += bucket.size();
        }
        return count;
    }
}
