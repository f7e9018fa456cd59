package io.github.yok.jw.core.hamiltonian;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.jw.core.term.PauliTerm;
import io.github.yok.jw.core.term.PauliTermType;
import io.github.yok.jw.core.term.PauliTermValue;
import io.github.yok.jw.core.term.WeightedPauliTerm;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pauli 構造タグごとに Pauli 項と係数を保持するハミルトニアンです。
 *
 * <p>
 * 同じ Pauli 項が繰り返し追加された場合は、係数を成分ごとに加算します。
 * </p>
 */
public final class PauliHamiltonian {

    /**
     * 構造タグ → (Pauli 項 → 係数) の対応です。
     */
    private final Map<PauliTermType, Map<PauliTerm, PauliTermValue>> terms =
            new EnumMap<>(PauliTermType.class);

    /**
     * 系（量子ビット）インデックスの集合です。
     */
    private final SortedSet<Integer> systemIndices = new TreeSet<>();

    /**
     * 項を追加します。
     *
     * @param term Pauli 項です（null 不可）
     * @param value 係数です（null 不可）
     * @return このハミルトニアンです
     * @throws IllegalArgumentException 既存の係数と成分数が一致しない場合に発生します
     */
    public PauliHamiltonian addTerm(PauliTerm term, PauliTermValue value) {
        checkNotNull(term, "term は null 不可です");
        checkNotNull(value, "value は null 不可です");
        terms.computeIfAbsent(term.getType(), k -> new LinkedHashMap<>()).merge(term, value,
                PauliTermValue::plus);
        return this;
    }

    /**
     * 係数付き Pauli 項をまとめて追加します。
     *
     * @param weightedTerms 係数付き Pauli 項です（null 不可）
     * @return このハミルトニアンです
     */
    public PauliHamiltonian addTerms(Collection<WeightedPauliTerm> weightedTerms) {
        checkNotNull(weightedTerms, "weightedTerms は null 不可です");
        for (WeightedPauliTerm w : weightedTerms) {
            addTerm(w.getTerm(), w.getValue());
        }
        return this;
    }

    /**
     * 指定した Pauli 項の係数を返します。
     *
     * @param term Pauli 項です
     * @return 係数です（未登録の場合は空）
     */
    public Optional<PauliTermValue> coefficientOf(PauliTerm term) {
        if (term == null) {
            return Optional.empty();
        }
        Map<PauliTerm, PauliTermValue> bucket = terms.get(term.getType());
        return bucket == null ? Optional.empty() : Optional.ofNullable(bucket.get(term));
    }

    /**
     * 構造タグごとの項を返します（読み取り専用）。
     *
     * @return 構造タグ → (Pauli 項 → 係数) の対応です
     */
    public Map<PauliTermType, Map<PauliTerm, PauliTermValue>> getTerms() {
        Map<PauliTermType, Map<PauliTerm, PauliTermValue>> view =
                new EnumMap<>(PauliTermType.class);
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
     * 系インデックス集合を置き換えます（引数は複製して保持します）。
     *
     * @param indices 系インデックス集合です（null 不可）
     */
    public void setSystemIndices(Collection<Integer> indices) {
        checkNotNull(indices, "indices は null 不可です");
        systemIndices.clear();
        systemIndices.addAll(indices);
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
     * 全構造タグの項数を返します。
     *
     * @return 項数です
     */
    public int termCount() {
        int count = 0;
        for (Map<PauliTerm, PauliTermValue> bucket : terms.values()) {
            count += bucket.size();
        }
        return count;
    }
}
