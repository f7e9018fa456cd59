package io.github.yok.jw.core.encoder;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import io.github.yok.jw.core.term.PauliTerm;
import io.github.yok.jw.core.term.PauliTermType;
import io.github.yok.jw.core.term.PauliTermValue;
import io.github.yok.jw.core.term.WeightedPauliTerm;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Jordan–Wigner 写像によりフェルミオン項を Pauli 項へ展開するクラスです。
 *
 * <p>
 * 対称性クラスごとの展開規則（係数は入力係数の有理数倍）は以下のとおりです。
 * </p>
 * <ul>
 * <li>IDENTITY: {@code (I, c)}</li>
 * <li>PP: {@code (I, c/2)}, {@code (Z_p, -c/2)}</li>
 * <li>PQ: {@code (PQ_{pq}, c/4)}</li>
 * <li>PQQP: {@code (Z_p Z_q, -c/4)}, {@code (Z_p, -c/4)}, {@code (Z_q, c/4)}</li>
 * <li>PQQR: p,q,q,r の順に並べ替えたうえで {@code (PQQR, -c m/8)}, {@code (PQ_{pr}, c m/8)}（m は並べ替えの符号）</li>
 * <li>PQRS: 昇順に並べ替え、{@link PermutationClassifier} の 4 成分係数で {@code (V01234, v)}</li>
 * </ul>
 */
public final class JordanWignerTermEncoder implements TermEncoder {

    /**
     * PQRS 項の置換分類器です。
     */
    private final PermutationClassifier permutationClassifier;

    /**
     * エンコーダを生成します。
     *
     * @param permutationClassifier PQRS 項の置換分類器です（null 不可）
     */
    public JordanWignerTermEncoder(PermutationClassifier permutationClassifier) {
        this.permutationClassifier =
                checkNotNull(permutationClassifier, "permutationClassifier は null 不可です");
    }

    @Override
    public List<WeightedPauliTerm> encode(FermionTerm term, FermionTermType termType,
            double coefficient) {
        checkNotNull(term, "term は null 不可です");
        if (termType == null) {
            throw new UnsupportedTermClassException(null);
        }
        if (term.size() != termType.arity()) {
            throw new MalformedTermException(term, termType);
        }

        List<WeightedPauliTerm> out = new ArrayList<>(3);

        // 並べ替え用の作業コピーです。
        int[] seq = term.toArray();

        switch (termType) {
            case IDENTITY:
                out.add(weighted(PauliTerm.identity(), coefficient));
                break;

            case PP:
                out.add(weighted(PauliTerm.identity(), 0.5 * coefficient));
                out.add(weighted(PauliTerm.of(PauliTermType.Z, seq[0]), -0.5 * coefficient));
                break;

            case PQ:
                out.add(weighted(PauliTerm.of(PauliTermType.PQ, seq), 0.25 * coefficient));
                break;

            case PQQP:
                out.add(weighted(PauliTerm.of(PauliTermType.ZZ, seq[0], seq[1]),
                        -0.25 * coefficient));
                out.add(weighted(PauliTerm.of(PauliTermType.Z, seq[0]), -0.25 * coefficient));
                out.add(weighted(PauliTerm.of(PauliTermType.Z, seq[1]), 0.25 * coefficient));
                break;

            case PQQR:
                encodePqqr(seq, coefficient, out);
                break;

            case PQRS:
                int[] sorted = seq.clone();
                Arrays.sort(sorted);
                PermutationClassification classified =
                        permutationClassifier.classify(sorted, seq, coefficient);
                out.add(new WeightedPauliTerm(
                        PauliTerm.of(PauliTermType.V01234, classified.getSorted()),
                        PauliTermValue.of(classified.getCoefficients())));
                break;

            default:
                throw new UnsupportedTermClassException(termType);
        }
        return out;
    }

    /**
     * PQQR 項を p,q,q,r の順に並べ替えて展開します。
     *
     * @param seq インデックス列の作業コピーです（並べ替えで上書きします）
     * @param coefficient 係数です
     * @param out 出力先です
     */
    private static void encodePqqr(int[] seq, double coefficient, List<WeightedPauliTerm> out) {
        double multiplier = 1.0;
        if (seq[0] == seq[3]) {
            // q p r q の並び。順に代入して p q q r にします（seq[2] には更新後の seq[1] が入ります）。
            seq[0] = seq[1];
            seq[1] = seq[3];
            seq[3] = seq[2];
            seq[2] = seq[1];
        } else if (seq[1] == seq[3]) {
            // p q r q の並び
            seq[3] = seq[2];
            seq[2] = seq[1];
            multiplier = -1.0;
        }
        out.add(weighted(PauliTerm.of(PauliTermType.PQQR, seq), -0.125 * multiplier * coefficient));
        out.add(weighted(PauliTerm.of(PauliTermType.PQ, seq[0], seq[3]),
                0.125 * multiplier * coefficient));
    }

    private static WeightedPauliTerm weighted(PauliTerm term, double coefficient) {
        return new WeightedPauliTerm(term, PauliTermValue.of(coefficient));
    }
}
