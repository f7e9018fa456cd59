package io.github.yok.jw.core.encoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import io.github.yok.jw.core.term.PauliTerm;
import io.github.yok.jw.core.term.PauliTermType;
import io.github.yok.jw.core.term.WeightedPauliTerm;
import java.util.List;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

/**
 * JordanWignerTermEncoder の単体テストです。
 */
class JordanWignerTermEncoderTest {

    private static final Offset<Double> TOL = within(1e-12);

    private final JordanWignerTermEncoder encoder =
            new JordanWignerTermEncoder(new PermutationClassifier());

    // ------------------------------------------------------------------
    // IDENTITY / PP / PQ / PQQP
    // ------------------------------------------------------------------

    @Test
    void identity_emitsSingleIdentityTermWithSameCoefficient() {
        List<WeightedPauliTerm> out = encoder.encode(FermionTerm.of(), FermionTermType.IDENTITY, 2.0);

        assertThat(out).hasSize(1);
        assertTerm(out.get(0), PauliTerm.identity(), 2.0);
    }

    @Test
    void numberOperator_emitsIdentityAndZ() {
        List<WeightedPauliTerm> out = encoder.encode(FermionTerm.of(3), FermionTermType.PP, 1.0);

        assertThat(out).hasSize(2);
        assertTerm(out.get(0), PauliTerm.identity(), 0.5);
        assertTerm(out.get(1), PauliTerm.of(PauliTermType.Z, 3), -0.5);
        assertThat(out.get(0).getValue().get(0) + out.get(1).getValue().get(0)).isCloseTo(0.0, TOL);
    }

    @Test
    void excitation_emitsJordanWignerStringWithQuarterWeight() {
        List<WeightedPauliTerm> out = encoder.encode(FermionTerm.of(1, 4), FermionTermType.PQ, 2.0);

        assertThat(out).hasSize(1);
        assertTerm(out.get(0), PauliTerm.of(PauliTermType.PQ, 1, 4), 0.5);
    }

    @Test
    void densityDensity_emitsZzAndTwoZ() {
        List<WeightedPauliTerm> out = encoder.encode(FermionTerm.of(1, 2), FermionTermType.PQQP, 4.0);

        assertThat(out).hasSize(3);
        assertTerm(out.get(0), PauliTerm.of(PauliTermType.ZZ, 1, 2), -1.0);
        assertTerm(out.get(1), PauliTerm.of(PauliTermType.Z, 1), -1.0);
        assertTerm(out.get(2), PauliTerm.of(PauliTermType.Z, 2), 1.0);

        double sum = out.stream().mapToDouble(w -> w.getValue().get(0)).sum();
        assertThat(sum).isCloseTo(-0.25 * 4.0, TOL);
    }

    // ------------------------------------------------------------------
    // PQQR
    // ------------------------------------------------------------------

    @Test
    void pqqr_firstEqualsLast_isReorderedWithPositiveSign() {
        // q p r q = 3 1 2 3 -> p q q r = 1 3 3 2
        List<WeightedPauliTerm> out =
                encoder.encode(FermionTerm.of(3, 1, 2, 3), FermionTermType.PQQR, 8.0);

        assertThat(out).hasSize(2);
        assertTerm(out.get(0), PauliTerm.of(PauliTermType.PQQR, 1, 3, 3, 2), -1.0);
        assertTerm(out.get(1), PauliTerm.of(PauliTermType.PQ, 1, 2), 1.0);
    }

    @Test
    void pqqr_secondEqualsFourth_isReorderedWithNegativeSign() {
        // p q r q = 1 3 2 3 -> p q q r = 1 3 3 2
        List<WeightedPauliTerm> out =
                encoder.encode(FermionTerm.of(1, 3, 2, 3), FermionTermType.PQQR, 8.0);

        assertThat(out).hasSize(2);
        assertTerm(out.get(0), PauliTerm.of(PauliTermType.PQQR, 1, 3, 3, 2), 1.0);
        assertTerm(out.get(1), PauliTerm.of(PauliTermType.PQ, 1, 2), -1.0);
    }

    @Test
    void pqqr_alreadyCanonical_isKept() {
        List<WeightedPauliTerm> out =
                encoder.encode(FermionTerm.of(0, 2, 2, 5), FermionTermType.PQQR, 8.0);

        assertTerm(out.get(0), PauliTerm.of(PauliTermType.PQQR, 0, 2, 2, 5), -1.0);
        assertTerm(out.get(1), PauliTerm.of(PauliTermType.PQ, 0, 5), 1.0);
    }

    @Test
    void pqqr_doesNotMutateInputTerm() {
        FermionTerm term = FermionTerm.of(3, 1, 2, 3);

        encoder.encode(term, FermionTermType.PQQR, 1.0);

        assertThat(term.getIndices()).containsExactly(3, 1, 2, 3);
    }

    // ------------------------------------------------------------------
    // PQRS
    // ------------------------------------------------------------------

    @Test
    void pqrs_usesSortedIndicesAndClassifierCoefficients() {
        List<WeightedPauliTerm> out =
                encoder.encode(FermionTerm.of(0, 2, 3, 1), FermionTermType.PQRS, 16.0);

        assertThat(out).hasSize(1);
        WeightedPauliTerm w = out.get(0);
        assertThat(w.getTerm()).isEqualTo(PauliTerm.of(PauliTermType.V01234, 0, 1, 2, 3));
        assertThat(w.getValue().toArray()).containsExactly(new double[] {1.0, 1.0, -1.0, 1.0},
                TOL);
    }

    @Test
    void pqrs_unsortedNonCorrectedOrdering_givesZeroVector() {
        // q p r s
        List<WeightedPauliTerm> out =
                encoder.encode(FermionTerm.of(5, 2, 7, 9), FermionTermType.PQRS, 16.0);

        assertThat(out.get(0).getTerm().getQubits()).containsExactly(2, 5, 7, 9);
        assertThat(out.get(0).getValue().toArray()).containsExactly(new double[] {0, 0, 0, 0}, TOL);
    }

    // ------------------------------------------------------------------
    // Scaling
    // ------------------------------------------------------------------

    @Test
    void everyClass_scalesLinearlyWithCoefficient() {
        Object[][] cases = {{FermionTermType.IDENTITY, FermionTerm.of()},
                {FermionTermType.PP, FermionTerm.of(2)}, {FermionTermType.PQ, FermionTerm.of(0, 3)},
                {FermionTermType.PQQP, FermionTerm.of(1, 4)},
                {FermionTermType.PQQR, FermionTerm.of(4, 1, 2, 4)},
                {FermionTermType.PQQR, FermionTerm.of(1, 4, 2, 4)},
                {FermionTermType.PQRS, FermionTerm.of(0, 2, 3, 1)},
                {FermionTermType.PQRS, FermionTerm.of(0, 1, 3, 2)},
                {FermionTermType.PQRS, FermionTerm.of(0, 3, 2, 1)}};
        double c = 1.5;
        double k = -3.25;

        for (Object[] tc : cases) {
            FermionTermType type = (FermionTermType) tc[0];
            FermionTerm term = (FermionTerm) tc[1];

            List<WeightedPauliTerm> base = encoder.encode(term, type, c);
            List<WeightedPauliTerm> scaled = encoder.encode(term, type, k * c);

            assertThat(scaled).hasSameSizeAs(base);
            for (int i = 0; i < base.size(); i++) {
                assertThat(scaled.get(i).getTerm()).isEqualTo(base.get(i).getTerm());
                double[] b = base.get(i).getValue().toArray();
                double[] s = scaled.get(i).getValue().toArray();
                assertThat(s).hasSameSizeAs(b);
                for (int j = 0; j < b.length; j++) {
                    assertThat(s[j]).as("%s component %s", type, j).isCloseTo(k * b[j], TOL);
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void arityMismatch_throwsMalformedTerm() {
        assertThatThrownBy(() -> encoder.encode(FermionTerm.of(1, 2, 3), FermionTermType.PQ, 1.0))
                .isInstanceOf(MalformedTermException.class)
                .hasFieldOrPropertyWithValue("termType", FermionTermType.PQ);
    }

    @Test
    void identityWithIndices_throwsMalformedTerm() {
        assertThatThrownBy(() -> encoder.encode(FermionTerm.of(0), FermionTermType.IDENTITY, 1.0))
                .isInstanceOf(MalformedTermException.class);
    }

    @Test
    void missingTermClass_throwsUnsupportedTermClass() {
        assertThatThrownBy(() -> encoder.encode(FermionTerm.of(0), null, 1.0))
                .isInstanceOf(UnsupportedTermClassException.class);
    }

    private static void assertTerm(WeightedPauliTerm actual, PauliTerm expectedTerm,
            double expectedCoefficient) {
        assertThat(actual.getTerm()).isEqualTo(expectedTerm);
        assertThat(actual.getValue().size()).isEqualTo(1);
        assertThat(actual.getValue().get(0)).isCloseTo(expectedCoefficient, TOL);
    }
}
