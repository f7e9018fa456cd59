package io.github.yok.jw.core.transform;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.jw.core.encoder.TermEncoder;
import io.github.yok.jw.core.hamiltonian.FermionHamiltonian;
import io.github.yok.jw.core.hamiltonian.PauliHamiltonian;
import io.github.yok.jw.core.term.FermionTerm;
import io.github.yok.jw.core.term.FermionTermType;
import io.github.yok.jw.core.term.WeightedPauliTerm;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * フェルミオンハミルトニアンを Pauli ハミルトニアンへ変換するクラスです。
 *
 * <p>
 * 対称性クラスごとの全項を {@link TermEncoder} で展開し、出力ハミルトニアンへ集約（同一 Pauli 項は係数を加算）したうえで、
 * 系インデックス集合を複製します。入力は変更しません。
 * </p>
 *
 * <p>
 * {@code parallelism > 1} の場合は項ごとの展開を専用の {@link ForkJoinPool} で並列に行います。 集約は入力の列挙順で逐次に行うため、
 * 加算順序は逐次実行と同一です。
 * </p>
 *
 * <p>
 * いずれかの項の展開に失敗した場合は、例外をそのまま送出し、部分的な結果は返しません。
 * </p>
 */
@Getter
@Slf4j
public final class JordanWignerTransformer {

    /**
     * 項ごとのエンコーダです。
     */
    private final TermEncoder encoder;

    /**
     * 項ごとの展開に使う並列度です（1 は逐次）。
     */
    private final int parallelism;

    /**
     * 逐次実行の変換器を生成します。
     *
     * @param encoder 項ごとのエンコーダです（null 不可）
     */
    public JordanWignerTransformer(TermEncoder encoder) {
        this(encoder, 1);
    }

    /**
     * 変換器を生成します。
     *
     * @param encoder 項ごとのエンコーダです（null 不可）
     * @param parallelism 並列度です（1 以上）
     * @throws IllegalArgumentException parallelism が 1 未満の場合に発生します
     */
    public JordanWignerTransformer(TermEncoder encoder, int parallelism) {
        this.encoder = checkNotNull(encoder, "encoder は null 不可です");
        checkArgument(parallelism >= 1, "parallelism は 1 以上が必要です: %s", parallelism);
        this.parallelism = parallelism;
    }

    /**
     * フェルミオンハミルトニアンを Pauli ハミルトニアンへ変換します。
     *
     * @param source 入力のフェルミオンハミルトニアンです（null 不可）
     * @return 新しい Pauli ハミルトニアンです
     * @throws io.github.yok.jw.core.encoder.MalformedTermException 不正な項が含まれる場合に発生します
     * @throws io.github.yok.jw.core.encoder.UnsupportedTermClassException 未対応の対称性クラスが含まれる場合に発生します
     */
    public PauliHamiltonian convert(FermionHamiltonian source) {
        checkNotNull(source, "source は null 不可です");

        long t0 = System.nanoTime();
        List<TermTask> tasks = collectTasks(source);

        log.info("Pauli 変換を開始します。項数={}、系サイズ={}、並列度={}", tasks.size(), source.systemSize(),
                parallelism);

        List<List<WeightedPauliTerm>> encoded =
                parallelism > 1 && tasks.size() > 1 ? encodeParallel(tasks) : encodeSequential(tasks);

        PauliHamiltonian target = new PauliHamiltonian();
        for (List<WeightedPauliTerm> pauliTerms : encoded) {
            target.addTerms(pauliTerms);
        }

        // 系インデックス集合は再計算せずに複製します。
        target.setSystemIndices(source.getSystemIndices());

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("Pauli 変換が完了しました。入力項数={}、出力項数={}、所要時間={}ms", tasks.size(),
                target.termCount(), elapsedMs);
        return target;
    }

    /**
     * 入力の全項を列挙順に並べます。
     *
     * @param source 入力のフェルミオンハミルトニアンです
     * @return 展開対象の一覧です
     */
    private static List<TermTask> collectTasks(FermionHamiltonian source) {
        List<TermTask> tasks = new ArrayList<>(source.termCount());
        for (Map.Entry<FermionTermType, Map<FermionTerm, Double>> bucket : source.getTerms()
                .entrySet()) {
            log.debug("対称性クラス {} の項数={}", bucket.getKey(), bucket.getValue().size());
            for (Map.Entry<FermionTerm, Double> entry : bucket.getValue().entrySet()) {
                tasks.add(new TermTask(bucket.getKey(), entry.getKey(), entry.getValue()));
            }
        }
        return tasks;
    }

    private List<List<WeightedPauliTerm>> encodeSequential(List<TermTask> tasks) {
        List<List<WeightedPauliTerm>> encoded = new ArrayList<>(tasks.size());
        for (TermTask task : tasks) {
            encoded.add(encode(task));
        }
        return encoded;
    }

    /**
     * 専用プールで並列に展開します。結果は入力の列挙順で返します。
     *
     * @param tasks 展開対象の一覧です
     * @return 項ごとの展開結果です
     */
    private List<List<WeightedPauliTerm>> encodeParallel(List<TermTask> tasks) {
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> tasks.parallelStream().map(this::encode)
                    .collect(Collectors.toList())).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Pauli 変換が中断されました", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Pauli 変換に失敗しました", cause);
        } finally {
            pool.shutdown();
        }
    }

    private List<WeightedPauliTerm> encode(TermTask task) {
        return encoder.encode(task.getTerm(), task.getTermType(), task.getCoefficient());
    }

    /**
     * 展開対象の 1 項です。
     */
    @Value
    private static class TermTask {

        FermionTermType termType;

        FermionTerm term;

        double coefficient;
    }
}
